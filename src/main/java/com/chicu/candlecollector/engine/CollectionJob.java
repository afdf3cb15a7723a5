package com.chicu.candlecollector.engine;

import java.util.Locale;
import java.util.Optional;

public enum CollectionJob {

    CURRENT("current"),
    HISTORICAL("historical");

    private final String jobName;

    CollectionJob(String jobName) {
        this.jobName = jobName;
    }

    public String getJobName() {
        return jobName;
    }

    public static Optional<CollectionJob> byName(String name) {
        if (name == null) return Optional.empty();
        String n = name.trim().toLowerCase(Locale.ROOT);
        for (CollectionJob j : values()) {
            if (j.jobName.equals(n)) return Optional.of(j);
        }
        return Optional.empty();
    }
}
