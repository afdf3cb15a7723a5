package com.chicu.candlecollector.engine;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Единственный владелец состояния job'ов. Все переходы IDLE ⇄ RUNNING: под одним замком.
 */
@Slf4j
@Component
public class JobRegistry {

    private final Object lock = new Object();
    private final Map<CollectionJob, Entry> jobs = new EnumMap<>(CollectionJob.class);

    public JobRegistry() {
        for (CollectionJob job : CollectionJob.values()) {
            jobs.put(job, new Entry());
        }
    }

    /**
     * IDLE → RUNNING.
     *
     * @return false: job уже выполняется
     */
    public boolean tryAcquire(CollectionJob job, Instant now) {
        synchronized (lock) {
            Entry e = jobs.get(job);
            if (e.state == JobState.RUNNING) {
                return false;
            }
            e.state = JobState.RUNNING;
            e.startedAt = now;
            return true;
        }
    }

    /**
     * RUNNING → IDLE с итогом прогона.
     */
    public void release(CollectionJob job, Instant finishedAt, Instant nextRunAt, String error, String summary) {
        synchronized (lock) {
            Entry e = jobs.get(job);
            if (e.state != JobState.RUNNING) {
                log.warn("⚠️ release для job '{}', который не выполнялся", job.getJobName());
            }
            e.state = JobState.IDLE;
            e.startedAt = null;
            e.lastRunAt = finishedAt;
            e.nextRunAt = nextRunAt;
            e.lastError = error;
            e.lastSummary = summary;
        }
    }

    public void setNextRun(CollectionJob job, Instant nextRunAt) {
        synchronized (lock) {
            jobs.get(job).nextRunAt = nextRunAt;
        }
    }

    public boolean isRunning(CollectionJob job) {
        synchronized (lock) {
            return jobs.get(job).state == JobState.RUNNING;
        }
    }

    public JobStatus status(CollectionJob job) {
        synchronized (lock) {
            return jobs.get(job).snapshot(job);
        }
    }

    public List<JobStatus> snapshot() {
        synchronized (lock) {
            List<JobStatus> out = new ArrayList<>(jobs.size());
            jobs.forEach((job, e) -> out.add(e.snapshot(job)));
            return out;
        }
    }

    private static final class Entry {
        JobState state = JobState.IDLE;
        Instant startedAt;
        Instant lastRunAt;
        Instant nextRunAt;
        String lastError;
        String lastSummary;

        JobStatus snapshot(CollectionJob job) {
            return new JobStatus(job.getJobName(), state, startedAt, lastRunAt, nextRunAt, lastError, lastSummary);
        }
    }
}
