package com.chicu.candlecollector.service;

import com.chicu.candlecollector.engine.JobStatus;
import com.chicu.candlecollector.engine.TriggerResult;
import com.chicu.candlecollector.market.store.CollectionStats;

import java.time.Instant;
import java.util.List;

/**
 * Внешние операции сборщика: ручной запуск, статус job'ов, статистика.
 */
public interface DataCollectionService {

    TriggerResult triggerCurrentCollection();

    TriggerResult triggerHistoricalCollection();

    SchedulerStatus getJobStatus();

    CollectionStats getCollectionStats();

    DatabaseStatus checkDatabase();

    List<LogFileInfo> getLogFiles();

    record SchedulerStatus(boolean running, List<JobStatus> jobs) {
    }

    record DatabaseStatus(boolean connected, String error) {
    }

    record LogFileInfo(String name, long sizeBytes, Instant modifiedAt) {
    }
}
