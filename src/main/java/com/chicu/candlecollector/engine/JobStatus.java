package com.chicu.candlecollector.engine;

import java.time.Instant;

/**
 * Снимок состояния job'а.
 */
public record JobStatus(
        String name,
        JobState state,
        Instant startedAt,
        Instant lastRunAt,
        Instant nextRunAt,
        String lastError,
        String lastSummary
) {
}
