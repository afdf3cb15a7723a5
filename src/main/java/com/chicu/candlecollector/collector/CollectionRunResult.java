package com.chicu.candlecollector.collector;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Итог одного прогона сбора по всем единицам.
 */
public record CollectionRunResult(
        CollectionMode mode,
        Instant startedAt,
        Instant finishedAt,
        List<UnitResult> units
) {

    public CollectionRunResult {
        units = List.copyOf(units);
    }

    public long count(UnitStatus status) {
        return units.stream().filter(u -> u.status() == status).count();
    }

    public int totalInserted() {
        return units.stream().mapToInt(UnitResult::inserted).sum();
    }

    public int totalUpdated() {
        return units.stream().mapToInt(UnitResult::updated).sum();
    }

    public int totalRejected() {
        return units.stream().mapToInt(UnitResult::rejected).sum();
    }

    /** Прогон завершён не полностью: что-то упало или не успело */
    public boolean isPartial() {
        return units.stream().anyMatch(u -> u.status() != UnitStatus.SUCCESS);
    }

    public Duration duration() {
        return Duration.between(startedAt, finishedAt);
    }

    public String summary() {
        return String.format("%s: units=%d ok=%d partial=%d failed=%d skipped=%d, +%d ~%d, rejected=%d, %d ms",
                mode, units.size(),
                count(UnitStatus.SUCCESS), count(UnitStatus.PARTIAL),
                count(UnitStatus.FAILED), count(UnitStatus.SKIPPED),
                totalInserted(), totalUpdated(), totalRejected(),
                duration().toMillis());
    }
}
