package com.chicu.candlecollector.collector;

import com.chicu.candlecollector.market.store.UpsertResult;

import java.time.Instant;

/**
 * Итог обхода одной серии.
 *
 * @param cursor с какого openTime начнётся следующий обход
 * @param error  причина для FAILED, иначе null
 */
public record BackfillOutcome(
        BackfillState state,
        int pages,
        int fetched,
        int rejected,
        UpsertResult stored,
        Instant cursor,
        String error
) {
}
