package com.chicu.candlecollector.market.store;

/**
 * Итог upsert'а одного батча.
 */
public record UpsertResult(int inserted, int updated, int skipped) {

    public static UpsertResult empty() {
        return new UpsertResult(0, 0, 0);
    }

    public UpsertResult plus(UpsertResult other) {
        return new UpsertResult(
                inserted + other.inserted,
                updated + other.updated,
                skipped + other.skipped
        );
    }
}
