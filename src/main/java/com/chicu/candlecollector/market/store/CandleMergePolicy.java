package com.chicu.candlecollector.market.store;

import com.chicu.candlecollector.domain.Candle;
import com.chicu.candlecollector.market.model.NormalizedCandle;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Разрешение конфликта по (биржа, пара, период, openTime).
 *
 * Закрытая свеча неизменна. Незакрытая перезаписывается только более свежими данными.
 */
public final class CandleMergePolicy {

    public enum Decision {
        INSERT,
        UPDATE,
        SKIP
    }

    private CandleMergePolicy() {
    }

    public static Decision decide(Candle existing, NormalizedCandle incoming) {
        if (existing == null) {
            return Decision.INSERT;
        }
        if (existing.isClosed()) {
            return Decision.SKIP;
        }
        Instant stored = existing.getFetchedAt();
        if (stored != null && !incoming.fetchedAt().isAfter(stored)) {
            return Decision.SKIP;
        }
        return Decision.UPDATE;
    }

    /**
     * Дубликаты openTime внутри батча: побеждает последний. Результат по возрастанию openTime.
     */
    public static List<NormalizedCandle> dedupe(Collection<NormalizedCandle> batch) {
        Map<Instant, NormalizedCandle> byOpen = new LinkedHashMap<>();
        for (NormalizedCandle c : batch) {
            byOpen.put(c.openTime(), c);
        }
        List<NormalizedCandle> out = new ArrayList<>(byOpen.values());
        out.sort(Comparator.comparing(NormalizedCandle::openTime));
        return out;
    }
}
