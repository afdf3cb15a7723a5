package com.chicu.candlecollector.market.store;

import com.chicu.candlecollector.common.time.Timeframe;
import com.chicu.candlecollector.domain.Candle;
import com.chicu.candlecollector.market.model.NormalizedCandle;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static com.chicu.candlecollector.support.TestData.candle;
import static org.junit.jupiter.api.Assertions.*;

class CandleMergePolicyTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private static Candle stored(boolean closed, Instant fetchedAt) {
        return Candle.builder().openTime(T0).closed(closed).fetchedAt(fetchedAt).build();
    }

    @Test
    void noExistingRow_shouldInsert() {
        NormalizedCandle in = candle(Timeframe.H1, T0, "10", true, T0.plusSeconds(7200));
        assertEquals(CandleMergePolicy.Decision.INSERT, CandleMergePolicy.decide(null, in));
    }

    @Test
    void closedRow_shouldNeverBeOverwritten() {
        NormalizedCandle newer = candle(Timeframe.H1, T0, "99", true, T0.plusSeconds(99_999));
        assertEquals(CandleMergePolicy.Decision.SKIP,
                CandleMergePolicy.decide(stored(true, T0.plusSeconds(3600)), newer));
    }

    @Test
    void openRow_shouldBeUpdated_onlyByNewerFetch() {
        Candle open = stored(false, T0.plusSeconds(1800));

        assertEquals(CandleMergePolicy.Decision.UPDATE,
                CandleMergePolicy.decide(open, candle(Timeframe.H1, T0, "12", false, T0.plusSeconds(2400))));
        assertEquals(CandleMergePolicy.Decision.SKIP,
                CandleMergePolicy.decide(open, candle(Timeframe.H1, T0, "12", false, T0.plusSeconds(1800))));
        assertEquals(CandleMergePolicy.Decision.SKIP,
                CandleMergePolicy.decide(open, candle(Timeframe.H1, T0, "12", false, T0.plusSeconds(60))));
    }

    @Test
    void dedupe_shouldKeepLastDuplicate_andSortByOpenTime() {
        Instant t1 = T0.plusSeconds(3600);
        Instant fetched = T0.plusSeconds(86_400);

        List<NormalizedCandle> out = CandleMergePolicy.dedupe(List.of(
                candle(Timeframe.H1, t1, "1", true, fetched),
                candle(Timeframe.H1, T0, "2", true, fetched),
                candle(Timeframe.H1, t1, "3", true, fetched)
        ));

        assertEquals(2, out.size());
        assertEquals(T0, out.get(0).openTime());
        assertEquals(t1, out.get(1).openTime());
        assertEquals(0, new BigDecimal("3").compareTo(out.get(1).volume()));
    }
}
