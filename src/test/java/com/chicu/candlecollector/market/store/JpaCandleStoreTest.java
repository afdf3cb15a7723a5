package com.chicu.candlecollector.market.store;

import com.chicu.candlecollector.common.enums.MarketType;
import com.chicu.candlecollector.common.time.Timeframe;
import com.chicu.candlecollector.domain.Candle;
import com.chicu.candlecollector.domain.CurrencyPair;
import com.chicu.candlecollector.domain.Exchange;
import com.chicu.candlecollector.domain.Symbol;
import com.chicu.candlecollector.domain.TimePeriod;
import com.chicu.candlecollector.market.model.CandleSeries;
import com.chicu.candlecollector.market.model.NormalizedCandle;
import com.chicu.candlecollector.repository.CandleRepository;
import com.chicu.candlecollector.repository.ExchangeRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.context.annotation.Import;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static com.chicu.candlecollector.support.TestData.candle;
import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
@Import({JpaCandleStore.class, CandleUpsertService.class, JpaBackfillCursorStore.class})
class JpaCandleStoreTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");
    private static final Instant LATER = Instant.parse("2024-01-02T00:00:00Z");

    @Autowired private TestEntityManager em;
    @Autowired private JpaCandleStore store;
    @Autowired private JpaBackfillCursorStore cursorStore;
    @Autowired private CandleRepository candleRepository;
    @Autowired private ExchangeRepository exchangeRepository;

    private Exchange binance;
    private Exchange okx;
    private CurrencyPair btcUsdt;
    private TimePeriod hour;
    private CandleSeries series;

    @BeforeEach
    void setUp() {
        binance = em.persist(Exchange.builder().name("Binance").code("binance").build());
        okx = em.persist(Exchange.builder().name("OKX").code("okx").build());
        em.persist(Exchange.builder().name("Gate").code("gate").active(false).build());

        Symbol btc = em.persist(Symbol.builder().name("Bitcoin").symbol("BTC").build());
        Symbol eth = em.persist(Symbol.builder().name("Ethereum").symbol("ETH").build());
        Symbol usdt = em.persist(Symbol.builder().name("Tether").symbol("USDT").build());

        // глобальная пара
        btcUsdt = em.persist(CurrencyPair.builder().baseSymbol(btc).quoteSymbol(usdt).type(MarketType.SPOT).build());
        // только OKX
        em.persist(CurrencyPair.builder().baseSymbol(eth).quoteSymbol(usdt).exchange(okx).build());
        // выключенная
        em.persist(CurrencyPair.builder().baseSymbol(eth).quoteSymbol(btc).active(false).build());

        hour = em.persist(TimePeriod.builder().name("1 hour").minutes(60).build());
        em.persist(TimePeriod.builder().name("1 minute").minutes(1).build());
        em.persist(TimePeriod.builder().name("legacy").minutes(7).active(false).build());
        em.flush();

        series = CandleSeries.of(binance, btcUsdt, hour, Timeframe.H1);
    }

    // =====================================================================
    // UPSERT
    // =====================================================================

    @Test
    void upsertSameBatchTwice_shouldBeIdempotent() {
        List<NormalizedCandle> batch = List.of(
                candle(Timeframe.H1, T0, "10", true, LATER),
                candle(Timeframe.H1, T0.plusSeconds(3600), "11", true, LATER)
        );

        UpsertResult first = store.upsertCandles(series, batch);
        em.clear();
        UpsertResult second = store.upsertCandles(series, batch);

        assertEquals(2, first.inserted());
        assertEquals(0, second.inserted());
        assertEquals(0, second.updated());
        assertEquals(2, second.skipped());
        assertEquals(2, candleRepository.count());
    }

    @Test
    void closedCandle_shouldNotBeOverwrittenByLaterFetch() {
        store.upsertCandles(series, List.of(candle(Timeframe.H1, T0, "10", true, LATER)));
        em.clear();

        UpsertResult r = store.upsertCandles(series, List.of(candle(Timeframe.H1, T0, "99", true, LATER.plusSeconds(600))));
        em.flush();
        em.clear();

        assertEquals(1, r.skipped());
        Candle c = candleRepository.findAll().get(0);
        assertEquals(0, new BigDecimal("10").compareTo(c.getVolume()));
    }

    @Test
    void openCandle_shouldBeUpdatedByNewerFetch_andBecomeClosed() {
        store.upsertCandles(series, List.of(candle(Timeframe.H1, T0, "3", false, T0.plusSeconds(1200))));
        em.clear();

        UpsertResult r = store.upsertCandles(series, List.of(candle(Timeframe.H1, T0, "10", true, T0.plusSeconds(3600))));
        em.flush();
        em.clear();

        assertEquals(1, r.updated());
        Candle c = candleRepository.findAll().get(0);
        assertTrue(c.isClosed());
        assertEquals(0, new BigDecimal("10").compareTo(c.getVolume()));
        assertEquals(T0.plusSeconds(3600), c.getFetchedAt());
    }

    @Test
    void emptyBatch_shouldWriteNothing() {
        assertEquals(UpsertResult.empty(), store.upsertCandles(series, List.of()));
        assertEquals(0, candleRepository.count());
    }

    @Test
    void latestStoredOpenTime_shouldReturnMaxForSeries() {
        assertTrue(store.latestStoredOpenTime(series).isEmpty());

        store.upsertCandles(series, List.of(
                candle(Timeframe.H1, T0, "1", true, LATER),
                candle(Timeframe.H1, T0.plusSeconds(7200), "1", true, LATER)
        ));

        assertEquals(T0.plusSeconds(7200), store.latestStoredOpenTime(series).orElseThrow());
    }

    // =====================================================================
    // СПРАВОЧНИКИ И СТАТИСТИКА
    // =====================================================================

    @Test
    void listActivePairs_shouldIncludeGlobalAndOwnPairsOnly() {
        List<CurrencyPair> forBinance = store.listActivePairs(binance);
        List<CurrencyPair> forOkx = store.listActivePairs(okx);

        assertEquals(List.of("BTC/USDT"), forBinance.stream().map(CurrencyPair::displaySymbol).toList());
        assertEquals(List.of("BTC/USDT", "ETH/USDT"), forOkx.stream().map(CurrencyPair::displaySymbol).toList());
    }

    @Test
    void listActiveExchangesAndPeriods_shouldSkipInactive() {
        assertEquals(List.of("binance", "okx"),
                store.listActiveExchanges().stream().map(Exchange::getCode).toList());
        assertEquals(List.of(1, 60),
                store.listActivePeriods().stream().map(TimePeriod::getMinutes).toList());
        assertTrue(exchangeRepository.findByCode("gate").isPresent());
    }

    @Test
    void collectionStats_shouldCountRowsAndLatestUpdatePerExchange() {
        store.upsertCandles(series, List.of(candle(Timeframe.H1, T0, "1", true, LATER)));

        CollectionStats stats = store.collectionStats();

        assertEquals(1, stats.totalCandles());
        assertEquals(3, stats.totalExchanges());
        assertEquals(3, stats.totalPairs());
        assertEquals(3, stats.totalPeriods());
        assertEquals(1, stats.latestUpdatePerExchange().size());
        assertNotNull(stats.latestUpdatePerExchange().get("Binance"));
    }

    // =====================================================================
    // КУРСОР
    // =====================================================================

    @Test
    void cursor_shouldBeSavedAndOnlyMoveForward() {
        assertTrue(cursorStore.load(series).isEmpty());

        cursorStore.save(series, T0.plusSeconds(7200));
        cursorStore.save(series, T0);

        assertEquals(T0.plusSeconds(7200), cursorStore.load(series).orElseThrow());

        cursorStore.save(series, T0.plusSeconds(10_800));
        assertEquals(T0.plusSeconds(10_800), cursorStore.load(series).orElseThrow());
    }
}
