package com.chicu.candlecollector.collector;

import com.chicu.candlecollector.common.time.Timeframe;
import com.chicu.candlecollector.config.CollectorProperties;
import com.chicu.candlecollector.domain.CurrencyPair;
import com.chicu.candlecollector.domain.Exchange;
import com.chicu.candlecollector.domain.TimePeriod;
import com.chicu.candlecollector.exchange.client.ExchangeClient;
import com.chicu.candlecollector.exchange.client.ExchangeClientFactory;
import com.chicu.candlecollector.exchange.exception.ExchangeException;
import com.chicu.candlecollector.exchange.exception.FatalExchangeException;
import com.chicu.candlecollector.market.CandleNormalizer;
import com.chicu.candlecollector.market.model.CandleSeries;
import com.chicu.candlecollector.market.model.UnifiedKline;
import com.chicu.candlecollector.market.store.CandlePersistenceException;
import com.chicu.candlecollector.market.store.CandleStore;
import com.chicu.candlecollector.market.store.UpsertResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;

/**
 * Раскладывает прогон сбора на единицы (биржа × пара × таймфрейм) и выполняет их
 * на общем пуле с ограничением параллельности на каждую биржу.
 *
 * Ошибка единицы фиксируется в её UnitResult и не трогает остальные.
 */
@Slf4j
@Service
public class CandleCollectionOrchestrator {

    private final CandleStore store;
    private final ExchangeClientFactory clientFactory;
    private final CandleNormalizer normalizer;
    private final BackfillWalker walker;
    private final ExecutorService workers;
    private final CollectorProperties props;
    private final Clock clock;

    public CandleCollectionOrchestrator(CandleStore store,
                                        ExchangeClientFactory clientFactory,
                                        CandleNormalizer normalizer,
                                        BackfillWalker walker,
                                        @Qualifier("collectorWorkers") ExecutorService workers,
                                        CollectorProperties props,
                                        Clock clock) {
        this.store = store;
        this.clientFactory = clientFactory;
        this.normalizer = normalizer;
        this.walker = walker;
        this.workers = workers;
        this.props = props;
        this.clock = clock;
    }

    // =====================================================================
    // ПУБЛИЧНОЕ API
    // =====================================================================

    public CollectionRunResult collectCurrent() {
        return run(CollectionMode.CURRENT, props.getCurrent().getRunBudget());
    }

    public CollectionRunResult collectHistorical() {
        return run(CollectionMode.HISTORICAL, props.getHistorical().getRunBudget());
    }

    // =====================================================================
    // ПРОГОН
    // =====================================================================

    CollectionRunResult run(CollectionMode mode, Duration budget) {
        Instant startedAt = clock.instant();
        Instant deadline = budget == null ? null : startedAt.plus(budget);

        List<UnitResult> results = new ArrayList<>();
        List<Unit> units = interleave(plan(results));

        log.info("🚀 {}: {} единиц сбора", mode, units.size());

        Map<String, Semaphore> perExchange = new LinkedHashMap<>();
        int permits = Math.max(1, props.getPerExchangeConcurrency());

        List<Future<UnitResult>> futures = new ArrayList<>(units.size());
        for (Unit unit : units) {
            Semaphore sem = perExchange.computeIfAbsent(unit.series().exchangeCode(), k -> new Semaphore(permits));
            futures.add(workers.submit(() -> guarded(mode, unit, sem, deadline)));
        }

        for (int i = 0; i < futures.size(); i++) {
            results.add(await(futures.get(i), units.get(i)));
        }

        CollectionRunResult result = new CollectionRunResult(mode, startedAt, clock.instant(), results);
        if (result.isPartial()) {
            log.warn("⚠️ {}", result.summary());
        } else {
            log.info("✅ {}", result.summary());
        }
        return result;
    }

    /**
     * Активные биржи × их пары × активные периоды.
     * Биржа без адаптера сразу даёт FAILED по всем своим сериям.
     */
    private List<Unit> plan(List<UnitResult> early) {
        List<TimePeriod> periods = store.listActivePeriods();
        List<Unit> units = new ArrayList<>();

        for (Exchange exchange : store.listActiveExchanges()) {
            List<CandleSeries> series = new ArrayList<>();
            for (CurrencyPair pair : store.listActivePairs(exchange)) {
                for (TimePeriod period : periods) {
                    Optional<Timeframe> tf = period.timeframe();
                    if (tf.isEmpty()) {
                        log.debug("⏭ период '{}' ({} мин) не поддерживается, пропуск", period.getName(), period.getMinutes());
                        continue;
                    }
                    series.add(CandleSeries.of(exchange, pair, period, tf.get()));
                }
            }

            ExchangeClient client;
            try {
                client = clientFactory.get(exchange);
            } catch (FatalExchangeException e) {
                log.warn("❌ {}: {}", exchange.getCode(), e.getMessage());
                series.forEach(s -> early.add(UnitResult.failed(s, e.getMessage())));
                continue;
            }

            for (CandleSeries s : series) {
                if (!client.supports(s.timeframe())) {
                    early.add(UnitResult.skipped(s, "timeframe " + s.timeframe().getCode() + " not supported by " + client.getExchangeCode()));
                    continue;
                }
                units.add(new Unit(s, client));
            }
        }
        return units;
    }

    /** Чередуем биржи, чтобы одна большая биржа не заняла весь пул ожиданием семафора */
    private static List<Unit> interleave(List<Unit> units) {
        Map<String, List<Unit>> byExchange = new LinkedHashMap<>();
        for (Unit u : units) {
            byExchange.computeIfAbsent(u.series().exchangeCode(), k -> new ArrayList<>()).add(u);
        }

        List<Unit> out = new ArrayList<>(units.size());
        for (int i = 0; out.size() < units.size(); i++) {
            for (List<Unit> list : byExchange.values()) {
                if (i < list.size()) out.add(list.get(i));
            }
        }
        return out;
    }

    private UnitResult guarded(CollectionMode mode, Unit unit, Semaphore sem, Instant deadline) {
        if (deadline != null && clock.instant().isAfter(deadline)) {
            return UnitResult.skipped(unit.series(), "run budget exhausted");
        }

        try {
            sem.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return UnitResult.skipped(unit.series(), "interrupted");
        }

        try {
            if (deadline != null && clock.instant().isAfter(deadline)) {
                return UnitResult.skipped(unit.series(), "run budget exhausted");
            }
            return mode == CollectionMode.CURRENT
                    ? collectCurrent(unit)
                    : collectHistorical(unit, deadline);

        } catch (RuntimeException e) {
            log.error("💥 [{}] неожиданная ошибка: {}", unit.series(), e.getMessage(), e);
            return UnitResult.failed(unit.series(), e.getClass().getSimpleName() + ": " + e.getMessage());
        } finally {
            sem.release();
        }
    }

    private UnitResult collectCurrent(Unit unit) {
        CandleSeries series = unit.series();
        try {
            // отметка до запроса: бар, закрывшийся во время запроса, остаётся открытым
            Instant fetchedAt = clock.instant();
            List<UnifiedKline> raw = unit.client().fetchCandles(
                    series.baseSymbol(), series.quoteSymbol(), series.timeframe(),
                    null, props.getCurrent().getCandlesPerFetch());

            CandleNormalizer.Batch batch = normalizer.normalizeAll(series, raw, fetchedAt);
            UpsertResult stored = store.upsertCandles(series, batch.accepted());

            return UnitResult.of(series, UnitStatus.SUCCESS, raw.size(), batch.rejected(), stored);

        } catch (ExchangeException e) {
            log.warn("⚠️ [{}] {}", series, e.getMessage());
            return UnitResult.failed(series, e.getMessage());
        } catch (CandlePersistenceException e) {
            log.warn("⚠️ [{}] {}", series, e.getMessage());
            return UnitResult.failed(series, e.getMessage());
        }
    }

    private UnitResult collectHistorical(Unit unit, Instant deadline) {
        BackfillOutcome outcome = walker.walk(unit.client(), unit.series(), deadline);

        return switch (outcome.state()) {
            case FAILED -> {
                UnitResult r = UnitResult.of(unit.series(), UnitStatus.FAILED,
                        outcome.fetched(), outcome.rejected(), outcome.stored());
                yield r.withMessage(outcome.error());
            }
            case SUSPENDED -> UnitResult.of(unit.series(), UnitStatus.PARTIAL,
                            outcome.fetched(), outcome.rejected(), outcome.stored())
                    .withMessage("suspended at " + outcome.cursor());
            default -> UnitResult.of(unit.series(), UnitStatus.SUCCESS,
                    outcome.fetched(), outcome.rejected(), outcome.stored());
        };
    }

    private UnitResult await(Future<UnitResult> future, Unit unit) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return UnitResult.skipped(unit.series(), "interrupted");
        } catch (ExecutionException e) {
            return UnitResult.failed(unit.series(), String.valueOf(e.getCause()));
        }
    }

    private record Unit(CandleSeries series, ExchangeClient client) {
    }
}
