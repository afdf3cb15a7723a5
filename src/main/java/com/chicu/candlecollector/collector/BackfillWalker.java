package com.chicu.candlecollector.collector;

import com.chicu.candlecollector.common.time.Timeframe;
import com.chicu.candlecollector.config.CollectorProperties;
import com.chicu.candlecollector.exchange.client.ExchangeClient;
import com.chicu.candlecollector.exchange.exception.ExchangeException;
import com.chicu.candlecollector.market.CandleNormalizer;
import com.chicu.candlecollector.market.model.CandleSeries;
import com.chicu.candlecollector.market.model.UnifiedKline;
import com.chicu.candlecollector.market.store.BackfillCursorStore;
import com.chicu.candlecollector.market.store.CandlePersistenceException;
import com.chicu.candlecollector.market.store.CandleStore;
import com.chicu.candlecollector.market.store.UpsertResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Постраничная догрузка истории одной серии от фиксированной даты до "сейчас".
 *
 * Окно страницы: pageSize слотов сетки начиная с курсора. Пустое окно не завершает
 * обход (до листинга пары биржа честно отдаёт пустоту), курсор просто перешагивает
 * через него. Обход кончается, когда курсор дошёл до "сейчас".
 *
 * Курсор сохраняется только после успешного upsert'а страницы: это openTime последней
 * закрытой свечи либо конец окна, если окно целиком закрыто. Время отметки fetchedAt
 * берётся до запроса, чтобы бар, закрывшийся во время запроса, не считался закрытым.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BackfillWalker {

    private final CandleStore store;
    private final BackfillCursorStore cursorStore;
    private final CandleNormalizer normalizer;
    private final CollectorProperties props;
    private final Clock clock;

    /**
     * @param deadline после этого момента новые страницы не запрашиваются; null: без ограничения
     */
    public BackfillOutcome walk(ExchangeClient client, CandleSeries series, Instant deadline) {
        Timeframe tf = series.timeframe();
        int pageSize = Math.max(1, Math.min(props.getHistorical().getPageSize(), client.getMaxCandlesPerRequest()));

        Instant cursor = initialCursor(series);
        BackfillState state = BackfillState.START;

        int pages = 0;
        int fetched = 0;
        int rejected = 0;
        UpsertResult stored = UpsertResult.empty();

        log.debug("📜 [{}] старт истории с {}", series, cursor);

        while (!state.isTerminal()) {
            Instant now = clock.instant();

            if (!cursor.isBefore(now)) {
                state = BackfillState.DONE;
                continue;
            }
            if (deadline != null && now.isAfter(deadline)) {
                log.info("⏸ [{}] бюджет прогона истёк, курсор {}", series, cursor);
                state = BackfillState.SUSPENDED;
                continue;
            }

            // ---------- FETCHING ----------
            state = BackfillState.FETCHING;
            Instant windowEnd = tf.plusBars(cursor, pageSize - 1L);
            Instant fetchedAt = clock.instant();
            List<UnifiedKline> raw;
            try {
                raw = client.fetchCandles(series.baseSymbol(), series.quoteSymbol(), tf, cursor, pageSize);
            } catch (ExchangeException e) {
                log.warn("⚠️ [{}] страница с {} не получена: {}", series, cursor, e.getMessage());
                return new BackfillOutcome(BackfillState.FAILED, pages, fetched, rejected, stored, cursor, e.getMessage());
            }

            boolean windowClosed = !tf.closeTime(windowEnd).isAfter(fetchedAt);

            // Пустое окно: у биржи нет баров в [cursor, windowEnd], например до листинга пары
            if (raw.isEmpty()) {
                log.debug("📜 [{}] пустое окно {}..{}", series, cursor, windowEnd);
                if (windowClosed) {
                    cursorStore.save(series, windowEnd);
                }
                cursor = tf.alignUp(tf.next(windowEnd));
                continue;
            }

            CandleNormalizer.Batch batch = normalizer.normalizeAll(series, raw, fetchedAt);

            // ---------- STORING ----------
            state = BackfillState.STORING;
            try {
                stored = stored.plus(store.upsertCandles(series, batch.accepted()));
            } catch (CandlePersistenceException e) {
                return new BackfillOutcome(BackfillState.FAILED, pages, fetched, rejected, stored, cursor, e.getMessage());
            }

            pages++;
            fetched += raw.size();
            rejected += batch.rejected();

            Instant lastOpen = lastOpenTime(raw);
            Instant mark = lastClosedOpenTime(tf, raw, fetchedAt);
            if (windowClosed && (mark == null || windowEnd.isAfter(mark))) {
                mark = windowEnd;
            }
            if (mark != null) {
                cursorStore.save(series, mark);
            }

            if (lastOpen == null || lastOpen.isBefore(cursor)) {
                log.warn("⚠️ [{}] биржа вернула бары до курсора {}, обход остановлен", series, cursor);
                state = BackfillState.DONE;
                continue;
            }

            Instant next = lastOpen.isAfter(windowEnd) ? lastOpen : windowEnd;
            cursor = tf.alignUp(tf.next(next));
        }

        log.info("📜 [{}] {}: страниц {}, +{} ~{}, отброшено {}",
                series, state, pages, stored.inserted(), stored.updated(), rejected);

        return new BackfillOutcome(state, pages, fetched, rejected, stored, cursor, null);
    }

    /**
     * max(сохранённый курсор + период, старт истории), выровненный вверх по сетке.
     */
    Instant initialCursor(CandleSeries series) {
        Timeframe tf = series.timeframe();
        Instant epoch = props.getHistorical().getStart();

        Instant fromCursor = cursorStore.load(series).map(tf::next).orElse(epoch);
        Instant start = fromCursor.isAfter(epoch) ? fromCursor : epoch;
        return tf.alignUp(start);
    }

    private static Instant lastOpenTime(List<UnifiedKline> raw) {
        Instant last = null;
        for (UnifiedKline k : raw) {
            if (k == null || k.getOpenTime() == null) continue;
            Instant t = Instant.ofEpochMilli(k.getOpenTime());
            if (last == null || t.isAfter(last)) last = t;
        }
        return last;
    }

    /** Незакрытая свеча в курсор не попадает: следующий обход заберёт её окончательной */
    private static Instant lastClosedOpenTime(Timeframe tf, List<UnifiedKline> raw, Instant fetchedAt) {
        Instant last = null;
        for (UnifiedKline k : raw) {
            if (k == null || k.getOpenTime() == null) continue;
            Instant t = Instant.ofEpochMilli(k.getOpenTime());
            if (tf.closeTime(t).isAfter(fetchedAt)) continue;
            if (last == null || t.isAfter(last)) last = t;
        }
        return last;
    }
}
