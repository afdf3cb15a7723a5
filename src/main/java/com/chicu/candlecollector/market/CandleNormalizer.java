package com.chicu.candlecollector.market;

import com.chicu.candlecollector.common.time.Timeframe;
import com.chicu.candlecollector.market.model.CandleSeries;
import com.chicu.candlecollector.market.model.NormalizedCandle;
import com.chicu.candlecollector.market.model.UnifiedKline;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * UnifiedKline → NormalizedCandle.
 *
 * Кривые бары отбрасываются с причиной в логе, ничего не подгоняется.
 */
@Slf4j
@Component
public class CandleNormalizer {

    /**
     * Результат нормализации страницы.
     *
     * @param accepted прошедшие проверку, в порядке входа
     * @param rejected сколько отброшено
     */
    public record Batch(List<NormalizedCandle> accepted, int rejected) {
    }

    /**
     * @throws MalformedCandleException нет поля, нарушен OHLCV или openTime не на сетке
     */
    public NormalizedCandle normalize(Timeframe timeframe, UnifiedKline k, Instant fetchedAt)
            throws MalformedCandleException {

        if (k == null) {
            throw new MalformedCandleException("null bar");
        }
        if (k.getOpenTime() == null) {
            throw new MalformedCandleException("missing openTime");
        }

        BigDecimal open = require(k.getOpen(), "open");
        BigDecimal high = require(k.getHigh(), "high");
        BigDecimal low = require(k.getLow(), "low");
        BigDecimal close = require(k.getClose(), "close");
        BigDecimal volume = require(k.getVolume(), "volume");

        Instant openTime = Instant.ofEpochMilli(k.getOpenTime());
        if (!timeframe.isAligned(openTime)) {
            throw new MalformedCandleException("openTime " + openTime + " is not on the " + timeframe.getCode() + " grid");
        }

        if (low.compareTo(high) > 0) {
            throw new MalformedCandleException("low " + low + " > high " + high);
        }
        if (high.compareTo(open.max(close)) < 0) {
            throw new MalformedCandleException("high " + high + " < max(open, close)");
        }
        if (low.compareTo(open.min(close)) > 0) {
            throw new MalformedCandleException("low " + low + " > min(open, close)");
        }
        if (volume.signum() < 0) {
            throw new MalformedCandleException("negative volume " + volume);
        }
        if (k.getQuoteVolume() != null && k.getQuoteVolume().signum() < 0) {
            throw new MalformedCandleException("negative quote volume " + k.getQuoteVolume());
        }

        Instant closeTime = timeframe.closeTime(openTime);

        return new NormalizedCandle(
                openTime,
                closeTime,
                open,
                high,
                low,
                close,
                volume,
                k.getQuoteVolume(),
                k.getTradesCount(),
                !closeTime.isAfter(fetchedAt),
                fetchedAt
        );
    }

    /**
     * Нормализует страницу. Отброшенные бары логируются и считаются.
     */
    public Batch normalizeAll(CandleSeries series, List<UnifiedKline> bars, Instant fetchedAt) {
        List<NormalizedCandle> accepted = new ArrayList<>(bars.size());
        int rejected = 0;

        for (UnifiedKline k : bars) {
            try {
                accepted.add(normalize(series.timeframe(), k, fetchedAt));
            } catch (MalformedCandleException e) {
                rejected++;
                log.warn("🚫 [{}] бар отброшен: {}", series, e.getMessage());
            }
        }

        if (rejected > 0) {
            log.info("🧹 [{}] принято {} / отброшено {}", series, accepted.size(), rejected);
        }
        return new Batch(accepted, rejected);
    }

    private static BigDecimal require(BigDecimal v, String field) throws MalformedCandleException {
        if (v == null) {
            throw new MalformedCandleException("missing " + field);
        }
        return v;
    }
}
