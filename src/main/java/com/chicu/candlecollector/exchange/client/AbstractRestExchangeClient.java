package com.chicu.candlecollector.exchange.client;

import com.chicu.candlecollector.common.time.Sleeper;
import com.chicu.candlecollector.common.time.Timeframe;
import com.chicu.candlecollector.exchange.exception.ExchangeException;
import com.chicu.candlecollector.exchange.exception.FatalExchangeException;
import com.chicu.candlecollector.exchange.exception.RateLimitedException;
import com.chicu.candlecollector.exchange.exception.TransientExchangeException;
import com.chicu.candlecollector.exchange.ratelimit.ExchangeRateLimiter;
import com.chicu.candlecollector.market.model.UnifiedKline;
import lombok.extern.slf4j.Slf4j;
import org.json.JSONArray;
import org.json.JSONException;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Общая часть REST-адаптеров: троттлинг, классификация ошибок, повторы с backoff.
 *
 * Наследник отвечает только за URL, разбор тела и коды ошибок биржи в JSON.
 */
@Slf4j
public abstract class AbstractRestExchangeClient implements ExchangeClient {

    private static final int MAX_ERROR_BODY = 300;

    protected final RestTemplate rest;

    private final String exchangeCode;
    private final ExchangeRateLimiter rateLimiter;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;

    protected AbstractRestExchangeClient(String exchangeCode,
                                         RestTemplate rest,
                                         ExchangeRateLimiter rateLimiter,
                                         RetryPolicy retryPolicy,
                                         Sleeper sleeper) {
        this.exchangeCode = exchangeCode;
        this.rest = rest;
        this.rateLimiter = rateLimiter;
        this.retryPolicy = retryPolicy;
        this.sleeper = sleeper;
    }

    @Override
    public String getExchangeCode() {
        return exchangeCode;
    }

    @Override
    public int getRateLimitPerMinute() {
        return rateLimiter.getRequestsPerMinute();
    }

    // =====================================================================
    // MARKET DATA
    // =====================================================================

    @Override
    public List<UnifiedKline> fetchCandles(String baseSymbol,
                                           String quoteSymbol,
                                           Timeframe timeframe,
                                           Instant since,
                                           Integer limit) throws ExchangeException {

        if (!supports(timeframe)) {
            throw new FatalExchangeException(exchangeCode,
                    "Unsupported timeframe " + timeframe.getCode() + " on " + exchangeCode);
        }

        int max = getMaxCandlesPerRequest();
        int effective = limit == null ? max : Math.max(1, Math.min(limit, max));
        String symbol = toVenueSymbol(baseSymbol, quoteSymbol);

        List<UnifiedKline> bars = new ArrayList<>(requestCandles(symbol, timeframe, since, effective));
        bars.sort(Comparator.comparing(UnifiedKline::getOpenTime,
                Comparator.nullsLast(Comparator.naturalOrder())));

        // "последние N": биржа может вернуть больше, чем просили
        if (since == null && bars.size() > effective) {
            bars = new ArrayList<>(bars.subList(bars.size() - effective, bars.size()));
        }
        return bars;
    }

    /** BTC + USDT → формат символа биржи */
    protected abstract String toVenueSymbol(String baseSymbol, String quoteSymbol);

    /** Запрос одной страницы; порядок не важен, сортирует базовый класс */
    protected abstract List<UnifiedKline> requestCandles(String symbol,
                                                         Timeframe timeframe,
                                                         Instant since,
                                                         int limit) throws ExchangeException;

    /**
     * Проверка кода ошибки в теле ответа (Bybit retCode, OKX code).
     * По умолчанию: ничего.
     */
    protected void checkBody(String body) throws ExchangeException {
    }

    /** Доп. заголовки (OKX demo trading) */
    protected HttpHeaders headers() {
        return new HttpHeaders();
    }

    // =====================================================================
    // HTTP + RETRY
    // =====================================================================

    /**
     * GET с троттлингом и повторами.
     * RateLimited/Transient повторяются по RetryPolicy, исчерпание → Fatal.
     */
    protected String get(String url) throws ExchangeException {
        int failed = 0;

        while (true) {
            try {
                rateLimiter.acquire(getRequestCost());
                String body = executeOnce(url);
                checkBody(body);
                return body;

            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new FatalExchangeException(exchangeCode, "Interrupted while waiting for " + exchangeCode, e);

            } catch (ExchangeException e) {
                if (!e.isRetryable()) {
                    throw e;
                }
                failed++;
                if (!retryPolicy.canRetry(failed)) {
                    throw new FatalExchangeException(exchangeCode,
                            "Retries exhausted (" + failed + ") on " + exchangeCode + ": " + e.getMessage(), e);
                }

                Duration delay = e instanceof RateLimitedException rl
                        ? retryPolicy.delayFor(failed, rl)
                        : retryPolicy.delayFor(failed);

                log.warn("⏳ {}: {}, повтор {}/{} через {} ms",
                        exchangeCode, e.getMessage(), failed, retryPolicy.getMaxAttempts() - 1, delay.toMillis());

                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new FatalExchangeException(exchangeCode, "Interrupted during backoff", ie);
                }
            }
        }
    }

    private String executeOnce(String url) throws ExchangeException {
        try {
            String body = rest.exchange(url, HttpMethod.GET, new HttpEntity<>(null, headers()), String.class).getBody();
            if (body == null || body.isBlank()) {
                throw new TransientExchangeException(exchangeCode, "Empty response from " + exchangeCode);
            }
            return body;

        } catch (HttpClientErrorException e) {
            HttpStatusCode status = e.getStatusCode();
            if (status.value() == 429 || status.value() == 418) {
                throw new RateLimitedException(exchangeCode,
                        exchangeCode + " rate limit: HTTP " + status.value(),
                        retryAfterMs(e.getResponseHeaders()));
            }
            throw new FatalExchangeException(exchangeCode,
                    exchangeCode + " error: HTTP " + status.value() + " " + shorten(e.getResponseBodyAsString()), e);

        } catch (HttpServerErrorException e) {
            throw new TransientExchangeException(exchangeCode,
                    exchangeCode + " server error: HTTP " + e.getStatusCode().value(), e);

        } catch (ResourceAccessException e) {
            throw new TransientExchangeException(exchangeCode,
                    exchangeCode + " I/O error: " + e.getMessage(), e);

        } catch (RestClientException e) {
            throw new TransientExchangeException(exchangeCode,
                    exchangeCode + " client error: " + e.getMessage(), e);
        }
    }

    private static long retryAfterMs(HttpHeaders headers) {
        if (headers == null) return 0;
        String v = headers.getFirst(HttpHeaders.RETRY_AFTER);
        if (v == null || v.isBlank()) return 0;
        try {
            return Long.parseLong(v.trim()) * 1000L;
        } catch (NumberFormatException ignored) {
            return 0;
        }
    }

    // =====================================================================
    // ВСПОМОГАТЕЛЬНЫЕ
    // =====================================================================

    /**
     * Открытие последнего бара страницы из limit баров, начиная с since.
     */
    protected static Instant lastOpenOfPage(Timeframe tf, Instant since, int limit) {
        return tf.plusBars(since, limit - 1L);
    }

    /** Разбор JSON-массива в массив массивов; кривой JSON: фатально */
    protected JSONArray parseArray(String body) throws FatalExchangeException {
        try {
            return new JSONArray(body);
        } catch (JSONException e) {
            throw new FatalExchangeException(exchangeCode, "Malformed response from " + exchangeCode, e);
        }
    }

    /** Число из массива бара; null: если поля нет или оно не число */
    protected static BigDecimal decimal(JSONArray row, int index) {
        if (row.length() <= index || row.isNull(index)) {
            return null;
        }
        try {
            return new BigDecimal(row.get(index).toString().trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    protected static Long epochMillis(JSONArray row, int index) {
        BigDecimal v = decimal(row, index);
        return v == null ? null : v.longValue();
    }

    protected static String shorten(String s) {
        if (s == null) return "";
        return s.length() <= MAX_ERROR_BODY ? s : s.substring(0, MAX_ERROR_BODY) + "…";
    }
}
