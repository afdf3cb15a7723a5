package com.chicu.candlecollector.exchange.bybit;

import com.chicu.candlecollector.common.enums.NetworkType;
import com.chicu.candlecollector.common.time.Sleeper;
import com.chicu.candlecollector.common.time.Timeframe;
import com.chicu.candlecollector.exchange.client.AbstractRestExchangeClient;
import com.chicu.candlecollector.exchange.client.RetryPolicy;
import com.chicu.candlecollector.exchange.exception.ExchangeException;
import com.chicu.candlecollector.exchange.exception.FatalExchangeException;
import com.chicu.candlecollector.exchange.exception.RateLimitedException;
import com.chicu.candlecollector.exchange.ratelimit.TokenBucketRateLimiter;
import com.chicu.candlecollector.market.model.UnifiedKline;
import lombok.extern.slf4j.Slf4j;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.web.client.RestTemplate;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Bybit v5: GET /v5/market/kline (category=spot).
 *
 * list: от новых к старым: [startTime, open, high, low, close, volume, turnover].
 * Ошибки приходят с HTTP 200 и ненулевым retCode.
 */
@Slf4j
public class BybitExchangeClient extends AbstractRestExchangeClient {

    public static final String CODE = "bybit";

    private static final String MAIN = "https://api.bybit.com";
    private static final String TEST = "https://api-testnet.bybit.com";

    private static final int DEFAULT_RPM = 600;
    private static final int MAX_LIMIT = 1000;

    /** 10006: too many visits, 10018: превышен лимит IP */
    private static final int RET_TOO_MANY_VISITS = 10006;
    private static final int RET_IP_LIMIT = 10018;
    private static final long RATE_LIMIT_PAUSE_MS = 1_000;

    private static final Map<Timeframe, String> INTERVALS = new EnumMap<>(Timeframe.class);

    static {
        INTERVALS.put(Timeframe.M1, "1");
        INTERVALS.put(Timeframe.M3, "3");
        INTERVALS.put(Timeframe.M5, "5");
        INTERVALS.put(Timeframe.M15, "15");
        INTERVALS.put(Timeframe.M30, "30");
        INTERVALS.put(Timeframe.H1, "60");
        INTERVALS.put(Timeframe.H2, "120");
        INTERVALS.put(Timeframe.H4, "240");
        INTERVALS.put(Timeframe.H6, "360");
        INTERVALS.put(Timeframe.H12, "720");
        INTERVALS.put(Timeframe.D1, "D");
        INTERVALS.put(Timeframe.W1, "W");
        INTERVALS.put(Timeframe.MON1, "M");
        // 8h у Bybit нет
    }

    private final String baseUrl;

    public BybitExchangeClient(RestTemplate rest,
                               NetworkType network,
                               Integer requestsPerMinute,
                               RetryPolicy retryPolicy,
                               Sleeper sleeper) {
        super(CODE, rest,
                new TokenBucketRateLimiter(requestsPerMinute != null ? requestsPerMinute : DEFAULT_RPM, 10),
                retryPolicy, sleeper);
        this.baseUrl = network == NetworkType.TESTNET ? TEST : MAIN;
        log.info("🔌 Bybit klines → {}", baseUrl);
    }

    @Override
    public int getMaxCandlesPerRequest() {
        return MAX_LIMIT;
    }

    @Override
    public boolean supports(Timeframe timeframe) {
        return INTERVALS.containsKey(timeframe);
    }

    @Override
    protected String toVenueSymbol(String baseSymbol, String quoteSymbol) {
        return (baseSymbol + quoteSymbol).toUpperCase(Locale.ROOT);
    }

    @Override
    protected void checkBody(String body) throws ExchangeException {
        JSONObject json;
        try {
            json = new JSONObject(body);
        } catch (JSONException e) {
            throw new FatalExchangeException(CODE, "Malformed response from bybit", e);
        }

        int retCode = json.optInt("retCode", 0);
        if (retCode == 0) return;

        String msg = json.optString("retMsg", "");
        if (retCode == RET_TOO_MANY_VISITS || retCode == RET_IP_LIMIT) {
            throw new RateLimitedException(CODE, "bybit rate limit: retCode=" + retCode + " " + msg, RATE_LIMIT_PAUSE_MS);
        }
        throw new FatalExchangeException(CODE, "bybit error: retCode=" + retCode + " " + msg);
    }

    @Override
    protected List<UnifiedKline> requestCandles(String symbol,
                                                Timeframe timeframe,
                                                Instant since,
                                                int limit) throws ExchangeException {

        String interval = INTERVALS.get(timeframe);

        StringBuilder url = new StringBuilder(baseUrl)
                .append("/v5/market/kline?category=spot")
                .append("&symbol=").append(symbol)
                .append("&interval=").append(interval)
                .append("&limit=").append(limit);

        // без end Bybit отдаёт самые свежие бары из диапазона: ограничиваем окно страницей
        if (since != null) {
            url.append("&start=").append(since.toEpochMilli())
               .append("&end=").append(lastOpenOfPage(timeframe, since, limit).toEpochMilli());
        }

        JSONObject result = new JSONObject(get(url.toString())).optJSONObject("result");
        JSONArray list = result == null ? null : result.optJSONArray("list");
        if (list == null) {
            return List.of();
        }

        List<UnifiedKline> out = new ArrayList<>(list.length());
        for (int i = 0; i < list.length(); i++) {
            JSONArray k = list.optJSONArray(i);
            if (k == null) continue;

            out.add(UnifiedKline.builder()
                    .openTime(epochMillis(k, 0))
                    .open(decimal(k, 1))
                    .high(decimal(k, 2))
                    .low(decimal(k, 3))
                    .close(decimal(k, 4))
                    .volume(decimal(k, 5))
                    .quoteVolume(decimal(k, 6))
                    .timeframe(interval)
                    .symbol(symbol)
                    .build());
        }
        return out;
    }
}
