package com.chicu.candlecollector.exchange.okx;

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
import org.springframework.http.HttpHeaders;
import org.springframework.web.client.RestTemplate;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * OKX v5.
 *
 * - последние бары: /api/v5/market/candles
 * - история: /api/v5/market/history-candles с after = граница страницы (бары строго раньше)
 *
 * data: от новых к старым: [ts, o, h, l, c, vol, volCcy, volCcyQuote, confirm].
 * Demo trading: тот же хост + заголовок x-simulated-trading: 1.
 */
@Slf4j
public class OkxExchangeClient extends AbstractRestExchangeClient {

    public static final String CODE = "okx";

    private static final String BASE = "https://www.okx.com";

    private static final int DEFAULT_RPM = 300;
    private static final int MAX_LIMIT = 100;

    private static final String CODE_OK = "0";
    private static final String CODE_RATE_LIMIT = "50011";
    private static final long RATE_LIMIT_PAUSE_MS = 2_000;

    /** дневные и старше: UTC-варианты, иначе OKX режет по Гонконгу */
    private static final Map<Timeframe, String> BARS = new EnumMap<>(Timeframe.class);

    static {
        BARS.put(Timeframe.M1, "1m");
        BARS.put(Timeframe.M3, "3m");
        BARS.put(Timeframe.M5, "5m");
        BARS.put(Timeframe.M15, "15m");
        BARS.put(Timeframe.M30, "30m");
        BARS.put(Timeframe.H1, "1H");
        BARS.put(Timeframe.H2, "2H");
        BARS.put(Timeframe.H4, "4H");
        BARS.put(Timeframe.H6, "6Hutc");
        BARS.put(Timeframe.H12, "12Hutc");
        BARS.put(Timeframe.D1, "1Dutc");
        BARS.put(Timeframe.W1, "1Wutc");
        BARS.put(Timeframe.MON1, "1Mutc");
    }

    private final boolean simulated;

    public OkxExchangeClient(RestTemplate rest,
                             NetworkType network,
                             Integer requestsPerMinute,
                             RetryPolicy retryPolicy,
                             Sleeper sleeper) {
        super(CODE, rest,
                new TokenBucketRateLimiter(requestsPerMinute != null ? requestsPerMinute : DEFAULT_RPM, 10),
                retryPolicy, sleeper);
        this.simulated = network == NetworkType.TESTNET;
        log.info("🔌 OKX klines → {} (demo={})", BASE, simulated);
    }

    @Override
    public int getMaxCandlesPerRequest() {
        return MAX_LIMIT;
    }

    @Override
    public boolean supports(Timeframe timeframe) {
        return BARS.containsKey(timeframe);
    }

    @Override
    protected String toVenueSymbol(String baseSymbol, String quoteSymbol) {
        return (baseSymbol + "-" + quoteSymbol).toUpperCase(Locale.ROOT);
    }

    @Override
    protected HttpHeaders headers() {
        HttpHeaders h = new HttpHeaders();
        if (simulated) {
            h.set("x-simulated-trading", "1");
        }
        return h;
    }

    @Override
    protected void checkBody(String body) throws ExchangeException {
        JSONObject json;
        try {
            json = new JSONObject(body);
        } catch (JSONException e) {
            throw new FatalExchangeException(CODE, "Malformed response from okx", e);
        }

        String code = json.optString("code", CODE_OK);
        if (CODE_OK.equals(code)) return;

        String msg = json.optString("msg", "");
        if (CODE_RATE_LIMIT.equals(code)) {
            throw new RateLimitedException(CODE, "okx rate limit: code=" + code + " " + msg, RATE_LIMIT_PAUSE_MS);
        }
        throw new FatalExchangeException(CODE, "okx error: code=" + code + " " + msg);
    }

    @Override
    protected List<UnifiedKline> requestCandles(String symbol,
                                                Timeframe timeframe,
                                                Instant since,
                                                int limit) throws ExchangeException {

        String bar = BARS.get(timeframe);
        StringBuilder url = new StringBuilder(BASE);

        if (since == null) {
            url.append("/api/v5/market/candles");
        } else {
            url.append("/api/v5/market/history-candles");
        }
        url.append("?instId=").append(symbol)
           .append("&bar=").append(bar)
           .append("&limit=").append(limit);

        if (since != null) {
            // after: бары с ts < after: ровно одна страница от since
            Instant pageEnd = timeframe.next(lastOpenOfPage(timeframe, since, limit));
            url.append("&after=").append(pageEnd.toEpochMilli());
        }

        JSONArray data = new JSONObject(get(url.toString())).optJSONArray("data");
        if (data == null) {
            return List.of();
        }

        long sinceMs = since == null ? Long.MIN_VALUE : since.toEpochMilli();

        List<UnifiedKline> out = new ArrayList<>(data.length());
        for (int i = 0; i < data.length(); i++) {
            JSONArray k = data.optJSONArray(i);
            if (k == null) continue;

            Long ts = epochMillis(k, 0);
            if (ts != null && ts < sinceMs) continue;

            out.add(UnifiedKline.builder()
                    .openTime(ts)
                    .open(decimal(k, 1))
                    .high(decimal(k, 2))
                    .low(decimal(k, 3))
                    .close(decimal(k, 4))
                    .volume(decimal(k, 5))
                    .quoteVolume(decimal(k, 7))
                    .timeframe(bar)
                    .symbol(symbol)
                    .build());
        }
        return out;
    }
}
