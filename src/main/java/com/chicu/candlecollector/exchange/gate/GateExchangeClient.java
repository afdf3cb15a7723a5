package com.chicu.candlecollector.exchange.gate;

import com.chicu.candlecollector.common.enums.NetworkType;
import com.chicu.candlecollector.common.time.Sleeper;
import com.chicu.candlecollector.common.time.Timeframe;
import com.chicu.candlecollector.exchange.client.AbstractRestExchangeClient;
import com.chicu.candlecollector.exchange.client.RetryPolicy;
import com.chicu.candlecollector.exchange.exception.ExchangeException;
import com.chicu.candlecollector.exchange.ratelimit.TokenBucketRateLimiter;
import com.chicu.candlecollector.market.model.UnifiedKline;
import lombok.extern.slf4j.Slf4j;
import org.json.JSONArray;
import org.springframework.web.client.RestTemplate;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Gate.io v4: GET /api/v4/spot/candlesticks.
 *
 * Время в СЕКУНДАХ. Строка бара:
 * [t, quoteVolume, close, high, low, open, baseVolume, windowClosed]
 *
 * limit нельзя сочетать с from/to: для истории окно задаётся только from/to.
 */
@Slf4j
public class GateExchangeClient extends AbstractRestExchangeClient {

    public static final String CODE = "gate";

    private static final String MAIN = "https://api.gateio.ws";
    private static final String TEST = "https://api-testnet.gateapi.io";

    private static final int DEFAULT_RPM = 600;
    private static final int MAX_LIMIT = 1000;

    /** 7d и 30d у Gate не совпадают с календарной сеткой: не поддерживаем */
    private static final Map<Timeframe, String> INTERVALS = new EnumMap<>(Timeframe.class);

    static {
        INTERVALS.put(Timeframe.M1, "1m");
        INTERVALS.put(Timeframe.M5, "5m");
        INTERVALS.put(Timeframe.M15, "15m");
        INTERVALS.put(Timeframe.M30, "30m");
        INTERVALS.put(Timeframe.H1, "1h");
        INTERVALS.put(Timeframe.H4, "4h");
        INTERVALS.put(Timeframe.H8, "8h");
        INTERVALS.put(Timeframe.D1, "1d");
    }

    private final String baseUrl;

    public GateExchangeClient(RestTemplate rest,
                              NetworkType network,
                              Integer requestsPerMinute,
                              RetryPolicy retryPolicy,
                              Sleeper sleeper) {
        super(CODE, rest,
                new TokenBucketRateLimiter(requestsPerMinute != null ? requestsPerMinute : DEFAULT_RPM, 10),
                retryPolicy, sleeper);
        this.baseUrl = network == NetworkType.TESTNET ? TEST : MAIN;
        log.info("🔌 Gate klines → {}", baseUrl);
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
        return (baseSymbol + "_" + quoteSymbol).toUpperCase(Locale.ROOT);
    }

    @Override
    protected List<UnifiedKline> requestCandles(String symbol,
                                                Timeframe timeframe,
                                                Instant since,
                                                int limit) throws ExchangeException {

        String interval = INTERVALS.get(timeframe);

        StringBuilder url = new StringBuilder(baseUrl)
                .append("/api/v4/spot/candlesticks?currency_pair=").append(symbol)
                .append("&interval=").append(interval);

        if (since == null) {
            url.append("&limit=").append(limit);
        } else {
            url.append("&from=").append(since.getEpochSecond())
               .append("&to=").append(lastOpenOfPage(timeframe, since, limit).getEpochSecond());
        }

        JSONArray arr = parseArray(get(url.toString()));

        List<UnifiedKline> out = new ArrayList<>(arr.length());
        for (int i = 0; i < arr.length(); i++) {
            JSONArray k = arr.optJSONArray(i);
            if (k == null) continue;

            BigDecimal t = decimal(k, 0);

            out.add(UnifiedKline.builder()
                    .openTime(t == null ? null : t.longValue() * 1000L)
                    .quoteVolume(decimal(k, 1))
                    .close(decimal(k, 2))
                    .high(decimal(k, 3))
                    .low(decimal(k, 4))
                    .open(decimal(k, 5))
                    .volume(decimal(k, 6))
                    .timeframe(interval)
                    .symbol(symbol)
                    .build());
        }
        return out;
    }
}
