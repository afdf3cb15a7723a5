package com.chicu.candlecollector.exchange.binance;

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

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Binance Spot: GET /api/v3/klines.
 *
 * Ответ: массив массивов, по возрастанию openTime:
 * [openTime, open, high, low, close, volume, closeTime, quoteVolume, trades, ...]
 */
@Slf4j
public class BinanceExchangeClient extends AbstractRestExchangeClient {

    public static final String CODE = "binance";

    private static final String MAIN = "https://api.binance.com";
    private static final String TEST = "https://testnet.binance.vision";

    /** вес klines при limit 100..500: 2 */
    private static final int KLINES_WEIGHT = 2;
    private static final int DEFAULT_RPM = 1200;
    private static final int MAX_LIMIT = 1000;

    private final String baseUrl;

    public BinanceExchangeClient(RestTemplate rest,
                                 NetworkType network,
                                 Integer requestsPerMinute,
                                 RetryPolicy retryPolicy,
                                 Sleeper sleeper) {
        super(CODE, rest,
                new TokenBucketRateLimiter(requestsPerMinute != null ? requestsPerMinute : DEFAULT_RPM, 20),
                retryPolicy, sleeper);
        this.baseUrl = network == NetworkType.TESTNET ? TEST : MAIN;
        log.info("🔌 Binance klines → {}", baseUrl);
    }

    @Override
    public int getRequestCost() {
        return KLINES_WEIGHT;
    }

    @Override
    public int getMaxCandlesPerRequest() {
        return MAX_LIMIT;
    }

    @Override
    public boolean supports(Timeframe timeframe) {
        // у Binance есть все наши таймфреймы, коды совпадают
        return timeframe != null;
    }

    @Override
    protected String toVenueSymbol(String baseSymbol, String quoteSymbol) {
        return (baseSymbol + quoteSymbol).toUpperCase(Locale.ROOT);
    }

    @Override
    protected List<UnifiedKline> requestCandles(String symbol,
                                                Timeframe timeframe,
                                                Instant since,
                                                int limit) throws ExchangeException {

        StringBuilder url = new StringBuilder(baseUrl)
                .append("/api/v3/klines?symbol=").append(symbol)
                .append("&interval=").append(timeframe.getCode())
                .append("&limit=").append(limit);
        if (since != null) {
            url.append("&startTime=").append(since.toEpochMilli());
        }

        JSONArray arr = parseArray(get(url.toString()));

        List<UnifiedKline> out = new ArrayList<>(arr.length());
        for (int i = 0; i < arr.length(); i++) {
            JSONArray k = arr.optJSONArray(i);
            if (k == null) continue;

            out.add(UnifiedKline.builder()
                    .openTime(epochMillis(k, 0))
                    .open(decimal(k, 1))
                    .high(decimal(k, 2))
                    .low(decimal(k, 3))
                    .close(decimal(k, 4))
                    .volume(decimal(k, 5))
                    .quoteVolume(decimal(k, 7))
                    .tradesCount(k.length() > 8 && !k.isNull(8) ? k.optInt(8) : null)
                    .timeframe(timeframe.getCode())
                    .symbol(symbol)
                    .build());
        }
        return out;
    }
}
