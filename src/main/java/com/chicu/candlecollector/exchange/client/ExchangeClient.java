package com.chicu.candlecollector.exchange.client;

import com.chicu.candlecollector.common.time.Timeframe;
import com.chicu.candlecollector.exchange.exception.ExchangeException;
import com.chicu.candlecollector.market.model.UnifiedKline;

import java.time.Instant;
import java.util.List;

/**
 * 🌐 ExchangeClient: единый интерфейс рыночных данных для всех бирж.
 *
 * 🧩 Реализуют:
 *   - BinanceExchangeClient (binance, binance_testnet)
 *   - BybitExchangeClient
 *   - OkxExchangeClient
 *   - GateExchangeClient
 *
 * Сборщик зависит только от этого интерфейса и ничего не знает о причудах биржи.
 */
public interface ExchangeClient {

    /**
     * Код биржи ("binance", "bybit", "okx", "gate").
     */
    String getExchangeCode();

    /**
     * Свечи по паре, отсортированные по openTime по возрастанию.
     *
     * @param baseSymbol  базовая валюта (BTC)
     * @param quoteSymbol котируемая валюта (USDT)
     * @param timeframe   таймфрейм
     * @param since       null: последние свечи; иначе первая свеча не раньше since
     * @param limit       null: максимум страницы биржи; обрезается до getMaxCandlesPerRequest()
     *
     * @throws com.chicu.candlecollector.exchange.exception.RateLimitedException      лимит не отпустил за все попытки
     * @throws com.chicu.candlecollector.exchange.exception.TransientExchangeException сеть не восстановилась
     * @throws com.chicu.candlecollector.exchange.exception.FatalExchangeException     запрос не имеет смысла повторять
     */
    List<UnifiedKline> fetchCandles(String baseSymbol,
                                    String quoteSymbol,
                                    Timeframe timeframe,
                                    Instant since,
                                    Integer limit) throws ExchangeException;

    /** Бюджет запросов в минуту, под который адаптер сам себя тормозит. */
    int getRateLimitPerMinute();

    /** Стоимость одного fetchCandles в единицах бюджета. */
    default int getRequestCost() {
        return 1;
    }

    /** Максимальный размер страницы свечей. */
    int getMaxCandlesPerRequest();

    /** Поддерживает ли биржа этот таймфрейм. */
    boolean supports(Timeframe timeframe);
}
