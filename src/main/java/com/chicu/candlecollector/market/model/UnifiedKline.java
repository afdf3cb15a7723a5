package com.chicu.candlecollector.market.model;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;

/**
 * Сырой бар (kline) от биржи в едином виде, ДО валидации.
 * Любое поле может быть null, если биржа его не прислала :
 * решение принимает CandleNormalizer.
 */
@Data
@Builder
public class UnifiedKline {

    /** Время открытия свечи (ms epoch) */
    private Long openTime;

    private BigDecimal open;
    private BigDecimal high;
    private BigDecimal low;
    private BigDecimal close;

    /** Объём в базовой валюте */
    private BigDecimal volume;

    /** Объём в котируемой валюте (если биржа даёт) */
    private BigDecimal quoteVolume;

    /** Кол-во сделок (только Binance) */
    private Integer tradesCount;

    /** Таймфрейм в коде биржи: "1h", "60", "1H", ... */
    private String timeframe;

    /** Символ в формате биржи: BTCUSDT, BTC-USDT, BTC_USDT */
    private String symbol;
}
