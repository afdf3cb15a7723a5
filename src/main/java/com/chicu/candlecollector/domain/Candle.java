package com.chicu.candlecollector.domain;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Свеча OHLCV. Уникальна по (exchange, pair, period, open_time).
 * Создаётся и перезаписывается только CandleUpsertService, никогда не удаляется.
 */
@Entity
@Table(
        name = "candles",
        uniqueConstraints = {
                @UniqueConstraint(
                        name = "ux_candles_series_open_time",
                        columnNames = {"exchange_id", "currency_pair_id", "time_period_id", "open_time"}
                )
        },
        indexes = {
                @Index(name = "ix_candles_exchange", columnList = "exchange_id"),
                @Index(name = "ix_candles_open_time", columnList = "open_time")
        }
)
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Candle {

    private static final int PRICE_PRECISION = 28;
    private static final int PRICE_SCALE = 12;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "exchange_id", nullable = false)
    private Exchange exchange;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "currency_pair_id", nullable = false)
    private CurrencyPair currencyPair;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "time_period_id", nullable = false)
    private TimePeriod timePeriod;

    @Column(name = "open_time", nullable = false)
    private Instant openTime;

    @Column(name = "close_time", nullable = false)
    private Instant closeTime;

    @Column(name = "open_price", nullable = false, precision = PRICE_PRECISION, scale = PRICE_SCALE)
    private BigDecimal open;

    @Column(name = "high_price", nullable = false, precision = PRICE_PRECISION, scale = PRICE_SCALE)
    private BigDecimal high;

    @Column(name = "low_price", nullable = false, precision = PRICE_PRECISION, scale = PRICE_SCALE)
    private BigDecimal low;

    @Column(name = "close_price", nullable = false, precision = PRICE_PRECISION, scale = PRICE_SCALE)
    private BigDecimal close;

    @Column(name = "volume", nullable = false, precision = PRICE_PRECISION, scale = PRICE_SCALE)
    private BigDecimal volume;

    @Column(name = "quote_volume", precision = PRICE_PRECISION, scale = PRICE_SCALE)
    private BigDecimal quoteVolume;

    @Column(name = "trades_count")
    private Integer tradesCount;

    /** Период уже был закрыт на момент fetchedAt: OHLCV окончательные */
    @Column(name = "is_closed", nullable = false)
    private boolean closed;

    /** Когда данные были получены с биржи */
    @Column(name = "fetched_at", nullable = false)
    private Instant fetchedAt;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false, nullable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
}
