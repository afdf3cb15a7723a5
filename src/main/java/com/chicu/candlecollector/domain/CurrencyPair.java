package com.chicu.candlecollector.domain;

import com.chicu.candlecollector.common.enums.MarketType;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;

/**
 * Валютная пара (base/quote).
 *
 * exchange == null: пара отслеживается на всех активных биржах,
 * иначе только на указанной.
 */
@Entity
@Table(
        name = "currency_pairs",
        indexes = @Index(name = "ix_currency_pairs_exchange", columnList = "exchange_id")
)
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CurrencyPair {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.EAGER, optional = false)
    @JoinColumn(name = "base_symbol_id", nullable = false)
    private Symbol baseSymbol;

    @ManyToOne(fetch = FetchType.EAGER, optional = false)
    @JoinColumn(name = "quote_symbol_id", nullable = false)
    private Symbol quoteSymbol;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "exchange_id")
    private Exchange exchange;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false, length = 16)
    @Builder.Default
    private MarketType type = MarketType.SPOT;

    @Column(name = "is_active", nullable = false)
    @Builder.Default
    private boolean active = true;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false, nullable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    /** "BTC/USDT" */
    @Transient
    public String displaySymbol() {
        return baseCode() + "/" + quoteCode();
    }

    @Transient
    public String baseCode() {
        return baseSymbol == null ? "?" : baseSymbol.getSymbol();
    }

    @Transient
    public String quoteCode() {
        return quoteSymbol == null ? "?" : quoteSymbol.getSymbol();
    }
}
