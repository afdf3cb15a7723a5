package com.chicu.candlecollector.domain;

import com.chicu.candlecollector.common.enums.NetworkType;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.util.Locale;

@Entity
@Table(
        name = "exchanges",
        indexes = {
                @Index(name = "ix_exchanges_code", columnList = "code"),
                @Index(name = "ix_exchanges_active", columnList = "is_active")
        }
)
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Exchange {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /** Отображаемое имя ("Binance", "OKX") */
    @Column(name = "name", nullable = false, length = 64)
    private String name;

    /** Код адаптера: binance, binance_testnet, bybit, okx, gate */
    @Column(name = "code", nullable = false, length = 32)
    private String code;

    /** Окружение: MAINNET / TESTNET (production / sandbox) */
    @Enumerated(EnumType.STRING)
    @Column(name = "environment", nullable = false, length = 16)
    @Builder.Default
    private NetworkType environment = NetworkType.MAINNET;

    /** Ключи: для сборщика непрозрачны, рыночные данные публичные */
    @Column(name = "api_key", length = 256)
    private String apiKey;

    @Column(name = "api_secret", length = 256)
    private String apiSecret;

    @Column(name = "api_passphrase", length = 256)
    private String apiPassphrase;

    /**
     * Бюджет запросов в минуту для этой биржи.
     * null: берётся дефолт адаптера.
     */
    @Column(name = "rate_limit_per_minute")
    private Integer rateLimitPerMinute;

    @Column(name = "is_active", nullable = false)
    @Builder.Default
    private boolean active = true;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false, nullable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    // ===================== Утилиты =====================

    /** Нормализованный код адаптера */
    @Transient
    public String normalizedCode() {
        return code == null ? "" : code.trim().toLowerCase(Locale.ROOT);
    }
}
