package com.chicu.candlecollector.domain;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;

/**
 * Код актива (BTC, USDT, ...). Справочник, ядром не меняется.
 */
@Entity
@Table(
        name = "symbols",
        uniqueConstraints = @UniqueConstraint(name = "ux_symbols_symbol", columnNames = "symbol")
)
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Symbol {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "name", nullable = false, length = 64)
    private String name;

    @Column(name = "symbol", nullable = false, length = 32)
    private String symbol;

    @Column(name = "description")
    private String description;

    @Column(name = "is_active", nullable = false)
    @Builder.Default
    private boolean active = true;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false, nullable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
}
