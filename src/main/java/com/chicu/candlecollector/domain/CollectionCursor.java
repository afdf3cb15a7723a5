package com.chicu.candlecollector.domain;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;

/**
 * High-water mark догрузки истории: последний open_time,
 * успешно сохранённый BackfillWalker'ом для серии.
 */
@Entity
@Table(
        name = "collection_cursors",
        uniqueConstraints = {
                @UniqueConstraint(
                        name = "ux_collection_cursors_series",
                        columnNames = {"exchange_id", "currency_pair_id", "time_period_id"}
                )
        }
)
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CollectionCursor {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "exchange_id", nullable = false)
    private Long exchangeId;

    @Column(name = "currency_pair_id", nullable = false)
    private Long currencyPairId;

    @Column(name = "time_period_id", nullable = false)
    private Long timePeriodId;

    @Column(name = "last_open_time", nullable = false)
    private Instant lastOpenTime;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
}
