package com.chicu.candlecollector.domain;

import com.chicu.candlecollector.common.time.Timeframe;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.util.Optional;

@Entity
@Table(name = "time_periods")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TimePeriod {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "name", nullable = false, length = 32)
    private String name;

    /** Длительность бара в минутах (1, 60, 1440, ...) */
    @Column(name = "minutes", nullable = false)
    private Integer minutes;

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

    @Transient
    public Optional<Timeframe> timeframe() {
        Optional<Timeframe> byMinutes = minutes == null ? Optional.empty() : Timeframe.fromMinutes(minutes);
        // запасной вариант: имя периода ("1h", "1d")
        return byMinutes.isPresent() ? byMinutes : Timeframe.fromCode(name);
    }
}
