package com.github.dimitryivaniuta.quota.counter;

import com.github.dimitryivaniuta.quota.window.PeriodType;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * One row per (user, period type, window start). Rows of past windows are the usage history
 * and are never deleted here.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
        name = "rate_limit_counters",
        uniqueConstraints = @UniqueConstraint(
                name = "rate_limit_counters_user_period_idx",
                columnNames = {"user_id", "period_type", "period_start"}
        ),
        indexes = @Index(name = "rate_limit_counters_user_type_idx", columnList = "user_id, period_type")
)
public class RateLimitCounter {

    @Id
    private UUID id;

    @Column(name = "user_id", nullable = false, length = 128)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "period_type", nullable = false, length = 16)
    private PeriodType periodType;

    @Column(name = "period_start", nullable = false)
    private Instant periodStart;

    @Column(name = "request_count", nullable = false)
    private int requestCount;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void prePersist() {
        Instant now = Instant.now();
        if (id == null) {
            id = UUID.randomUUID();
        }
        if (createdAt == null) {
            createdAt = now;
        }
        updatedAt = now;
    }

    @PreUpdate
    void preUpdate() {
        updatedAt = Instant.now();
    }

    /** Stored counts are reported as-is except that negatives read as zero. */
    public int usedCount() {
        return Math.max(0, requestCount);
    }
}
