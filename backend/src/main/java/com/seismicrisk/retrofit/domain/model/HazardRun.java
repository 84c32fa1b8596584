package com.seismicrisk.retrofit.domain.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * Ledger row for one hazard computation, keyed by its cache key.
 *
 * The curves themselves live in the hazard-curve-stores cache. This row records
 * what the cache is supposed to hold, so that a missing or corrupt entry can be
 * told apart from one that was never computed.
 */
@Entity
@Table(name = "hazard_runs", indexes = {
    @Index(name = "idx_hazard_run_key", columnList = "cacheKey", unique = true),
    @Index(name = "idx_hazard_run_status", columnList = "status")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class HazardRun {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * SHA-256 fingerprint of the hazard-affecting parameters.
     */
    @Column(nullable = false, length = 64)
    private String cacheKey;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private HazardRunStatus status;

    /**
     * Content checksum of the published store. Set only when the run is COMPLETE.
     */
    @Column(length = 64)
    private String checksum;

    private Integer curveCount;

    private Integer realizationCount;

    private LocalDateTime startedAt;

    private LocalDateTime completedAt;

    /**
     * Number of times the store was served from cache instead of recomputed.
     */
    @Column(nullable = false)
    @Builder.Default
    private Long reuseCount = 0L;

    @Column(length = 1024)
    private String failureReason;

    @Column(nullable = false)
    private LocalDateTime updatedAt;

    @PrePersist
    @PreUpdate
    protected void touch() {
        updatedAt = LocalDateTime.now();
        if (reuseCount == null) {
            reuseCount = 0L;
        }
    }
}
