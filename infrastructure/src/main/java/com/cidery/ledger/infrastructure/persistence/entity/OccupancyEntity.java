package com.cidery.ledger.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Which batch sits in which vessel. At most one unreleased row per vessel,
 * enforced by a partial unique index.
 */
@Entity
@Table(name = "occupancies", indexes = {
    @Index(name = "idx_occupancies_batch", columnList = "batch_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OccupancyEntity {

    @Id
    @Column(name = "id")
    private UUID id;

    @Column(name = "vessel_id", nullable = false, length = 64)
    private String vesselId;

    @Column(name = "batch_id", nullable = false, length = 64)
    private String batchId;

    @Column(name = "since", nullable = false)
    private OffsetDateTime since;

    @Column(name = "released_at")
    private OffsetDateTime releasedAt;

    @PrePersist
    protected void onCreate() {
        if (id == null) {
            id = UUID.randomUUID();
        }
        if (since == null) {
            since = OffsetDateTime.now();
        }
    }

    public boolean isActive() {
        return releasedAt == null;
    }
}
