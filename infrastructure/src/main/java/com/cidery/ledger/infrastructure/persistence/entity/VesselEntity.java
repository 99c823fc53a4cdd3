package com.cidery.ledger.infrastructure.persistence.entity;

import com.cidery.ledger.domain.enums.VesselStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

/**
 * JPA entity for vessels. The version column serializes concurrent mutations
 * touching the same vessel.
 */
@Entity
@Table(name = "vessels", indexes = {
    @Index(name = "idx_vessels_status", columnList = "status")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VesselEntity {

    @Id
    @Column(name = "id", length = 64)
    private String id;

    @Column(name = "name", nullable = false, length = 255)
    private String name;

    @Column(name = "capacity_liters", nullable = false, precision = 14, scale = 3)
    private BigDecimal capacityLiters;

    /**
     * Unit the capacity was registered in, for display.
     */
    @Column(name = "capacity_unit", nullable = false, length = 8)
    private String capacityUnit;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private VesselStatus status;

    @Column(name = "location", length = 255)
    private String location;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    @Column(name = "created_at", nullable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        OffsetDateTime now = OffsetDateTime.now();
        createdAt = now;
        updatedAt = now;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = OffsetDateTime.now();
    }
}
