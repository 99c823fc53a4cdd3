package com.cidery.ledger.infrastructure.persistence.entity;

import com.cidery.ledger.domain.enums.BatchStatus;
import com.cidery.ledger.domain.enums.TaxClass;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

/**
 * JPA entity for batches.
 * current_volume_liters is a projection of the transaction log, checked against it
 * before every mutation.
 */
@Entity
@Table(name = "batches", indexes = {
    @Index(name = "idx_batches_status", columnList = "status")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchEntity {

    @Id
    @Column(name = "id", length = 64)
    private String id;

    @Column(name = "name", nullable = false, length = 255)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private BatchStatus status;

    @Column(name = "abv_pct", precision = 5, scale = 2)
    private BigDecimal abvPct;

    @Enumerated(EnumType.STRING)
    @Column(name = "tax_class", length = 32)
    private TaxClass taxClass;

    @Builder.Default
    @Column(name = "current_volume_liters", nullable = false, precision = 14, scale = 3)
    private BigDecimal currentVolumeLiters = BigDecimal.ZERO;

    @Column(name = "composition_sources", nullable = false, columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private String compositionSources;

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
