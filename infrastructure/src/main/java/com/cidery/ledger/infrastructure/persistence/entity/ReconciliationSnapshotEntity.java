package com.cidery.ledger.infrastructure.persistence.entity;

import com.cidery.ledger.domain.enums.PeriodType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Stored result of reconciling one reporting period. Lines and discrepancies are
 * kept as JSON.
 */
@Entity
@Table(name = "reconciliation_snapshots", indexes = {
    @Index(name = "idx_reconciliation_period", columnList = "period_type, period_year, period_number")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReconciliationSnapshotEntity {

    @Id
    @Column(name = "id")
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(name = "period_type", nullable = false, length = 16)
    private PeriodType periodType;

    @Column(name = "period_year", nullable = false)
    private Integer periodYear;

    @Column(name = "period_number", nullable = false)
    private Integer periodNumber;

    @Column(name = "period_start", nullable = false)
    private LocalDate periodStart;

    @Column(name = "period_end", nullable = false)
    private LocalDate periodEnd;

    @Column(name = "tolerance_gallons", nullable = false, precision = 10, scale = 3)
    private BigDecimal toleranceGallons;

    @Column(name = "balanced", nullable = false)
    private boolean balanced;

    @Column(name = "snapshot_data", nullable = false, columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private String snapshotData;

    @Column(name = "generated_by", nullable = false, length = 128)
    private String generatedBy;

    @Column(name = "generated_at", nullable = false)
    private OffsetDateTime generatedAt;

    @PrePersist
    protected void onCreate() {
        if (id == null) {
            id = UUID.randomUUID();
        }
        if (generatedAt == null) {
            generatedAt = OffsetDateTime.now();
        }
    }
}
