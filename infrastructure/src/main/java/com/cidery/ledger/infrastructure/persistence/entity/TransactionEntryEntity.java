package com.cidery.ledger.infrastructure.persistence.entity;

import com.cidery.ledger.domain.enums.TransactionType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Append-only transaction log row. (batch_id, batch_seq) is unique, so two
 * concurrent appends to the same batch cannot both commit.
 */
@Entity
@Immutable
@Table(name = "transaction_entries",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_transaction_entries_batch_seq", columnNames = {"batch_id", "batch_seq"})
    },
    indexes = {
        @Index(name = "idx_transaction_entries_occurred_at", columnList = "occurred_at"),
        @Index(name = "idx_transaction_entries_vessel", columnList = "vessel_id"),
        @Index(name = "idx_transaction_entries_operation", columnList = "operation_id")
    })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransactionEntryEntity {

    @Id
    @Column(name = "id")
    private UUID id;

    @Column(name = "operation_id", nullable = false)
    private UUID operationId;

    @Column(name = "batch_id", nullable = false, length = 64)
    private String batchId;

    @Column(name = "vessel_id", length = 64)
    private String vesselId;

    @Column(name = "batch_seq", nullable = false)
    private Long batchSeq;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false, length = 20)
    private TransactionType type;

    @Column(name = "delta_liters", nullable = false, precision = 14, scale = 3)
    private BigDecimal deltaLiters;

    @Column(name = "abv_pct", precision = 5, scale = 2)
    private BigDecimal abvPct;

    @Column(name = "volume_before_liters", nullable = false, precision = 14, scale = 3)
    private BigDecimal volumeBeforeLiters;

    @Column(name = "volume_after_liters", nullable = false, precision = 14, scale = 3)
    private BigDecimal volumeAfterLiters;

    @Column(name = "reason_code", nullable = false, length = 64)
    private String reasonCode;

    @Column(name = "detail", nullable = false, columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private String detail;

    @Column(name = "occurred_at", nullable = false)
    private OffsetDateTime occurredAt;

    @Column(name = "actor_id", nullable = false, length = 128)
    private String actorId;

    @Column(name = "correlation_id", length = 128)
    private String correlationId;

    @PrePersist
    protected void onCreate() {
        if (id == null) {
            id = UUID.randomUUID();
        }
    }
}
