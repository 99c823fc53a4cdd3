package com.cidery.ledger.infrastructure.persistence.entity;

import com.cidery.ledger.domain.enums.AuditOperation;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Append-only audit trail row with full snapshots, derived diff and a checksum.
 */
@Entity
@Immutable
@Table(name = "audit_log", indexes = {
    @Index(name = "idx_audit_log_record", columnList = "table_name, record_id"),
    @Index(name = "idx_audit_log_changed_at", columnList = "changed_at"),
    @Index(name = "idx_audit_log_changed_by", columnList = "changed_by")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditLogEntity {

    @Id
    @Column(name = "id")
    private UUID id;

    @Column(name = "table_name", nullable = false, length = 64)
    private String tableName;

    @Column(name = "record_id", nullable = false, length = 64)
    private String recordId;

    @Enumerated(EnumType.STRING)
    @Column(name = "operation", nullable = false, length = 20)
    private AuditOperation operation;

    @Column(name = "old_data", columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private String oldData;

    @Column(name = "new_data", columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private String newData;

    @Column(name = "diff_data", nullable = false, columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private String diffData;

    @Column(name = "changed_by", nullable = false, length = 128)
    private String changedBy;

    @Column(name = "reason", length = 1000)
    private String reason;

    @Column(name = "correlation_id", length = 128)
    private String correlationId;

    @Column(name = "changed_at", nullable = false)
    private OffsetDateTime changedAt;

    @Column(name = "audit_version", nullable = false, length = 8)
    private String auditVersion;

    @Column(name = "checksum", nullable = false, length = 64)
    private String checksum;

    @PrePersist
    protected void onCreate() {
        if (id == null) {
            id = UUID.randomUUID();
        }
    }
}
