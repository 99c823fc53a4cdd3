package com.cidery.ledger.infrastructure.persistence.repository;

import com.cidery.ledger.domain.enums.AuditOperation;
import com.cidery.ledger.infrastructure.persistence.entity.AuditLogEntity;
import org.springframework.data.jpa.domain.Specification;

import java.time.OffsetDateTime;

/**
 * Composable audit log filters. Each returns null for a null argument, which
 * Specification.where/and treat as no restriction.
 */
public final class AuditLogSpecifications {

    private AuditLogSpecifications() {
    }

    public static Specification<AuditLogEntity> tableName(String tableName) {
        return tableName == null ? null : (root, query, cb) -> cb.equal(root.get("tableName"), tableName);
    }

    public static Specification<AuditLogEntity> recordId(String recordId) {
        return recordId == null ? null : (root, query, cb) -> cb.equal(root.get("recordId"), recordId);
    }

    public static Specification<AuditLogEntity> operation(AuditOperation operation) {
        return operation == null ? null : (root, query, cb) -> cb.equal(root.get("operation"), operation);
    }

    public static Specification<AuditLogEntity> changedBy(String actor) {
        return actor == null ? null : (root, query, cb) -> cb.equal(root.get("changedBy"), actor);
    }

    public static Specification<AuditLogEntity> changedFrom(OffsetDateTime from) {
        return from == null ? null : (root, query, cb) -> cb.greaterThanOrEqualTo(root.get("changedAt"), from);
    }

    public static Specification<AuditLogEntity> changedBefore(OffsetDateTime to) {
        return to == null ? null : (root, query, cb) -> cb.lessThan(root.get("changedAt"), to);
    }
}
