package com.cidery.ledger.domain.enums;

public enum AuditOperation {
    CREATE,
    UPDATE,
    DELETE,
    SOFT_DELETE,
    RESTORE
}
