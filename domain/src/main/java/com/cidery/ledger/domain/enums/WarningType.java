package com.cidery.ledger.domain.enums;

public enum WarningType {
    LARGE_ADJUSTMENT,
    RECONCILIATION_DISCREPANCY,
    RECONCILIATION_UNBALANCED
}
