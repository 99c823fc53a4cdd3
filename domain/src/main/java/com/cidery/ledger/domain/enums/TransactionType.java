package com.cidery.ledger.domain.enums;

/**
 * Kind of ledger movement recorded in the transaction log
 */
public enum TransactionType {
    FILL,
    TRANSFER,
    ADJUSTMENT,
    BLEND,
    SPLIT,
    LOSS,
    REMOVAL     // leaves the premises: distillation, packaging, tax-paid removal
}
