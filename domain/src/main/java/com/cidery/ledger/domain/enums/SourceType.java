package com.cidery.ledger.domain.enums;

/**
 * Provenance of liquid contributing to a batch
 */
public enum SourceType {
    BATCH,
    PRESS_RUN,
    PURCHASE_LOT,
    JUICE_PURCHASE,
    DISTILLATION_RECEIPT
}
