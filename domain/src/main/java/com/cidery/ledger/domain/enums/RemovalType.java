package com.cidery.ledger.domain.enums;

/**
 * Ways liquid leaves a batch other than loss
 */
public enum RemovalType {
    DISTILLATION,
    PACKAGING,
    TAX_PAID_REMOVAL,
    SAMPLE,
    BREAKAGE
}
