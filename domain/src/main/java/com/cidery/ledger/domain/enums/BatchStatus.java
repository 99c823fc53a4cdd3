package com.cidery.ledger.domain.enums;

/**
 * Batch production status
 */
public enum BatchStatus {
    FERMENTATION,
    AGING,
    CONDITIONING,
    COMPLETED,
    CANCELLED;

    public boolean isClosed() {
        return this == COMPLETED || this == CANCELLED;
    }
}
