package com.cidery.ledger.domain.exception;

/**
 * Coarse classification of ledger failures.
 * VALIDATION failures are raised before any write, CONFLICT failures may be retried,
 * INVARIANT failures indicate corrupted ledger state and need a human-reviewed correction.
 */
public enum ErrorCategory {
    VALIDATION,
    CONFLICT,
    INVARIANT
}
