package com.cidery.ledger.domain.exception;

import java.util.Map;

/**
 * Conflicting concurrent state. The caller may re-read and retry.
 */
public abstract class LedgerConflictException extends LedgerException {

    protected LedgerConflictException(String code, String message, Map<String, Object> details, Throwable cause) {
        super(code, message, details, cause);
    }

    @Override
    public ErrorCategory getCategory() {
        return ErrorCategory.CONFLICT;
    }
}
