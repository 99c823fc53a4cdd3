package com.cidery.ledger.domain.exception;

import java.util.Map;

/**
 * Input or state rejected before anything was written.
 */
public class LedgerValidationException extends LedgerException {

    public LedgerValidationException(String message) {
        this("VALIDATION_FAILED", message, null);
    }

    public LedgerValidationException(String code, String message, Map<String, Object> details) {
        super(code, message, details);
    }

    @Override
    public ErrorCategory getCategory() {
        return ErrorCategory.VALIDATION;
    }
}
