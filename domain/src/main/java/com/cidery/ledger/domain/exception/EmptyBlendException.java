package com.cidery.ledger.domain.exception;

public class EmptyBlendException extends LedgerValidationException {

    public EmptyBlendException() {
        super("EMPTY_BLEND", "Blend has no volume; weighted ABV is undefined", null);
    }
}
