package com.cidery.ledger.domain.exception;

public class LedgerEntityNotFoundException extends LedgerValidationException {

    public LedgerEntityNotFoundException(String recordType, String recordId) {
        super("NOT_FOUND",
                String.format("%s %s not found", recordType, recordId),
                details("recordType", recordType, "recordId", recordId));
    }
}
