package com.cidery.ledger.domain.exception;

public class InvalidStateTransitionException extends LedgerValidationException {

    public InvalidStateTransitionException(String recordType, String recordId, String from, String to, String reason) {
        super("INVALID_STATE_TRANSITION",
                String.format("%s %s cannot move from %s to %s: %s", recordType, recordId, from, to, reason),
                details("recordType", recordType, "recordId", recordId, "from", from, "to", to));
    }
}
