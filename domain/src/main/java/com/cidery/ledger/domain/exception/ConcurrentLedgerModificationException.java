package com.cidery.ledger.domain.exception;

public class ConcurrentLedgerModificationException extends LedgerConflictException {

    public ConcurrentLedgerModificationException(String message, Throwable cause) {
        super("CONCURRENT_MODIFICATION", message, null, cause);
    }

    public ConcurrentLedgerModificationException(String recordType, String recordId, Long expectedVersion,
                                                 Long actualVersion) {
        super("CONCURRENT_MODIFICATION",
                String.format("%s %s is at version %s, expected %s", recordType, recordId, actualVersion, expectedVersion),
                details("recordType", recordType, "recordId", recordId,
                        "expectedVersion", expectedVersion, "actualVersion", actualVersion), null);
    }
}
