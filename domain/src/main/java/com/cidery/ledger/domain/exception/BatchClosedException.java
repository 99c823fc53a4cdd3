package com.cidery.ledger.domain.exception;

import com.cidery.ledger.domain.enums.BatchStatus;

public class BatchClosedException extends LedgerValidationException {

    public BatchClosedException(String batchId, BatchStatus status) {
        super("BATCH_CLOSED",
                String.format("Batch %s is %s and accepts no further movements", batchId, status),
                details("batchId", batchId, "status", status.name()));
    }
}
