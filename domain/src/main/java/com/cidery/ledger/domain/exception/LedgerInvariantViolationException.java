package com.cidery.ledger.domain.exception;

import java.math.BigDecimal;

/**
 * The materialized batch volume disagrees with the transaction log.
 * Never repaired automatically; a reviewed adjustment has to reconcile it.
 */
public class LedgerInvariantViolationException extends LedgerException {

    public LedgerInvariantViolationException(String batchId, BigDecimal projectedLiters, BigDecimal loggedLiters) {
        super("LEDGER_INVARIANT_VIOLATION",
                String.format("Batch %s projection is %s L but its transaction log sums to %s L",
                        batchId, projectedLiters.toPlainString(), loggedLiters.toPlainString()),
                details("batchId", batchId, "projectedLiters", projectedLiters, "loggedLiters", loggedLiters));
    }

    @Override
    public ErrorCategory getCategory() {
        return ErrorCategory.INVARIANT;
    }
}
