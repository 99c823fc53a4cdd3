package com.cidery.ledger.domain.exception;

import java.math.BigDecimal;

public class CapacityExceededException extends LedgerValidationException {

    public CapacityExceededException(String vesselId, BigDecimal requestedLiters, BigDecimal availableLiters) {
        super("CAPACITY_EXCEEDED",
                String.format("Vessel %s cannot take %s L, only %s L of capacity left",
                        vesselId, requestedLiters.toPlainString(), availableLiters.toPlainString()),
                details("vesselId", vesselId, "requestedLiters", requestedLiters, "availableLiters", availableLiters));
    }
}
