package com.cidery.ledger.domain.exception;

import java.math.BigDecimal;

public class InsufficientVolumeException extends LedgerValidationException {

    public InsufficientVolumeException(String batchId, String vesselId, BigDecimal requestedLiters,
                                       BigDecimal availableLiters) {
        super("INSUFFICIENT_VOLUME",
                String.format("Batch %s holds %s L in vessel %s, %s L requested",
                        batchId, availableLiters.toPlainString(), vesselId, requestedLiters.toPlainString()),
                details("batchId", batchId, "vesselId", vesselId,
                        "requestedLiters", requestedLiters, "availableLiters", availableLiters,
                        "shortfallLiters", requestedLiters.subtract(availableLiters)));
    }
}
