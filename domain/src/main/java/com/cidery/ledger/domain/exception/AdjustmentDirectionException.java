package com.cidery.ledger.domain.exception;

import com.cidery.ledger.domain.enums.AdjustmentType;

import java.math.BigDecimal;

/**
 * Raised when an adjustment type is applied against its allowed direction,
 * for example an evaporation loss recorded as a gain.
 */
public class AdjustmentDirectionException extends LedgerValidationException {

    public AdjustmentDirectionException(String batchId, AdjustmentType type, BigDecimal deltaLiters) {
        super("ADJUSTMENT_DIRECTION",
                String.format("Adjustment type %s is %s but the measured delta for batch %s is %s L",
                        type, type.getDirection().name().toLowerCase().replace('_', '-'),
                        batchId, deltaLiters.toPlainString()),
                details("batchId", batchId, "adjustmentType", type.name(), "deltaLiters", deltaLiters));
    }
}
