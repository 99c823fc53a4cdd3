package com.cidery.ledger.application.service;

import com.cidery.ledger.domain.enums.AdjustmentType;
import com.cidery.ledger.domain.enums.WarningType;
import com.cidery.ledger.domain.exception.AdjustmentDirectionException;
import com.cidery.ledger.domain.exception.LedgerValidationException;
import com.cidery.ledger.domain.model.LedgerWarning;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Rules for volume adjustments: the direction each adjustment type allows and the
 * size above which an adjustment is flagged for review.
 */
@Component
public class AdjustmentPolicy {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final BigDecimal largeThresholdPct;

    public AdjustmentPolicy(@Value("${ledger.adjustment.large-threshold-pct:10}") BigDecimal largeThresholdPct) {
        this.largeThresholdPct = largeThresholdPct;
    }

    public void checkDirection(String batchId, AdjustmentType type, BigDecimal deltaLiters) {
        if (type == null) {
            throw new LedgerValidationException("MISSING_FIELD", "adjustmentType is required",
                    Map.of("field", "adjustmentType"));
        }
        if (deltaLiters.signum() == 0) {
            throw new LedgerValidationException("NO_OP_ADJUSTMENT",
                    "Measured volume equals the computed volume of batch " + batchId,
                    Map.of("batchId", batchId));
        }
        if (!type.permits(deltaLiters)) {
            throw new AdjustmentDirectionException(batchId, type, deltaLiters);
        }
    }

    /**
     * Warning for an adjustment larger than the threshold share of the computed volume.
     * Any change to an empty computed volume counts as large.
     */
    public Optional<LedgerWarning> largeAdjustment(String batchId, BigDecimal computedLiters, BigDecimal deltaLiters) {
        if (computedLiters.signum() != 0
                && deltaLiters.abs().multiply(HUNDRED).compareTo(largeThresholdPct.multiply(computedLiters.abs())) <= 0) {
            return Optional.empty();
        }
        // rounded for display only; the comparison above is exact
        BigDecimal pct = computedLiters.signum() == 0
                ? null
                : deltaLiters.abs().multiply(HUNDRED).divide(computedLiters.abs(), 2, RoundingMode.HALF_UP);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("batchId", batchId);
        details.put("computedLiters", computedLiters);
        details.put("deltaLiters", deltaLiters);
        details.put("changePct", pct);
        details.put("thresholdPct", largeThresholdPct);
        return Optional.of(LedgerWarning.builder()
                .type(WarningType.LARGE_ADJUSTMENT)
                .message(String.format("Adjustment of %s L on batch %s exceeds %s%% of the computed volume",
                        deltaLiters.toPlainString(), batchId, largeThresholdPct.toPlainString()))
                .details(details)
                .build());
    }
}
