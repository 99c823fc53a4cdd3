package com.cidery.ledger.application.service;

import com.cidery.ledger.domain.exception.EmptyBlendException;
import com.cidery.ledger.domain.exception.LedgerValidationException;
import com.cidery.ledger.domain.model.BlendCalculation;
import com.cidery.ledger.domain.model.BlendComponent;
import com.cidery.ledger.domain.units.UnitConverter;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Blend arithmetic: total volume, volume-weighted ABV and each component's share.
 * Volumes are treated as additive.
 */
@Component
public class BlendCalculator {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    public BlendCalculation blend(List<BlendComponent> components) {
        if (components == null || components.isEmpty()) {
            throw new EmptyBlendException();
        }

        BigDecimal total = BigDecimal.ZERO;
        BigDecimal alcohol = BigDecimal.ZERO;
        List<BigDecimal> volumes = new ArrayList<>();
        for (BlendComponent component : components) {
            if (component.getVolume() == null) {
                throw new LedgerValidationException("MISSING_FIELD", "Blend component volume is required",
                        Map.of("batchId", String.valueOf(component.getBatchId())));
            }
            if (component.getAbvPct() == null) {
                throw new LedgerValidationException("ABV_REQUIRED",
                        "ABV of blend component " + component.getBatchId() + " is unknown",
                        Map.of("batchId", String.valueOf(component.getBatchId())));
            }
            BigDecimal liters = component.getVolume().toLiters();
            volumes.add(liters);
            total = total.add(liters);
            alcohol = alcohol.add(liters.multiply(component.getAbvPct()));
        }
        if (total.signum() == 0) {
            throw new EmptyBlendException();
        }

        List<BlendCalculation.Share> shares = new ArrayList<>();
        for (int i = 0; i < components.size(); i++) {
            BlendComponent component = components.get(i);
            BigDecimal liters = volumes.get(i);
            shares.add(BlendCalculation.Share.builder()
                    .batchId(component.getBatchId())
                    .volumeLiters(liters)
                    .abvPct(component.getAbvPct())
                    .percentage(liters.multiply(HUNDRED).divide(total, UnitConverter.ABV_SCALE, RoundingMode.HALF_UP))
                    .build());
        }

        return BlendCalculation.builder()
                .totalLiters(total)
                .weightedAbv(alcohol.divide(total, UnitConverter.ABV_SCALE, RoundingMode.HALF_UP))
                .shares(shares)
                .build();
    }
}
