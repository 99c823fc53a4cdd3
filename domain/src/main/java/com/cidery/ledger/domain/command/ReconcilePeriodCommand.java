package com.cidery.ledger.domain.command;

import com.cidery.ledger.domain.enums.TaxClass;
import com.cidery.ledger.domain.model.ReportingPeriod;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.Map;

/**
 * Externally reported balances to check the ledger against, in wine gallons per tax class.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReconcilePeriodCommand {

    private ReportingPeriod period;

    @Builder.Default
    private Map<TaxClass, BigDecimal> reportedOpeningGallons = new EnumMap<>(TaxClass.class);

    @Builder.Default
    private Map<TaxClass, BigDecimal> reportedClosingGallons = new EnumMap<>(TaxClass.class);

    /**
     * Overrides the configured tolerance when set.
     */
    private BigDecimal toleranceGallons;

    private String actorId;
}
