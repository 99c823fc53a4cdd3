package com.cidery.ledger.domain.model;

import com.cidery.ledger.domain.enums.TaxClass;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * One tax class of a reconciliation, all volumes in US wine gallons.
 * Balance identity: opening + produced + blendedIn + adjustmentsIn
 * = removed + blendedOut + losses + adjustmentsOut + closing.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaxClassLine {

    private TaxClass taxClass;

    private BigDecimal openingGallons;

    private BigDecimal producedGallons;

    /**
     * Received from blends and splits.
     */
    private BigDecimal blendedInGallons;

    private BigDecimal adjustmentsInGallons;

    /**
     * Left the premises: distillation, packaging, tax-paid removals, samples, breakage.
     */
    private BigDecimal removedGallons;

    /**
     * Used as a blend or split source.
     */
    private BigDecimal blendedOutGallons;

    private BigDecimal lossGallons;

    private BigDecimal adjustmentsOutGallons;

    private BigDecimal closingGallons;

    /**
     * Closing balance in proof gallons. Only set for spirits.
     */
    private BigDecimal closingProofGallons;

    private BigDecimal variance;

    private boolean balanced;

    private BigDecimal reportedOpeningGallons;

    private BigDecimal reportedClosingGallons;
}
