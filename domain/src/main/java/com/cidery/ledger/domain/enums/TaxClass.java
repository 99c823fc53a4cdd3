package com.cidery.ledger.domain.enums;

import java.math.BigDecimal;

/**
 * Excise tax classes (TTB 5120.17 wine classes plus apple brandy).
 * Bounds are ABV percentages, lower inclusive and upper exclusive.
 */
public enum TaxClass {
    HARD_CIDER("0", "8.5", false),
    WINE_UNDER_16("8.5", "16", false),
    WINE_16_TO_21("16", "21", false),
    WINE_21_TO_24("21", "24", false),
    APPLE_BRANDY("24", "100.01", true);

    private final BigDecimal minAbv;
    private final BigDecimal maxAbv;
    private final boolean spirits;

    TaxClass(String minAbv, String maxAbv, boolean spirits) {
        this.minAbv = new BigDecimal(minAbv);
        this.maxAbv = new BigDecimal(maxAbv);
        this.spirits = spirits;
    }

    public boolean isSpirits() {
        return spirits;
    }

    /**
     * Classify by ABV. Unknown ABV counts as hard cider.
     */
    public static TaxClass forAbv(BigDecimal abvPct) {
        if (abvPct == null) {
            return HARD_CIDER;
        }
        for (TaxClass taxClass : values()) {
            if (abvPct.compareTo(taxClass.minAbv) >= 0 && abvPct.compareTo(taxClass.maxAbv) < 0) {
                return taxClass;
            }
        }
        throw new IllegalArgumentException("ABV out of range: " + abvPct);
    }
}
