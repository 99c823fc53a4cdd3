package com.cidery.ledger.domain.units;

import java.math.BigDecimal;

public enum VolumeUnit implements MeasureUnit {
    LITER("L", "1"),
    GALLON("gal", "3.78541"),   // US liquid gallon
    MILLILITER("mL", "0.001");

    private final String symbol;
    private final BigDecimal factorToBase;

    VolumeUnit(String symbol, String factorToBase) {
        this.symbol = symbol;
        this.factorToBase = new BigDecimal(factorToBase);
    }

    @Override
    public Dimension getDimension() {
        return Dimension.VOLUME;
    }

    @Override
    public BigDecimal getFactorToBase() {
        return factorToBase;
    }

    @Override
    public String getSymbol() {
        return symbol;
    }
}
