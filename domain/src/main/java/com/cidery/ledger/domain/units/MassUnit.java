package com.cidery.ledger.domain.units;

import java.math.BigDecimal;

public enum MassUnit implements MeasureUnit {
    KILOGRAM("kg", "1"),
    POUND("lb", "0.453592"),
    BUSHEL("bu", "18.14");      // apples, 40 lb

    private final String symbol;
    private final BigDecimal factorToBase;

    MassUnit(String symbol, String factorToBase) {
        this.symbol = symbol;
        this.factorToBase = new BigDecimal(factorToBase);
    }

    @Override
    public Dimension getDimension() {
        return Dimension.MASS;
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
