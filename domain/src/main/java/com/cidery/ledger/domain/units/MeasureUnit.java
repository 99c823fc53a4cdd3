package com.cidery.ledger.domain.units;

import java.math.BigDecimal;

/**
 * A unit of measure with a fixed factor to its dimension's base unit
 * (liters for volume, kilograms for mass).
 */
public interface MeasureUnit {

    Dimension getDimension();

    /**
     * How many base units one of this unit is.
     */
    BigDecimal getFactorToBase();

    String getSymbol();

    /**
     * Resolve a unit by symbol ("gal") or enum name ("GALLON"), case-insensitive.
     */
    static MeasureUnit fromSymbol(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("Unit symbol is required");
        }
        String trimmed = symbol.trim();
        for (VolumeUnit unit : VolumeUnit.values()) {
            if (unit.getSymbol().equalsIgnoreCase(trimmed) || unit.name().equalsIgnoreCase(trimmed)) {
                return unit;
            }
        }
        for (MassUnit unit : MassUnit.values()) {
            if (unit.getSymbol().equalsIgnoreCase(trimmed) || unit.name().equalsIgnoreCase(trimmed)) {
                return unit;
            }
        }
        throw new IllegalArgumentException("Unknown unit: " + symbol);
    }
}
