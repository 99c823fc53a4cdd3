package com.cidery.ledger.domain.units;

import com.cidery.ledger.domain.exception.IncompatibleUnitsException;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Stateless unit and alcohol-strength conversions.
 *
 * All arithmetic is decimal. Conversions go through the dimension's base unit and keep
 * {@value #INTERNAL_SCALE} fractional digits, so converting there and back again stays
 * well inside the system volume precision of {@value #VOLUME_SCALE} places.
 */
public final class UnitConverter {

    public static final int INTERNAL_SCALE = 9;
    public static final int VOLUME_SCALE = 3;
    public static final int ABV_SCALE = 2;

    private static final BigDecimal TWO = BigDecimal.valueOf(2);
    private static final BigDecimal FIFTY = BigDecimal.valueOf(50);
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private UnitConverter() {
    }

    /**
     * Convert a non-negative amount between units of the same dimension.
     *
     * @throws IncompatibleUnitsException when the units measure different dimensions
     */
    public static BigDecimal convert(BigDecimal amount, MeasureUnit from, MeasureUnit to) {
        requireNonNegative(amount);
        return convertDelta(amount, from, to);
    }

    /**
     * Same as {@link #convert(BigDecimal, MeasureUnit, MeasureUnit)} but accepts signed amounts,
     * used for ledger deltas.
     */
    public static BigDecimal convertDelta(BigDecimal amount, MeasureUnit from, MeasureUnit to) {
        if (amount == null) {
            throw new IllegalArgumentException("Amount is required");
        }
        if (from.getDimension() != to.getDimension()) {
            throw new IncompatibleUnitsException(from.getSymbol(), to.getSymbol());
        }
        if (from == to) {
            return amount;
        }
        BigDecimal base = amount.multiply(from.getFactorToBase());
        return base.divide(to.getFactorToBase(), INTERNAL_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Convert across volume and mass using a density in kilograms per liter.
     */
    public static BigDecimal convert(BigDecimal amount, MeasureUnit from, MeasureUnit to,
                                     BigDecimal densityKgPerLiter) {
        requireNonNegative(amount);
        if (from.getDimension() == to.getDimension()) {
            return convertDelta(amount, from, to);
        }
        if (densityKgPerLiter == null || densityKgPerLiter.signum() <= 0) {
            throw new IncompatibleUnitsException(from.getSymbol(), to.getSymbol());
        }
        if (from.getDimension() == Dimension.VOLUME) {
            BigDecimal liters = convertDelta(amount, from, VolumeUnit.LITER);
            return convertDelta(liters.multiply(densityKgPerLiter), MassUnit.KILOGRAM, to);
        }
        BigDecimal kilograms = convertDelta(amount, from, MassUnit.KILOGRAM);
        BigDecimal liters = kilograms.divide(densityKgPerLiter, INTERNAL_SCALE, RoundingMode.HALF_UP);
        return convertDelta(liters, VolumeUnit.LITER, to);
    }

    public static BigDecimal toLiters(BigDecimal amount, MeasureUnit from) {
        return convertDelta(amount, from, VolumeUnit.LITER).setScale(VOLUME_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Liters to US wine gallons at volume precision.
     */
    public static BigDecimal toGallons(BigDecimal liters) {
        return convertDelta(liters, VolumeUnit.LITER, VolumeUnit.GALLON).setScale(VOLUME_SCALE, RoundingMode.HALF_UP);
    }

    public static BigDecimal abvToProof(BigDecimal abvPct) {
        requireAbv(abvPct);
        return abvPct.multiply(TWO);
    }

    public static BigDecimal proofToAbv(BigDecimal proof) {
        requireNonNegative(proof);
        BigDecimal abv = proof.divide(TWO, INTERNAL_SCALE, RoundingMode.HALF_UP);
        requireAbv(abv);
        return abv.setScale(ABV_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Proof gallons: wine gallons x ABV / 50. One proof gallon is one gallon at 50% ABV.
     */
    public static BigDecimal proofGallons(BigDecimal amount, VolumeUnit unit, BigDecimal abvPct) {
        requireAbv(abvPct);
        BigDecimal gallons = convertDelta(amount, unit, VolumeUnit.GALLON);
        return gallons.multiply(abvPct).divide(FIFTY, VOLUME_SCALE, RoundingMode.HALF_UP);
    }

    private static void requireNonNegative(BigDecimal amount) {
        if (amount == null) {
            throw new IllegalArgumentException("Amount is required");
        }
        if (amount.signum() < 0) {
            throw new IllegalArgumentException("Amount must not be negative: " + amount.toPlainString());
        }
    }

    private static void requireAbv(BigDecimal abvPct) {
        if (abvPct == null || abvPct.signum() < 0 || abvPct.compareTo(HUNDRED) > 0) {
            throw new IllegalArgumentException("ABV must be between 0 and 100: " + abvPct);
        }
    }
}
