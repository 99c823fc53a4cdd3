package com.cidery.ledger.domain.model;

import com.cidery.ledger.domain.exception.IncompatibleUnitsException;
import com.cidery.ledger.domain.units.MeasureUnit;
import com.cidery.ledger.domain.units.UnitConverter;
import com.cidery.ledger.domain.units.VolumeUnit;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * Immutable amount of liquid or fruit in a unit, optionally with its alcohol concentration
 * (ABV, percent by volume).
 *
 * Quantities built through {@link #of} are non-negative. Ledger deltas use {@link #delta},
 * which allows a sign. Equality is by value in the base unit, so 1 gal equals 3.78541 L.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Quantity implements Comparable<Quantity> {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final BigDecimal amount;
    private final MeasureUnit unit;
    private final BigDecimal concentrationPct;

    private Quantity(BigDecimal amount, MeasureUnit unit, BigDecimal concentrationPct) {
        if (amount == null) {
            throw new IllegalArgumentException("Quantity amount is required");
        }
        this.unit = Objects.requireNonNull(unit, "unit");
        if (concentrationPct != null
                && (concentrationPct.signum() < 0 || concentrationPct.compareTo(HUNDRED) > 0)) {
            throw new IllegalArgumentException("Concentration must be between 0 and 100: " + concentrationPct);
        }
        this.amount = amount;
        this.concentrationPct = concentrationPct == null
                ? null
                : concentrationPct.setScale(UnitConverter.ABV_SCALE, RoundingMode.HALF_UP);
    }

    public static Quantity of(BigDecimal amount, MeasureUnit unit) {
        return of(amount, unit, null);
    }

    public static Quantity of(BigDecimal amount, MeasureUnit unit, BigDecimal concentrationPct) {
        if (amount != null && amount.signum() < 0) {
            throw new IllegalArgumentException("Quantity must not be negative: " + amount.toPlainString());
        }
        return new Quantity(amount, unit, concentrationPct);
    }

    @JsonCreator
    public static Quantity fromJson(@JsonProperty("amount") BigDecimal amount,
                                    @JsonProperty("unit") String unit,
                                    @JsonProperty("concentrationPct") BigDecimal concentrationPct) {
        return of(amount, MeasureUnit.fromSymbol(unit), concentrationPct);
    }

    public static Quantity liters(String amount) {
        return of(new BigDecimal(amount), VolumeUnit.LITER);
    }

    public static Quantity liters(BigDecimal amount) {
        return of(amount, VolumeUnit.LITER);
    }

    public static Quantity liters(BigDecimal amount, BigDecimal abvPct) {
        return of(amount, VolumeUnit.LITER, abvPct);
    }

    /**
     * A signed quantity, used for transaction log deltas.
     */
    public static Quantity delta(BigDecimal amount, MeasureUnit unit, BigDecimal concentrationPct) {
        return new Quantity(amount, unit, concentrationPct);
    }

    public BigDecimal getAmount() {
        return amount;
    }

    @JsonIgnore
    public MeasureUnit getUnit() {
        return unit;
    }

    @JsonProperty("unit")
    public String getUnitSymbol() {
        return unit.getSymbol();
    }

    public BigDecimal getConcentrationPct() {
        return concentrationPct;
    }

    public Quantity to(MeasureUnit target) {
        return new Quantity(UnitConverter.convertDelta(amount, unit, target), target, concentrationPct);
    }

    /**
     * Amount in liters at volume precision.
     *
     * @throws IncompatibleUnitsException for mass quantities
     */
    public BigDecimal toLiters() {
        return UnitConverter.toLiters(amount, unit);
    }

    public Quantity withConcentration(BigDecimal abvPct) {
        return new Quantity(amount, unit, abvPct);
    }

    public Quantity plus(Quantity other) {
        return new Quantity(amount.add(other.amountIn(unit)), unit, concentrationPct);
    }

    public Quantity minus(Quantity other) {
        return new Quantity(amount.subtract(other.amountIn(unit)), unit, concentrationPct);
    }

    public Quantity negate() {
        return new Quantity(amount.negate(), unit, concentrationPct);
    }

    @JsonIgnore
    public boolean isZero() {
        return amount.signum() == 0;
    }

    @JsonIgnore
    public boolean isNegative() {
        return amount.signum() < 0;
    }

    private BigDecimal amountIn(MeasureUnit target) {
        return UnitConverter.convertDelta(amount, unit, target);
    }

    private BigDecimal baseAmount() {
        return amount.multiply(unit.getFactorToBase());
    }

    @Override
    public int compareTo(Quantity other) {
        if (unit.getDimension() != other.unit.getDimension()) {
            throw new IncompatibleUnitsException(unit.getSymbol(), other.unit.getSymbol());
        }
        return baseAmount().compareTo(other.baseAmount());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Quantity)) {
            return false;
        }
        Quantity that = (Quantity) o;
        if (unit.getDimension() != that.unit.getDimension()) {
            return false;
        }
        if (baseAmount().compareTo(that.baseAmount()) != 0) {
            return false;
        }
        if (concentrationPct == null || that.concentrationPct == null) {
            return concentrationPct == that.concentrationPct;
        }
        return concentrationPct.compareTo(that.concentrationPct) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(unit.getDimension(),
                baseAmount().stripTrailingZeros(),
                concentrationPct == null ? null : concentrationPct.stripTrailingZeros());
    }

    @Override
    public String toString() {
        String text = amount.toPlainString() + " " + unit.getSymbol();
        return concentrationPct == null ? text : text + " @ " + concentrationPct.toPlainString() + "%";
    }
}
