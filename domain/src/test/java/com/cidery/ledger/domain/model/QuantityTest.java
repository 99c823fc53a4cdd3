package com.cidery.ledger.domain.model;

import com.cidery.ledger.domain.exception.IncompatibleUnitsException;
import com.cidery.ledger.domain.units.MassUnit;
import com.cidery.ledger.domain.units.VolumeUnit;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class QuantityTest {

    @Test
    void testRejectsNegativeAmount() {
        assertThrows(IllegalArgumentException.class, () -> Quantity.liters("-0.5"));
    }

    @Test
    void testRejectsConcentrationOutOfRange() {
        assertThrows(IllegalArgumentException.class,
                () -> Quantity.of(BigDecimal.ONE, VolumeUnit.LITER, new BigDecimal("100.5")));
        assertThrows(IllegalArgumentException.class,
                () -> Quantity.of(BigDecimal.ONE, VolumeUnit.LITER, new BigDecimal("-1")));
    }

    @Test
    void testDeltaMayBeNegative() {
        Quantity delta = Quantity.delta(new BigDecimal("-20"), VolumeUnit.LITER, null);
        assertTrue(delta.isNegative());
        assertEquals(0, new BigDecimal("20").compareTo(delta.negate().getAmount()));
    }

    @Test
    void testEqualityAcrossUnits() {
        Quantity gallon = Quantity.of(BigDecimal.ONE, VolumeUnit.GALLON);
        Quantity liters = Quantity.liters("3.78541");
        assertEquals(gallon, liters);
        assertEquals(gallon.hashCode(), liters.hashCode());
        assertNotEquals(gallon, Quantity.of(BigDecimal.ONE, MassUnit.KILOGRAM));
    }

    @Test
    void testArithmeticKeepsLeftUnit() {
        Quantity total = Quantity.liters("10").plus(Quantity.of(BigDecimal.ONE, VolumeUnit.GALLON));
        assertEquals(VolumeUnit.LITER, total.getUnit());
        assertEquals(0, new BigDecimal("13.785").compareTo(total.toLiters()));
        assertEquals(0, new BigDecimal("5.000").compareTo(Quantity.liters("8").minus(Quantity.liters("3")).toLiters()));
    }

    @Test
    void testCompareAcrossDimensionsFails() {
        assertThrows(IncompatibleUnitsException.class,
                () -> Quantity.liters("1").compareTo(Quantity.of(BigDecimal.ONE, MassUnit.POUND)));
    }

    @Test
    void testJsonUsesUnitSymbol() throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        Quantity quantity = Quantity.of(new BigDecimal("5"), VolumeUnit.GALLON, new BigDecimal("6.5"));

        String json = mapper.writeValueAsString(quantity);
        assertTrue(json.contains("\"unit\":\"gal\""), json);

        Quantity read = mapper.readValue(json, Quantity.class);
        assertEquals(quantity, read);
    }
}
