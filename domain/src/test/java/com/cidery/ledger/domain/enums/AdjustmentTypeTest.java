package com.cidery.ledger.domain.enums;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class AdjustmentTypeTest {

    @Test
    void testIncreaseOnlyTypes() {
        for (AdjustmentType type : new AdjustmentType[]{AdjustmentType.CORRECTION_UP, AdjustmentType.CALIBRATION_GAIN}) {
            assertEquals(AdjustmentType.Direction.INCREASE_ONLY, type.getDirection());
            assertTrue(type.permits(BigDecimal.ONE), type.name());
            assertFalse(type.permits(BigDecimal.ONE.negate()), type.name());
        }
    }

    @Test
    void testDecreaseOnlyTypes() {
        for (AdjustmentType type : new AdjustmentType[]{AdjustmentType.CORRECTION_DOWN, AdjustmentType.EVAPORATION,
                AdjustmentType.SEDIMENT, AdjustmentType.SPILLAGE}) {
            assertEquals(AdjustmentType.Direction.DECREASE_ONLY, type.getDirection());
            assertTrue(type.permits(new BigDecimal("-0.001")), type.name());
            assertFalse(type.permits(new BigDecimal("0.001")), type.name());
        }
    }

    @Test
    void testPhysicalCountEitherWay() {
        assertTrue(AdjustmentType.PHYSICAL_COUNT.permits(BigDecimal.ONE));
        assertTrue(AdjustmentType.PHYSICAL_COUNT.permits(BigDecimal.ONE.negate()));
    }

    @Test
    void testZeroDeltaNeverPermitted() {
        for (AdjustmentType type : AdjustmentType.values()) {
            assertFalse(type.permits(BigDecimal.ZERO), type.name());
        }
    }
}
