package com.cidery.ledger.domain.enums;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class TaxClassTest {

    @Test
    void testClassifyByAbv() {
        assertEquals(TaxClass.HARD_CIDER, TaxClass.forAbv(new BigDecimal("6.0")));
        assertEquals(TaxClass.WINE_UNDER_16, TaxClass.forAbv(new BigDecimal("8.5")));
        assertEquals(TaxClass.WINE_16_TO_21, TaxClass.forAbv(new BigDecimal("18")));
        assertEquals(TaxClass.WINE_21_TO_24, TaxClass.forAbv(new BigDecimal("22.00")));
        assertEquals(TaxClass.APPLE_BRANDY, TaxClass.forAbv(new BigDecimal("55")));
        assertEquals(TaxClass.APPLE_BRANDY, TaxClass.forAbv(new BigDecimal("100")));
    }

    @Test
    void testUnknownAbvIsHardCider() {
        assertEquals(TaxClass.HARD_CIDER, TaxClass.forAbv(null));
    }
}
