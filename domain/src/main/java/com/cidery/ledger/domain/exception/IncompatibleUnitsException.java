package com.cidery.ledger.domain.exception;

public class IncompatibleUnitsException extends LedgerValidationException {

    public IncompatibleUnitsException(String fromUnit, String toUnit) {
        super("INCOMPATIBLE_UNITS",
                String.format("Cannot convert %s to %s without a density factor", fromUnit, toUnit),
                details("fromUnit", fromUnit, "toUnit", toUnit));
    }
}
