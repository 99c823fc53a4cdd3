package com.cidery.ledger.domain.units;

/**
 * Physical dimension of a unit. Conversion is exact only within one dimension.
 */
public enum Dimension {
    VOLUME,
    MASS
}
