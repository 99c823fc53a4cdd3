package com.cidery.ledger.domain.enums;

/**
 * Vessel lifecycle status
 */
public enum VesselStatus {
    AVAILABLE,
    OCCUPIED,
    CLEANING,
    MAINTENANCE,
    RETIRED     // terminal
}
