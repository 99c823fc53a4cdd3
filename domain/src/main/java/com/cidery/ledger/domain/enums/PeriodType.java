package com.cidery.ledger.domain.enums;

/**
 * Excise reporting period granularity
 */
public enum PeriodType {
    MONTHLY,
    QUARTERLY,
    ANNUAL
}
