package com.cidery.ledger.domain.enums;

/**
 * Process loss categories
 */
public enum LossType {
    RACKING,
    FILTERING,
    TRANSFER,
    SPOILAGE,
    OTHER
}
