package com.cidery.ledger.domain.enums;

public enum DiffKind {
    ADDED,
    REMOVED,
    MODIFIED
}
