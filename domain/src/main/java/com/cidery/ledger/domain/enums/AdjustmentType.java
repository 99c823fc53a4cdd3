package com.cidery.ledger.domain.enums;

import java.math.BigDecimal;

/**
 * Reason for reconciling a measured volume against the ledger, tagged with the
 * direction in which it may move the books.
 */
public enum AdjustmentType {
    CORRECTION_UP(Direction.INCREASE_ONLY),
    CALIBRATION_GAIN(Direction.INCREASE_ONLY),
    CORRECTION_DOWN(Direction.DECREASE_ONLY),
    EVAPORATION(Direction.DECREASE_ONLY),
    SEDIMENT(Direction.DECREASE_ONLY),
    SPILLAGE(Direction.DECREASE_ONLY),
    PHYSICAL_COUNT(Direction.EITHER);

    public enum Direction {
        INCREASE_ONLY,
        DECREASE_ONLY,
        EITHER
    }

    private final Direction direction;

    AdjustmentType(Direction direction) {
        this.direction = direction;
    }

    public Direction getDirection() {
        return direction;
    }

    public boolean permits(BigDecimal delta) {
        return switch (direction) {
            case INCREASE_ONLY -> delta.signum() > 0;
            case DECREASE_ONLY -> delta.signum() < 0;
            case EITHER -> delta.signum() != 0;
        };
    }
}
