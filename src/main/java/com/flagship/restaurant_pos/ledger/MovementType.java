package com.flagship.restaurant_pos.ledger;

import java.math.BigDecimal;

/**
 * Kind of stock movement and the sign its delta must carry.
 * {@link #ADJUSTMENT} takes an absolute target instead of a delta.
 */
public enum MovementType {
    PURCHASE(1),
    SALE(-1),
    ADJUSTMENT(0),
    WASTAGE(-1),
    RETURN(1);

    private final int requiredSign;

    MovementType(int requiredSign) {
        this.requiredSign = requiredSign;
    }

    public boolean isAbsoluteTarget() {
        return this == ADJUSTMENT;
    }

    boolean acceptsDelta(BigDecimal delta) {
        return delta.signum() == requiredSign;
    }

    public String code() {
        return name().toLowerCase();
    }

    public static MovementType fromCode(String code) {
        return valueOf(code.toUpperCase());
    }
}
