package com.flagship.restaurant_pos.order;

import java.util.EnumSet;
import java.util.Set;

/**
 * Order lifecycle.
 *
 * <pre>
 *   PENDING -> PREPARING -> READY -> SERVED -> COMPLETED
 *       \__________\___________\_______\____> CANCELLED
 * </pre>
 *
 * Full payment completes an order from any non-terminal status.
 */
public enum OrderStatus {
    PENDING,
    PREPARING,
    READY,
    SERVED,
    COMPLETED,
    CANCELLED;

    public static final Set<OrderStatus> ACTIVE = EnumSet.of(PENDING, PREPARING, READY, SERVED);

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }

    /**
     * Items may be added, removed or resized only while the kitchen has not
     * declared the order ready.
     */
    public boolean acceptsItemChanges() {
        return this == PENDING || this == PREPARING;
    }

    public boolean canTransitionTo(OrderStatus next) {
        return switch (this) {
            case PENDING -> next == PREPARING || next == COMPLETED || next == CANCELLED;
            case PREPARING -> next == READY || next == COMPLETED || next == CANCELLED;
            case READY -> next == SERVED || next == COMPLETED || next == CANCELLED;
            case SERVED -> next == COMPLETED || next == CANCELLED;
            case COMPLETED, CANCELLED -> false;
        };
    }
}
