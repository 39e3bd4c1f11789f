package com.flagship.restaurant_pos.exception;

/**
 * Attempt to alter a payment, a stock movement, an audit entry or a locked
 * field of a confirmed order item. Never caught inside the core.
 */
public class ImmutabilityViolationException extends RuntimeException {

    public ImmutabilityViolationException(String message) {
        super(message);
    }
}
