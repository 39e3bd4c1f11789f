package com.flagship.restaurant_pos.exception;

/**
 * The target entity is in the wrong state for the requested transition
 * (order already completed, duplicate open shift, item added to a ready order).
 * The caller may retry with fresh state.
 */
public class StateConflictException extends IllegalStateException {

    public StateConflictException(String message) {
        super(message);
    }
}
