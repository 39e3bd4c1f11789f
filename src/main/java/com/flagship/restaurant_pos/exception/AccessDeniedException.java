package com.flagship.restaurant_pos.exception;

import lombok.Getter;

/**
 * Role or device check failed. The web layer sends the terminal back to login
 * when the reason is {@link Reason#DEVICE_MISMATCH} or {@link Reason#UNAUTHENTICATED}.
 */
@Getter
public class AccessDeniedException extends RuntimeException {

    public enum Reason {
        UNAUTHENTICATED,
        ROLE,
        DEVICE_MISMATCH
    }

    private final Reason reason;

    public AccessDeniedException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public boolean requiresReauthentication() {
        return reason != Reason.ROLE;
    }
}
