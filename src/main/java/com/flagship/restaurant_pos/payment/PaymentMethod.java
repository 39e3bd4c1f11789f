package com.flagship.restaurant_pos.payment;

import com.flagship.restaurant_pos.exception.ValidationException;

import java.util.Arrays;

/**
 * Accepted tenders. Mobile money payments must carry the operator's
 * transaction reference.
 */
public enum PaymentMethod {
    CASH(false),
    MOBILE_MONEY(true),
    ORANGE_MONEY(true);

    private final boolean requiresReference;

    PaymentMethod(boolean requiresReference) {
        this.requiresReference = requiresReference;
    }

    public boolean requiresReference() {
        return requiresReference;
    }

    public String code() {
        return name().toLowerCase();
    }

    /**
     * @throws ValidationException for anything outside the accepted set
     */
    public static PaymentMethod fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new ValidationException("Payment method is required");
        }
        return Arrays.stream(values())
                .filter(method -> method.name().equalsIgnoreCase(code.trim()))
                .findFirst()
                .orElseThrow(() -> new ValidationException("Unsupported payment method: " + code));
    }
}
