package com.flagship.restaurant_pos.exception;

/**
 * Bad input: non-positive amount or quantity, missing transaction reference,
 * unknown payment method. Raised before any state is changed.
 */
public class ValidationException extends IllegalArgumentException {

    public ValidationException(String message) {
        super(message);
    }
}
