package com.flagship.restaurant_pos.sequence;

/**
 * Prefixes of the daily document sequences.
 */
public enum DocumentNumber {
    ORDER("ORD"),
    PAYMENT("PAY");

    private final String prefix;

    DocumentNumber(String prefix) {
        this.prefix = prefix;
    }

    public String prefix() {
        return prefix;
    }
}
