package com.flagship.restaurant_pos.audit;

/**
 * Closed set of audited actions. Stored lower-case in {@code audit_logs.action_type}.
 */
public enum AuditActionType {
    LOGIN,
    LOGOUT,
    ORDER_CREATE,
    ORDER_MODIFY,
    ORDER_CANCEL,
    PAYMENT_PROCESS,
    STOCK_ADJUST,
    PRICE_CHANGE,
    USER_ACTION;

    public String code() {
        return name().toLowerCase();
    }

    public static AuditActionType fromCode(String code) {
        return valueOf(code.toUpperCase());
    }
}
