package com.flagship.restaurant_pos.access;

/**
 * Staff roles. Capability checks compare against this enum, never against strings.
 */
public enum Role {
    ADMIN,
    CASHIER,
    WAITER,
    KITCHEN;

    /**
     * Admins manage terminals, so they are never tied to one device.
     */
    public boolean isExemptFromDeviceBinding() {
        return this == ADMIN;
    }
}
