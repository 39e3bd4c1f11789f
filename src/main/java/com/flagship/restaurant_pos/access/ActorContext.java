package com.flagship.restaurant_pos.access;

import lombok.Value;

import java.util.UUID;

/**
 * Who is acting, from which terminal and address. Built once per request by
 * {@link DeviceBindingInterceptor} and passed into every core operation.
 */
@Value
public class ActorContext {

    public static final String REQUEST_ATTRIBUTE = "pos.actor";

    UUID userId;
    String deviceId;
    String ipAddress;

    public static ActorContext of(UUID userId, String deviceId, String ipAddress) {
        if (userId == null) {
            throw new IllegalArgumentException("Actor user id is required");
        }
        return new ActorContext(userId, deviceId, ipAddress);
    }
}
