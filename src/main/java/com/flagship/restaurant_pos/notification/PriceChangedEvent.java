package com.flagship.restaurant_pos.notification;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
public class PriceChangedEvent {

    public static final String EVENT_TYPE = "PriceChanged";

    UUID eventId;
    UUID productId;
    String productName;
    BigDecimal oldPrice;
    BigDecimal newPrice;
    UUID changedBy;
    Instant occurredAt;
}
