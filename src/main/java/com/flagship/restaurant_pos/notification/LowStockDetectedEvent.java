package com.flagship.restaurant_pos.notification;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A product dropped to or below its minimum level. {@code condition} is
 * {@code LOW_STOCK} or {@code OUT_OF_STOCK}.
 */
@Value
public class LowStockDetectedEvent {

    public static final String EVENT_TYPE = "LowStockDetected";

    UUID eventId;
    UUID productId;
    String productName;
    String sku;
    BigDecimal currentStock;
    BigDecimal minStockLevel;
    String condition;
    String reference;
    Instant occurredAt;
}
