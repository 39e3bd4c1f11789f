package com.flagship.restaurant_pos.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A notification waiting in {@code outbox_events} for the publisher.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;
    UUID aggregateId;
    String eventType;
    String payload;
    Instant createdAt;
    Instant publishedAt;
    int retryCount;
    String lastError;
    Long sequenceNumber;

    public boolean isPublished() {
        return publishedAt != null;
    }
}
