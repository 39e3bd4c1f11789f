package com.flagship.restaurant_pos.audit;

import com.flagship.restaurant_pos.access.ActorContext;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;
import java.util.UUID;

/**
 * Input to {@link AuditTrailService#record(AuditRecord)}.
 */
@Value
@Builder
public class AuditRecord {
    UUID userId;
    AuditActionType actionType;
    String tableName;
    String recordId;
    String description;
    String deviceId;
    String ipAddress;
    @Singular("meta")
    Map<String, Object> metadata;

    /**
     * Starts a builder pre-filled with the actor's user, device and address.
     */
    public static AuditRecordBuilder by(ActorContext actor, AuditActionType actionType) {
        AuditRecordBuilder builder = builder().actionType(actionType);
        if (actor != null) {
            builder.userId(actor.getUserId())
                    .deviceId(actor.getDeviceId())
                    .ipAddress(actor.getIpAddress());
        }
        return builder;
    }
}
