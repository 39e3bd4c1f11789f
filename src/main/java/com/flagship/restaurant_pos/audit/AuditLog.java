package com.flagship.restaurant_pos.audit;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * A stored audit entry. Read-only; there is no way to change one.
 */
@Value
public class AuditLog {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("user_id")
    UUID userId;

    @JsonProperty("action_type")
    AuditActionType actionType;

    @JsonProperty("table_name")
    String tableName;

    @JsonProperty("record_id")
    String recordId;

    @JsonProperty("description")
    String description;

    @JsonProperty("ip_address")
    String ipAddress;

    @JsonProperty("device_id")
    String deviceId;

    @JsonProperty("metadata")
    Map<String, Object> metadata;

    @JsonProperty("created_at")
    Instant createdAt;
}
