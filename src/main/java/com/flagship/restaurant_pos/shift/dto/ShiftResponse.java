package com.flagship.restaurant_pos.shift.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.restaurant_pos.shift.Shift;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class ShiftResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("user_id")
    UUID userId;

    @JsonProperty("device_id")
    String deviceId;

    @JsonProperty("opening_cash")
    BigDecimal openingCash;

    @JsonProperty("closing_cash")
    BigDecimal closingCash;

    @JsonProperty("expected_cash")
    BigDecimal expectedCash;

    @JsonProperty("variance")
    BigDecimal variance;

    @JsonProperty("variance_warning")
    boolean varianceWarning;

    @JsonProperty("started_at")
    Instant startedAt;

    @JsonProperty("ended_at")
    Instant endedAt;

    public static ShiftResponse from(Shift shift, boolean varianceWarning) {
        return ShiftResponse.builder()
                .id(shift.getId())
                .userId(shift.getUser().getId())
                .deviceId(shift.getDeviceId())
                .openingCash(shift.getOpeningCash())
                .closingCash(shift.getClosingCash())
                .expectedCash(shift.getExpectedCash())
                .variance(shift.getVariance())
                .varianceWarning(varianceWarning)
                .startedAt(shift.getStartedAt())
                .endedAt(shift.getEndedAt())
                .build();
    }
}
