package com.flagship.restaurant_pos.shift.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Running totals of the caller's open shift.
 */
@Value
@Builder
public class ShiftSummary {

    @JsonProperty("shift_id")
    UUID shiftId;

    @JsonProperty("started_at")
    Instant startedAt;

    @JsonProperty("opening_cash")
    BigDecimal openingCash;

    @JsonProperty("cash_collected")
    BigDecimal cashCollected;

    @JsonProperty("expected_cash")
    BigDecimal expectedCash;

    @JsonProperty("transaction_count")
    long transactionCount;
}
