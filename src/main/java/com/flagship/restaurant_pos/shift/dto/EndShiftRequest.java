package com.flagship.restaurant_pos.shift.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class EndShiftRequest {

    @NotNull(message = "Closing cash is required")
    @DecimalMin(value = "0.00", message = "Closing cash must be zero or more")
    @JsonProperty("closing_cash")
    BigDecimal closingCash;
}
