package com.flagship.restaurant_pos.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.restaurant_pos.ledger.InventoryService;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class StockAdjustmentRequest {

    @NotNull(message = "Adjustment type is required")
    @JsonProperty("type")
    InventoryService.Adjustment type;

    @NotNull(message = "Quantity is required")
    @DecimalMin(value = "0", message = "Quantity cannot be negative")
    @JsonProperty("quantity")
    BigDecimal quantity;

    @JsonProperty("notes")
    String notes;
}
