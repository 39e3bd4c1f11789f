package com.flagship.restaurant_pos.order.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class AddItemRequest {

    @NotNull(message = "Product ID is required")
    @JsonProperty("product_id")
    UUID productId;

    @NotNull(message = "Quantity is required")
    @DecimalMin(value = "0.01", message = "Quantity must be greater than 0")
    @JsonProperty("quantity")
    BigDecimal quantity;

    @JsonProperty("special_instructions")
    String specialInstructions;
}
