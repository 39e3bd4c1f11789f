package com.flagship.restaurant_pos.catalog.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

@Value
@Builder
@Jacksonized
public class CreateProductRequest {

    @NotBlank(message = "Name is required")
    @JsonProperty("name")
    String name;

    @NotBlank(message = "SKU is required")
    @JsonProperty("sku")
    String sku;

    @JsonProperty("description")
    String description;

    @NotNull(message = "Price is required")
    @DecimalMin(value = "0", message = "Price cannot be negative")
    @JsonProperty("price")
    BigDecimal price;

    @DecimalMin(value = "0", message = "Initial stock cannot be negative")
    @JsonProperty("initial_stock")
    BigDecimal initialStock;

    @DecimalMin(value = "0", message = "Minimum stock level cannot be negative")
    @JsonProperty("min_stock_level")
    BigDecimal minStockLevel;

    @JsonProperty("unit_of_measure")
    String unitOfMeasure;

    @JsonProperty("requires_kitchen")
    boolean requiresKitchen;
}
