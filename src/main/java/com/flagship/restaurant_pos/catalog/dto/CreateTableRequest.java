package com.flagship.restaurant_pos.catalog.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

@Value
public class CreateTableRequest {

    @NotBlank(message = "Table number is required")
    @JsonProperty("number")
    String number;

    @Min(value = 1, message = "Capacity must be at least 1")
    @JsonProperty("capacity")
    int capacity;
}
