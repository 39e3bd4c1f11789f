package com.flagship.restaurant_pos.catalog.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

@Value
public class AvailabilityRequest {

    @JsonProperty("available")
    boolean available;
}
