package com.flagship.restaurant_pos.order.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

@Value
public class CancelOrderRequest {

    @JsonProperty("reason")
    String reason;
}
