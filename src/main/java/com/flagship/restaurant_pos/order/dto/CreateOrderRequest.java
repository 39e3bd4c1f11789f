package com.flagship.restaurant_pos.order.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.UUID;

/**
 * {@code table_id} absent means takeout.
 */
@Value
public class CreateOrderRequest {

    @JsonProperty("table_id")
    UUID tableId;
}
