package com.flagship.restaurant_pos.catalog.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.UUID;

@Value
public class TableResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("number")
    String number;

    @JsonProperty("capacity")
    int capacity;

    @JsonProperty("occupied")
    boolean occupied;

    @JsonProperty("active_order_id")
    UUID activeOrderId;

    @JsonProperty("active_order_number")
    String activeOrderNumber;
}
