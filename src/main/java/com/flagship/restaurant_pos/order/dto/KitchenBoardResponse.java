package com.flagship.restaurant_pos.order.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * What a kitchen display shows: open tickets plus the watermark it should
 * send back as {@code since} on its next poll.
 */
@Value
@Builder
public class KitchenBoardResponse {

    @JsonProperty("watermark")
    Instant watermark;

    @JsonProperty("has_updates")
    boolean hasUpdates;

    @JsonProperty("tickets")
    List<Ticket> tickets;

    @Value
    @Builder
    public static class Ticket {

        @JsonProperty("order_id")
        UUID orderId;

        @JsonProperty("order_number")
        String orderNumber;

        @JsonProperty("table_number")
        String tableNumber;

        @JsonProperty("waiter_name")
        String waiterName;

        @JsonProperty("items")
        List<OrderItemResponse> items;
    }
}
