package com.flagship.restaurant_pos.order.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.restaurant_pos.order.OrderItem;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class OrderItemResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("product_id")
    UUID productId;

    @JsonProperty("product_name")
    String productName;

    @JsonProperty("quantity")
    BigDecimal quantity;

    @JsonProperty("unit_price")
    BigDecimal unitPrice;

    @JsonProperty("subtotal")
    BigDecimal subtotal;

    @JsonProperty("special_instructions")
    String specialInstructions;

    @JsonProperty("requires_kitchen")
    boolean requiresKitchen;

    @JsonProperty("is_confirmed")
    boolean confirmed;

    @JsonProperty("confirmed_at")
    Instant confirmedAt;

    @JsonProperty("created_at")
    Instant createdAt;

    public static OrderItemResponse from(OrderItem item) {
        return OrderItemResponse.builder()
                .id(item.getId())
                .productId(item.getProduct().getId())
                .productName(item.getProduct().getName())
                .quantity(item.getQuantity())
                .unitPrice(item.getUnitPrice())
                .subtotal(item.getSubtotal())
                .specialInstructions(item.getSpecialInstructions())
                .requiresKitchen(item.requiresKitchen())
                .confirmed(item.isConfirmed())
                .confirmedAt(item.getConfirmedAt())
                .createdAt(item.getCreatedAt())
                .build();
    }
}
