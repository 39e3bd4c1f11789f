package com.flagship.restaurant_pos.order.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.restaurant_pos.order.Order;
import com.flagship.restaurant_pos.order.OrderStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Snapshot of an order, taken inside the transaction that loaded it.
 */
@Value
@Builder(toBuilder = true)
public class OrderResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("order_number")
    String orderNumber;

    @JsonProperty("table_id")
    UUID tableId;

    @JsonProperty("table_number")
    String tableNumber;

    @JsonProperty("waiter_id")
    UUID waiterId;

    @JsonProperty("waiter_name")
    String waiterName;

    @JsonProperty("status")
    OrderStatus status;

    @JsonProperty("subtotal")
    BigDecimal subtotal;

    @JsonProperty("tax_amount")
    BigDecimal taxAmount;

    @JsonProperty("total_amount")
    BigDecimal totalAmount;

    @JsonProperty("total_paid")
    BigDecimal totalPaid;

    @JsonProperty("remaining_balance")
    BigDecimal remainingBalance;

    @JsonProperty("device_id")
    String deviceId;

    @JsonProperty("items")
    List<OrderItemResponse> items;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("completed_at")
    Instant completedAt;

    /**
     * True when the request asked for a new order on a table that already had
     * one and got the existing order back.
     */
    @JsonProperty("existing")
    boolean existing;

    public static OrderResponse from(Order order, BigDecimal totalPaid) {
        BigDecimal remaining = order.getTotalAmount().subtract(totalPaid);
        return OrderResponse.builder()
                .id(order.getId())
                .orderNumber(order.getOrderNumber())
                .tableId(order.getTable() != null ? order.getTable().getId() : null)
                .tableNumber(order.getTable() != null ? order.getTable().getNumber() : null)
                .waiterId(order.getWaiter().getId())
                .waiterName(order.getWaiter().getFullName() != null
                        ? order.getWaiter().getFullName() : order.getWaiter().getUsername())
                .status(order.getStatus())
                .subtotal(order.getSubtotal())
                .taxAmount(order.getTaxAmount())
                .totalAmount(order.getTotalAmount())
                .totalPaid(totalPaid)
                .remainingBalance(remaining.signum() > 0 ? remaining : BigDecimal.ZERO.setScale(2))
                .deviceId(order.getDeviceId())
                .items(order.getItems().stream().map(OrderItemResponse::from).toList())
                .createdAt(order.getCreatedAt())
                .completedAt(order.getCompletedAt())
                .build();
    }
}
