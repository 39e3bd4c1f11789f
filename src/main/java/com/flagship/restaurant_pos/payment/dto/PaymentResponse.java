package com.flagship.restaurant_pos.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.restaurant_pos.order.Order;
import com.flagship.restaurant_pos.order.OrderStatus;
import com.flagship.restaurant_pos.payment.Payment;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class PaymentResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("payment_number")
    String paymentNumber;

    @JsonProperty("order_id")
    UUID orderId;

    @JsonProperty("order_number")
    String orderNumber;

    @JsonProperty("amount")
    BigDecimal amount;

    /**
     * What the cashier entered; larger than {@code amount} when the payment
     * was capped to the remaining balance.
     */
    @JsonProperty("requested_amount")
    BigDecimal requestedAmount;

    @JsonProperty("payment_method")
    String paymentMethod;

    @JsonProperty("transaction_reference")
    String transactionReference;

    @JsonProperty("processed_by")
    UUID processedBy;

    @JsonProperty("processed_at")
    Instant processedAt;

    @JsonProperty("device_id")
    String deviceId;

    @JsonProperty("receipt_printed")
    boolean receiptPrinted;

    @JsonProperty("order_status")
    OrderStatus orderStatus;

    @JsonProperty("order_total")
    BigDecimal orderTotal;

    @JsonProperty("total_paid")
    BigDecimal totalPaid;

    @JsonProperty("remaining_balance")
    BigDecimal remainingBalance;

    public static PaymentResponse from(Payment payment, BigDecimal requestedAmount, BigDecimal totalPaid) {
        Order order = payment.getOrder();
        BigDecimal remaining = order.getTotalAmount().subtract(totalPaid);
        return PaymentResponse.builder()
                .id(payment.getId())
                .paymentNumber(payment.getPaymentNumber())
                .orderId(order.getId())
                .orderNumber(order.getOrderNumber())
                .amount(payment.getAmount())
                .requestedAmount(requestedAmount)
                .paymentMethod(payment.getMethod().code())
                .transactionReference(payment.getTransactionReference())
                .processedBy(payment.getProcessedBy().getId())
                .processedAt(payment.getProcessedAt())
                .deviceId(payment.getDeviceId())
                .receiptPrinted(payment.isReceiptPrinted())
                .orderStatus(order.getStatus())
                .orderTotal(order.getTotalAmount())
                .totalPaid(totalPaid)
                .remainingBalance(remaining.signum() > 0 ? remaining : BigDecimal.ZERO.setScale(2))
                .build();
    }
}
