package com.flagship.restaurant_pos.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class ProcessPaymentRequest {

    @NotNull(message = "Order ID is required")
    @JsonProperty("order_id")
    UUID orderId;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0.01", message = "Amount must be greater than 0")
    @JsonProperty("amount")
    BigDecimal amount;

    @NotBlank(message = "Payment method is required")
    @JsonProperty("payment_method")
    String paymentMethod;

    @JsonProperty("transaction_reference")
    String transactionReference;
}
