package com.flagship.restaurant_pos.signal;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Tells a cashier terminal to open its drawer after a cash payment.
 */
@Value
public class CashDrawerSignal {
    UUID paymentId;
    String paymentNumber;
    BigDecimal amount;
    String deviceId;
    Instant raisedAt;

    @JsonCreator
    public CashDrawerSignal(@JsonProperty("paymentId") UUID paymentId,
                            @JsonProperty("paymentNumber") String paymentNumber,
                            @JsonProperty("amount") BigDecimal amount,
                            @JsonProperty("deviceId") String deviceId,
                            @JsonProperty("raisedAt") Instant raisedAt) {
        this.paymentId = paymentId;
        this.paymentNumber = paymentNumber;
        this.amount = amount;
        this.deviceId = deviceId;
        this.raisedAt = raisedAt;
    }
}
