package com.flagship.restaurant_pos.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.restaurant_pos.payment.Receipt;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class ReceiptResponse {

    @JsonProperty("payment_id")
    UUID paymentId;

    @JsonProperty("printed")
    boolean printed;

    @JsonProperty("receipt_printed_at")
    Instant receiptPrintedAt;

    @JsonProperty("receipt")
    Receipt receipt;
}
