package com.flagship.restaurant_pos.payment;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Printer-independent receipt content. Turning it into printer bytes is the
 * {@link ReceiptPrinter}'s job.
 */
@Value
@Builder
public class Receipt {

    @JsonProperty("business_name")
    String businessName;

    @JsonProperty("business_address")
    String businessAddress;

    @JsonProperty("tax_id")
    String taxId;

    @JsonProperty("receipt_number")
    String receiptNumber;

    @JsonProperty("order_number")
    String orderNumber;

    /**
     * Table number, or "Takeout".
     */
    @JsonProperty("table")
    String table;

    @JsonProperty("waiter")
    String waiter;

    @JsonProperty("cashier")
    String cashier;

    @JsonProperty("issued_at")
    Instant issuedAt;

    @Singular
    @JsonProperty("lines")
    List<Line> lines;

    @JsonProperty("subtotal")
    BigDecimal subtotal;

    @JsonProperty("tax_amount")
    BigDecimal taxAmount;

    @JsonProperty("total_amount")
    BigDecimal totalAmount;

    @JsonProperty("payment_method")
    String paymentMethod;

    @JsonProperty("amount_paid")
    BigDecimal amountPaid;

    @JsonProperty("transaction_reference")
    String transactionReference;

    @JsonProperty("currency")
    String currency;

    @Value
    public static class Line {
        @JsonProperty("name")
        String name;

        @JsonProperty("quantity")
        BigDecimal quantity;

        @JsonProperty("unit_price")
        BigDecimal unitPrice;

        @JsonProperty("line_total")
        BigDecimal lineTotal;
    }
}
