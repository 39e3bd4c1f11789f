package com.flagship.restaurant_pos.ledger;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * One line of the stock journal. {@code newQuantity = previousQuantity + quantity}
 * always holds (also checked by the table). Rows are never updated or deleted.
 */
@Value
public class StockMovement {
    @JsonProperty("id")
    UUID id;

    @JsonProperty("sequence_number")
    long sequenceNumber;

    @JsonProperty("product_id")
    UUID productId;

    @JsonProperty("movement_type")
    MovementType movementType;

    @JsonProperty("quantity")
    BigDecimal quantity;

    @JsonProperty("previous_quantity")
    BigDecimal previousQuantity;

    @JsonProperty("new_quantity")
    BigDecimal newQuantity;

    @JsonProperty("reference_number")
    String referenceNumber;

    @JsonProperty("notes")
    String notes;

    @JsonProperty("created_by")
    UUID createdBy;

    @JsonProperty("created_at")
    Instant createdAt;
}
