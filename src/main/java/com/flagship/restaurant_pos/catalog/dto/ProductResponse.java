package com.flagship.restaurant_pos.catalog.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.restaurant_pos.catalog.Product;
import com.flagship.restaurant_pos.ledger.StockCondition;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
@Builder
public class ProductResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("name")
    String name;

    @JsonProperty("sku")
    String sku;

    @JsonProperty("description")
    String description;

    @JsonProperty("current_price")
    BigDecimal currentPrice;

    @JsonProperty("stock_quantity")
    BigDecimal stockQuantity;

    @JsonProperty("min_stock_level")
    BigDecimal minStockLevel;

    @JsonProperty("unit_of_measure")
    String unitOfMeasure;

    @JsonProperty("stock_condition")
    StockCondition stockCondition;

    @JsonProperty("requires_kitchen")
    boolean requiresKitchen;

    @JsonProperty("available")
    boolean available;

    @JsonProperty("active")
    boolean active;

    public static ProductResponse from(Product product) {
        return from(product, product.getStockQuantity());
    }

    /**
     * Uses {@code stockQuantity} instead of the entity's value, which is stale
     * once the ledger has moved stock in the same transaction.
     */
    public static ProductResponse from(Product product, BigDecimal stockQuantity) {
        return ProductResponse.builder()
                .id(product.getId())
                .name(product.getName())
                .sku(product.getSku())
                .description(product.getDescription())
                .currentPrice(product.getCurrentPrice())
                .stockQuantity(stockQuantity)
                .minStockLevel(product.getMinStockLevel())
                .unitOfMeasure(product.getUnitOfMeasure())
                .stockCondition(StockCondition.evaluate(stockQuantity, product.getMinStockLevel()))
                .requiresKitchen(product.isRequiresKitchen())
                .available(product.isAvailable())
                .active(product.isActive())
                .build();
    }
}
