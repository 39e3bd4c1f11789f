package com.flagship.restaurant_pos.catalog;

import com.flagship.restaurant_pos.exception.ValidationException;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.UUID;

/**
 * Sellable catalog item.
 *
 * {@code stockQuantity} is read-only here: the column is written exclusively
 * by {@link com.flagship.restaurant_pos.ledger.StockLedgerService}, together
 * with the movement that explains the change. The value held by a loaded
 * entity is the stock at load time.
 */
@Entity
@Table(name = "products")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Product {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(nullable = false, length = 200)
    private String name;

    @Column(nullable = false, unique = true, updatable = false, length = 50)
    private String sku;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Column(name = "base_price", nullable = false, updatable = false, precision = 12, scale = 2)
    private BigDecimal basePrice;

    @Column(name = "current_price", nullable = false, precision = 12, scale = 2)
    private BigDecimal currentPrice;

    @Column(name = "stock_quantity", nullable = false, insertable = false, updatable = false, precision = 12, scale = 2)
    private BigDecimal stockQuantity;

    @Column(name = "unit_of_measure", nullable = false, length = 20)
    private String unitOfMeasure;

    @Column(name = "min_stock_level", nullable = false, precision = 12, scale = 2)
    private BigDecimal minStockLevel;

    @Column(name = "requires_kitchen", nullable = false)
    private boolean requiresKitchen;

    @Column(nullable = false)
    private boolean available;

    @Column(nullable = false)
    private boolean active;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    public static Product create(String name, String sku, String description, BigDecimal price,
                                 String unitOfMeasure, BigDecimal minStockLevel, boolean requiresKitchen) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("Product name is required");
        }
        if (sku == null || sku.isBlank()) {
            throw new ValidationException("Product SKU is required");
        }
        BigDecimal normalized = normalizePrice(price);
        return new Product(UUID.randomUUID(), name, sku, description, normalized, normalized, BigDecimal.ZERO,
                unitOfMeasure != null ? unitOfMeasure : "piece",
                minStockLevel != null ? minStockLevel : BigDecimal.TEN,
                requiresKitchen, true, true, null, null);
    }

    /**
     * Orderable means active and flagged available. Stock level does not matter.
     */
    public boolean isOrderable() {
        return active && available;
    }

    /**
     * Sets a new selling price. Already placed order items keep the price
     * they locked.
     *
     * @return the previous price
     */
    public BigDecimal changePrice(BigDecimal newPrice) {
        BigDecimal previous = this.currentPrice;
        this.currentPrice = normalizePrice(newPrice);
        return previous;
    }

    public void setAvailability(boolean available) {
        if (available && !active) {
            throw new ValidationException("Inactive product " + sku + " cannot be made available");
        }
        this.available = available;
    }

    /**
     * Soft delete. Order history keeps referring to the row.
     */
    public void deactivate() {
        this.active = false;
        this.available = false;
    }

    private static BigDecimal normalizePrice(BigDecimal price) {
        if (price == null || price.signum() < 0) {
            throw new ValidationException("Price must be zero or positive");
        }
        return price.setScale(2, RoundingMode.HALF_UP);
    }
}
