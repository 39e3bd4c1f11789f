package com.flagship.restaurant_pos.order;

import com.flagship.restaurant_pos.catalog.Product;
import com.flagship.restaurant_pos.exception.ImmutabilityViolationException;
import com.flagship.restaurant_pos.exception.ValidationException;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.PreRemove;
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
 * One line of an order.
 *
 * The unit price is copied from the product when the line is created and
 * never changes. Once the kitchen confirms the line (or it is auto-confirmed
 * because the product needs no preparation) its quantity is frozen as well and
 * it can no longer be removed; the {@code order_items} triggers enforce the same.
 */
@Entity
@Table(name = "order_items")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class OrderItem {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "order_id", nullable = false, updatable = false)
    private Order order;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "product_id", nullable = false, updatable = false)
    private Product product;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal quantity;

    @Column(name = "unit_price", nullable = false, updatable = false, precision = 12, scale = 2)
    private BigDecimal unitPrice;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal subtotal;

    @Column(name = "special_instructions", columnDefinition = "TEXT")
    private String specialInstructions;

    @Column(name = "is_confirmed", nullable = false)
    private boolean confirmed;

    @Column(name = "confirmed_at")
    private Instant confirmedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    static OrderItem create(Order order, Product product, BigDecimal quantity, String specialInstructions,
                            Instant now) {
        BigDecimal normalized = requirePositive(quantity);
        BigDecimal unitPrice = product.getCurrentPrice();
        return new OrderItem(UUID.randomUUID(), order, product, normalized, unitPrice,
                lineTotal(normalized, unitPrice), specialInstructions, false, null, now);
    }

    /**
     * Marks the line as prepared. Confirming twice keeps the first timestamp.
     *
     * @return true if this call confirmed the line
     */
    boolean confirm(Instant now) {
        if (confirmed) {
            return false;
        }
        this.confirmed = true;
        this.confirmedAt = now;
        return true;
    }

    /**
     * @return the previous quantity
     */
    BigDecimal changeQuantity(BigDecimal newQuantity) {
        if (confirmed) {
            throw new ImmutabilityViolationException("Order item " + id + " is confirmed; its quantity is locked");
        }
        BigDecimal previous = this.quantity;
        this.quantity = requirePositive(newQuantity);
        this.subtotal = lineTotal(this.quantity, unitPrice);
        return previous;
    }

    public boolean requiresKitchen() {
        return product.isRequiresKitchen();
    }

    public boolean isAwaitingKitchen() {
        return requiresKitchen() && !confirmed;
    }

    @PreRemove
    void onRemove() {
        if (confirmed) {
            throw new ImmutabilityViolationException("Order item " + id + " is confirmed and cannot be removed");
        }
    }

    static BigDecimal lineTotal(BigDecimal quantity, BigDecimal unitPrice) {
        return quantity.multiply(unitPrice).setScale(2, RoundingMode.HALF_UP);
    }

    private static BigDecimal requirePositive(BigDecimal quantity) {
        if (quantity == null || quantity.signum() <= 0) {
            throw new ValidationException("Quantity must be greater than 0");
        }
        return quantity.setScale(2, RoundingMode.HALF_UP);
    }
}
