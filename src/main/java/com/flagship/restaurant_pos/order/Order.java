package com.flagship.restaurant_pos.order;

import com.flagship.restaurant_pos.access.User;
import com.flagship.restaurant_pos.catalog.DiningTable;
import com.flagship.restaurant_pos.catalog.Product;
import com.flagship.restaurant_pos.exception.ImmutabilityViolationException;
import com.flagship.restaurant_pos.exception.NotFoundException;
import com.flagship.restaurant_pos.exception.StateConflictException;
import com.flagship.restaurant_pos.exception.ValidationException;
import jakarta.persistence.CascadeType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.OneToMany;
import jakarta.persistence.OrderBy;
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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * Aggregate root of a dining transaction.
 *
 * All item changes go through this class so totals are recomputed from the
 * full item set each time, never adjusted incrementally. Callers hold the
 * order row lock (see {@link OrderRepository#findByIdForUpdate}) while
 * mutating it.
 */
@Entity
@Table(name = "orders")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Order {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "order_number", nullable = false, unique = true, updatable = false, length = 20)
    private String orderNumber;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "table_id", updatable = false)
    private DiningTable table;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "waiter_id", nullable = false, updatable = false)
    private User waiter;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private OrderStatus status;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal subtotal;

    @Column(name = "tax_amount", nullable = false, precision = 12, scale = 2)
    private BigDecimal taxAmount;

    @Column(name = "total_amount", nullable = false, precision = 12, scale = 2)
    private BigDecimal totalAmount;

    @Column(name = "device_id", updatable = false, length = 100)
    private String deviceId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "cancelled_at")
    private Instant cancelledAt;

    @OneToMany(mappedBy = "order", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("createdAt ASC")
    private List<OrderItem> items = new ArrayList<>();

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    /**
     * Opens a pending order. {@code table} is null for takeout.
     */
    public static Order open(String orderNumber, DiningTable table, User waiter, String deviceId) {
        return new Order(UUID.randomUUID(), orderNumber, table, waiter, OrderStatus.PENDING,
                zero(), zero(), zero(), deviceId, null, null, null, null, new ArrayList<>());
    }

    public List<OrderItem> getItems() {
        return Collections.unmodifiableList(items);
    }

    public boolean isTakeout() {
        return table == null;
    }

    /**
     * Adds a line at the product's current price. Pushes a pending order to
     * preparing, auto-confirms lines that need no kitchen step, then
     * recomputes totals and readiness.
     */
    public OrderItem addItem(Product product, BigDecimal quantity, String specialInstructions,
                             BigDecimal taxRate, Instant now) {
        requireItemChanges();
        if (!product.isOrderable()) {
            throw new ValidationException("Product " + product.getName() + " is not available");
        }
        OrderItem item = OrderItem.create(this, product, quantity, specialInstructions, now);
        items.add(item);
        if (status == OrderStatus.PENDING) {
            status = OrderStatus.PREPARING;
        }
        if (!product.isRequiresKitchen()) {
            item.confirm(now);
        }
        recalculateTotals(taxRate);
        refreshReadiness();
        return item;
    }

    /**
     * Removes an unconfirmed line.
     *
     * @throws ImmutabilityViolationException if the line is confirmed
     */
    public OrderItem removeItem(UUID itemId, BigDecimal taxRate) {
        requireItemChanges();
        OrderItem item = findItem(itemId);
        if (item.isConfirmed()) {
            throw new ImmutabilityViolationException("Order item " + itemId + " is confirmed and cannot be removed");
        }
        items.remove(item);
        recalculateTotals(taxRate);
        refreshReadiness();
        return item;
    }

    /**
     * @return the previous quantity of the line
     */
    public BigDecimal changeItemQuantity(UUID itemId, BigDecimal quantity, BigDecimal taxRate) {
        OrderItem item = findItem(itemId);
        if (item.isConfirmed()) {
            throw new ImmutabilityViolationException("Order item " + itemId + " is confirmed; its quantity is locked");
        }
        requireItemChanges();
        BigDecimal previous = item.changeQuantity(quantity);
        recalculateTotals(taxRate);
        return previous;
    }

    /**
     * Kitchen confirmation of one line. A completed order may still have
     * lines the kitchen has not confirmed, when it was paid up front.
     *
     * @return true if the line was not confirmed before
     */
    public boolean confirmItem(UUID itemId, Instant now) {
        if (status == OrderStatus.CANCELLED) {
            throw new StateConflictException("Order " + orderNumber + " is " + status);
        }
        boolean changed = findItem(itemId).confirm(now);
        refreshReadiness();
        return changed;
    }

    public OrderItem findItem(UUID itemId) {
        return items.stream()
                .filter(item -> item.getId().equals(itemId))
                .findFirst()
                .orElseThrow(() -> NotFoundException.of("Order item", itemId));
    }

    /**
     * subtotal = sum of quantity x locked price, tax = subtotal x rate,
     * total = subtotal + tax. Idempotent.
     */
    public void recalculateTotals(BigDecimal taxRate) {
        BigDecimal sum = items.stream()
                .map(item -> OrderItem.lineTotal(item.getQuantity(), item.getUnitPrice()))
                .reduce(BigDecimal.ZERO, BigDecimal::add)
                .setScale(2, RoundingMode.HALF_UP);
        BigDecimal tax = sum.multiply(taxRate).setScale(2, RoundingMode.HALF_UP);
        this.subtotal = sum;
        this.taxAmount = tax;
        this.totalAmount = sum.add(tax);
    }

    /**
     * A preparing order becomes ready once it has lines and none of them is
     * still waiting for the kitchen.
     *
     * @return true if the order just became ready
     */
    public boolean refreshReadiness() {
        if (status != OrderStatus.PREPARING || items.isEmpty()) {
            return false;
        }
        boolean allConfirmed = items.stream().noneMatch(OrderItem::isAwaitingKitchen);
        if (allConfirmed) {
            status = OrderStatus.READY;
        }
        return allConfirmed;
    }

    public void markServed() {
        transitionTo(OrderStatus.SERVED);
    }

    /**
     * Closes the order on full payment and frees its table.
     */
    public void complete(Instant now) {
        transitionTo(OrderStatus.COMPLETED);
        this.completedAt = now;
        if (table != null) {
            table.release();
        }
    }

    /**
     * Aborts the order and frees its table.
     */
    void cancel(Instant now) {
        transitionTo(OrderStatus.CANCELLED);
        this.cancelledAt = now;
        if (table != null) {
            table.release();
        }
    }

    private void transitionTo(OrderStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new StateConflictException(
                    "Order " + orderNumber + " cannot move from " + status + " to " + next);
        }
        this.status = next;
    }

    private void requireItemChanges() {
        if (!status.acceptsItemChanges()) {
            throw new StateConflictException(
                    "Order " + orderNumber + " is " + status + "; items can no longer be changed");
        }
    }

    private static BigDecimal zero() {
        return BigDecimal.ZERO.setScale(2);
    }
}
