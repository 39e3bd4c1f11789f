package com.flagship.restaurant_pos.payment;

import com.flagship.restaurant_pos.access.User;
import com.flagship.restaurant_pos.exception.ImmutabilityViolationException;
import com.flagship.restaurant_pos.exception.ValidationException;
import com.flagship.restaurant_pos.order.Order;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
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
 * A recorded payment. Immutable once inserted.
 *
 * Enforced at three levels:
 * <ul>
 *   <li>mapping: every business column is {@code updatable = false}, there are no setters,
 *       and removal throws from {@link #onRemove()}</li>
 *   <li>repository: {@link PaymentRepository} exposes no delete methods</li>
 *   <li>database: triggers on {@code payments} reject DELETE and any UPDATE other than
 *       flipping {@code receipt_printed} from false to true</li>
 * </ul>
 */
@Entity
@Table(name = "payments")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Payment {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "payment_number", nullable = false, unique = true, updatable = false, length = 20)
    private String paymentNumber;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "order_id", nullable = false, updatable = false)
    private Order order;

    @Column(nullable = false, updatable = false, precision = 12, scale = 2)
    private BigDecimal amount;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_method", nullable = false, updatable = false, length = 20)
    private PaymentMethod method;

    @Column(name = "transaction_reference", updatable = false, length = 100)
    private String transactionReference;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "processed_by", nullable = false, updatable = false)
    private User processedBy;

    @Column(name = "processed_at", nullable = false, updatable = false)
    private Instant processedAt;

    @Column(name = "device_id", updatable = false, length = 100)
    private String deviceId;

    @Column(name = "receipt_printed", nullable = false)
    private boolean receiptPrinted;

    @Column(name = "receipt_printed_at")
    private Instant receiptPrintedAt;

    /**
     * Validates the tender and builds the row. The amount must already be
     * capped to the order's remaining balance.
     */
    static Payment record(String paymentNumber, Order order, BigDecimal amount, PaymentMethod method,
                          String transactionReference, User processedBy, String deviceId, Instant now) {
        validate(amount, method, transactionReference);
        String reference = transactionReference != null && !transactionReference.isBlank()
                ? transactionReference.trim() : null;
        return new Payment(UUID.randomUUID(), paymentNumber, order, amount.setScale(2, RoundingMode.HALF_UP),
                method, reference, processedBy, now, deviceId, false, null);
    }

    static void validate(BigDecimal amount, PaymentMethod method, String transactionReference) {
        if (amount == null || amount.signum() <= 0) {
            throw new ValidationException("Payment amount must be greater than 0");
        }
        if (method == null) {
            throw new ValidationException("Payment method is required");
        }
        if (method.requiresReference() && (transactionReference == null || transactionReference.isBlank())) {
            throw new ValidationException("Transaction reference is required for " + method.code());
        }
    }

    /**
     * Records a successful print. Only the first one counts.
     *
     * @return true if this call set the flag
     */
    boolean markReceiptPrinted(Instant now) {
        if (receiptPrinted) {
            return false;
        }
        this.receiptPrinted = true;
        this.receiptPrintedAt = now;
        return true;
    }

    @PreRemove
    void onRemove() {
        throw new ImmutabilityViolationException("Payment " + paymentNumber + " cannot be deleted");
    }
}
