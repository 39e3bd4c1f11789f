package com.flagship.restaurant_pos.shift;

import com.flagship.restaurant_pos.access.User;
import com.flagship.restaurant_pos.exception.StateConflictException;
import com.flagship.restaurant_pos.exception.ValidationException;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
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
 * A cashier's drawer session. Opening cash is fixed at start; the closing
 * figures are written once when the shift ends.
 */
@Entity
@Table(name = "shifts")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Shift {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false, updatable = false)
    private User user;

    @Column(name = "device_id", updatable = false, length = 100)
    private String deviceId;

    @Column(name = "opening_cash", nullable = false, updatable = false, precision = 12, scale = 2)
    private BigDecimal openingCash;

    @Column(name = "closing_cash", precision = 12, scale = 2)
    private BigDecimal closingCash;

    @Column(name = "expected_cash", precision = 12, scale = 2)
    private BigDecimal expectedCash;

    @Column(precision = 12, scale = 2)
    private BigDecimal variance;

    @Column(name = "started_at", nullable = false, updatable = false)
    private Instant startedAt;

    @Column(name = "ended_at")
    private Instant endedAt;

    static Shift start(User user, String deviceId, BigDecimal openingCash, Instant now) {
        return new Shift(UUID.randomUUID(), user, deviceId, requireCash(openingCash, "Opening cash"),
                null, null, null, now, null);
    }

    public boolean isOpen() {
        return endedAt == null;
    }

    /**
     * Closes the shift. variance = closing - expected; positive means surplus.
     */
    void end(BigDecimal closingCash, BigDecimal expectedCash, Instant now) {
        if (!isOpen()) {
            throw new StateConflictException("Shift " + id + " is already closed");
        }
        this.closingCash = requireCash(closingCash, "Closing cash");
        this.expectedCash = expectedCash.setScale(2, RoundingMode.HALF_UP);
        this.variance = this.closingCash.subtract(this.expectedCash);
        this.endedAt = now;
    }

    private static BigDecimal requireCash(BigDecimal amount, String label) {
        if (amount == null || amount.signum() < 0) {
            throw new ValidationException(label + " must be zero or more");
        }
        return amount.setScale(2, RoundingMode.HALF_UP);
    }
}
