package com.flagship.restaurant_pos.payment;

import com.flagship.restaurant_pos.access.Role;
import com.flagship.restaurant_pos.access.User;
import com.flagship.restaurant_pos.exception.ImmutabilityViolationException;
import com.flagship.restaurant_pos.exception.ValidationException;
import com.flagship.restaurant_pos.order.Order;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class PaymentTest {

    private final User cashier = User.create("cashier-1", "Binta", Role.CASHIER);
    private final Order order = Order.open("ORD-20240101-0001", null,
            User.create("waiter-1", "Awa", Role.WAITER), "tablet-1");

    @Test
    @DisplayName("Payment methods parse case-insensitively")
    void testMethodParsing() {
        assertEquals(PaymentMethod.CASH, PaymentMethod.fromCode("cash"));
        assertEquals(PaymentMethod.MOBILE_MONEY, PaymentMethod.fromCode("MOBILE_MONEY"));
        assertEquals(PaymentMethod.ORANGE_MONEY, PaymentMethod.fromCode(" orange_money "));
    }

    @Test
    @DisplayName("Unknown or missing payment method is a validation error")
    void testUnknownMethod() {
        assertThrows(ValidationException.class, () -> PaymentMethod.fromCode("card"));
        assertThrows(ValidationException.class, () -> PaymentMethod.fromCode(""));
        assertThrows(ValidationException.class, () -> PaymentMethod.fromCode(null));
    }

    @Test
    @DisplayName("Non-positive amounts are rejected")
    void testAmountMustBePositive() {
        assertThrows(ValidationException.class,
                () -> Payment.validate(BigDecimal.ZERO, PaymentMethod.CASH, null));
        assertThrows(ValidationException.class,
                () -> Payment.validate(new BigDecimal("-5"), PaymentMethod.CASH, null));
        assertThrows(ValidationException.class,
                () -> Payment.validate(null, PaymentMethod.CASH, null));
    }

    @Test
    @DisplayName("Mobile money requires a transaction reference, cash does not")
    void testReferenceRules() {
        assertDoesNotThrow(() -> Payment.validate(new BigDecimal("100"), PaymentMethod.CASH, null));
        assertThrows(ValidationException.class,
                () -> Payment.validate(new BigDecimal("100"), PaymentMethod.MOBILE_MONEY, null));
        assertThrows(ValidationException.class,
                () -> Payment.validate(new BigDecimal("100"), PaymentMethod.ORANGE_MONEY, "  "));
        assertDoesNotThrow(() -> Payment.validate(new BigDecimal("100"), PaymentMethod.ORANGE_MONEY, "OM-123"));
    }

    @Test
    @DisplayName("Recorded payment normalizes amount and trims the reference")
    void testRecord() {
        Instant now = Instant.now();
        Payment payment = Payment.record("PAY-20240101-0001", order, new BigDecimal("1500"),
                PaymentMethod.MOBILE_MONEY, "  MM-42 ", cashier, "till-1", now);

        assertNotNull(payment.getId());
        assertEquals(new BigDecimal("1500.00"), payment.getAmount());
        assertEquals("MM-42", payment.getTransactionReference());
        assertEquals(now, payment.getProcessedAt());
        assertFalse(payment.isReceiptPrinted());
    }

    @Test
    @DisplayName("Receipt flag is write-once")
    void testReceiptFlagWriteOnce() {
        Payment payment = Payment.record("PAY-20240101-0002", order, new BigDecimal("100"),
                PaymentMethod.CASH, null, cashier, "till-1", Instant.now());
        Instant first = Instant.now();

        assertTrue(payment.markReceiptPrinted(first));
        assertFalse(payment.markReceiptPrinted(first.plusSeconds(30)));
        assertTrue(payment.isReceiptPrinted());
        assertEquals(first, payment.getReceiptPrintedAt());
    }

    @Test
    @DisplayName("Removal is refused at the mapping level")
    void testRemoveRefused() {
        Payment payment = Payment.record("PAY-20240101-0003", order, new BigDecimal("100"),
                PaymentMethod.CASH, null, cashier, "till-1", Instant.now());

        assertThrows(ImmutabilityViolationException.class, payment::onRemove);
    }
}
