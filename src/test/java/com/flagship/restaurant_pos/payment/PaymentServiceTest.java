package com.flagship.restaurant_pos.payment;

import com.flagship.restaurant_pos.PosIntegrationTestSupport;
import com.flagship.restaurant_pos.access.ActorContext;
import com.flagship.restaurant_pos.access.Role;
import com.flagship.restaurant_pos.catalog.dto.ProductResponse;
import com.flagship.restaurant_pos.catalog.dto.TableResponse;
import com.flagship.restaurant_pos.exception.AccessDeniedException;
import com.flagship.restaurant_pos.exception.StateConflictException;
import com.flagship.restaurant_pos.exception.ValidationException;
import com.flagship.restaurant_pos.order.OrderService;
import com.flagship.restaurant_pos.order.OrderStatus;
import com.flagship.restaurant_pos.order.dto.OrderResponse;
import com.flagship.restaurant_pos.payment.dto.PaymentResponse;
import com.flagship.restaurant_pos.payment.dto.ReceiptResponse;
import com.flagship.restaurant_pos.shift.ShiftService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Payment service")
class PaymentServiceTest extends PosIntegrationTestSupport {

    @Autowired
    private PaymentService paymentService;

    @Autowired
    private ReceiptService receiptService;

    @Autowired
    private OrderService orderService;

    @Autowired
    private ShiftService shiftService;

    private ActorContext waiter;
    private ActorContext cashier;
    private TableResponse table;
    private OrderResponse order;

    @BeforeEach
    void setUp() {
        waiter = actor(createUser(Role.WAITER), "tablet-1");
        cashier = actor(createUser(Role.CASHIER), "till-1");
        shiftService.startShift(new BigDecimal("5000"), cashier);

        // 2 x 1000 + 1 x 500 = 2500, nothing for the kitchen so it is ready at once
        ProductResponse grill = createProduct("Mixed grill", "1000", "20", "2", false);
        ProductResponse drink = createProduct("Palm wine", "500", "20", "2", false);
        table = createTable();
        order = orderService.createOrder(table.getId(), waiter);
        orderService.addItem(order.getId(), grill.getId(), new BigDecimal("2"), null, waiter);
        orderService.addItem(order.getId(), drink.getId(), BigDecimal.ONE, null, waiter);
    }

    private boolean tableOccupied() {
        return Boolean.TRUE.equals(jdbcTemplate.queryForObject(
                "SELECT occupied FROM dining_tables WHERE id = ?", Boolean.class, table.getId()));
    }

    @Nested
    @DisplayName("Split payments")
    class SplitPayments {

        @Test
        @DisplayName("Partial then overpaying payment is capped and completes the order")
        void testPartialThenCapped() {
            printTestHeader("Split and capped payment");

            // When
            PaymentResponse first = paymentService.processPayment(order.getId(), new BigDecimal("1000"), "cash", null, cashier);
            printOutput("First", first.getPaymentNumber() + " remaining " + first.getRemainingBalance());

            // Then
            assertEquals(0, new BigDecimal("1000.00").compareTo(first.getAmount()));
            assertEquals(0, new BigDecimal("1500.00").compareTo(first.getRemainingBalance()));
            assertNotEquals(OrderStatus.COMPLETED, first.getOrderStatus());
            assertTrue(first.getPaymentNumber().startsWith("PAY-"));
            assertTrue(tableOccupied());

            // When
            PaymentResponse second = paymentService.processPayment(order.getId(), new BigDecimal("2000"),
                    "mobile_money", "MM-778812", cashier);
            printOutput("Second", second.getAmount() + " of requested " + second.getRequestedAmount());

            // Then
            assertEquals(0, new BigDecimal("1500.00").compareTo(second.getAmount()));
            assertEquals(0, new BigDecimal("2000.00").compareTo(second.getRequestedAmount()));
            assertEquals(0, new BigDecimal("2500.00").compareTo(second.getTotalPaid()));
            assertEquals(0, second.getRemainingBalance().signum());
            assertEquals(OrderStatus.COMPLETED, second.getOrderStatus());
            assertEquals(OrderStatus.COMPLETED, orderService.getOrder(order.getId(), waiter).getStatus());
            assertFalse(tableOccupied());

            List<PaymentResponse> payments = paymentService.paymentsForOrder(order.getId(), cashier);
            assertEquals(2, payments.size());
            printSuccess("Order completed at exactly its total");
        }

        @Test
        @DisplayName("A completed order takes no further payment")
        void testPaymentAfterCompletion() {
            paymentService.processPayment(order.getId(), new BigDecimal("2500"), "cash", null, cashier);

            StateConflictException exception = assertThrows(StateConflictException.class, () ->
                    paymentService.processPayment(order.getId(), new BigDecimal("100"), "cash", null, cashier));
            printExpectedException("StateConflictException", exception.getMessage());
        }

        @Test
        @DisplayName("An order with payments cannot be cancelled")
        void testCancelAfterPayment() {
            paymentService.processPayment(order.getId(), new BigDecimal("500"), "cash", null, cashier);

            assertThrows(StateConflictException.class, () -> orderService.cancelOrder(order.getId(), null, waiter));
        }
    }

    @Nested
    @DisplayName("Preconditions")
    class Preconditions {

        @Test
        @DisplayName("A cashier without an open shift is refused")
        void testNoShift() {
            ActorContext offShift = actor(createUser(Role.CASHIER), "till-2");

            assertThrows(StateConflictException.class, () ->
                    paymentService.processPayment(order.getId(), new BigDecimal("100"), "cash", null, offShift));
        }

        @Test
        @DisplayName("Mobile money needs a transaction reference")
        void testReferenceRequired() {
            assertThrows(ValidationException.class, () ->
                    paymentService.processPayment(order.getId(), new BigDecimal("100"), "orange_money", "  ", cashier));
            assertThrows(ValidationException.class, () ->
                    paymentService.processPayment(order.getId(), new BigDecimal("100"), "cheque", null, cashier));
            assertThrows(ValidationException.class, () ->
                    paymentService.processPayment(order.getId(), new BigDecimal("-5"), "cash", null, cashier));
        }

        @Test
        @DisplayName("Waiters cannot take payments")
        void testWaiterDenied() {
            assertThrows(AccessDeniedException.class, () ->
                    paymentService.processPayment(order.getId(), new BigDecimal("100"), "cash", null, waiter));
        }
    }

    @Nested
    @DisplayName("Immutability")
    class Immutability {

        @Test
        @DisplayName("Payment rows cannot be edited or deleted")
        void testPaymentsAreImmutable() {
            printTestHeader("Payment immutability");

            PaymentResponse payment = paymentService.processPayment(order.getId(), new BigDecimal("700"), "cash", null, cashier);

            DataAccessException update = assertThrows(DataAccessException.class, () ->
                    jdbcTemplate.update("UPDATE payments SET amount = 1 WHERE id = ?", payment.getId()));
            DataAccessException delete = assertThrows(DataAccessException.class, () ->
                    jdbcTemplate.update("DELETE FROM payments WHERE id = ?", payment.getId()));
            printExpectedException(update.getClass().getSimpleName(), update.getMostSpecificCause().getMessage());

            assertTrue(update.getMostSpecificCause().getMessage().contains("immutable"));
            assertTrue(delete.getMostSpecificCause().getMessage().contains("immutable"));
        }

        @Test
        @DisplayName("The database refuses a payment that would overpay")
        void testOverpayGuard() {
            PaymentResponse payment = paymentService.processPayment(order.getId(), new BigDecimal("2000"), "cash", null, cashier);

            DataAccessException exception = assertThrows(DataAccessException.class, () ->
                    jdbcTemplate.update("INSERT INTO payments (id, payment_number, order_id, amount, payment_method, processed_by) " +
                                    "VALUES (gen_random_uuid(), 'PAY-MANUAL-1', ?, 900, 'CASH', ?)",
                            order.getId(), payment.getProcessedBy()));
            assertTrue(exception.getMostSpecificCause().getMessage().contains("would overpay"));
        }

        @Test
        @DisplayName("The receipt flag is set once and stays set")
        void testReceiptPrintedOnce() {
            printTestHeader("Receipt printing");

            PaymentResponse payment = paymentService.processPayment(order.getId(), new BigDecimal("2500"), "cash", null, cashier);

            ReceiptResponse first = receiptService.print(payment.getId(), cashier);
            ReceiptResponse second = receiptService.print(payment.getId(), cashier);
            printOutput("Printed at", first.getReceiptPrintedAt());

            assertTrue(first.isPrinted());
            assertNotNull(first.getReceiptPrintedAt());
            assertTrue(Duration.between(first.getReceiptPrintedAt(), second.getReceiptPrintedAt()).abs().toMillis() < 1);
            assertTrue(paymentService.getPayment(payment.getId(), cashier).isReceiptPrinted());
            assertEquals(table.getNumber(), first.getReceipt().getTable());

            assertThrows(DataAccessException.class, () ->
                    jdbcTemplate.update("UPDATE payments SET receipt_printed = FALSE WHERE id = ?", payment.getId()));
            printSuccess("Reprint keeps the original timestamp");
        }
    }
}
