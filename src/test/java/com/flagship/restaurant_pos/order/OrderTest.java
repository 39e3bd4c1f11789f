package com.flagship.restaurant_pos.order;

import com.flagship.restaurant_pos.access.Role;
import com.flagship.restaurant_pos.access.User;
import com.flagship.restaurant_pos.catalog.DiningTable;
import com.flagship.restaurant_pos.catalog.Product;
import com.flagship.restaurant_pos.exception.ImmutabilityViolationException;
import com.flagship.restaurant_pos.exception.StateConflictException;
import com.flagship.restaurant_pos.exception.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Aggregate rules of {@link Order} without a database: totals, readiness and
 * the immutability of confirmed lines.
 */
class OrderTest {

    private static final BigDecimal NO_TAX = BigDecimal.ZERO;

    private DiningTable table;
    private Order order;
    private Product burger;
    private Product soda;
    private final Instant now = Instant.now();

    @BeforeEach
    void setUp() {
        table = DiningTable.create("T1", 4);
        table.occupy();
        User waiter = User.create("waiter-1", "Awa", Role.WAITER);
        order = Order.open("ORD-20240101-0001", table, waiter, "tablet-1");
        burger = Product.create("Burger", "BRG", null, new BigDecimal("1500"), null, BigDecimal.ONE, true);
        soda = Product.create("Soda", "SOD", null, new BigDecimal("500"), null, BigDecimal.ONE, false);
    }

    @Nested
    @DisplayName("Totals")
    class Totals {

        @Test
        @DisplayName("Totals are recomputed from every line")
        void testTotalsFromAllLines() {
            order.addItem(burger, new BigDecimal("2"), null, NO_TAX, now);
            order.addItem(soda, new BigDecimal("2"), "no ice", NO_TAX, now);

            assertEquals(0, new BigDecimal("4000.00").compareTo(order.getSubtotal()));
            assertEquals(0, BigDecimal.ZERO.compareTo(order.getTaxAmount()));
            assertEquals(0, new BigDecimal("4000.00").compareTo(order.getTotalAmount()));
        }

        @Test
        @DisplayName("Tax is subtotal x rate, rounded half up to two decimals")
        void testTaxRounding() {
            BigDecimal rate = new BigDecimal("0.1925");
            order.addItem(burger, new BigDecimal("2"), null, rate, now);
            order.addItem(soda, new BigDecimal("2"), null, rate, now);

            assertEquals(new BigDecimal("4000.00"), order.getSubtotal());
            assertEquals(new BigDecimal("770.00"), order.getTaxAmount());
            assertEquals(new BigDecimal("4770.00"), order.getTotalAmount());
        }

        @Test
        @DisplayName("A later price change does not touch lines already placed")
        void testUnitPriceLocked() {
            OrderItem line = order.addItem(burger, BigDecimal.ONE, null, NO_TAX, now);
            burger.changePrice(new BigDecimal("2000"));
            order.recalculateTotals(NO_TAX);

            assertEquals(new BigDecimal("1500.00"), line.getUnitPrice());
            assertEquals(0, new BigDecimal("1500.00").compareTo(order.getTotalAmount()));
        }

        @Test
        @DisplayName("Removing a line lowers the total")
        void testRemoveLine() {
            OrderItem first = order.addItem(burger, BigDecimal.ONE, null, NO_TAX, now);
            order.addItem(burger, new BigDecimal("3"), null, NO_TAX, now);

            order.removeItem(first.getId(), NO_TAX);

            assertEquals(1, order.getItems().size());
            assertEquals(0, new BigDecimal("4500.00").compareTo(order.getTotalAmount()));
        }

        @Test
        @DisplayName("Changing quantity returns the previous quantity and recomputes")
        void testChangeQuantity() {
            OrderItem line = order.addItem(burger, new BigDecimal("2"), null, NO_TAX, now);

            BigDecimal previous = order.changeItemQuantity(line.getId(), new BigDecimal("5"), NO_TAX);

            assertEquals(0, new BigDecimal("2").compareTo(previous));
            assertEquals(0, new BigDecimal("7500.00").compareTo(order.getTotalAmount()));
        }
    }

    @Nested
    @DisplayName("Readiness")
    class Readiness {

        @Test
        @DisplayName("First item moves a pending order to preparing")
        void testFirstItemStartsPreparation() {
            assertEquals(OrderStatus.PENDING, order.getStatus());
            order.addItem(burger, BigDecimal.ONE, null, NO_TAX, now);
            assertEquals(OrderStatus.PREPARING, order.getStatus());
        }

        @Test
        @DisplayName("Lines without a kitchen step are confirmed on creation")
        void testAutoConfirm() {
            order.addItem(burger, BigDecimal.ONE, null, NO_TAX, now);
            OrderItem drink = order.addItem(soda, BigDecimal.ONE, null, NO_TAX, now);

            assertTrue(drink.isConfirmed());
            assertNotNull(drink.getConfirmedAt());
            assertEquals(OrderStatus.PREPARING, order.getStatus(), "Burger still waits for the kitchen");
        }

        @Test
        @DisplayName("Confirming the last kitchen line makes the order ready")
        void testLastConfirmationMakesReady() {
            OrderItem first = order.addItem(burger, BigDecimal.ONE, null, NO_TAX, now);
            OrderItem second = order.addItem(burger, BigDecimal.ONE, "well done", NO_TAX, now);

            assertTrue(order.confirmItem(first.getId(), now));
            assertEquals(OrderStatus.PREPARING, order.getStatus());

            assertTrue(order.confirmItem(second.getId(), now));
            assertEquals(OrderStatus.READY, order.getStatus());
        }

        @Test
        @DisplayName("Confirming twice keeps the first timestamp")
        void testConfirmIdempotent() {
            OrderItem line = order.addItem(burger, BigDecimal.ONE, null, NO_TAX, now);
            order.confirmItem(line.getId(), now);

            assertFalse(order.confirmItem(line.getId(), now.plusSeconds(60)));
            assertEquals(now, line.getConfirmedAt());
        }

        @Test
        @DisplayName("Ready orders accept no new items")
        void testNoItemsAfterReady() {
            order.addItem(soda, BigDecimal.ONE, null, NO_TAX, now);
            assertEquals(OrderStatus.READY, order.getStatus());

            assertThrows(StateConflictException.class,
                    () -> order.addItem(burger, BigDecimal.ONE, null, NO_TAX, now));
        }
    }

    @Nested
    @DisplayName("Confirmed line immutability")
    class ConfirmedLines {

        @Test
        @DisplayName("Confirmed line cannot be removed")
        void testRemoveConfirmed() {
            order.addItem(burger, BigDecimal.ONE, null, NO_TAX, now);
            OrderItem drink = order.addItem(soda, BigDecimal.ONE, null, NO_TAX, now);

            assertThrows(ImmutabilityViolationException.class, () -> order.removeItem(drink.getId(), NO_TAX));
            assertEquals(2, order.getItems().size());
        }

        @Test
        @DisplayName("Confirmed line keeps its quantity")
        void testResizeConfirmed() {
            OrderItem line = order.addItem(burger, new BigDecimal("2"), null, NO_TAX, now);
            order.addItem(burger, BigDecimal.ONE, null, NO_TAX, now);
            order.confirmItem(line.getId(), now);

            assertThrows(ImmutabilityViolationException.class,
                    () -> order.changeItemQuantity(line.getId(), new BigDecimal("3"), NO_TAX));
            assertEquals(0, new BigDecimal("2").compareTo(line.getQuantity()));
        }

        @Test
        @DisplayName("The item list cannot be modified from outside")
        void testItemsUnmodifiable() {
            order.addItem(burger, BigDecimal.ONE, null, NO_TAX, now);
            assertThrows(UnsupportedOperationException.class, () -> order.getItems().clear());
        }
    }

    @Nested
    @DisplayName("Validation and lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("Zero quantity is rejected")
        void testZeroQuantity() {
            assertThrows(ValidationException.class,
                    () -> order.addItem(burger, BigDecimal.ZERO, null, NO_TAX, now));
            assertTrue(order.getItems().isEmpty());
        }

        @Test
        @DisplayName("Unavailable product is rejected")
        void testUnavailableProduct() {
            burger.setAvailability(false);
            assertThrows(ValidationException.class,
                    () -> order.addItem(burger, BigDecimal.ONE, null, NO_TAX, now));
        }

        @Test
        @DisplayName("Completion frees the table")
        void testCompleteFreesTable() {
            order.addItem(burger, BigDecimal.ONE, null, NO_TAX, now);
            order.complete(now);

            assertEquals(OrderStatus.COMPLETED, order.getStatus());
            assertEquals(now, order.getCompletedAt());
            assertFalse(table.isOccupied());
        }

        @Test
        @DisplayName("Kitchen can still confirm a line after the order was paid and completed")
        void testConfirmAfterCompletion() {
            OrderItem line = order.addItem(burger, BigDecimal.ONE, null, NO_TAX, now);
            order.complete(now);

            assertTrue(order.confirmItem(line.getId(), now.plusSeconds(300)));
            assertTrue(line.isConfirmed());
            assertEquals(OrderStatus.COMPLETED, order.getStatus(), "Completion is final");
        }

        @Test
        @DisplayName("Kitchen cannot confirm a line of a cancelled order")
        void testConfirmAfterCancel() {
            OrderItem line = order.addItem(burger, BigDecimal.ONE, null, NO_TAX, now);
            order.cancel(now);

            assertThrows(StateConflictException.class, () -> order.confirmItem(line.getId(), now));
            assertFalse(line.isConfirmed());
        }

        @Test
        @DisplayName("Cancelled order cannot be served or completed")
        void testCancelledIsTerminal() {
            order.cancel(now);

            assertFalse(table.isOccupied());
            assertThrows(StateConflictException.class, () -> order.markServed());
            assertThrows(StateConflictException.class, () -> order.complete(now));
        }

        @Test
        @DisplayName("Served requires ready")
        void testServedRequiresReady() {
            order.addItem(burger, BigDecimal.ONE, null, NO_TAX, now);
            assertThrows(StateConflictException.class, () -> order.markServed());
        }
    }
}
