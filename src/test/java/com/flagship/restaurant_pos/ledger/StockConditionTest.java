package com.flagship.restaurant_pos.ledger;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class StockConditionTest {

    private static final BigDecimal MIN = new BigDecimal("10");

    @Test
    @DisplayName("Zero or negative stock is out of stock")
    void testOutOfStock() {
        assertEquals(StockCondition.OUT_OF_STOCK, StockCondition.evaluate(BigDecimal.ZERO, MIN));
        assertEquals(StockCondition.OUT_OF_STOCK, StockCondition.evaluate(new BigDecimal("-3"), MIN));
    }

    @Test
    @DisplayName("At or below the minimum is low stock")
    void testLowStock() {
        assertEquals(StockCondition.LOW_STOCK, StockCondition.evaluate(new BigDecimal("10"), MIN));
        assertEquals(StockCondition.LOW_STOCK, StockCondition.evaluate(new BigDecimal("0.5"), MIN));
    }

    @Test
    @DisplayName("Above the minimum is fine")
    void testOk() {
        assertEquals(StockCondition.OK, StockCondition.evaluate(new BigDecimal("10.01"), MIN));
    }

    @Test
    @DisplayName("Movement types enforce the sign of their delta")
    void testMovementSigns() {
        assertTrue(MovementType.SALE.acceptsDelta(new BigDecimal("-1")));
        assertFalse(MovementType.SALE.acceptsDelta(BigDecimal.ONE));
        assertTrue(MovementType.RETURN.acceptsDelta(BigDecimal.ONE));
        assertTrue(MovementType.PURCHASE.acceptsDelta(BigDecimal.ONE));
        assertFalse(MovementType.WASTAGE.acceptsDelta(BigDecimal.ONE));
        assertTrue(MovementType.ADJUSTMENT.isAbsoluteTarget());
        assertEquals(MovementType.RETURN, MovementType.fromCode("return"));
    }
}
