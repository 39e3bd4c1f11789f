package com.flagship.restaurant_pos.ledger;

import java.math.BigDecimal;

public enum StockCondition {
    OK,
    LOW_STOCK,
    OUT_OF_STOCK;

    public static StockCondition evaluate(BigDecimal quantity, BigDecimal minStockLevel) {
        if (quantity.signum() <= 0) {
            return OUT_OF_STOCK;
        }
        if (quantity.compareTo(minStockLevel) <= 0) {
            return LOW_STOCK;
        }
        return OK;
    }
}
