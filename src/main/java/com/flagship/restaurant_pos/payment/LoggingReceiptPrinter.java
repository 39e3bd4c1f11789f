package com.flagship.restaurant_pos.payment;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Fallback printer for terminals without a thermal printer attached: writes
 * the receipt to the log and reports success.
 */
@Component
@Slf4j
public class LoggingReceiptPrinter implements ReceiptPrinter {

    @Override
    public boolean print(Receipt receipt) {
        log.info("Receipt {} for order {}: {} lines, total {} {}, paid {} by {}",
                receipt.getReceiptNumber(), receipt.getOrderNumber(), receipt.getLines().size(),
                receipt.getTotalAmount(), receipt.getCurrency(), receipt.getAmountPaid(), receipt.getPaymentMethod());
        return true;
    }
}
