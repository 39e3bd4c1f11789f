package com.flagship.restaurant_pos.payment;

/**
 * Output device for receipts.
 */
public interface ReceiptPrinter {

    /**
     * @return true if the receipt was printed
     */
    boolean print(Receipt receipt);
}
