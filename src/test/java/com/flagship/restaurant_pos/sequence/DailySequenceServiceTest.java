package com.flagship.restaurant_pos.sequence;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class DailySequenceServiceTest {

    @Test
    @DisplayName("Numbers are PREFIX-YYYYMMDD-NNNN")
    void testFormat() {
        LocalDate day = LocalDate.of(2024, 3, 9);

        assertEquals("ORD-20240309-0001", DailySequenceService.format(DocumentNumber.ORDER, day, 1));
        assertEquals("PAY-20240309-0042", DailySequenceService.format(DocumentNumber.PAYMENT, day, 42));
    }

    @Test
    @DisplayName("Counter widens past four digits instead of wrapping")
    void testWideCounter() {
        assertEquals("ORD-20241231-12345",
                DailySequenceService.format(DocumentNumber.ORDER, LocalDate.of(2024, 12, 31), 12345));
    }
}
