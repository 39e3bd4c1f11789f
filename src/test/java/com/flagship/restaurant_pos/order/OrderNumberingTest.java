package com.flagship.restaurant_pos.order;

import com.flagship.restaurant_pos.PosIntegrationTestSupport;
import com.flagship.restaurant_pos.access.ActorContext;
import com.flagship.restaurant_pos.access.Role;
import com.flagship.restaurant_pos.order.dto.OrderResponse;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Order numbers come from a per-day counter row and must stay unique and
 * gap-free under concurrent creation.
 */
class OrderNumberingTest extends PosIntegrationTestSupport {

    @Autowired
    private OrderService orderService;

    @Test
    @DisplayName("Concurrent order creation yields distinct consecutive numbers")
    void testConcurrentNumbering() throws InterruptedException {
        printTestHeader("Concurrent order numbering");

        // Given
        ActorContext waiter = actor(createUser(Role.WAITER), "tablet-numbering");
        int threadCount = 50;
        ExecutorService executor = Executors.newFixedThreadPool(16);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threadCount);
        Set<String> numbers = ConcurrentHashMap.newKeySet();
        AtomicInteger failures = new AtomicInteger();
        printInput("Concurrent creates", threadCount);

        // When
        for (int i = 0; i < threadCount; i++) {
            executor.submit(() -> {
                try {
                    start.await();
                    OrderResponse order = orderService.createOrder(null, waiter);
                    numbers.add(order.getOrderNumber());
                } catch (Exception e) {
                    failures.incrementAndGet();
                } finally {
                    done.countDown();
                }
            });
        }
        start.countDown();
        assertTrue(done.await(120, TimeUnit.SECONDS));
        executor.shutdown();

        // Then
        assertEquals(0, failures.get());
        assertEquals(threadCount, numbers.size(), "every number is distinct");

        List<Long> suffixes = new ArrayList<>();
        String day = null;
        for (String number : numbers) {
            String[] parts = number.split("-");
            assertEquals("ORD", parts[0]);
            assertTrue(day == null || day.equals(parts[1]), "same business day");
            day = parts[1];
            suffixes.add(Long.parseLong(parts[2]));
        }
        Collections.sort(suffixes);
        printOutput("Range", suffixes.get(0) + ".." + suffixes.get(suffixes.size() - 1));
        assertEquals(threadCount - 1, suffixes.get(suffixes.size() - 1) - suffixes.get(0), "no gaps");
        printSuccess("Numbers unique and consecutive");
    }
}
