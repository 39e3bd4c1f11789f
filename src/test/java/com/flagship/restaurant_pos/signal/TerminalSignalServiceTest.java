package com.flagship.restaurant_pos.signal;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.flagship.restaurant_pos.observability.PosMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.ArgumentMatchers;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Redis-backed signals with a mocked template. Unless a test opens
 * synchronization itself, no transaction is active and writes happen
 * immediately.
 */
@ExtendWith(MockitoExtension.class)
class TerminalSignalServiceTest {

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    @Mock
    private PosMetrics metrics;

    private final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private TerminalSignalService service;

    @BeforeEach
    void setUp() {
        service = new TerminalSignalService(Optional.of(redisTemplate), objectMapper, metrics);
        ReflectionTestUtils.setField(service, "kitchenTtl", Duration.ofHours(24));
        ReflectionTestUtils.setField(service, "cashDrawerTtl", Duration.ofSeconds(60));
        ReflectionTestUtils.setField(service, "lowStockTtl", Duration.ofHours(1));
    }

    @Test
    @DisplayName("Cash drawer signal is stored per device with the drawer TTL and read back once")
    void testCashDrawerRoundTrip() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        CashDrawerSignal signal = new CashDrawerSignal(UUID.randomUUID(), "PAY-20240101-0001",
                new BigDecimal("1500.00"), "till-1", Instant.now().truncatedTo(ChronoUnit.MILLIS));

        service.raiseCashDrawer(signal);

        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(valueOperations).set(eq("pos:drawer:till-1"), json.capture(), eq(Duration.ofSeconds(60)));

        when(valueOperations.getAndDelete("pos:drawer:till-1")).thenReturn(json.getValue());
        Optional<CashDrawerSignal> taken = service.takeCashDrawer("till-1");

        assertTrue(taken.isPresent());
        assertEquals(signal, taken.get());
    }

    @Test
    @DisplayName("Kitchen watermark is advanced with the compare-and-set script and read back as an instant")
    void testKitchenWatermark() {
        Instant before = Instant.now().truncatedTo(ChronoUnit.MILLIS);
        when(redisTemplate.execute(ArgumentMatchers.<RedisScript<Long>>any(), anyList(), any(), any()))
                .thenReturn(before.toEpochMilli());

        service.touchKitchenWatermark();

        ArgumentCaptor<String> stamp = ArgumentCaptor.forClass(String.class);
        verify(redisTemplate).execute(eq(TerminalSignalService.ADVANCE_WATERMARK),
                eq(List.of("pos:kitchen:watermark")), stamp.capture(), eq("86400000"));
        assertFalse(Instant.ofEpochMilli(Long.parseLong(stamp.getValue())).isBefore(before));

        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get("pos:kitchen:watermark")).thenReturn(String.valueOf(before.toEpochMilli()));
        assertEquals(Optional.of(before), service.kitchenWatermark());
    }

    @Test
    @DisplayName("Kitchen watermark is stamped when the transaction commits, not when the change is made")
    void testKitchenWatermarkStampedAtCommit() throws InterruptedException {
        TransactionSynchronizationManager.initSynchronization();
        try {
            // Given
            service.touchKitchenWatermark();
            verify(redisTemplate, never()).execute(ArgumentMatchers.<RedisScript<Long>>any(), anyList(), any(), any());
            Thread.sleep(20);
            Instant commitStarted = Instant.now().truncatedTo(ChronoUnit.MILLIS);

            // When
            TransactionSynchronizationManager.getSynchronizations().forEach(TransactionSynchronization::afterCommit);

            // Then
            ArgumentCaptor<String> stamp = ArgumentCaptor.forClass(String.class);
            verify(redisTemplate).execute(eq(TerminalSignalService.ADVANCE_WATERMARK),
                    eq(List.of("pos:kitchen:watermark")), stamp.capture(), any());
            assertFalse(Instant.ofEpochMilli(Long.parseLong(stamp.getValue())).isBefore(commitStarted));
        } finally {
            TransactionSynchronizationManager.clearSynchronization();
        }
    }

    @Test
    @DisplayName("Redis failure on write is logged and counted, never thrown")
    void testWriteFailureSwallowed() {
        when(redisTemplate.execute(ArgumentMatchers.<RedisScript<Long>>any(), anyList(), any(), any()))
                .thenThrow(new IllegalStateException("connection refused"));

        assertDoesNotThrow(() -> service.touchKitchenWatermark());
        verify(metrics).recordSignalFailure("kitchen_watermark");
    }

    @Test
    @DisplayName("Redis failure on read yields an empty result")
    void testReadFailureEmpty() {
        when(redisTemplate.hasKey(anyString())).thenThrow(new IllegalStateException("timeout"));

        assertFalse(service.lowStockRecentlyNotified(UUID.randomUUID()));
        verify(metrics).recordSignalFailure("low_stock");
    }

    @Test
    @DisplayName("Without Redis every signal is a no-op")
    void testNoRedis() {
        TerminalSignalService withoutRedis = new TerminalSignalService(Optional.empty(), objectMapper, metrics);

        assertDoesNotThrow(() -> withoutRedis.touchKitchenWatermark());
        assertTrue(withoutRedis.kitchenWatermark().isEmpty());
        assertTrue(withoutRedis.takeCashDrawer("till-1").isEmpty());
        assertFalse(withoutRedis.lowStockRecentlyNotified(UUID.randomUUID()));
    }
}
