package com.flagship.restaurant_pos.signal;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.restaurant_pos.observability.PosMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.Optional;
import java.util.UUID;

/**
 * Short-lived hints shared between terminals through Redis.
 *
 * Nothing here is durable state. Writes are deferred until the surrounding
 * transaction commits, so a rolled-back operation never raises a signal, and
 * every Redis failure is logged and dropped. Readers poll and accept values up
 * to the configured TTL old.
 *
 * Keys:
 * <ul>
 *   <li>{@code pos:kitchen:watermark}: epoch millis of the last kitchen-relevant commit, never decreasing</li>
 *   <li>{@code pos:drawer:{deviceId}}: pending cash-drawer open for a terminal</li>
 *   <li>{@code pos:low-stock:{productId}}: suppresses repeated low-stock notifications</li>
 * </ul>
 */
@Service
@Slf4j
public class TerminalSignalService {

    static final String KITCHEN_WATERMARK_KEY = "pos:kitchen:watermark";
    static final String DRAWER_KEY_PREFIX = "pos:drawer:";
    static final String LOW_STOCK_KEY_PREFIX = "pos:low-stock:";

    // KEYS[1] watermark, ARGV[1] candidate millis, ARGV[2] ttl millis. Returns the stored value.
    static final RedisScript<Long> ADVANCE_WATERMARK = new DefaultRedisScript<>("""
            local current = tonumber(redis.call('GET', KEYS[1]))
            local candidate = tonumber(ARGV[1])
            if current ~= nil and current >= candidate then
                redis.call('PEXPIRE', KEYS[1], ARGV[2])
                return current
            end
            redis.call('SET', KEYS[1], ARGV[1], 'PX', ARGV[2])
            return candidate
            """, Long.class);

    private final Optional<StringRedisTemplate> redisTemplate;
    private final ObjectMapper objectMapper;
    private final PosMetrics metrics;

    @Value("${pos.signals.kitchen-ttl:PT24H}")
    private Duration kitchenTtl;

    @Value("${pos.signals.cash-drawer-ttl:PT60S}")
    private Duration cashDrawerTtl;

    @Value("${pos.signals.low-stock-ttl:PT1H}")
    private Duration lowStockTtl;

    public TerminalSignalService(Optional<StringRedisTemplate> redisTemplate, ObjectMapper objectMapper,
                                 PosMetrics metrics) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
    }

    /**
     * Moves the kitchen watermark to the commit time of the current
     * transaction. Commits finishing out of order never move it back.
     */
    public void touchKitchenWatermark() {
        afterCommit("kitchen_watermark", redis -> advanceKitchenWatermark(redis, Instant.now()));
    }

    void advanceKitchenWatermark(StringRedisTemplate redis, Instant committedAt) {
        Long stored = redis.execute(ADVANCE_WATERMARK, Collections.singletonList(KITCHEN_WATERMARK_KEY),
                String.valueOf(committedAt.toEpochMilli()), String.valueOf(kitchenTtl.toMillis()));
        if (stored != null && stored > committedAt.toEpochMilli()) {
            log.debug("Kitchen watermark kept at {}, later than {}", Instant.ofEpochMilli(stored), committedAt);
        }
    }

    public Optional<Instant> kitchenWatermark() {
        return read("kitchen_watermark", redis -> {
            String value = redis.opsForValue().get(KITCHEN_WATERMARK_KEY);
            return value == null ? null : Instant.ofEpochMilli(Long.parseLong(value));
        });
    }

    public void raiseCashDrawer(CashDrawerSignal signal) {
        if (signal.getDeviceId() == null) {
            log.debug("Cash drawer signal skipped, payment {} has no device", signal.getPaymentNumber());
            return;
        }
        afterCommit("cash_drawer", redis -> {
            try {
                redis.opsForValue().set(DRAWER_KEY_PREFIX + signal.getDeviceId(),
                        objectMapper.writeValueAsString(signal), cashDrawerTtl);
            } catch (JsonProcessingException e) {
                throw new IllegalArgumentException("Unserializable cash drawer signal", e);
            }
            log.info("Cash drawer signal raised: device={}, payment={}", signal.getDeviceId(), signal.getPaymentNumber());
        });
    }

    /**
     * Reads and clears the pending drawer signal for a terminal.
     */
    public Optional<CashDrawerSignal> takeCashDrawer(String deviceId) {
        return read("cash_drawer", redis -> {
            String json = redis.opsForValue().getAndDelete(DRAWER_KEY_PREFIX + deviceId);
            if (json == null) {
                return null;
            }
            try {
                return objectMapper.readValue(json, CashDrawerSignal.class);
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Unreadable cash drawer signal", e);
            }
        });
    }

    /**
     * True if a low-stock notification for this product went out within the TTL.
     * Without Redis nothing is suppressed.
     */
    public boolean lowStockRecentlyNotified(UUID productId) {
        return read("low_stock", redis -> redis.hasKey(LOW_STOCK_KEY_PREFIX + productId)).orElse(false);
    }

    public void rememberLowStockNotified(UUID productId) {
        afterCommit("low_stock", redis ->
                redis.opsForValue().set(LOW_STOCK_KEY_PREFIX + productId, Instant.now().toString(), lowStockTtl));
    }

    private void afterCommit(String signal, RedisAction action) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        Runnable guarded = () -> {
            try {
                action.apply(redisTemplate.get());
            } catch (Exception e) {
                log.warn("Signal {} not written: {}", signal, e.getMessage());
                metrics.recordSignalFailure(signal);
            }
        };
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    guarded.run();
                }
            });
        } else {
            guarded.run();
        }
    }

    private <T> Optional<T> read(String signal, RedisRead<T> reader) {
        if (redisTemplate.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(reader.apply(redisTemplate.get()));
        } catch (Exception e) {
            log.warn("Signal {} not readable: {}", signal, e.getMessage());
            metrics.recordSignalFailure(signal);
            return Optional.empty();
        }
    }

    @FunctionalInterface
    private interface RedisAction {
        void apply(StringRedisTemplate redis);
    }

    @FunctionalInterface
    private interface RedisRead<T> {
        T apply(StringRedisTemplate redis);
    }
}
