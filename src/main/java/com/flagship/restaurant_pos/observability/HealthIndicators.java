package com.flagship.restaurant_pos.observability;

import com.flagship.restaurant_pos.outbox.OutboxEventRepository;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Readiness checks beyond the database.
 */
public class HealthIndicators {

    /**
     * Down when notifications pile up faster than Kafka takes them.
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        private static final long BACKLOG_WARNING_THRESHOLD = 1000;
        private static final long BACKLOG_CRITICAL_THRESHOLD = 10000;

        private final OutboxEventRepository outboxRepository;

        public OutboxHealthIndicator(OutboxEventRepository outboxRepository) {
            this.outboxRepository = outboxRepository;
        }

        @Override
        public Health health() {
            try {
                long backlogSize = outboxRepository.countUnpublished();
                Health.Builder builder = backlogSize < BACKLOG_WARNING_THRESHOLD
                        ? Health.up()
                        : backlogSize < BACKLOG_CRITICAL_THRESHOLD
                        ? Health.status("WARNING")
                        : Health.down();
                return builder
                        .withDetail("backlogSize", backlogSize)
                        .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                        .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                        .build();
            } catch (Exception e) {
                return Health.down().withDetail("error", e.getMessage()).build();
            }
        }
    }

    /**
     * The signal store only carries short-lived terminal hints, so losing it
     * degrades freshness but never correctness.
     */
    @Component("signalStoreHealth")
    public static class SignalStoreHealthIndicator implements HealthIndicator {

        private static final String NOTE = "Kitchen board falls back to the database; cash drawer hints are skipped";

        private final Optional<StringRedisTemplate> redisTemplate;

        public SignalStoreHealthIndicator(Optional<StringRedisTemplate> redisTemplate) {
            this.redisTemplate = redisTemplate;
        }

        @Override
        public Health health() {
            if (redisTemplate.isEmpty() || redisTemplate.get().getConnectionFactory() == null) {
                return Health.status("DEGRADED").withDetail("error", "No Redis configured").withDetail("note", NOTE).build();
            }
            try (RedisConnection connection = redisTemplate.get().getConnectionFactory().getConnection()) {
                String result = connection.ping();
                return "PONG".equals(result)
                        ? Health.up().withDetail("response", result).build()
                        : Health.status("DEGRADED").withDetail("response", String.valueOf(result)).withDetail("note", NOTE).build();
            } catch (Exception e) {
                return Health.status("DEGRADED")
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .withDetail("note", NOTE)
                        .build();
            }
        }
    }
}
