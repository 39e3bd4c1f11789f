package com.flagship.restaurant_pos.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Micrometer meters for the point-of-sale core.
 *
 * <ul>
 *   <li>pos.orders.created, pos.orders.completed, pos.orders.cancelled</li>
 *   <li>pos.order.items.added</li>
 *   <li>pos.payments.processed{method}, pos.payments.capped</li>
 *   <li>pos.stock.condition{condition}</li>
 *   <li>pos.shift.variance.warnings</li>
 *   <li>pos.audit.write.failures{action}</li>
 *   <li>pos.signal.failures{signal}</li>
 *   <li>pos.device.mismatches</li>
 *   <li>pos.operation.latency{operation}</li>
 * </ul>
 */
@Component
public class PosMetrics {

    private final MeterRegistry registry;

    private final Counter ordersCreated;
    private final Counter ordersCompleted;
    private final Counter ordersCancelled;
    private final Counter itemsAdded;
    private final Counter cappedPayments;
    private final Counter varianceWarnings;
    private final Counter deviceMismatches;

    public PosMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.ordersCreated = Counter.builder("pos.orders.created")
                .description("Orders opened")
                .register(registry);
        this.ordersCompleted = Counter.builder("pos.orders.completed")
                .description("Orders closed by full payment")
                .register(registry);
        this.ordersCancelled = Counter.builder("pos.orders.cancelled")
                .description("Orders aborted before payment")
                .register(registry);
        this.itemsAdded = Counter.builder("pos.order.items.added")
                .description("Order lines created")
                .register(registry);
        this.cappedPayments = Counter.builder("pos.payments.capped")
                .description("Payments reduced to the remaining balance")
                .register(registry);
        this.varianceWarnings = Counter.builder("pos.shift.variance.warnings")
                .description("Shifts closed with a cash variance above threshold")
                .register(registry);
        this.deviceMismatches = Counter.builder("pos.device.mismatches")
                .description("Requests refused because of device binding")
                .register(registry);
    }

    public void incrementOrdersCreated() {
        ordersCreated.increment();
    }

    public void incrementOrdersCompleted() {
        ordersCompleted.increment();
    }

    public void incrementOrdersCancelled() {
        ordersCancelled.increment();
    }

    public void incrementItemsAdded() {
        itemsAdded.increment();
    }

    public void recordPaymentProcessed(String method) {
        registry.counter("pos.payments.processed", "method", sanitizeTag(method)).increment();
    }

    public void incrementCappedPayments() {
        cappedPayments.increment();
    }

    public void recordStockCondition(String condition) {
        registry.counter("pos.stock.condition", "condition", sanitizeTag(condition)).increment();
    }

    public void incrementVarianceWarnings() {
        varianceWarnings.increment();
    }

    public void recordDeviceMismatch() {
        deviceMismatches.increment();
    }

    public void recordAuditWriteFailure(String actionType) {
        registry.counter("pos.audit.write.failures", "action", sanitizeTag(actionType)).increment();
    }

    public void recordSignalFailure(String signal) {
        registry.counter("pos.signal.failures", "signal", sanitizeTag(signal)).increment();
    }

    public void recordLatency(String operation, long durationMs) {
        Timer.builder("pos.operation.latency")
                .tag("operation", sanitizeTag(operation))
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry)
                .record(Duration.ofMillis(durationMs));
    }

    /**
     * Keeps tag values short and free of punctuation.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
