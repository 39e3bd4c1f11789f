package com.flagship.restaurant_pos.notification;

import com.flagship.restaurant_pos.outbox.OutboxService;
import com.flagship.restaurant_pos.signal.TerminalSignalService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Hands low-stock and price-change notifications to the outbox. Delivery
 * (dashboard, mail) is downstream of the Kafka topic.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NotificationService {

    static final String PRODUCT_AGGREGATE = "Product";

    private final OutboxService outboxService;
    private final TerminalSignalService signals;

    /**
     * Queues a low-stock notification unless one for the same product went
     * out recently.
     *
     * @return true if an event was queued
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public boolean lowStock(UUID productId, String productName, String sku, BigDecimal currentStock,
                            BigDecimal minStockLevel, String condition, String reference) {
        if (signals.lowStockRecentlyNotified(productId)) {
            log.debug("Low-stock notification suppressed for product {} ({})", productName, condition);
            return false;
        }
        LowStockDetectedEvent event = new LowStockDetectedEvent(UUID.randomUUID(), productId, productName, sku,
                currentStock, minStockLevel, condition, reference, Instant.now());
        outboxService.saveEvent(PRODUCT_AGGREGATE, productId, LowStockDetectedEvent.EVENT_TYPE, event);
        signals.rememberLowStockNotified(productId);
        log.warn("{}: {} ({}) at {} / min {}", condition, productName, sku, currentStock, minStockLevel);
        return true;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void priceChanged(UUID productId, String productName, BigDecimal oldPrice, BigDecimal newPrice,
                             UUID changedBy) {
        PriceChangedEvent event = new PriceChangedEvent(UUID.randomUUID(), productId, productName,
                oldPrice, newPrice, changedBy, Instant.now());
        outboxService.saveEvent(PRODUCT_AGGREGATE, productId, PriceChangedEvent.EVENT_TYPE, event);
    }
}
