package com.flagship.restaurant_pos.order;

import com.flagship.restaurant_pos.access.ActorContext;
import com.flagship.restaurant_pos.access.CapabilityGuard;
import com.flagship.restaurant_pos.access.Role;
import com.flagship.restaurant_pos.access.User;
import com.flagship.restaurant_pos.access.UserRepository;
import com.flagship.restaurant_pos.audit.AuditActionType;
import com.flagship.restaurant_pos.audit.AuditRecord;
import com.flagship.restaurant_pos.audit.AuditTrailService;
import com.flagship.restaurant_pos.catalog.DiningTable;
import com.flagship.restaurant_pos.catalog.DiningTableRepository;
import com.flagship.restaurant_pos.catalog.Product;
import com.flagship.restaurant_pos.catalog.ProductRepository;
import com.flagship.restaurant_pos.exception.NotFoundException;
import com.flagship.restaurant_pos.exception.StateConflictException;
import com.flagship.restaurant_pos.exception.ValidationException;
import com.flagship.restaurant_pos.ledger.MovementType;
import com.flagship.restaurant_pos.ledger.StockLedgerService;
import com.flagship.restaurant_pos.observability.CorrelationContext;
import com.flagship.restaurant_pos.observability.PosMetrics;
import com.flagship.restaurant_pos.order.dto.OrderItemResponse;
import com.flagship.restaurant_pos.order.dto.OrderResponse;
import com.flagship.restaurant_pos.payment.PaymentRepository;
import com.flagship.restaurant_pos.sequence.DailySequenceService;
import com.flagship.restaurant_pos.sequence.DocumentNumber;
import com.flagship.restaurant_pos.signal.TerminalSignalService;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Order state machine.
 *
 * Every operation runs in one transaction that holds the order row lock, so
 * concurrent terminals working on the same order are serialized and the
 * stock movement, totals, status and audit entry of one call commit together
 * or not at all. Lock order is order, then table, then product (inside the
 * ledger).
 */
@Service
@Slf4j
public class OrderService {

    private final OrderRepository orderRepository;
    private final OrderItemRepository orderItemRepository;
    private final ProductRepository productRepository;
    private final DiningTableRepository tableRepository;
    private final UserRepository userRepository;
    private final PaymentRepository paymentRepository;
    private final StockLedgerService ledger;
    private final DailySequenceService sequences;
    private final AuditTrailService auditTrail;
    private final TerminalSignalService signals;
    private final CapabilityGuard capabilities;
    private final PosMetrics metrics;
    private final TransactionTemplate transactionTemplate;

    @Value("${pos.tax-rate:0}")
    private BigDecimal taxRate;

    public OrderService(OrderRepository orderRepository, OrderItemRepository orderItemRepository,
                        ProductRepository productRepository,
                        DiningTableRepository tableRepository, UserRepository userRepository,
                        PaymentRepository paymentRepository, StockLedgerService ledger,
                        DailySequenceService sequences, AuditTrailService auditTrail,
                        TerminalSignalService signals, CapabilityGuard capabilities, PosMetrics metrics,
                        TransactionTemplate transactionTemplate) {
        this.orderRepository = orderRepository;
        this.orderItemRepository = orderItemRepository;
        this.productRepository = productRepository;
        this.tableRepository = tableRepository;
        this.userRepository = userRepository;
        this.paymentRepository = paymentRepository;
        this.ledger = ledger;
        this.sequences = sequences;
        this.auditTrail = auditTrail;
        this.signals = signals;
        this.capabilities = capabilities;
        this.metrics = metrics;
        this.transactionTemplate = transactionTemplate;
    }

    /**
     * Opens an order on a table, or a takeout order when {@code tableId} is null.
     *
     * If the table already has an active order, that order is returned with
     * {@code existing = true} instead of creating a second one. The order
     * number is allocated before the order transaction starts; when the
     * redirect is only discovered under the table lock, the number is left
     * unused.
     */
    public OrderResponse createOrder(UUID tableId, ActorContext actor) {
        long startTime = System.currentTimeMillis();
        User waiter = capabilities.requires(actor, Role.WAITER, Role.ADMIN);

        if (tableId != null) {
            Optional<OrderResponse> existing = transactionTemplate.execute(status ->
                    orderRepository.findByTableIdAndStatusIn(tableId, OrderStatus.ACTIVE)
                            .map(order -> snapshot(order).toBuilder().existing(true).build()));
            if (existing != null && existing.isPresent()) {
                log.info("Table {} already has order {}, returning it", tableId, existing.get().getOrderNumber());
                return existing.get();
            }
        }

        String orderNumber = sequences.next(DocumentNumber.ORDER);
        OrderResponse response = transactionTemplate.execute(status ->
                openOrder(orderNumber, tableId, waiter.getId(), actor));
        metrics.recordLatency("create_order", System.currentTimeMillis() - startTime);
        return response;
    }

    private OrderResponse openOrder(String orderNumber, UUID tableId, UUID waiterId, ActorContext actor) {
        DiningTable table = null;
        if (tableId != null) {
            table = tableRepository.findByIdForUpdate(tableId)
                    .filter(DiningTable::isActive)
                    .orElseThrow(() -> NotFoundException.of("Table", tableId));
            Optional<Order> existing = orderRepository.findByTableIdAndStatusIn(tableId, OrderStatus.ACTIVE);
            if (existing.isPresent()) {
                log.info("Table {} got order {} concurrently; number {} left unused",
                        table.getNumber(), existing.get().getOrderNumber(), orderNumber);
                return snapshot(existing.get()).toBuilder().existing(true).build();
            }
            table.occupy();
        }

        Order order = orderRepository.save(
                Order.open(orderNumber, table, userRepository.getReferenceById(waiterId), actor.getDeviceId()));
        MDC.put(CorrelationContext.ORDER_ID_MDC_KEY, order.getId().toString());

        auditTrail.record(AuditRecord.by(actor, AuditActionType.ORDER_CREATE)
                .tableName("orders")
                .recordId(order.getId().toString())
                .description("Order " + orderNumber + " created for " + (table != null ? "table " + table.getNumber() : "takeout"))
                .meta("order_number", orderNumber)
                .build());
        metrics.incrementOrdersCreated();
        log.info("Order created: number={}, table={}", orderNumber, table != null ? table.getNumber() : "takeout");
        return snapshot(order, BigDecimal.ZERO.setScale(2));
    }

    /**
     * Adds a line, deducts stock through the ledger and recomputes totals.
     *
     * @throws StateConflictException if the order is past preparing
     * @throws ValidationException if the product is not orderable or the quantity is not positive
     */
    @Transactional
    public OrderItemResponse addItem(UUID orderId, UUID productId, BigDecimal quantity,
                                     String specialInstructions, ActorContext actor) {
        capabilities.requires(actor, Role.WAITER, Role.ADMIN);
        if (quantity == null || quantity.signum() <= 0) {
            throw new ValidationException("Quantity must be greater than 0");
        }
        Order order = lockOrder(orderId);
        Product product = productRepository.findById(productId)
                .orElseThrow(() -> NotFoundException.of("Product", productId));

        Instant now = Instant.now();
        OrderItem item = order.addItem(product, quantity, specialInstructions, taxRate, now);
        ledger.recordMovement(product.getId(), MovementType.SALE, item.getQuantity().negate(),
                order.getOrderNumber(), "Sold on order " + order.getOrderNumber(), actor);

        if (item.requiresKitchen()) {
            signals.touchKitchenWatermark();
        }
        auditTrail.record(AuditRecord.by(actor, AuditActionType.ORDER_MODIFY)
                .tableName("order_items")
                .recordId(item.getId().toString())
                .description(String.format("Added %s x %s to order %s", item.getQuantity().toPlainString(),
                        product.getName(), order.getOrderNumber()))
                .meta("order_id", order.getId().toString())
                .meta("unit_price", item.getUnitPrice().toPlainString())
                .meta("order_total", order.getTotalAmount().toPlainString())
                .build());
        metrics.incrementItemsAdded();
        log.info("Item added: order={}, product={}, qty={}, total={}, status={}",
                order.getOrderNumber(), product.getSku(), item.getQuantity(), order.getTotalAmount(), order.getStatus());
        return OrderItemResponse.from(item);
    }

    /**
     * Removes an unconfirmed line and puts its quantity back into stock.
     *
     * @throws StateConflictException once the order has payments
     */
    @Transactional
    public OrderResponse removeItem(UUID orderId, UUID itemId, ActorContext actor) {
        capabilities.requires(actor, Role.WAITER, Role.ADMIN);
        Order order = lockOrder(orderId);
        requireNoPayments(order, "lines cannot be removed");
        OrderItem item = order.removeItem(itemId, taxRate);

        ledger.recordMovement(item.getProduct().getId(), MovementType.RETURN, item.getQuantity(),
                order.getOrderNumber(), "Removed from order " + order.getOrderNumber(), actor);
        if (item.requiresKitchen()) {
            signals.touchKitchenWatermark();
        }
        auditTrail.record(AuditRecord.by(actor, AuditActionType.ORDER_MODIFY)
                .tableName("order_items")
                .recordId(itemId.toString())
                .description(String.format("Removed %s x %s from order %s", item.getQuantity().toPlainString(),
                        item.getProduct().getName(), order.getOrderNumber()))
                .meta("order_id", order.getId().toString())
                .meta("order_total", order.getTotalAmount().toPlainString())
                .build());
        log.info("Item removed: order={}, item={}, total={}", order.getOrderNumber(), itemId, order.getTotalAmount());
        return snapshot(order);
    }

    /**
     * Resizes an unconfirmed line; the ledger moves the difference. Once the
     * order has payments a line may only grow.
     */
    @Transactional
    public OrderResponse updateItemQuantity(UUID orderId, UUID itemId, BigDecimal quantity, ActorContext actor) {
        capabilities.requires(actor, Role.WAITER, Role.ADMIN);
        Order order = lockOrder(orderId);
        if (quantity != null && quantity.compareTo(order.findItem(itemId).getQuantity()) < 0) {
            requireNoPayments(order, "quantities cannot be lowered");
        }
        BigDecimal previous = order.changeItemQuantity(itemId, quantity, taxRate);
        OrderItem item = order.findItem(itemId);
        BigDecimal difference = item.getQuantity().subtract(previous);

        if (difference.signum() > 0) {
            ledger.recordMovement(item.getProduct().getId(), MovementType.SALE, difference.negate(),
                    order.getOrderNumber(), "Quantity raised on order " + order.getOrderNumber(), actor);
        } else if (difference.signum() < 0) {
            ledger.recordMovement(item.getProduct().getId(), MovementType.RETURN, difference.negate(),
                    order.getOrderNumber(), "Quantity lowered on order " + order.getOrderNumber(), actor);
        }
        if (difference.signum() != 0 && item.requiresKitchen()) {
            signals.touchKitchenWatermark();
        }
        auditTrail.record(AuditRecord.by(actor, AuditActionType.ORDER_MODIFY)
                .tableName("order_items")
                .recordId(itemId.toString())
                .description(String.format("Quantity of %s on order %s changed from %s to %s",
                        item.getProduct().getName(), order.getOrderNumber(),
                        previous.toPlainString(), item.getQuantity().toPlainString()))
                .meta("order_id", order.getId().toString())
                .build());
        return snapshot(order);
    }

    /**
     * Kitchen confirms a line. The last outstanding kitchen line makes the
     * order ready.
     */
    @Transactional
    public OrderResponse confirmItem(UUID itemId, ActorContext actor) {
        capabilities.requires(actor, Role.KITCHEN, Role.ADMIN);
        UUID orderId = orderItemOrderId(itemId);
        Order order = lockOrder(orderId);
        Instant now = Instant.now();
        OrderStatus before = order.getStatus();
        boolean changed = order.confirmItem(itemId, now);
        if (!changed) {
            return snapshot(order);
        }
        OrderItem item = order.findItem(itemId);
        signals.touchKitchenWatermark();
        auditTrail.record(AuditRecord.by(actor, AuditActionType.ORDER_MODIFY)
                .tableName("order_items")
                .recordId(itemId.toString())
                .description(String.format("Kitchen confirmed %s x %s on order %s",
                        item.getQuantity().toPlainString(), item.getProduct().getName(), order.getOrderNumber()))
                .meta("order_id", order.getId().toString())
                .meta("order_status", order.getStatus().name())
                .build());
        if (before != order.getStatus()) {
            log.info("Order {} is {}", order.getOrderNumber(), order.getStatus());
        }
        return snapshot(order);
    }

    @Transactional
    public OrderResponse markServed(UUID orderId, ActorContext actor) {
        capabilities.requires(actor, Role.WAITER, Role.ADMIN);
        Order order = lockOrder(orderId);
        order.markServed();
        auditTrail.record(AuditRecord.by(actor, AuditActionType.ORDER_MODIFY)
                .tableName("orders")
                .recordId(order.getId().toString())
                .description("Order " + order.getOrderNumber() + " served")
                .build());
        return snapshot(order);
    }

    /**
     * Aborts an order that has not been paid at all. Stock of unconfirmed
     * lines is returned; confirmed lines were prepared and stay consumed.
     */
    @Transactional
    public OrderResponse cancelOrder(UUID orderId, String reason, ActorContext actor) {
        capabilities.requires(actor, Role.WAITER, Role.ADMIN);
        Order order = lockOrder(orderId);
        if (order.getStatus().isTerminal()) {
            throw new StateConflictException("Order " + order.getOrderNumber() + " is already " + order.getStatus());
        }
        requireNoPayments(order, "it cannot be cancelled");

        for (OrderItem item : order.getItems()) {
            if (!item.isConfirmed()) {
                ledger.recordMovement(item.getProduct().getId(), MovementType.RETURN, item.getQuantity(),
                        order.getOrderNumber(), "Order " + order.getOrderNumber() + " cancelled", actor);
            }
        }
        order.cancel(Instant.now());
        signals.touchKitchenWatermark();

        auditTrail.record(AuditRecord.by(actor, AuditActionType.ORDER_CANCEL)
                .tableName("orders")
                .recordId(order.getId().toString())
                .description("Order " + order.getOrderNumber() + " cancelled"
                        + (reason != null && !reason.isBlank() ? ": " + reason : ""))
                .meta("order_total", order.getTotalAmount().toPlainString())
                .build());
        metrics.incrementOrdersCancelled();
        log.info("Order cancelled: number={}, reason={}", order.getOrderNumber(), reason);
        return snapshot(order, BigDecimal.ZERO.setScale(2));
    }

    @Transactional(readOnly = true)
    public OrderResponse getOrder(UUID orderId, ActorContext actor) {
        capabilities.requires(actor);
        return snapshot(orderRepository.findById(orderId)
                .orElseThrow(() -> NotFoundException.of("Order", orderId)));
    }

    /**
     * Orders in the given statuses, oldest first. Defaults to all active ones.
     */
    @Transactional(readOnly = true)
    public List<OrderResponse> listOrders(Collection<OrderStatus> statuses, ActorContext actor) {
        capabilities.requires(actor);
        Collection<OrderStatus> filter = statuses == null || statuses.isEmpty()
                ? OrderStatus.ACTIVE : EnumSet.copyOf(statuses);
        return orderRepository.findByStatusInOrderByCreatedAtAsc(filter).stream()
                .map(this::snapshot)
                .toList();
    }

    private Order lockOrder(UUID orderId) {
        MDC.put(CorrelationContext.ORDER_ID_MDC_KEY, orderId.toString());
        return orderRepository.findByIdForUpdate(orderId)
                .orElseThrow(() -> NotFoundException.of("Order", orderId));
    }

    private void requireNoPayments(Order order, String consequence) {
        if (paymentRepository.sumAmountByOrderId(order.getId()).signum() > 0) {
            throw new StateConflictException("Order " + order.getOrderNumber() + " has payments, " + consequence);
        }
    }

    private UUID orderItemOrderId(UUID itemId) {
        return orderItemRepository.findOrderIdByItemId(itemId)
                .orElseThrow(() -> NotFoundException.of("Order item", itemId));
    }

    private OrderResponse snapshot(Order order) {
        return snapshot(order, paymentRepository.sumAmountByOrderId(order.getId()));
    }

    private OrderResponse snapshot(Order order, BigDecimal paid) {
        return OrderResponse.from(order, paid);
    }
}
