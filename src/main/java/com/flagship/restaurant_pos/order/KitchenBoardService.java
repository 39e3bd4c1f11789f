package com.flagship.restaurant_pos.order;

import com.flagship.restaurant_pos.access.ActorContext;
import com.flagship.restaurant_pos.access.CapabilityGuard;
import com.flagship.restaurant_pos.access.Role;
import com.flagship.restaurant_pos.order.dto.KitchenBoardResponse;
import com.flagship.restaurant_pos.order.dto.OrderItemResponse;
import com.flagship.restaurant_pos.signal.TerminalSignalService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read model behind the kitchen displays.
 *
 * The watermark is the instant of the last kitchen-relevant change. It is
 * read from the shared signal store and recomputed from the database when the
 * signal is missing (expired, or Redis unavailable), so a display never
 * misses an update, it just may see it up to one TTL late.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class KitchenBoardService {

    private static final String WATERMARK_SQL = """
        SELECT GREATEST(MAX(oi.created_at), MAX(oi.confirmed_at), MAX(o.cancelled_at))
        FROM order_items oi
        JOIN products p ON p.id = oi.product_id
        JOIN orders o ON o.id = oi.order_id
        WHERE p.requires_kitchen = true
        """;

    private final OrderItemRepository orderItemRepository;
    private final TerminalSignalService signals;
    private final JdbcTemplate jdbcTemplate;
    private final CapabilityGuard capabilities;

    /**
     * @param since the watermark the display last saw, or null on first load
     */
    @Transactional(readOnly = true)
    public KitchenBoardResponse board(Instant since, ActorContext actor) {
        capabilities.requires(actor, Role.KITCHEN, Role.ADMIN);
        Instant watermark = watermark();

        Map<Order, List<OrderItem>> byOrder = new LinkedHashMap<>();
        for (OrderItem item : orderItemRepository.findAwaitingKitchen()) {
            byOrder.computeIfAbsent(item.getOrder(), order -> new ArrayList<>()).add(item);
        }
        List<KitchenBoardResponse.Ticket> tickets = byOrder.entrySet().stream()
                .map(entry -> ticket(entry.getKey(), entry.getValue()))
                .toList();

        boolean hasUpdates = since == null || (watermark != null && watermark.isAfter(since));
        return KitchenBoardResponse.builder()
                .watermark(watermark)
                .hasUpdates(hasUpdates)
                .tickets(tickets)
                .build();
    }

    Instant watermark() {
        Optional<Instant> cached = signals.kitchenWatermark();
        if (cached.isPresent()) {
            return cached.get();
        }
        Timestamp latest = jdbcTemplate.queryForObject(WATERMARK_SQL, Timestamp.class);
        log.debug("Kitchen watermark recomputed from database: {}", latest);
        return latest != null ? latest.toInstant() : null;
    }

    private KitchenBoardResponse.Ticket ticket(Order order, List<OrderItem> items) {
        return KitchenBoardResponse.Ticket.builder()
                .orderId(order.getId())
                .orderNumber(order.getOrderNumber())
                .tableNumber(order.isTakeout() ? "Takeout" : order.getTable().getNumber())
                .waiterName(order.getWaiter().getFullName() != null
                        ? order.getWaiter().getFullName() : order.getWaiter().getUsername())
                .items(items.stream().map(OrderItemResponse::from).toList())
                .build();
    }
}
