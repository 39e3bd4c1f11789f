package com.flagship.restaurant_pos.ledger;

import com.flagship.restaurant_pos.access.ActorContext;
import com.flagship.restaurant_pos.audit.AuditActionType;
import com.flagship.restaurant_pos.audit.AuditRecord;
import com.flagship.restaurant_pos.audit.AuditTrailService;
import com.flagship.restaurant_pos.exception.NotFoundException;
import com.flagship.restaurant_pos.exception.ValidationException;
import com.flagship.restaurant_pos.notification.NotificationService;
import com.flagship.restaurant_pos.observability.PosMetrics;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Append-only stock journal and the only writer of {@code products.stock_quantity}.
 *
 * Each movement locks the product row ({@code SELECT ... FOR UPDATE}), computes
 * the new quantity, updates the product and appends the movement in the
 * caller's transaction. Movements on one product are therefore strictly
 * sequential and each one's {@code previous_quantity} is the previous one's
 * {@code new_quantity}.
 *
 * Stock may go negative. A sale is never refused for lack of stock; instead a
 * low-stock or out-of-stock notification is queued when a decrease leaves the
 * product at or below its minimum.
 */
@Service
@Slf4j
public class StockLedgerService {

    private static final String LOCK_PRODUCT_SQL =
            "SELECT name, sku, stock_quantity, min_stock_level FROM products WHERE id = ? FOR UPDATE";

    private static final String SELECT_MOVEMENT_COLUMNS =
            "SELECT id, sequence_number, product_id, movement_type, quantity, previous_quantity, new_quantity, " +
            "reference_number, notes, created_by, created_at FROM stock_movements ";

    private final JdbcTemplate jdbcTemplate;
    private final AuditTrailService auditTrail;
    private final NotificationService notifications;
    private final PosMetrics metrics;

    public StockLedgerService(JdbcTemplate jdbcTemplate, AuditTrailService auditTrail,
                              NotificationService notifications, PosMetrics metrics) {
        this.jdbcTemplate = jdbcTemplate;
        this.auditTrail = auditTrail;
        this.notifications = notifications;
        this.metrics = metrics;
    }

    /**
     * Records one stock movement.
     *
     * @param productId product to move
     * @param type movement type
     * @param quantity signed delta (negative for sale and wastage, positive for
     *                 purchase and return), or the absolute target for an adjustment
     * @param reference order number or other document reference, may be null
     * @param notes free text, may be null
     * @param actor who caused the movement
     * @return the appended movement
     * @throws NotFoundException if the product does not exist
     * @throws ValidationException if the delta is zero or carries the wrong sign
     */
    @Transactional
    public StockMovement recordMovement(UUID productId, MovementType type, BigDecimal quantity,
                                        String reference, String notes, ActorContext actor) {
        validate(type, quantity);

        ProductStock stock = jdbcTemplate.query(LOCK_PRODUCT_SQL, (rs, rowNum) -> new ProductStock(
                        rs.getString("name"),
                        rs.getString("sku"),
                        rs.getBigDecimal("stock_quantity"),
                        rs.getBigDecimal("min_stock_level")), productId)
                .stream()
                .findFirst()
                .orElseThrow(() -> NotFoundException.of("Product", productId));

        BigDecimal previous = stock.getQuantity();
        BigDecimal target = type.isAbsoluteTarget() ? scaled(quantity) : previous.add(scaled(quantity));
        BigDecimal delta = target.subtract(previous);

        jdbcTemplate.update("UPDATE products SET stock_quantity = ?, updated_at = CURRENT_TIMESTAMP WHERE id = ?",
                target, productId);

        UUID movementId = UUID.randomUUID();
        Instant now = Instant.now();
        UUID actorId = actor != null ? actor.getUserId() : null;
        Long sequenceNumber = jdbcTemplate.queryForObject(
                "INSERT INTO stock_movements (id, product_id, movement_type, quantity, previous_quantity, " +
                "new_quantity, reference_number, notes, created_by, created_at) " +
                "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?) RETURNING sequence_number",
                Long.class,
                movementId, productId, type.code(), delta, previous, target, reference, notes, actorId,
                Timestamp.from(now));

        StockMovement movement = new StockMovement(movementId, sequenceNumber != null ? sequenceNumber : 0L,
                productId, type, delta, previous, target, reference, notes, actorId, now);

        log.debug("Stock movement: product={}, type={}, {} -> {} ({})", stock.getSku(), type, previous, target, delta);

        auditTrail.record(AuditRecord.by(actor, AuditActionType.STOCK_ADJUST)
                .tableName("stock_movements")
                .recordId(movementId.toString())
                .description(String.format("%s: %s %s (%s -> %s)", type.code(), stock.getName(), delta.toPlainString(),
                        previous.toPlainString(), target.toPlainString()))
                .meta("product_id", productId.toString())
                .meta("movement_type", type.code())
                .meta("previous_quantity", previous.toPlainString())
                .meta("new_quantity", target.toPlainString())
                .meta("reference", reference != null ? reference : "")
                .build());

        StockCondition condition = StockCondition.evaluate(target, stock.getMinStockLevel());
        if (condition != StockCondition.OK && delta.signum() < 0) {
            if (condition == StockCondition.OUT_OF_STOCK) {
                log.warn("Product {} ({}) oversold or depleted: stock now {}", stock.getName(), stock.getSku(), target);
            }
            metrics.recordStockCondition(condition.name());
            notifications.lowStock(productId, stock.getName(), stock.getSku(), target, stock.getMinStockLevel(),
                    condition.name(), reference);
        }
        return movement;
    }

    @Transactional(readOnly = true)
    public BigDecimal currentStock(UUID productId) {
        return jdbcTemplate.query("SELECT stock_quantity FROM products WHERE id = ?",
                        (rs, rowNum) -> rs.getBigDecimal("stock_quantity"), productId)
                .stream()
                .findFirst()
                .orElseThrow(() -> NotFoundException.of("Product", productId));
    }

    /**
     * Journal of one product in the order it was written.
     */
    @Transactional(readOnly = true)
    public List<StockMovement> movementsFor(UUID productId) {
        return jdbcTemplate.query(SELECT_MOVEMENT_COLUMNS + "WHERE product_id = ? ORDER BY sequence_number",
                movementRowMapper(), productId);
    }

    /**
     * Movements carrying a given reference, e.g. every line of one order.
     */
    @Transactional(readOnly = true)
    public List<StockMovement> movementsByReference(String reference) {
        return jdbcTemplate.query(SELECT_MOVEMENT_COLUMNS + "WHERE reference_number = ? ORDER BY sequence_number",
                movementRowMapper(), reference);
    }

    private void validate(MovementType type, BigDecimal quantity) {
        if (type == null) {
            throw new ValidationException("Movement type is required");
        }
        if (quantity == null) {
            throw new ValidationException("Movement quantity is required");
        }
        if (type.isAbsoluteTarget()) {
            if (quantity.signum() < 0) {
                throw new ValidationException("Adjustment target cannot be negative");
            }
        } else if (!type.acceptsDelta(quantity)) {
            throw new ValidationException("Invalid delta " + quantity.toPlainString() + " for " + type.code());
        }
    }

    private static BigDecimal scaled(BigDecimal value) {
        return value.setScale(2, RoundingMode.HALF_UP);
    }

    private RowMapper<StockMovement> movementRowMapper() {
        return (rs, rowNum) -> new StockMovement(
                rs.getObject("id", UUID.class),
                rs.getLong("sequence_number"),
                rs.getObject("product_id", UUID.class),
                MovementType.fromCode(rs.getString("movement_type")),
                rs.getBigDecimal("quantity"),
                rs.getBigDecimal("previous_quantity"),
                rs.getBigDecimal("new_quantity"),
                rs.getString("reference_number"),
                rs.getString("notes"),
                rs.getObject("created_by", UUID.class),
                rs.getTimestamp("created_at").toInstant()
        );
    }

    @Value
    private static class ProductStock {
        String name;
        String sku;
        BigDecimal quantity;
        BigDecimal minStockLevel;
    }
}
