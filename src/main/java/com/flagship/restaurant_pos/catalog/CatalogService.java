package com.flagship.restaurant_pos.catalog;

import com.flagship.restaurant_pos.access.ActorContext;
import com.flagship.restaurant_pos.access.CapabilityGuard;
import com.flagship.restaurant_pos.access.Role;
import com.flagship.restaurant_pos.audit.AuditActionType;
import com.flagship.restaurant_pos.audit.AuditRecord;
import com.flagship.restaurant_pos.audit.AuditTrailService;
import com.flagship.restaurant_pos.catalog.dto.CreateProductRequest;
import com.flagship.restaurant_pos.catalog.dto.ProductResponse;
import com.flagship.restaurant_pos.catalog.dto.TableResponse;
import com.flagship.restaurant_pos.exception.NotFoundException;
import com.flagship.restaurant_pos.exception.StateConflictException;
import com.flagship.restaurant_pos.ledger.MovementType;
import com.flagship.restaurant_pos.ledger.StockLedgerService;
import com.flagship.restaurant_pos.notification.NotificationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Products and tables.
 *
 * Price changes are allowed at any time and never touch prices already locked
 * into order items; each one is audited and announced. Products are never
 * deleted, only deactivated, because order history references them.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CatalogService {

    private final ProductRepository productRepository;
    private final DiningTableRepository tableRepository;
    private final StockLedgerService ledger;
    private final AuditTrailService auditTrail;
    private final NotificationService notifications;
    private final CapabilityGuard capabilities;
    private final JdbcTemplate jdbcTemplate;

    /**
     * Creates a product. Opening stock is booked as a purchase movement so the
     * journal explains the full balance from zero.
     */
    @Transactional
    public ProductResponse createProduct(CreateProductRequest request, ActorContext actor) {
        capabilities.requires(actor, Role.ADMIN);
        if (productRepository.existsBySku(request.getSku())) {
            throw new StateConflictException("SKU already in use: " + request.getSku());
        }
        Product product = productRepository.saveAndFlush(Product.create(request.getName(), request.getSku(),
                request.getDescription(), request.getPrice(), request.getUnitOfMeasure(),
                request.getMinStockLevel(), request.isRequiresKitchen()));

        BigDecimal stock = BigDecimal.ZERO;
        if (request.getInitialStock() != null && request.getInitialStock().signum() > 0) {
            stock = ledger.recordMovement(product.getId(), MovementType.PURCHASE, request.getInitialStock(),
                    null, "Opening stock", actor).getNewQuantity();
        }

        auditTrail.record(AuditRecord.by(actor, AuditActionType.USER_ACTION)
                .tableName("products")
                .recordId(product.getId().toString())
                .description("Product created: " + product.getName() + " (" + product.getSku() + ")")
                .meta("price", product.getCurrentPrice().toPlainString())
                .build());
        log.info("Product created: sku={}, price={}, stock={}", product.getSku(), product.getCurrentPrice(), stock);
        return ProductResponse.from(product, stock);
    }

    @Transactional
    public ProductResponse changePrice(UUID productId, BigDecimal newPrice, ActorContext actor) {
        capabilities.requires(actor, Role.ADMIN);
        Product product = loadProduct(productId);
        BigDecimal oldPrice = product.changePrice(newPrice);
        if (oldPrice.compareTo(product.getCurrentPrice()) == 0) {
            return ProductResponse.from(product);
        }

        log.warn("PRICE CHANGE: {} ({}) {} -> {} by {}", product.getName(), product.getSku(),
                oldPrice, product.getCurrentPrice(), actor.getUserId());
        auditTrail.record(AuditRecord.by(actor, AuditActionType.PRICE_CHANGE)
                .tableName("products")
                .recordId(product.getId().toString())
                .description(String.format("Price of %s changed from %s to %s", product.getName(),
                        oldPrice.toPlainString(), product.getCurrentPrice().toPlainString()))
                .meta("old_price", oldPrice.toPlainString())
                .meta("new_price", product.getCurrentPrice().toPlainString())
                .build());
        notifications.priceChanged(product.getId(), product.getName(), oldPrice, product.getCurrentPrice(),
                actor.getUserId());
        return ProductResponse.from(product);
    }

    @Transactional
    public ProductResponse setAvailability(UUID productId, boolean available, ActorContext actor) {
        capabilities.requires(actor, Role.ADMIN);
        Product product = loadProduct(productId);
        product.setAvailability(available);
        auditTrail.record(AuditRecord.by(actor, AuditActionType.USER_ACTION)
                .tableName("products")
                .recordId(product.getId().toString())
                .description(product.getName() + (available ? " made available" : " made unavailable"))
                .build());
        return ProductResponse.from(product);
    }

    @Transactional
    public ProductResponse deactivateProduct(UUID productId, ActorContext actor) {
        capabilities.requires(actor, Role.ADMIN);
        Product product = loadProduct(productId);
        product.deactivate();
        auditTrail.record(AuditRecord.by(actor, AuditActionType.USER_ACTION)
                .tableName("products")
                .recordId(product.getId().toString())
                .description("Product deactivated: " + product.getName())
                .build());
        log.info("Product deactivated: sku={}", product.getSku());
        return ProductResponse.from(product);
    }

    @Transactional(readOnly = true)
    public List<ProductResponse> listProducts(boolean orderableOnly, ActorContext actor) {
        capabilities.requires(actor);
        List<Product> products = orderableOnly
                ? productRepository.findByActiveTrueAndAvailableTrueOrderByNameAsc()
                : productRepository.findByActiveTrueOrderByNameAsc();
        return products.stream().map(ProductResponse::from).toList();
    }

    @Transactional(readOnly = true)
    public ProductResponse getProduct(UUID productId, ActorContext actor) {
        capabilities.requires(actor);
        return ProductResponse.from(loadProduct(productId));
    }

    @Transactional
    public TableResponse createTable(String number, int capacity, ActorContext actor) {
        capabilities.requires(actor, Role.ADMIN);
        if (tableRepository.existsByNumber(number)) {
            throw new StateConflictException("Table number already in use: " + number);
        }
        DiningTable table = tableRepository.save(DiningTable.create(number, capacity));
        auditTrail.record(AuditRecord.by(actor, AuditActionType.USER_ACTION)
                .tableName("dining_tables")
                .recordId(table.getId().toString())
                .description("Table " + number + " created")
                .build());
        return new TableResponse(table.getId(), table.getNumber(), table.getCapacity(), false, null, null);
    }

    /**
     * Active tables with the order currently sitting on each, if any.
     */
    @Transactional(readOnly = true)
    public List<TableResponse> listTables(ActorContext actor) {
        capabilities.requires(actor);
        return jdbcTemplate.query(
                "SELECT t.id, t.number, t.capacity, t.occupied, o.id AS order_id, o.order_number " +
                "FROM dining_tables t " +
                "LEFT JOIN orders o ON o.table_id = t.id AND o.status NOT IN ('COMPLETED', 'CANCELLED') " +
                "WHERE t.active ORDER BY t.number",
                (rs, rowNum) -> new TableResponse(
                        rs.getObject("id", UUID.class),
                        rs.getString("number"),
                        rs.getInt("capacity"),
                        rs.getBoolean("occupied"),
                        rs.getObject("order_id", UUID.class),
                        rs.getString("order_number")));
    }

    private Product loadProduct(UUID productId) {
        return productRepository.findById(productId)
                .orElseThrow(() -> NotFoundException.of("Product", productId));
    }
}
