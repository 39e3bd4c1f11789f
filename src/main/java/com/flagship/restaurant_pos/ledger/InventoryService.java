package com.flagship.restaurant_pos.ledger;

import com.flagship.restaurant_pos.access.ActorContext;
import com.flagship.restaurant_pos.access.CapabilityGuard;
import com.flagship.restaurant_pos.access.Role;
import com.flagship.restaurant_pos.catalog.Product;
import com.flagship.restaurant_pos.catalog.ProductRepository;
import com.flagship.restaurant_pos.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Manual stock operations for administrators. Every change goes through the ledger.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InventoryService {

    /**
     * What a back-office user can record by hand. Sales and returns are
     * produced by the order flow only.
     */
    public enum Adjustment {
        PURCHASE,
        WASTAGE,
        ADJUSTMENT
    }

    private final StockLedgerService ledger;
    private final ProductRepository productRepository;
    private final CapabilityGuard capabilities;

    /**
     * @param quantity amount received or wasted (positive), or the counted
     *                 stock for {@link Adjustment#ADJUSTMENT} (zero or positive)
     */
    @Transactional
    public StockMovement adjust(UUID productId, Adjustment adjustment, BigDecimal quantity, String notes,
                                ActorContext actor) {
        capabilities.requires(actor, Role.ADMIN);
        if (adjustment == null) {
            throw new ValidationException("Adjustment type is required");
        }
        if (quantity == null || quantity.signum() < 0
                || (adjustment != Adjustment.ADJUSTMENT && quantity.signum() == 0)) {
            throw new ValidationException("Invalid quantity for " + adjustment.name().toLowerCase());
        }

        StockMovement movement = switch (adjustment) {
            case PURCHASE -> ledger.recordMovement(productId, MovementType.PURCHASE, quantity, null, notes, actor);
            case WASTAGE -> ledger.recordMovement(productId, MovementType.WASTAGE, quantity.negate(), null, notes, actor);
            case ADJUSTMENT -> ledger.recordMovement(productId, MovementType.ADJUSTMENT, quantity, null, notes, actor);
        };
        log.info("Inventory {} on product {}: {} -> {}", adjustment, productId,
                movement.getPreviousQuantity(), movement.getNewQuantity());
        return movement;
    }

    @Transactional(readOnly = true)
    public List<StockMovement> history(UUID productId, ActorContext actor) {
        capabilities.requires(actor, Role.ADMIN);
        return ledger.movementsFor(productId);
    }

    @Transactional(readOnly = true)
    public List<Product> lowStock(ActorContext actor) {
        capabilities.requires(actor, Role.ADMIN);
        return productRepository.findLowStock();
    }
}
