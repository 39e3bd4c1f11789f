package com.flagship.restaurant_pos.ledger;

import com.flagship.restaurant_pos.access.ActorContext;
import com.flagship.restaurant_pos.catalog.dto.ProductResponse;
import com.flagship.restaurant_pos.ledger.dto.StockAdjustmentRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/inventory")
@RequiredArgsConstructor
public class InventoryController {

    private final InventoryService inventoryService;

    @PostMapping("/products/{productId}/adjustments")
    public ResponseEntity<StockMovement> adjust(@PathVariable("productId") UUID productId,
                                                @Valid @RequestBody StockAdjustmentRequest request,
                                                @RequestAttribute(ActorContext.REQUEST_ATTRIBUTE) ActorContext actor) {
        StockMovement movement = inventoryService.adjust(productId, request.getType(), request.getQuantity(),
                request.getNotes(), actor);
        return ResponseEntity.status(HttpStatus.CREATED).body(movement);
    }

    @GetMapping("/products/{productId}/movements")
    public List<StockMovement> history(@PathVariable("productId") UUID productId,
                                       @RequestAttribute(ActorContext.REQUEST_ATTRIBUTE) ActorContext actor) {
        return inventoryService.history(productId, actor);
    }

    @GetMapping("/low-stock")
    public List<ProductResponse> lowStock(@RequestAttribute(ActorContext.REQUEST_ATTRIBUTE) ActorContext actor) {
        return inventoryService.lowStock(actor).stream().map(ProductResponse::from).toList();
    }
}
