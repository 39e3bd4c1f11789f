package com.flagship.restaurant_pos.catalog;

import com.flagship.restaurant_pos.access.ActorContext;
import com.flagship.restaurant_pos.catalog.dto.AvailabilityRequest;
import com.flagship.restaurant_pos.catalog.dto.CreateProductRequest;
import com.flagship.restaurant_pos.catalog.dto.CreateTableRequest;
import com.flagship.restaurant_pos.catalog.dto.PriceChangeRequest;
import com.flagship.restaurant_pos.catalog.dto.ProductResponse;
import com.flagship.restaurant_pos.catalog.dto.TableResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class CatalogController {

    private final CatalogService catalogService;

    @GetMapping("/products")
    public List<ProductResponse> listProducts(
            @RequestParam(name = "orderable", defaultValue = "false") boolean orderableOnly,
            @RequestAttribute(ActorContext.REQUEST_ATTRIBUTE) ActorContext actor) {
        return catalogService.listProducts(orderableOnly, actor);
    }

    @GetMapping("/products/{productId}")
    public ProductResponse getProduct(@PathVariable("productId") UUID productId,
                                      @RequestAttribute(ActorContext.REQUEST_ATTRIBUTE) ActorContext actor) {
        return catalogService.getProduct(productId, actor);
    }

    @PostMapping("/products")
    public ResponseEntity<ProductResponse> createProduct(@Valid @RequestBody CreateProductRequest request,
                                                         @RequestAttribute(ActorContext.REQUEST_ATTRIBUTE) ActorContext actor) {
        return ResponseEntity.status(HttpStatus.CREATED).body(catalogService.createProduct(request, actor));
    }

    @PutMapping("/products/{productId}/price")
    public ProductResponse changePrice(@PathVariable("productId") UUID productId,
                                       @Valid @RequestBody PriceChangeRequest request,
                                       @RequestAttribute(ActorContext.REQUEST_ATTRIBUTE) ActorContext actor) {
        return catalogService.changePrice(productId, request.getPrice(), actor);
    }

    @PutMapping("/products/{productId}/availability")
    public ProductResponse setAvailability(@PathVariable("productId") UUID productId,
                                           @RequestBody AvailabilityRequest request,
                                           @RequestAttribute(ActorContext.REQUEST_ATTRIBUTE) ActorContext actor) {
        return catalogService.setAvailability(productId, request.isAvailable(), actor);
    }

    @DeleteMapping("/products/{productId}")
    public ProductResponse deactivateProduct(@PathVariable("productId") UUID productId,
                                             @RequestAttribute(ActorContext.REQUEST_ATTRIBUTE) ActorContext actor) {
        return catalogService.deactivateProduct(productId, actor);
    }

    @GetMapping("/tables")
    public List<TableResponse> listTables(@RequestAttribute(ActorContext.REQUEST_ATTRIBUTE) ActorContext actor) {
        return catalogService.listTables(actor);
    }

    @PostMapping("/tables")
    public ResponseEntity<TableResponse> createTable(@Valid @RequestBody CreateTableRequest request,
                                                     @RequestAttribute(ActorContext.REQUEST_ATTRIBUTE) ActorContext actor) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(catalogService.createTable(request.getNumber(), request.getCapacity(), actor));
    }
}
