package com.flagship.restaurant_pos.order;

import com.flagship.restaurant_pos.access.ActorContext;
import com.flagship.restaurant_pos.order.dto.AddItemRequest;
import com.flagship.restaurant_pos.order.dto.CancelOrderRequest;
import com.flagship.restaurant_pos.order.dto.CreateOrderRequest;
import com.flagship.restaurant_pos.order.dto.OrderItemResponse;
import com.flagship.restaurant_pos.order.dto.OrderResponse;
import com.flagship.restaurant_pos.order.dto.UpdateQuantityRequest;
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
@RequestMapping("/api/orders")
@RequiredArgsConstructor
public class OrderController {

    private final OrderService orderService;

    /**
     * 201 for a new order, 200 when the table's existing order is returned.
     */
    @PostMapping
    public ResponseEntity<OrderResponse> createOrder(@RequestBody(required = false) CreateOrderRequest request,
                                                     @RequestAttribute(ActorContext.REQUEST_ATTRIBUTE) ActorContext actor) {
        UUID tableId = request != null ? request.getTableId() : null;
        OrderResponse response = orderService.createOrder(tableId, actor);
        return ResponseEntity.status(response.isExisting() ? HttpStatus.OK : HttpStatus.CREATED).body(response);
    }

    @GetMapping
    public List<OrderResponse> listOrders(@RequestParam(name = "status", required = false) List<OrderStatus> statuses,
                                          @RequestAttribute(ActorContext.REQUEST_ATTRIBUTE) ActorContext actor) {
        return orderService.listOrders(statuses, actor);
    }

    @GetMapping("/{orderId}")
    public OrderResponse getOrder(@PathVariable("orderId") UUID orderId,
                                  @RequestAttribute(ActorContext.REQUEST_ATTRIBUTE) ActorContext actor) {
        return orderService.getOrder(orderId, actor);
    }

    @PostMapping("/{orderId}/items")
    public ResponseEntity<OrderItemResponse> addItem(@PathVariable("orderId") UUID orderId,
                                                     @Valid @RequestBody AddItemRequest request,
                                                     @RequestAttribute(ActorContext.REQUEST_ATTRIBUTE) ActorContext actor) {
        OrderItemResponse item = orderService.addItem(orderId, request.getProductId(), request.getQuantity(),
                request.getSpecialInstructions(), actor);
        return ResponseEntity.status(HttpStatus.CREATED).body(item);
    }

    @PutMapping("/{orderId}/items/{itemId}")
    public OrderResponse updateItemQuantity(@PathVariable("orderId") UUID orderId,
                                            @PathVariable("itemId") UUID itemId,
                                            @Valid @RequestBody UpdateQuantityRequest request,
                                            @RequestAttribute(ActorContext.REQUEST_ATTRIBUTE) ActorContext actor) {
        return orderService.updateItemQuantity(orderId, itemId, request.getQuantity(), actor);
    }

    @DeleteMapping("/{orderId}/items/{itemId}")
    public OrderResponse removeItem(@PathVariable("orderId") UUID orderId,
                                    @PathVariable("itemId") UUID itemId,
                                    @RequestAttribute(ActorContext.REQUEST_ATTRIBUTE) ActorContext actor) {
        return orderService.removeItem(orderId, itemId, actor);
    }

    @PostMapping("/{orderId}/served")
    public OrderResponse markServed(@PathVariable("orderId") UUID orderId,
                                    @RequestAttribute(ActorContext.REQUEST_ATTRIBUTE) ActorContext actor) {
        return orderService.markServed(orderId, actor);
    }

    @PostMapping("/{orderId}/cancel")
    public OrderResponse cancelOrder(@PathVariable("orderId") UUID orderId,
                                     @RequestBody(required = false) CancelOrderRequest request,
                                     @RequestAttribute(ActorContext.REQUEST_ATTRIBUTE) ActorContext actor) {
        return orderService.cancelOrder(orderId, request != null ? request.getReason() : null, actor);
    }
}
