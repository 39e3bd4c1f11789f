package com.flagship.restaurant_pos.order;

import com.flagship.restaurant_pos.access.ActorContext;
import com.flagship.restaurant_pos.order.dto.KitchenBoardResponse;
import com.flagship.restaurant_pos.order.dto.OrderResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.UUID;

@RestController
@RequestMapping("/api/kitchen")
@RequiredArgsConstructor
public class KitchenController {

    private final KitchenBoardService kitchenBoardService;
    private final OrderService orderService;

    @GetMapping("/board")
    public KitchenBoardResponse board(
            @RequestParam(name = "since", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant since,
            @RequestAttribute(ActorContext.REQUEST_ATTRIBUTE) ActorContext actor) {
        return kitchenBoardService.board(since, actor);
    }

    @PostMapping("/items/{itemId}/confirm")
    public OrderResponse confirmItem(@PathVariable("itemId") UUID itemId,
                                     @RequestAttribute(ActorContext.REQUEST_ATTRIBUTE) ActorContext actor) {
        return orderService.confirmItem(itemId, actor);
    }
}
