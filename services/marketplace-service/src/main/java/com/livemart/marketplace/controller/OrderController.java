package com.livemart.marketplace.controller;

import com.livemart.marketplace.dto.CheckoutRequest;
import com.livemart.marketplace.dto.OrderResponse;
import com.livemart.marketplace.entity.Order;
import com.livemart.marketplace.exception.ForbiddenException;
import com.livemart.marketplace.security.AuthenticatedUser;
import com.livemart.marketplace.service.CheckoutService;
import com.livemart.marketplace.service.OrderService;
import com.livemart.marketplace.service.checkout.CheckoutResult;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/orders")
public class OrderController {

    private final CheckoutService checkoutService;
    private final OrderService orderService;

    public OrderController(CheckoutService checkoutService, OrderService orderService) {
        this.checkoutService = checkoutService;
        this.orderService = orderService;
    }

    @PostMapping("/{userId}")
    public ResponseEntity<OrderResponse> placeOrder(@PathVariable String userId,
                                                    @Valid @RequestBody CheckoutRequest request) {
        CheckoutResult result = checkoutService.placeOrder(userId, request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(OrderResponse.from(result.order(), result.warnings()));
    }

    @GetMapping("/{userId}")
    public ResponseEntity<List<OrderResponse>> listOrders(@PathVariable String userId) {
        return ResponseEntity.ok(orderService.listForUser(userId).stream().map(OrderResponse::from).toList());
    }

    @GetMapping("/detail/{orderId}")
    public ResponseEntity<OrderResponse> getOrder(
            @PathVariable String orderId,
            @RequestAttribute(name = AuthenticatedUser.REQUEST_ATTRIBUTE, required = false) AuthenticatedUser caller) {
        Order order = orderService.get(orderId);
        if (caller != null && !caller.userId().equals(order.getUserId())) {
            throw new ForbiddenException("Order belongs to another user");
        }
        return ResponseEntity.ok(OrderResponse.from(order));
    }
}
