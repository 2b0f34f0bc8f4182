package com.livemart.marketplace.controller;

import com.livemart.marketplace.dto.CartItemRequest;
import com.livemart.marketplace.dto.CartResponse;
import com.livemart.marketplace.service.CartService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/cart")
public class CartController {

    private final CartService cartService;

    public CartController(CartService cartService) {
        this.cartService = cartService;
    }

    @GetMapping("/{userId}")
    public ResponseEntity<CartResponse> get(@PathVariable String userId) {
        return ResponseEntity.ok(cartService.find(userId)
                .map(CartResponse::from)
                .orElseGet(() -> CartResponse.empty(userId)));
    }

    @PostMapping("/{userId}")
    public ResponseEntity<CartResponse> addItem(@PathVariable String userId,
                                                @Valid @RequestBody CartItemRequest request) {
        return ResponseEntity.ok(CartResponse.from(
                cartService.addItem(userId, request.productId(), request.quantity())));
    }

    @PutMapping("/{userId}/{productId}")
    public ResponseEntity<CartResponse> updateQuantity(@PathVariable String userId,
                                                       @PathVariable String productId,
                                                       @RequestParam int quantity) {
        return ResponseEntity.ok(CartResponse.from(cartService.updateQuantity(userId, productId, quantity)));
    }

    @DeleteMapping("/{userId}/{productId}")
    public ResponseEntity<CartResponse> removeItem(@PathVariable String userId, @PathVariable String productId) {
        return ResponseEntity.ok(CartResponse.from(cartService.removeItem(userId, productId)));
    }

    @DeleteMapping("/{userId}")
    public ResponseEntity<Map<String, String>> clear(@PathVariable String userId) {
        cartService.clear(userId);
        return ResponseEntity.ok(Map.of("message", "Cart cleared"));
    }
}
