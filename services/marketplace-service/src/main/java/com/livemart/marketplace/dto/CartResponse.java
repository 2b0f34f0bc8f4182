package com.livemart.marketplace.dto;

import com.livemart.marketplace.entity.Cart;

import java.util.List;

public record CartResponse(String userId, List<ItemResponse> items) {

    public static CartResponse from(Cart cart) {
        List<ItemResponse> items = cart.getItems().stream()
                .map(item -> new ItemResponse(item.getProductId(), item.getQuantity()))
                .toList();
        return new CartResponse(cart.getUserId(), items);
    }

    public static CartResponse empty(String userId) {
        return new CartResponse(userId, List.of());
    }

    public record ItemResponse(String productId, int quantity) {}
}
