package com.livemart.marketplace.exception;

import org.springframework.http.HttpStatus;

public class NotFoundException extends MarketplaceException {

    public NotFoundException(String reason) {
        super(HttpStatus.NOT_FOUND, "NOT_FOUND", reason);
    }

    public static NotFoundException product(String productId) {
        return new NotFoundException("Product not found: " + productId);
    }

    public static NotFoundException user(String userId) {
        return new NotFoundException("User not found: " + userId);
    }

    public static NotFoundException order(String orderId) {
        return new NotFoundException("Order not found: " + orderId);
    }

    public static NotFoundException cart(String userId) {
        return new NotFoundException("Cart not found for user: " + userId);
    }
}
