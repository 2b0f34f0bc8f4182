package com.livemart.marketplace.exception;

import org.springframework.http.HttpStatus;

public class InsufficientStockException extends MarketplaceException {

    private final String productId;

    public InsufficientStockException(String productId, String productName) {
        super(HttpStatus.CONFLICT, "INSUFFICIENT_STOCK", "Insufficient stock for " + productName);
        this.productId = productId;
    }

    public String getProductId() {
        return productId;
    }
}
