package com.livemart.marketplace.service.checkout;

/**
 * One requested (product, quantity) pair of a checkout.
 */
public record CheckoutLine(String productId, int quantity) {}
