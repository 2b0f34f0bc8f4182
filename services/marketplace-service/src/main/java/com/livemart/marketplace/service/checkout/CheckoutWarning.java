package com.livemart.marketplace.service.checkout;

import com.livemart.marketplace.exception.PartialFulfillmentException;

/**
 * Non-fatal problem attached to a placed order.
 */
public record CheckoutWarning(String code, String message) {

    public static final String PARTIAL_FULFILLMENT = "partial_fulfillment";
    public static final String CART_NOT_CLEARED = "cart_not_cleared";

    public static CheckoutWarning partialFulfillment(PartialFulfillmentException e) {
        return new CheckoutWarning(PARTIAL_FULFILLMENT,
                "Stock could not be reserved for products " + e.getFailedProductIds()
                        + "; the order is kept and has been flagged for review");
    }

    public static CheckoutWarning cartNotCleared() {
        return new CheckoutWarning(CART_NOT_CLEARED, "Order placed but the cart could not be cleared");
    }
}
