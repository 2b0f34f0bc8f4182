package com.livemart.marketplace.service.checkout;

/**
 * Steps of a checkout in the order they run. Once {@link #PERSISTING} has succeeded the only way to
 * reach {@link #FAILED} is a rejected stock debit, which leaves the order cancelled.
 */
public enum CheckoutState {
    VALIDATING,
    BUILDING,
    PERSISTING,
    DEBITING,
    CLEARING_CART,
    COMPLETED,
    FAILED
}
