package com.livemart.marketplace.exception;

import org.springframework.http.HttpStatus;

import java.util.List;

/**
 * The order is persisted but not every stock decrement was applied. Inventory and the order
 * disagree until an operator reconciles the failed products.
 */
public class PartialFulfillmentException extends MarketplaceException {

    private final String orderId;
    private final List<String> debitedProductIds;
    private final List<String> failedProductIds;

    public PartialFulfillmentException(String orderId, List<String> debitedProductIds,
                                       List<String> failedProductIds, Throwable cause) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, "PARTIAL_FULFILLMENT",
                "Order " + orderId + " placed but stock was not debited for " + failedProductIds, cause);
        this.orderId = orderId;
        this.debitedProductIds = List.copyOf(debitedProductIds);
        this.failedProductIds = List.copyOf(failedProductIds);
    }

    public String getOrderId() { return orderId; }
    public List<String> getDebitedProductIds() { return debitedProductIds; }
    public List<String> getFailedProductIds() { return failedProductIds; }
}
