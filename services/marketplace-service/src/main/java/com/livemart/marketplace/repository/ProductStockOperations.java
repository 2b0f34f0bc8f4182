package com.livemart.marketplace.repository;

/**
 * Atomic stock mutations. Each call is a single guarded write, so concurrent checkouts cannot
 * drive a product's stock below zero.
 */
public interface ProductStockOperations {

    /**
     * Decrements stock by {@code quantity} only if the product exists and still holds at least that
     * many units.
     *
     * @return {@code false} when the guard did not match and nothing was written
     */
    boolean decrementStockIfAvailable(String productId, int quantity);

    /**
     * Adds {@code quantity} units back to a product's stock.
     *
     * @return {@code false} when the product no longer exists
     */
    boolean incrementStock(String productId, int quantity);
}
