package com.livemart.marketplace.repository;

import java.math.BigDecimal;

/**
 * Catalog listing filter. Every field except {@code availableOnly} and {@code limit} is optional.
 */
public record ProductFilter(
        String categoryId,
        String search,
        BigDecimal minPrice,
        BigDecimal maxPrice,
        boolean availableOnly,
        String sellerId,
        int limit
) {
    public static final String ALL_CATEGORIES = "all";
}
