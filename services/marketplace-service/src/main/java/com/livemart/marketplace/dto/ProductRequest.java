package com.livemart.marketplace.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigDecimal;

/**
 * Body of product create and update calls. On update, null fields are left unchanged.
 */
public record ProductRequest(
        String id,
        String name,
        String categoryId,
        @PositiveOrZero BigDecimal price,
        @PositiveOrZero Integer stock,
        String sellerId,
        String description,
        String imageUrl,
        @DecimalMin("0") @DecimalMax("5") Double rating
) {}
