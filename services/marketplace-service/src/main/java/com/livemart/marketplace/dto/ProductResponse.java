package com.livemart.marketplace.dto;

import com.livemart.marketplace.entity.Product;

import java.math.BigDecimal;

public record ProductResponse(
        String id,
        String name,
        String categoryId,
        BigDecimal price,
        int stock,
        String sellerId,
        String description,
        String imageUrl,
        double rating
) {
    public static ProductResponse from(Product product) {
        return new ProductResponse(
                product.getId(),
                product.getName(),
                product.getCategoryId(),
                product.getPrice(),
                product.getStock(),
                product.getSellerId(),
                product.getDescription(),
                product.getImageUrl(),
                product.getRating()
        );
    }
}
