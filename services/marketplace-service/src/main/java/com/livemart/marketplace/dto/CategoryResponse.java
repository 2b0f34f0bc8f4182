package com.livemart.marketplace.dto;

import com.livemart.marketplace.entity.Category;

public record CategoryResponse(String id, String name) {

    public static CategoryResponse from(Category category) {
        return new CategoryResponse(category.getId(), category.getName());
    }
}
