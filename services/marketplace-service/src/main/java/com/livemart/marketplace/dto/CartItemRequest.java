package com.livemart.marketplace.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

public record CartItemRequest(
        @NotBlank String productId,
        @Min(1) Integer quantity
) {
    public CartItemRequest {
        if (quantity == null) {
            quantity = 1;
        }
    }
}
