package com.livemart.marketplace.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

public record FeedbackRequest(
        @NotBlank String productId,
        @Min(1) @Max(5) Integer rating,
        String comment
) {
    public FeedbackRequest {
        if (rating == null) {
            rating = 5;
        }
        if (comment == null) {
            comment = "";
        }
    }
}
