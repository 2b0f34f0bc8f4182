package com.livemart.marketplace.dto;

import com.livemart.marketplace.entity.Feedback;

import java.time.Instant;

public record FeedbackResponse(
        String id,
        String userId,
        String userName,
        String productId,
        int rating,
        String comment,
        Instant createdAt
) {
    public static FeedbackResponse from(Feedback feedback) {
        return new FeedbackResponse(feedback.getId(), feedback.getUserId(), feedback.getUserName(),
                feedback.getProductId(), feedback.getRating(), feedback.getComment(), feedback.getCreatedAt());
    }
}
