package com.livemart.marketplace.dto;

import com.livemart.marketplace.entity.User;
import com.livemart.marketplace.entity.UserRole;

import java.time.Instant;

public record UserResponse(
        String id,
        String email,
        String name,
        String phone,
        UserRole role,
        String address,
        Instant createdAt
) {
    public static UserResponse from(User user) {
        return new UserResponse(user.getId(), user.getEmail(), user.getName(), user.getPhone(),
                user.getRole(), user.getAddress(), user.getCreatedAt());
    }
}
