package com.livemart.marketplace.dto;

public record AuthResponse(
        String accessToken,
        String tokenType,
        UserResponse user
) {
    public static AuthResponse bearer(String accessToken, UserResponse user) {
        return new AuthResponse(accessToken, "bearer", user);
    }
}
