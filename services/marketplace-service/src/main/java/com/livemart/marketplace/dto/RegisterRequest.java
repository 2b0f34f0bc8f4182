package com.livemart.marketplace.dto;

import com.livemart.marketplace.entity.UserRole;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record RegisterRequest(
        @NotBlank @Email String email,
        @NotBlank String name,
        @NotBlank String phone,
        @NotNull UserRole role,
        String address,
        @NotBlank String password
) {}
