package com.livemart.marketplace.dto;

import jakarta.validation.constraints.NotBlank;

public record CategoryRequest(
        String id,
        @NotBlank String name
) {}
