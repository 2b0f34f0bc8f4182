package com.livemart.marketplace.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

public record CheckoutRequest(
        @NotEmpty @Valid List<CheckoutItemRequest> items,
        @NotBlank String deliveryAddress,
        String paymentMethod
) {}
