package com.livemart.marketplace.service.checkout;

import com.livemart.marketplace.entity.Order;

import java.util.List;

public record CheckoutResult(Order order, List<CheckoutWarning> warnings) {

    public CheckoutResult {
        warnings = List.copyOf(warnings);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
