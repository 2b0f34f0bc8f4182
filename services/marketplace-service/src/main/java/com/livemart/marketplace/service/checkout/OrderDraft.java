package com.livemart.marketplace.service.checkout;

import com.livemart.marketplace.entity.OrderItem;

import java.math.BigDecimal;
import java.util.List;

/**
 * Priced order content that has not been written yet.
 */
public record OrderDraft(
        String userId,
        List<OrderItem> items,
        BigDecimal totalAmount,
        String deliveryAddress,
        String paymentMethod
) {
    public OrderDraft {
        items = List.copyOf(items);
    }
}
