package com.livemart.events.order;

import com.livemart.events.OrderLineItem;

import java.math.BigDecimal;
import java.util.List;

public record OrderCancelledEvent(
        String orderId,
        String userId,
        List<OrderLineItem> items,
        BigDecimal totalAmount,
        String reason
) {}
