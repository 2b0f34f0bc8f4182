package com.livemart.events;

import java.math.BigDecimal;

public record OrderLineItem(
        String productId,
        String productName,
        int quantity,
        BigDecimal unitPrice,
        String sellerId
) {}
