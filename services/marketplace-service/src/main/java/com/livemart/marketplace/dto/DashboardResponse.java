package com.livemart.marketplace.dto;

import java.math.BigDecimal;

public record DashboardResponse(
        long productsCount,
        long ordersCount,
        BigDecimal totalRevenue
) {}
