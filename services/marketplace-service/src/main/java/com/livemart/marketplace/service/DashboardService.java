package com.livemart.marketplace.service;

import com.livemart.marketplace.dto.DashboardResponse;
import com.livemart.marketplace.entity.Order;
import com.livemart.marketplace.exception.BadRequestException;
import com.livemart.marketplace.repository.OrderRepository;
import com.livemart.marketplace.repository.ProductRepository;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;

/**
 * Seller summary shared by the retailer and wholesaler dashboards. Revenue counts only the lines a
 * seller supplied, and cancelled orders are left out.
 */
@Service
public class DashboardService {

    private final ProductRepository productRepository;
    private final OrderRepository orderRepository;

    public DashboardService(ProductRepository productRepository, OrderRepository orderRepository) {
        this.productRepository = productRepository;
        this.orderRepository = orderRepository;
    }

    public DashboardResponse summarize(String sellerId) {
        if (sellerId == null || sellerId.isBlank()) {
            throw new BadRequestException("user_id is required");
        }

        long productsCount = productRepository.countBySellerId(sellerId);
        List<Order> orders = orderRepository.findActiveOrdersContainingSeller(sellerId);
        BigDecimal revenue = orders.stream()
                .flatMap(order -> order.getItems().stream())
                .filter(item -> sellerId.equals(item.getSellerId()))
                .map(item -> item.getSubtotal())
                .reduce(BigDecimal.ZERO, BigDecimal::add);

        return new DashboardResponse(productsCount, orders.size(), revenue);
    }
}
