package com.livemart.marketplace.service;

import com.livemart.marketplace.entity.Order;
import com.livemart.marketplace.exception.NotFoundException;
import com.livemart.marketplace.repository.OrderRepository;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class OrderService {

    private final OrderRepository orderRepository;

    public OrderService(OrderRepository orderRepository) {
        this.orderRepository = orderRepository;
    }

    public List<Order> listForUser(String userId) {
        return orderRepository.findByUserIdOrderByCreatedAtDesc(userId);
    }

    public Order get(String orderId) {
        return orderRepository.findById(orderId)
                .orElseThrow(() -> NotFoundException.order(orderId));
    }
}
