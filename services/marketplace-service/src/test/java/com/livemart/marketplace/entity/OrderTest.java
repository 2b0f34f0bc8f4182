package com.livemart.marketplace.entity;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class OrderTest {

    @Test
    void shouldCancelPlacedOrderOnce() {
        Order order = new Order("o1", "user-1",
                List.of(new OrderItem("p1", "Rice", 3, new BigDecimal("12.50"), "seller-a")),
                new BigDecimal("37.50"), "addr", "online", Instant.now());

        assertThat(order.getOrderStatus()).isEqualTo(OrderStatus.PLACED);
        assertThat(order.getPaymentStatus()).isEqualTo(PaymentStatus.PENDING);
        assertThat(order.cancel()).isTrue();
        assertThat(order.getOrderStatus()).isEqualTo(OrderStatus.CANCELLED);
        assertThat(order.getPaymentStatus()).isEqualTo(PaymentStatus.FAILED);
        assertThat(order.cancel()).isFalse();
    }

    @Test
    void shouldComputeLineTotalFromPriceAndQuantity() {
        OrderItem item = new OrderItem("p1", "Rice", 3, new BigDecimal("12.50"), "seller-a");

        assertThat(item.getSubtotal()).isEqualByComparingTo("37.50");
    }

    @Test
    void shouldNotLeaveCancelledState() {
        assertThat(OrderStatus.CANCELLED.canTransitionTo(OrderStatus.PLACED)).isFalse();
        assertThat(OrderStatus.PLACED.canTransitionTo(OrderStatus.CANCELLED)).isTrue();
    }
}
