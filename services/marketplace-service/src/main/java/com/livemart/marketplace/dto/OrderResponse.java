package com.livemart.marketplace.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.livemart.marketplace.entity.Order;
import com.livemart.marketplace.entity.OrderItem;
import com.livemart.marketplace.entity.OrderStatus;
import com.livemart.marketplace.entity.PaymentStatus;
import com.livemart.marketplace.service.checkout.CheckoutWarning;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

public record OrderResponse(
        String id,
        String userId,
        List<ItemResponse> items,
        BigDecimal totalAmount,
        String deliveryAddress,
        String paymentMethod,
        PaymentStatus paymentStatus,
        OrderStatus orderStatus,
        Instant createdAt,
        @JsonInclude(JsonInclude.Include.NON_EMPTY) List<CheckoutWarning> warnings
) {
    public static OrderResponse from(Order order) {
        return from(order, List.of());
    }

    public static OrderResponse from(Order order, List<CheckoutWarning> warnings) {
        List<ItemResponse> items = order.getItems().stream()
                .map(ItemResponse::from)
                .toList();
        return new OrderResponse(
                order.getId(),
                order.getUserId(),
                items,
                order.getTotalAmount(),
                order.getDeliveryAddress(),
                order.getPaymentMethod(),
                order.getPaymentStatus(),
                order.getOrderStatus(),
                order.getCreatedAt(),
                List.copyOf(warnings)
        );
    }

    public record ItemResponse(
            String productId,
            String productName,
            int quantity,
            BigDecimal price,
            BigDecimal total,
            String sellerId
    ) {
        public static ItemResponse from(OrderItem item) {
            return new ItemResponse(item.getProductId(), item.getProductName(), item.getQuantity(),
                    item.getUnitPrice(), item.getSubtotal(), item.getSellerId());
        }
    }
}
