package com.livemart.marketplace.service.checkout;

import com.livemart.marketplace.entity.Order;
import com.livemart.marketplace.exception.BadRequestException;
import com.livemart.marketplace.exception.ConflictException;
import com.livemart.marketplace.repository.OrderRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.UUID;

@Component
public class OrderPersister {

    private static final Logger log = LoggerFactory.getLogger(OrderPersister.class);

    private final OrderRepository orderRepository;
    private final String defaultPaymentMethod;

    public OrderPersister(OrderRepository orderRepository,
                          @Value("${marketplace.checkout.default-payment-method:online}") String defaultPaymentMethod) {
        this.orderRepository = orderRepository;
        this.defaultPaymentMethod = defaultPaymentMethod;
    }

    public Order persist(OrderDraft draft) {
        if (draft.deliveryAddress() == null || draft.deliveryAddress().isBlank()) {
            throw new BadRequestException("Delivery address required");
        }
        String paymentMethod = draft.paymentMethod() == null || draft.paymentMethod().isBlank()
                ? defaultPaymentMethod
                : draft.paymentMethod().trim();

        Order order = new Order(
                UUID.randomUUID().toString(),
                draft.userId(),
                draft.items(),
                draft.totalAmount(),
                draft.deliveryAddress().trim(),
                paymentMethod,
                Instant.now());

        try {
            Order saved = orderRepository.insert(order);
            log.info("Order persisted: id={}, user={}, total={}", saved.getId(), saved.getUserId(), saved.getTotalAmount());
            return saved;
        } catch (DuplicateKeyException e) {
            throw new ConflictException("Order identifier already exists: " + order.getId(), e);
        }
    }
}
