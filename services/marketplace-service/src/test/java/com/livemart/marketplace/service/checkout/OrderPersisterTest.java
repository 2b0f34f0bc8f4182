package com.livemart.marketplace.service.checkout;

import com.livemart.marketplace.entity.Order;
import com.livemart.marketplace.entity.OrderItem;
import com.livemart.marketplace.entity.OrderStatus;
import com.livemart.marketplace.entity.PaymentStatus;
import com.livemart.marketplace.exception.BadRequestException;
import com.livemart.marketplace.exception.ConflictException;
import com.livemart.marketplace.repository.OrderRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DuplicateKeyException;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OrderPersisterTest {

    @Mock
    private OrderRepository orderRepository;

    private OrderPersister persister;

    @BeforeEach
    void setUp() {
        persister = new OrderPersister(orderRepository, "online");
    }

    @Test
    void shouldInsertPlacedOrderWithPendingPayment() {
        when(orderRepository.insert(any(Order.class))).thenAnswer(invocation -> invocation.getArgument(0));

        Order order = persister.persist(draft("12 Main St", "cod"));

        ArgumentCaptor<Order> captor = ArgumentCaptor.forClass(Order.class);
        verify(orderRepository).insert(captor.capture());
        assertThat(captor.getValue()).isSameAs(order);
        assertThat(UUID.fromString(order.getId())).isNotNull();
        assertThat(order.getOrderStatus()).isEqualTo(OrderStatus.PLACED);
        assertThat(order.getPaymentStatus()).isEqualTo(PaymentStatus.PENDING);
        assertThat(order.getPaymentMethod()).isEqualTo("cod");
        assertThat(order.getCreatedAt()).isNotNull();
        assertThat(order.getTotalAmount()).isEqualByComparingTo("20.00");
    }

    @Test
    void shouldDefaultPaymentMethodWhenAbsent() {
        when(orderRepository.insert(any(Order.class))).thenAnswer(invocation -> invocation.getArgument(0));

        assertThat(persister.persist(draft("12 Main St", null)).getPaymentMethod()).isEqualTo("online");
        assertThat(persister.persist(draft("12 Main St", " ")).getPaymentMethod()).isEqualTo("online");
    }

    @Test
    void shouldRejectBlankAddressWithoutWriting() {
        assertThatThrownBy(() -> persister.persist(draft("  ", "cod")))
                .isInstanceOf(BadRequestException.class);
        verify(orderRepository, never()).insert(any(Order.class));
    }

    @Test
    void shouldReportDuplicateIdentifierAsConflict() {
        when(orderRepository.insert(any(Order.class))).thenThrow(new DuplicateKeyException("E11000"));

        assertThatThrownBy(() -> persister.persist(draft("12 Main St", "cod")))
                .isInstanceOf(ConflictException.class);
    }

    private static OrderDraft draft(String address, String paymentMethod) {
        OrderItem item = new OrderItem("p1", "Bread", 2, new BigDecimal("10.00"), "seller-1");
        return new OrderDraft("user-1", List.of(item), new BigDecimal("20.00"), address, paymentMethod);
    }
}
