package com.livemart.marketplace.service.checkout;

import com.livemart.marketplace.entity.OrderItem;
import com.livemart.marketplace.entity.Product;
import com.livemart.marketplace.exception.NotFoundException;
import com.livemart.marketplace.repository.ProductRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OrderBuilderTest {

    @Mock
    private ProductRepository productRepository;

    private OrderBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new OrderBuilder(productRepository);
    }

    @Test
    void shouldPriceLinesFromCurrentProductsAndSumTotal() {
        when(productRepository.findById("p1")).thenReturn(Optional.of(
                new Product("p1", "Rice 5kg", "grains", new BigDecimal("70"), 10, "seller-a", null, null, 0)));
        when(productRepository.findById("p2")).thenReturn(Optional.of(
                new Product("p2", "Lentils", "grains", new BigDecimal("40"), 10, "seller-b", null, null, 0)));

        OrderDraft draft = builder.build("user-1",
                List.of(new CheckoutLine("p1", 2), new CheckoutLine("p2", 1)), "12 Main St", "cod");

        assertThat(draft.items()).hasSize(2);
        OrderItem first = draft.items().get(0);
        assertThat(first.getProductName()).isEqualTo("Rice 5kg");
        assertThat(first.getUnitPrice()).isEqualByComparingTo("70");
        assertThat(first.getSubtotal()).isEqualByComparingTo("140");
        assertThat(first.getSellerId()).isEqualTo("seller-a");
        assertThat(draft.totalAmount()).isEqualByComparingTo("180");
        assertThat(draft.items().stream().map(OrderItem::getSubtotal).reduce(BigDecimal.ZERO, BigDecimal::add))
                .isEqualByComparingTo(draft.totalAmount());
        assertThat(draft.deliveryAddress()).isEqualTo("12 Main St");
        assertThat(draft.paymentMethod()).isEqualTo("cod");
    }

    @Test
    void shouldFailWhenProductVanishedSinceValidation() {
        when(productRepository.findById("p1")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> builder.build("user-1", List.of(new CheckoutLine("p1", 1)), "addr", null))
                .isInstanceOf(NotFoundException.class);
    }
}
