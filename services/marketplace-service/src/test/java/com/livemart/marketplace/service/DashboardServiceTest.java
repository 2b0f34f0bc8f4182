package com.livemart.marketplace.service;

import com.livemart.marketplace.dto.DashboardResponse;
import com.livemart.marketplace.entity.Order;
import com.livemart.marketplace.entity.OrderItem;
import com.livemart.marketplace.exception.BadRequestException;
import com.livemart.marketplace.repository.OrderRepository;
import com.livemart.marketplace.repository.ProductRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DashboardServiceTest {

    @Mock
    private ProductRepository productRepository;
    @Mock
    private OrderRepository orderRepository;

    private DashboardService dashboardService;

    @BeforeEach
    void setUp() {
        dashboardService = new DashboardService(productRepository, orderRepository);
    }

    @Test
    void shouldCountOnlyTheSellersLinesAsRevenue() {
        Order mixed = new Order("o1", "buyer", List.of(
                new OrderItem("p1", "Rice", 2, new BigDecimal("70"), "seller-a"),
                new OrderItem("p2", "Lentils", 1, new BigDecimal("40"), "seller-b")),
                new BigDecimal("180"), "addr", "online", Instant.now());
        Order single = new Order("o2", "buyer", List.of(
                new OrderItem("p1", "Rice", 1, new BigDecimal("70"), "seller-a")),
                new BigDecimal("70"), "addr", "online", Instant.now());
        when(productRepository.countBySellerId("seller-a")).thenReturn(3L);
        when(orderRepository.findActiveOrdersContainingSeller("seller-a")).thenReturn(List.of(mixed, single));

        DashboardResponse summary = dashboardService.summarize("seller-a");

        assertThat(summary.productsCount()).isEqualTo(3);
        assertThat(summary.ordersCount()).isEqualTo(2);
        assertThat(summary.totalRevenue()).isEqualByComparingTo("210");
    }

    @Test
    void shouldRequireSellerId() {
        assertThatThrownBy(() -> dashboardService.summarize(" ")).isInstanceOf(BadRequestException.class);
        verifyNoInteractions(productRepository, orderRepository);
    }
}
