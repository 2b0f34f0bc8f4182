package com.livemart.marketplace.service.checkout;

import com.livemart.marketplace.repository.CartRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CartClearerTest {

    @Mock
    private CartRepository cartRepository;

    private SimpleMeterRegistry meterRegistry;
    private CartClearer clearer;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        clearer = new CartClearer(cartRepository, meterRegistry);
    }

    @Test
    void shouldReturnNoWarningWhenCartDeleted() {
        when(cartRepository.deleteByUserId("user-1")).thenReturn(1L);

        assertThat(clearer.clear("user-1")).isEmpty();
        assertThat(meterRegistry.find("cart_clear_failures_total").counter()).isNull();
    }

    @Test
    void shouldTurnStoreFailureIntoWarning() {
        when(cartRepository.deleteByUserId("user-1")).thenThrow(new DataAccessResourceFailureException("down"));

        assertThat(clearer.clear("user-1"))
                .hasValueSatisfying(warning -> assertThat(warning.code()).isEqualTo(CheckoutWarning.CART_NOT_CLEARED));
        assertThat(meterRegistry.counter("cart_clear_failures_total").count()).isEqualTo(1.0);
    }
}
