package com.livemart.marketplace.service.checkout;

import com.livemart.marketplace.repository.CartRepository;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Last checkout step. The order already exists, so a failure here only yields a warning.
 */
@Component
public class CartClearer {

    private static final Logger log = LoggerFactory.getLogger(CartClearer.class);

    private final CartRepository cartRepository;
    private final MeterRegistry meterRegistry;

    public CartClearer(CartRepository cartRepository, MeterRegistry meterRegistry) {
        this.cartRepository = cartRepository;
        this.meterRegistry = meterRegistry;
    }

    public Optional<CheckoutWarning> clear(String userId) {
        try {
            long deleted = cartRepository.deleteByUserId(userId);
            log.debug("Cleared cart for user {} ({} document(s))", userId, deleted);
            return Optional.empty();
        } catch (DataAccessException e) {
            meterRegistry.counter("cart_clear_failures_total").increment();
            log.warn("Order placed but cart for user {} was not cleared: {}", userId, e.getMessage());
            return Optional.of(CheckoutWarning.cartNotCleared());
        }
    }
}
