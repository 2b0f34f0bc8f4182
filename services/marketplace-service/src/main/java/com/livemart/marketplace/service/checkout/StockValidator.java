package com.livemart.marketplace.service.checkout;

import com.livemart.marketplace.entity.Product;
import com.livemart.marketplace.exception.InsufficientStockException;
import com.livemart.marketplace.exception.NotFoundException;
import com.livemart.marketplace.repository.ProductRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only stock check run before anything is written. Lines naming the same product are summed
 * as {@code long} so repeated large quantities cannot wrap around.
 */
@Component
public class StockValidator {

    private static final Logger log = LoggerFactory.getLogger(StockValidator.class);

    private final ProductRepository productRepository;

    public StockValidator(ProductRepository productRepository) {
        this.productRepository = productRepository;
    }

    public void validate(String userId, List<CheckoutLine> lines) {
        Map<String, Long> demand = new LinkedHashMap<>();
        for (CheckoutLine line : lines) {
            demand.merge(line.productId(), (long) line.quantity(), Long::sum);
        }

        for (Map.Entry<String, Long> entry : demand.entrySet()) {
            String productId = entry.getKey();
            Product product = productRepository.findById(productId)
                    .orElseThrow(() -> NotFoundException.product(productId));
            if (!product.hasStockFor(entry.getValue())) {
                log.info("User {} requested {} of product {} but only {} in stock",
                        userId, entry.getValue(), productId, product.getStock());
                throw new InsufficientStockException(product.getId(), product.getName());
            }
        }
    }
}
