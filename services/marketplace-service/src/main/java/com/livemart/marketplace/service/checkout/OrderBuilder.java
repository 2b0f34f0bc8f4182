package com.livemart.marketplace.service.checkout;

import com.livemart.marketplace.entity.OrderItem;
import com.livemart.marketplace.entity.Product;
import com.livemart.marketplace.exception.NotFoundException;
import com.livemart.marketplace.repository.ProductRepository;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Prices each line from a fresh read of the product. The name and price captured here are the ones
 * the order keeps.
 */
@Component
public class OrderBuilder {

    private final ProductRepository productRepository;

    public OrderBuilder(ProductRepository productRepository) {
        this.productRepository = productRepository;
    }

    public OrderDraft build(String userId, List<CheckoutLine> lines, String deliveryAddress, String paymentMethod) {
        List<OrderItem> items = new ArrayList<>(lines.size());
        BigDecimal totalAmount = BigDecimal.ZERO;

        for (CheckoutLine line : lines) {
            // may have been deleted since validation
            Product product = productRepository.findById(line.productId())
                    .orElseThrow(() -> NotFoundException.product(line.productId()));
            OrderItem item = OrderItem.snapshotOf(product, line.quantity());
            items.add(item);
            totalAmount = totalAmount.add(item.getSubtotal());
        }

        return new OrderDraft(userId, items, totalAmount, deliveryAddress, paymentMethod);
    }
}
