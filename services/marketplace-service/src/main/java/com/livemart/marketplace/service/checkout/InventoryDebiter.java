package com.livemart.marketplace.service.checkout;

import com.livemart.marketplace.entity.Order;
import com.livemart.marketplace.entity.OrderItem;
import com.livemart.marketplace.exception.InsufficientStockException;
import com.livemart.marketplace.exception.PartialFulfillmentException;
import com.livemart.marketplace.repository.ProductRepository;
import com.livemart.marketplace.service.FulfillmentAlertService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Takes the ordered quantities out of stock, one guarded decrement per line.
 *
 * <p>If a guard rejects a line, the lines already debited for this order are put back and the
 * debit fails with {@link InsufficientStockException}. If the store fails on a line, the remaining
 * lines are still attempted and the debit ends with {@link PartialFulfillmentException}. A failed
 * decrement is never retried here: a timed-out {@code $inc} may already have been applied.
 */
@Component
public class InventoryDebiter {

    private static final Logger log = LoggerFactory.getLogger(InventoryDebiter.class);

    private final ProductRepository productRepository;
    private final FulfillmentAlertService fulfillmentAlertService;

    public InventoryDebiter(ProductRepository productRepository,
                            FulfillmentAlertService fulfillmentAlertService) {
        this.productRepository = productRepository;
        this.fulfillmentAlertService = fulfillmentAlertService;
    }

    public void debit(Order order) {
        List<OrderItem> debited = new ArrayList<>();
        List<String> failedProductIds = new ArrayList<>();
        DataAccessException lastFailure = null;

        for (OrderItem item : order.getItems()) {
            boolean applied;
            try {
                applied = productRepository.decrementStockIfAvailable(item.getProductId(), item.getQuantity());
            } catch (DataAccessException e) {
                log.error("Stock debit failed for product {} of order {}: {}",
                        item.getProductId(), order.getId(), e.getMessage());
                failedProductIds.add(item.getProductId());
                lastFailure = e;
                continue;
            }

            if (!applied) {
                log.warn("Stock debit rejected for product {} of order {}, restoring {} debited line(s)",
                        item.getProductId(), order.getId(), debited.size());
                restore(order, debited, failedProductIds);
                throw new InsufficientStockException(item.getProductId(), item.getProductName());
            }
            debited.add(item);
        }

        if (!failedProductIds.isEmpty()) {
            throw new PartialFulfillmentException(order.getId(), productIds(debited), failedProductIds, lastFailure);
        }
        log.info("Stock debited for order {} ({} line(s))", order.getId(), debited.size());
    }

    private void restore(Order order, List<OrderItem> debited, List<String> unknownProductIds) {
        List<String> restored = new ArrayList<>();
        List<String> notRestored = new ArrayList<>(unknownProductIds);

        for (OrderItem item : debited) {
            try {
                if (!productRepository.incrementStock(item.getProductId(), item.getQuantity())) {
                    log.warn("Product {} was deleted before its stock could be restored", item.getProductId());
                }
                restored.add(item.getProductId());
            } catch (DataAccessException e) {
                log.error("Stock restore failed for product {} of order {}: {}",
                        item.getProductId(), order.getId(), e.getMessage());
                notRestored.add(item.getProductId());
            }
        }

        if (!notRestored.isEmpty()) {
            fulfillmentAlertService.restockFailed(order, restored, notRestored);
        }
    }

    private static List<String> productIds(List<OrderItem> items) {
        return items.stream().map(OrderItem::getProductId).toList();
    }
}
