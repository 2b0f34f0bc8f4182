package com.livemart.marketplace.service;

import com.livemart.events.EventEnvelope;
import com.livemart.events.EventTypes;
import com.livemart.events.OrderLineItem;
import com.livemart.events.order.OrderCancelledEvent;
import com.livemart.marketplace.dto.CheckoutItemRequest;
import com.livemart.marketplace.dto.CheckoutRequest;
import com.livemart.marketplace.entity.Order;
import com.livemart.marketplace.exception.BadRequestException;
import com.livemart.marketplace.exception.InsufficientStockException;
import com.livemart.marketplace.exception.MarketplaceException;
import com.livemart.marketplace.exception.NotFoundException;
import com.livemart.marketplace.exception.PartialFulfillmentException;
import com.livemart.marketplace.exception.StoreUnavailableException;
import com.livemart.marketplace.outbox.OutboxWriter;
import com.livemart.marketplace.repository.OrderRepository;
import com.livemart.marketplace.repository.UserRepository;
import com.livemart.marketplace.service.checkout.CartClearer;
import com.livemart.marketplace.service.checkout.CheckoutLine;
import com.livemart.marketplace.service.checkout.CheckoutResult;
import com.livemart.marketplace.service.checkout.CheckoutState;
import com.livemart.marketplace.service.checkout.CheckoutWarning;
import com.livemart.marketplace.service.checkout.InventoryDebiter;
import com.livemart.marketplace.service.checkout.OrderBuilder;
import com.livemart.marketplace.service.checkout.OrderDraft;
import com.livemart.marketplace.service.checkout.OrderPersister;
import com.livemart.marketplace.service.checkout.StockValidator;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Runs a checkout: validate, build, persist, debit stock, clear the cart.
 *
 * <p>Anything that fails before the order is persisted aborts the checkout with no writes. After
 * that the order is always returned, except when a guarded debit is rejected: the order is then
 * cancelled and the caller gets {@link InsufficientStockException}.
 */
@Service
public class CheckoutService {

    private static final Logger log = LoggerFactory.getLogger(CheckoutService.class);

    private final UserRepository userRepository;
    private final OrderRepository orderRepository;
    private final StockValidator stockValidator;
    private final OrderBuilder orderBuilder;
    private final OrderPersister orderPersister;
    private final InventoryDebiter inventoryDebiter;
    private final CartClearer cartClearer;
    private final FulfillmentAlertService fulfillmentAlertService;
    private final OutboxWriter outboxWriter;
    private final MeterRegistry meterRegistry;

    public CheckoutService(UserRepository userRepository,
                           OrderRepository orderRepository,
                           StockValidator stockValidator,
                           OrderBuilder orderBuilder,
                           OrderPersister orderPersister,
                           InventoryDebiter inventoryDebiter,
                           CartClearer cartClearer,
                           FulfillmentAlertService fulfillmentAlertService,
                           OutboxWriter outboxWriter,
                           MeterRegistry meterRegistry) {
        this.userRepository = userRepository;
        this.orderRepository = orderRepository;
        this.stockValidator = stockValidator;
        this.orderBuilder = orderBuilder;
        this.orderPersister = orderPersister;
        this.inventoryDebiter = inventoryDebiter;
        this.cartClearer = cartClearer;
        this.fulfillmentAlertService = fulfillmentAlertService;
        this.outboxWriter = outboxWriter;
        this.meterRegistry = meterRegistry;
    }

    public CheckoutResult placeOrder(String userId, CheckoutRequest request) {
        CheckoutState state = CheckoutState.VALIDATING;
        Order order;
        try {
            List<CheckoutLine> lines = linesOf(request);
            if (!userRepository.existsById(userId)) {
                throw NotFoundException.user(userId);
            }
            stockValidator.validate(userId, lines);

            state = advance(userId, state, CheckoutState.BUILDING);
            OrderDraft draft = orderBuilder.build(userId, lines, request.deliveryAddress(), request.paymentMethod());

            state = advance(userId, state, CheckoutState.PERSISTING);
            order = orderPersister.persist(draft);
        } catch (MarketplaceException e) {
            throw reject(userId, state, e);
        } catch (DataAccessResourceFailureException | TransientDataAccessException e) {
            throw reject(userId, state, new StoreUnavailableException("Store unavailable during checkout", e));
        }

        List<CheckoutWarning> warnings = new ArrayList<>();
        state = advance(userId, state, CheckoutState.DEBITING);
        try {
            inventoryDebiter.debit(order);
        } catch (InsufficientStockException e) {
            cancelRejectedOrder(order, e);
            throw reject(userId, state, e);
        } catch (PartialFulfillmentException e) {
            meterRegistry.counter("checkout_partial_fulfillment_total").increment();
            fulfillmentAlertService.debitIncomplete(order, e);
            warnings.add(CheckoutWarning.partialFulfillment(e));
        }

        state = advance(userId, state, CheckoutState.CLEARING_CART);
        cartClearer.clear(userId).ifPresent(warnings::add);

        advance(userId, state, CheckoutState.COMPLETED);
        meterRegistry.counter("orders_placed_total").increment();
        log.info("Order placed: id={}, user={}, total={}, warnings={}",
                order.getId(), userId, order.getTotalAmount(), warnings.size());
        return new CheckoutResult(order, warnings);
    }

    private static List<CheckoutLine> linesOf(CheckoutRequest request) {
        if (request.items() == null || request.items().isEmpty()) {
            throw new BadRequestException("Order must contain at least one item");
        }
        if (request.deliveryAddress() == null || request.deliveryAddress().isBlank()) {
            throw new BadRequestException("Delivery address required");
        }
        List<CheckoutLine> lines = new ArrayList<>(request.items().size());
        for (CheckoutItemRequest item : request.items()) {
            if (item == null || item.productId() == null || item.productId().isBlank()) {
                throw new BadRequestException("Every item needs a product_id");
            }
            if (item.quantity() < 1) {
                throw new BadRequestException("Quantity must be positive for product " + item.productId());
            }
            lines.add(new CheckoutLine(item.productId(), item.quantity()));
        }
        return lines;
    }

    private void cancelRejectedOrder(Order order, InsufficientStockException cause) {
        String reason = "Insufficient stock for product " + cause.getProductId();
        try {
            if (!order.cancel()) {
                log.warn("Order {} cannot be cancelled from status {}", order.getId(), order.getOrderStatus());
                return;
            }
            orderRepository.save(order);

            List<OrderLineItem> lineItems = order.getItems().stream()
                    .map(item -> new OrderLineItem(item.getProductId(), item.getProductName(),
                            item.getQuantity(), item.getUnitPrice(), item.getSellerId()))
                    .toList();
            OrderCancelledEvent event = new OrderCancelledEvent(
                    order.getId(), order.getUserId(), lineItems, order.getTotalAmount(), reason);
            outboxWriter.write("Order", order.getId(),
                    EventEnvelope.wrap(EventTypes.ORDER_CANCELLED, event, order.getId()));

            meterRegistry.counter("orders_cancelled_total").increment();
            log.info("Order {} cancelled: {}", order.getId(), reason);
        } catch (DataAccessException e) {
            fulfillmentAlertService.cancelFailed(order, reason + "; cancellation failed: " + e.getMessage());
        }
    }

    private MarketplaceException reject(String userId, CheckoutState state, MarketplaceException e) {
        meterRegistry.counter("checkout_rejected_total", "reason", e.getCode().toLowerCase(Locale.ROOT)).increment();
        log.info("Checkout for user {} failed in {}: {} {}", userId, state, e.getCode(), e.getReason());
        advance(userId, state, CheckoutState.FAILED);
        return e;
    }

    private static CheckoutState advance(String userId, CheckoutState from, CheckoutState to) {
        log.debug("Checkout for user {}: {} -> {}", userId, from, to);
        return to;
    }
}
