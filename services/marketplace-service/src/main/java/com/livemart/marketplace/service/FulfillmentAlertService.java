package com.livemart.marketplace.service;

import com.livemart.events.EventEnvelope;
import com.livemart.events.EventTypes;
import com.livemart.events.fulfillment.FulfillmentIssueRaisedEvent;
import com.livemart.marketplace.entity.FulfillmentIssue;
import com.livemart.marketplace.entity.FulfillmentIssueKind;
import com.livemart.marketplace.entity.Order;
import com.livemart.marketplace.exception.PartialFulfillmentException;
import com.livemart.marketplace.outbox.OutboxWriter;
import com.livemart.marketplace.repository.FulfillmentIssueRepository;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Records orders whose stock bookkeeping went wrong after they were written.
 *
 * <p>Every alert is logged at ERROR and counted first, then stored as a {@link FulfillmentIssue}
 * and queued as a {@code FulfillmentIssueRaised} event. Raising an alert never fails the caller:
 * the log line and the counter are the fallback when the store is the thing that is down.
 */
@Service
public class FulfillmentAlertService {

    private static final Logger log = LoggerFactory.getLogger(FulfillmentAlertService.class);

    private final FulfillmentIssueRepository issueRepository;
    private final OutboxWriter outboxWriter;
    private final MeterRegistry meterRegistry;

    public FulfillmentAlertService(FulfillmentIssueRepository issueRepository,
                                   OutboxWriter outboxWriter,
                                   MeterRegistry meterRegistry) {
        this.issueRepository = issueRepository;
        this.outboxWriter = outboxWriter;
        this.meterRegistry = meterRegistry;
    }

    public void debitIncomplete(Order order, PartialFulfillmentException e) {
        raise(new FulfillmentIssue(order.getId(), FulfillmentIssueKind.DEBIT_INCOMPLETE,
                e.getDebitedProductIds(), e.getFailedProductIds(), e.getReason()));
    }

    public void restockFailed(Order order, List<String> restoredProductIds, List<String> failedProductIds) {
        raise(new FulfillmentIssue(order.getId(), FulfillmentIssueKind.RESTOCK_FAILED,
                restoredProductIds, failedProductIds,
                "Stock was debited for a rejected order and could not be restored"));
    }

    public void cancelFailed(Order order, String reason) {
        List<String> productIds = order.getItems().stream().map(item -> item.getProductId()).toList();
        raise(new FulfillmentIssue(order.getId(), FulfillmentIssueKind.CANCEL_FAILED,
                List.of(), productIds, reason));
    }

    private void raise(FulfillmentIssue issue) {
        meterRegistry.counter("fulfillment_issues_total", "kind", issue.getKind().value()).increment();
        log.error("Fulfillment issue for order {}: kind={}, debited={}, failed={}, reason={}",
                issue.getOrderId(), issue.getKind().value(), issue.getDebitedProductIds(),
                issue.getFailedProductIds(), issue.getReason());

        try {
            issueRepository.save(issue);
            FulfillmentIssueRaisedEvent event = new FulfillmentIssueRaisedEvent(
                    issue.getId(), issue.getOrderId(), issue.getKind().value(),
                    issue.getDebitedProductIds(), issue.getFailedProductIds(), issue.getReason());
            outboxWriter.write("FulfillmentIssue", issue.getId(),
                    EventEnvelope.wrap(EventTypes.FULFILLMENT_ISSUE_RAISED, event, issue.getOrderId()));
        } catch (RuntimeException e) {
            log.error("Could not record fulfillment issue {} for order {}", issue.getId(), issue.getOrderId(), e);
        }
    }
}
