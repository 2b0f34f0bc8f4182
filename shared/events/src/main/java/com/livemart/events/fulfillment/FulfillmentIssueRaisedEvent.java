package com.livemart.events.fulfillment;

import java.util.List;

/**
 * Raised when inventory no longer matches a persisted order and an operator has to reconcile it.
 */
public record FulfillmentIssueRaisedEvent(
        String issueId,
        String orderId,
        String kind,
        List<String> debitedProductIds,
        List<String> failedProductIds,
        String reason
) {}
