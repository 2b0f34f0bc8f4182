package com.livemart.events;

public final class EventTypes {
    private EventTypes() {}

    public static final String ORDER_CANCELLED = "OrderCancelled";

    public static final String FULFILLMENT_ISSUE_RAISED = "FulfillmentIssueRaised";
}
