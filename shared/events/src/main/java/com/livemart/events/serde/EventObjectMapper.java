package com.livemart.events.serde;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.jsontype.NamedType;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.livemart.events.EventTypes;
import com.livemart.events.fulfillment.FulfillmentIssueRaisedEvent;
import com.livemart.events.order.OrderCancelledEvent;

public final class EventObjectMapper {

    private static final ObjectMapper INSTANCE;

    static {
        INSTANCE = new ObjectMapper();
        INSTANCE.registerModule(new JavaTimeModule());
        INSTANCE.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        INSTANCE.registerSubtypes(
                new NamedType(OrderCancelledEvent.class, EventTypes.ORDER_CANCELLED),
                new NamedType(FulfillmentIssueRaisedEvent.class, EventTypes.FULFILLMENT_ISSUE_RAISED)
        );
    }

    private EventObjectMapper() {}

    public static ObjectMapper instance() {
        return INSTANCE;
    }
}
