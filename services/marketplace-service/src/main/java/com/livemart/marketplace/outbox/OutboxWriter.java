package com.livemart.marketplace.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.livemart.events.EventEnvelope;
import com.livemart.events.serde.EventObjectMapper;
import org.springframework.stereotype.Component;

/**
 * Serializes an envelope and stores it for {@link OutboxPublisher} to pick up.
 */
@Component
public class OutboxWriter {

    private final OutboxRepository outboxRepository;

    public OutboxWriter(OutboxRepository outboxRepository) {
        this.outboxRepository = outboxRepository;
    }

    public OutboxEvent write(String aggregateType, String aggregateId, EventEnvelope<?> envelope) {
        try {
            String payload = EventObjectMapper.instance().writeValueAsString(envelope);
            return outboxRepository.save(new OutboxEvent(aggregateType, aggregateId, envelope.eventType(), payload));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize event for outbox", e);
        }
    }
}
