package com.livemart.marketplace.outbox;

import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

@Component
@ConditionalOnProperty(name = "marketplace.outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
public class OutboxPublisher {

    private static final Logger log = LoggerFactory.getLogger(OutboxPublisher.class);

    static final String DEFAULT_TOPIC = "order-events";

    private static final Map<String, String> AGGREGATE_TO_TOPIC = Map.of(
            "Order", "order-events",
            "FulfillmentIssue", "fulfillment-alerts"
    );

    private final OutboxRepository outboxRepository;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final MeterRegistry meterRegistry;

    public OutboxPublisher(OutboxRepository outboxRepository,
                           KafkaTemplate<String, String> kafkaTemplate,
                           MeterRegistry meterRegistry) {
        this.outboxRepository = outboxRepository;
        this.kafkaTemplate = kafkaTemplate;
        this.meterRegistry = meterRegistry;
    }

    @Scheduled(fixedDelayString = "${marketplace.outbox.publisher.interval-ms:500}")
    public void publishPendingEvents() {
        List<OutboxEvent> events = outboxRepository.findTop100ByPublishedFalseOrderByCreatedAtAsc();
        for (OutboxEvent event : events) {
            try {
                publishSingleEvent(event);
            } catch (Exception e) {
                log.error("Failed to publish outbox event {}: {}", event.getId(), e.getMessage());
                break;
            }
        }
    }

    void publishSingleEvent(OutboxEvent event) {
        String topic = AGGREGATE_TO_TOPIC.getOrDefault(event.getAggregateType(), DEFAULT_TOPIC);
        try {
            kafkaTemplate.send(topic, event.getAggregateId(), event.getPayload()).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while publishing event " + event.getId(), e);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to publish event " + event.getId(), e);
        }
        event.markPublished();
        outboxRepository.save(event);
        meterRegistry.counter("outbox_published_total").increment();
        log.info("Published outbox event {} of type {} to topic {}",
                event.getId(), event.getEventType(), topic);
    }
}
