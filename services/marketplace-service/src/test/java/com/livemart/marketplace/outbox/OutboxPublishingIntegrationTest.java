package com.livemart.marketplace.outbox;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.boot.testcontainers.service.connection.ServiceConnection;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@SpringBootTest(properties = {
        "marketplace.outbox.publisher.enabled=true",
        "marketplace.outbox.publisher.interval-ms=100"
})
@Testcontainers(disabledWithoutDocker = true)
@ActiveProfiles("test")
class OutboxPublishingIntegrationTest {

    @Container
    @ServiceConnection
    static MongoDBContainer mongo = new MongoDBContainer("mongo:7.0");

    @MockBean
    private KafkaTemplate<String, String> kafkaTemplate;

    @Autowired
    private OutboxRepository outboxRepository;

    @Test
    void shouldPublishPendingEventAndMarkIt() {
        when(kafkaTemplate.send(anyString(), anyString(), anyString()))
                .thenReturn(CompletableFuture.completedFuture(null));
        String orderId = UUID.randomUUID().toString();
        OutboxEvent event = outboxRepository.save(new OutboxEvent("Order", orderId, "OrderCancelled", "{}"));

        await().atMost(10, TimeUnit.SECONDS).untilAsserted(() ->
                assertThat(outboxRepository.findById(event.getId()).orElseThrow().isPublished()).isTrue());
        verify(kafkaTemplate).send("order-events", orderId, "{}");
    }
}
