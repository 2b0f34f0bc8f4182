package com.livemart.marketplace.outbox;

import com.mongodb.client.result.DeleteResult;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Removes outbox documents once they have been on the broker for longer than the retention window.
 * Age is measured from {@code published_at}, so an event that waited in the outbox during a broker
 * outage still gets the full window after it is sent. Unpublished events are never removed.
 */
@Component
public class OutboxCleanup {

    private static final Logger log = LoggerFactory.getLogger(OutboxCleanup.class);

    private final MongoTemplate mongoTemplate;
    private final MeterRegistry meterRegistry;
    private final Duration retention;

    public OutboxCleanup(MongoTemplate mongoTemplate,
                         MeterRegistry meterRegistry,
                         @Value("${marketplace.outbox.cleanup.retention-days:7}") long retentionDays) {
        this.mongoTemplate = mongoTemplate;
        this.meterRegistry = meterRegistry;
        this.retention = Duration.ofDays(retentionDays);
    }

    @Scheduled(fixedDelayString = "${marketplace.outbox.cleanup.interval-ms:3600000}")
    public void removeExpiredEvents() {
        Instant cutoff = Instant.now().minus(retention);
        Query expired = Query.query(Criteria.where("published").is(true).and("published_at").lt(cutoff));

        DeleteResult result = mongoTemplate.remove(expired, OutboxEvent.class);
        long removed = result.getDeletedCount();
        if (removed > 0) {
            meterRegistry.counter("outbox_removed_total").increment(removed);
            log.info("Removed {} outbox events published before {}", removed, cutoff);
        }
    }
}
