package com.livemart.marketplace.entity;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Operator-facing record of an order whose inventory bookkeeping did not complete.
 */
@Document("fulfillment_issues")
public class FulfillmentIssue {

    @Id
    private String id;

    @Indexed
    @Field("order_id")
    private String orderId;

    private FulfillmentIssueKind kind;

    @Field("debited_product_ids")
    private List<String> debitedProductIds;

    @Field("failed_product_ids")
    private List<String> failedProductIds;

    private String reason;

    @Field("created_at")
    private Instant createdAt;

    private boolean resolved;

    protected FulfillmentIssue() {}

    public FulfillmentIssue(String orderId, FulfillmentIssueKind kind, List<String> debitedProductIds,
                            List<String> failedProductIds, String reason) {
        this.id = UUID.randomUUID().toString();
        this.orderId = orderId;
        this.kind = kind;
        this.debitedProductIds = List.copyOf(debitedProductIds);
        this.failedProductIds = List.copyOf(failedProductIds);
        this.reason = reason;
        this.createdAt = Instant.now();
        this.resolved = false;
    }

    public String getId() { return id; }
    public String getOrderId() { return orderId; }
    public FulfillmentIssueKind getKind() { return kind; }
    public List<String> getDebitedProductIds() { return debitedProductIds; }
    public List<String> getFailedProductIds() { return failedProductIds; }
    public String getReason() { return reason; }
    public Instant getCreatedAt() { return createdAt; }
    public boolean isResolved() { return resolved; }
}
