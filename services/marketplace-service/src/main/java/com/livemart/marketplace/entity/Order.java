package com.livemart.marketplace.entity;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;
import org.springframework.data.mongodb.core.mapping.FieldType;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Document("orders")
public class Order {

    @Id
    private String id;

    @Indexed
    @Field("user_id")
    private String userId;

    private List<OrderItem> items = new ArrayList<>();

    @Field(name = "total_amount", targetType = FieldType.DECIMAL128)
    private BigDecimal totalAmount;

    @Field("delivery_address")
    private String deliveryAddress;

    @Field("payment_method")
    private String paymentMethod;

    @Field("payment_status")
    private PaymentStatus paymentStatus;

    @Field("order_status")
    private OrderStatus orderStatus;

    @Field("created_at")
    private Instant createdAt;

    protected Order() {}

    public Order(String id, String userId, List<OrderItem> items, BigDecimal totalAmount,
                 String deliveryAddress, String paymentMethod, Instant createdAt) {
        this.id = id;
        this.userId = userId;
        this.items = new ArrayList<>(items);
        this.totalAmount = totalAmount;
        this.deliveryAddress = deliveryAddress;
        this.paymentMethod = paymentMethod;
        this.paymentStatus = PaymentStatus.PENDING;
        this.orderStatus = OrderStatus.PLACED;
        this.createdAt = createdAt;
    }

    public boolean cancel() {
        if (!orderStatus.canTransitionTo(OrderStatus.CANCELLED)) {
            return false;
        }
        this.orderStatus = OrderStatus.CANCELLED;
        this.paymentStatus = PaymentStatus.FAILED;
        return true;
    }

    public String getId() { return id; }
    public String getUserId() { return userId; }
    public List<OrderItem> getItems() { return items; }
    public BigDecimal getTotalAmount() { return totalAmount; }
    public String getDeliveryAddress() { return deliveryAddress; }
    public String getPaymentMethod() { return paymentMethod; }
    public PaymentStatus getPaymentStatus() { return paymentStatus; }
    public OrderStatus getOrderStatus() { return orderStatus; }
    public Instant getCreatedAt() { return createdAt; }
}
