package com.livemart.marketplace.entity;

import org.springframework.data.mongodb.core.mapping.Field;

public class CartItem {

    @Field("product_id")
    private String productId;

    private int quantity;

    protected CartItem() {}

    public CartItem(String productId, int quantity) {
        this.productId = productId;
        this.quantity = quantity;
    }

    void increaseBy(int amount) {
        this.quantity += amount;
    }

    void changeTo(int quantity) {
        this.quantity = quantity;
    }

    public String getProductId() { return productId; }
    public int getQuantity() { return quantity; }
}
