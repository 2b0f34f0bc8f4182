package com.livemart.marketplace.entity;

import org.springframework.data.mongodb.core.mapping.Field;
import org.springframework.data.mongodb.core.mapping.FieldType;

import java.math.BigDecimal;

/**
 * One priced line of an order. Name, price and seller are copied from the product when the order
 * is built, so later catalog edits do not change placed orders.
 */
public class OrderItem {

    @Field("product_id")
    private String productId;

    @Field("product_name")
    private String productName;

    private int quantity;

    @Field(name = "price", targetType = FieldType.DECIMAL128)
    private BigDecimal unitPrice;

    @Field(name = "total", targetType = FieldType.DECIMAL128)
    private BigDecimal subtotal;

    @Field("seller_id")
    private String sellerId;

    protected OrderItem() {}

    public OrderItem(String productId, String productName, int quantity, BigDecimal unitPrice, String sellerId) {
        this.productId = productId;
        this.productName = productName;
        this.quantity = quantity;
        this.unitPrice = unitPrice;
        this.subtotal = unitPrice.multiply(BigDecimal.valueOf(quantity));
        this.sellerId = sellerId;
    }

    public static OrderItem snapshotOf(Product product, int quantity) {
        return new OrderItem(product.getId(), product.getName(), quantity, product.getPrice(), product.getSellerId());
    }

    public String getProductId() { return productId; }
    public String getProductName() { return productName; }
    public int getQuantity() { return quantity; }
    public BigDecimal getUnitPrice() { return unitPrice; }
    public BigDecimal getSubtotal() { return subtotal; }
    public String getSellerId() { return sellerId; }
}
