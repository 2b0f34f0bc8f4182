package com.livemart.marketplace.entity;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;
import org.springframework.data.mongodb.core.mapping.FieldType;

import java.math.BigDecimal;

@Document("products")
public class Product {

    @Id
    private String id;

    private String name;

    @Field("category_id")
    private String categoryId;

    @Field(targetType = FieldType.DECIMAL128)
    private BigDecimal price;

    private int stock;

    @Indexed
    @Field("seller_id")
    private String sellerId;

    private String description;

    @Field("image_url")
    private String imageUrl;

    private double rating;

    protected Product() {}

    public Product(String id, String name, String categoryId, BigDecimal price, int stock,
                   String sellerId, String description, String imageUrl, double rating) {
        this.id = id;
        this.name = name;
        this.categoryId = categoryId;
        this.price = price;
        this.stock = stock;
        this.sellerId = sellerId;
        this.description = description;
        this.imageUrl = imageUrl;
        this.rating = rating;
    }

    public boolean hasStockFor(long quantity) {
        return stock >= quantity;
    }

    public void rename(String name) { this.name = name; }
    public void moveToCategory(String categoryId) { this.categoryId = categoryId; }
    public void reprice(BigDecimal price) { this.price = price; }
    public void restock(int stock) { this.stock = stock; }
    public void assignSeller(String sellerId) { this.sellerId = sellerId; }
    public void describe(String description) { this.description = description; }
    public void changeImage(String imageUrl) { this.imageUrl = imageUrl; }
    public void rate(double rating) { this.rating = rating; }

    public String getId() { return id; }
    public String getName() { return name; }
    public String getCategoryId() { return categoryId; }
    public BigDecimal getPrice() { return price; }
    public int getStock() { return stock; }
    public String getSellerId() { return sellerId; }
    public String getDescription() { return description; }
    public String getImageUrl() { return imageUrl; }
    public double getRating() { return rating; }
}
