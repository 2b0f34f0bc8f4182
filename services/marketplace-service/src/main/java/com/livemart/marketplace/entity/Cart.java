package com.livemart.marketplace.entity;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A user's shopping cart. Exactly one per user, enforced by the unique index on {@code user_id}.
 */
@Document("cart")
public class Cart {

    @Id
    private String id;

    @Indexed(unique = true)
    @Field("user_id")
    private String userId;

    private List<CartItem> items = new ArrayList<>();

    protected Cart() {}

    public Cart(String userId) {
        this.userId = userId;
    }

    public void addItem(String productId, int quantity) {
        findItem(productId).ifPresentOrElse(
                item -> item.increaseBy(quantity),
                () -> items.add(new CartItem(productId, quantity)));
    }

    public boolean updateQuantity(String productId, int quantity) {
        Optional<CartItem> item = findItem(productId);
        item.ifPresent(it -> it.changeTo(quantity));
        return item.isPresent();
    }

    public boolean removeItem(String productId) {
        return items.removeIf(item -> item.getProductId().equals(productId));
    }

    private Optional<CartItem> findItem(String productId) {
        if (items == null) {
            items = new ArrayList<>();
        }
        return items.stream()
                .filter(item -> item.getProductId().equals(productId))
                .findFirst();
    }

    public String getId() { return id; }
    public String getUserId() { return userId; }
    public List<CartItem> getItems() { return items == null ? List.of() : items; }
}
