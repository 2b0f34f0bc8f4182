package com.livemart.marketplace.repository;

import com.livemart.marketplace.entity.Order;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;

import java.util.List;

public interface OrderRepository extends MongoRepository<Order, String> {

    List<Order> findByUserIdOrderByCreatedAtDesc(String userId);

    @Query("{ 'items.seller_id': ?0, 'order_status': { $ne: 'cancelled' } }")
    List<Order> findActiveOrdersContainingSeller(String sellerId);
}
