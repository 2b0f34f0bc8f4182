package com.livemart.marketplace.repository;

import com.livemart.marketplace.entity.Cart;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Optional;

public interface CartRepository extends MongoRepository<Cart, String> {

    Optional<Cart> findByUserId(String userId);

    long deleteByUserId(String userId);
}
