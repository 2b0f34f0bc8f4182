package com.livemart.marketplace.repository;

import com.livemart.marketplace.entity.Feedback;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface FeedbackRepository extends MongoRepository<Feedback, String> {

    List<Feedback> findByProductIdOrderByCreatedAtDesc(String productId);
}
