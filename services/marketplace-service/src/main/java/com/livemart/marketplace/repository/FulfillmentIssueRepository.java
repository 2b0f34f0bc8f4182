package com.livemart.marketplace.repository;

import com.livemart.marketplace.entity.FulfillmentIssue;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface FulfillmentIssueRepository extends MongoRepository<FulfillmentIssue, String> {
}
