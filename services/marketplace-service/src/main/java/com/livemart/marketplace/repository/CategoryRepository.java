package com.livemart.marketplace.repository;

import com.livemart.marketplace.entity.Category;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface CategoryRepository extends MongoRepository<Category, String> {
}
