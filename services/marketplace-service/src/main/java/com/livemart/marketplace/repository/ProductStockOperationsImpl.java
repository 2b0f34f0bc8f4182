package com.livemart.marketplace.repository;

import com.livemart.marketplace.entity.Product;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Update;

import static org.springframework.data.mongodb.core.query.Criteria.where;
import static org.springframework.data.mongodb.core.query.Query.query;

public class ProductStockOperationsImpl implements ProductStockOperations {

    private final MongoTemplate mongoTemplate;

    public ProductStockOperationsImpl(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public boolean decrementStockIfAvailable(String productId, int quantity) {
        Product updated = mongoTemplate.findAndModify(
                query(where("id").is(productId).and("stock").gte(quantity)),
                new Update().inc("stock", -quantity),
                FindAndModifyOptions.options().returnNew(true),
                Product.class);
        return updated != null;
    }

    @Override
    public boolean incrementStock(String productId, int quantity) {
        return mongoTemplate.updateFirst(
                query(where("id").is(productId)),
                new Update().inc("stock", quantity),
                Product.class).getMatchedCount() > 0;
    }
}
