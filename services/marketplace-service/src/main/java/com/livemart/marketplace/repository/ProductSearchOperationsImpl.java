package com.livemart.marketplace.repository;

import com.livemart.marketplace.entity.Product;
import org.bson.types.Decimal128;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import static org.springframework.data.mongodb.core.query.Criteria.where;

public class ProductSearchOperationsImpl implements ProductSearchOperations {

    private final MongoTemplate mongoTemplate;

    public ProductSearchOperationsImpl(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public List<Product> search(ProductFilter filter) {
        return mongoTemplate.find(toQuery(filter), Product.class);
    }

    static Query toQuery(ProductFilter filter) {
        List<Criteria> criteria = new ArrayList<>();

        if (hasText(filter.sellerId())) {
            criteria.add(where("sellerId").is(filter.sellerId()));
        }
        if (hasText(filter.categoryId()) && !ProductFilter.ALL_CATEGORIES.equals(filter.categoryId())) {
            criteria.add(where("categoryId").is(filter.categoryId()));
        }
        if (hasText(filter.search())) {
            Pattern pattern = Pattern.compile(Pattern.quote(filter.search()), Pattern.CASE_INSENSITIVE);
            criteria.add(new Criteria().orOperator(
                    where("name").regex(pattern),
                    where("description").regex(pattern)));
        }
        if (filter.minPrice() != null || filter.maxPrice() != null) {
            Criteria price = where("price");
            if (filter.minPrice() != null) {
                price = price.gte(new Decimal128(filter.minPrice()));
            }
            if (filter.maxPrice() != null) {
                price = price.lte(new Decimal128(filter.maxPrice()));
            }
            criteria.add(price);
        }
        if (filter.availableOnly()) {
            criteria.add(where("stock").gt(0));
        }

        Query query = criteria.isEmpty()
                ? new Query()
                : new Query(new Criteria().andOperator(criteria.toArray(new Criteria[0])));
        return query.limit(filter.limit());
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
