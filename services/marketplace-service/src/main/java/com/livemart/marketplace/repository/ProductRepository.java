package com.livemart.marketplace.repository;

import com.livemart.marketplace.entity.Product;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface ProductRepository extends MongoRepository<Product, String>,
        ProductStockOperations, ProductSearchOperations {

    long countBySellerId(String sellerId);

    List<Product> findBySellerIdAndStockGreaterThan(String sellerId, int stock);
}
