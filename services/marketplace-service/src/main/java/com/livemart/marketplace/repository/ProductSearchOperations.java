package com.livemart.marketplace.repository;

import com.livemart.marketplace.entity.Product;

import java.util.List;

public interface ProductSearchOperations {

    List<Product> search(ProductFilter filter);
}
