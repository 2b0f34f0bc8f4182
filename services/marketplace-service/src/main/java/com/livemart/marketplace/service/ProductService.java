package com.livemart.marketplace.service;

import com.livemart.marketplace.dto.ProductRequest;
import com.livemart.marketplace.entity.Product;
import com.livemart.marketplace.exception.BadRequestException;
import com.livemart.marketplace.exception.NotFoundException;
import com.livemart.marketplace.repository.ProductFilter;
import com.livemart.marketplace.repository.ProductRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

@Service
public class ProductService {

    private static final Logger log = LoggerFactory.getLogger(ProductService.class);

    private final ProductRepository productRepository;

    public ProductService(ProductRepository productRepository) {
        this.productRepository = productRepository;
    }

    public List<Product> list(ProductFilter filter) {
        if (filter.limit() < 1) {
            throw new BadRequestException("limit must be positive");
        }
        if (filter.minPrice() != null && filter.maxPrice() != null
                && filter.minPrice().compareTo(filter.maxPrice()) > 0) {
            throw new BadRequestException("min_price must not exceed max_price");
        }
        return productRepository.search(filter);
    }

    public List<Product> listInStockBySeller(String sellerId) {
        return productRepository.findBySellerIdAndStockGreaterThan(sellerId, 0);
    }

    public Product get(String productId) {
        return productRepository.findById(productId)
                .orElseThrow(() -> NotFoundException.product(productId));
    }

    /**
     * Creates the product, or replaces it when the request carries an id that already exists.
     */
    public Product create(ProductRequest request) {
        if (request.name() == null || request.name().isBlank()) {
            throw new BadRequestException("Product name required");
        }
        if (request.price() == null) {
            throw new BadRequestException("Product price required");
        }
        String id = request.id() == null || request.id().isBlank() ? UUID.randomUUID().toString() : request.id();
        Product product = new Product(
                id,
                request.name(),
                request.categoryId(),
                request.price(),
                request.stock() == null ? 0 : request.stock(),
                request.sellerId(),
                request.description(),
                request.imageUrl(),
                request.rating() == null ? 0.0 : request.rating());
        Product saved = productRepository.save(product);
        log.info("Product saved: id={}, seller={}, stock={}", saved.getId(), saved.getSellerId(), saved.getStock());
        return saved;
    }

    public Product update(String productId, ProductRequest request) {
        Product product = get(productId);
        if (request.name() != null) {
            if (request.name().isBlank()) {
                throw new BadRequestException("Product name must not be blank");
            }
            product.rename(request.name());
        }
        if (request.categoryId() != null) product.moveToCategory(request.categoryId());
        if (request.price() != null) product.reprice(request.price());
        if (request.stock() != null) product.restock(request.stock());
        if (request.sellerId() != null) product.assignSeller(request.sellerId());
        if (request.description() != null) product.describe(request.description());
        if (request.imageUrl() != null) product.changeImage(request.imageUrl());
        if (request.rating() != null) product.rate(request.rating());

        Product saved = productRepository.save(product);
        log.info("Product updated: id={}", productId);
        return saved;
    }

    public void delete(String productId) {
        if (!productRepository.existsById(productId)) {
            throw NotFoundException.product(productId);
        }
        productRepository.deleteById(productId);
        log.info("Product deleted: id={}", productId);
    }
}
