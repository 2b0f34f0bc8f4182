package com.livemart.marketplace.controller;

import com.livemart.marketplace.dto.ProductRequest;
import com.livemart.marketplace.dto.ProductResponse;
import com.livemart.marketplace.entity.Product;
import com.livemart.marketplace.repository.ProductFilter;
import com.livemart.marketplace.service.ProductService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/products")
public class ProductController {

    private final ProductService productService;

    public ProductController(ProductService productService) {
        this.productService = productService;
    }

    @GetMapping
    public ResponseEntity<List<ProductResponse>> list(
            @RequestParam(name = "category_id", required = false) String categoryId,
            @RequestParam(required = false) String search,
            @RequestParam(name = "min_price", required = false) BigDecimal minPrice,
            @RequestParam(name = "max_price", required = false) BigDecimal maxPrice,
            @RequestParam(name = "available_only", defaultValue = "true") boolean availableOnly,
            @RequestParam(name = "seller_id", required = false) String sellerId,
            @RequestParam(defaultValue = "1000") int limit) {
        ProductFilter filter = new ProductFilter(categoryId, search, minPrice, maxPrice, availableOnly, sellerId, limit);
        return ResponseEntity.ok(toResponses(productService.list(filter)));
    }

    @GetMapping("/retailer/{sellerId}")
    public ResponseEntity<List<ProductResponse>> listForSeller(@PathVariable String sellerId) {
        return ResponseEntity.ok(toResponses(productService.listInStockBySeller(sellerId)));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ProductResponse> get(@PathVariable String id) {
        return ResponseEntity.ok(ProductResponse.from(productService.get(id)));
    }

    @PostMapping
    public ResponseEntity<ProductResponse> create(@Valid @RequestBody ProductRequest request) {
        return ResponseEntity.ok(ProductResponse.from(productService.create(request)));
    }

    @PutMapping("/{id}")
    public ResponseEntity<ProductResponse> update(@PathVariable String id, @Valid @RequestBody ProductRequest request) {
        return ResponseEntity.ok(ProductResponse.from(productService.update(id, request)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Map<String, String>> delete(@PathVariable String id) {
        productService.delete(id);
        return ResponseEntity.ok(Map.of("message", "Product deleted"));
    }

    private static List<ProductResponse> toResponses(List<Product> products) {
        return products.stream().map(ProductResponse::from).toList();
    }
}
