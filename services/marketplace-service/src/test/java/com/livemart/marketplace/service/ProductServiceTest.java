package com.livemart.marketplace.service;

import com.livemart.marketplace.dto.ProductRequest;
import com.livemart.marketplace.entity.Product;
import com.livemart.marketplace.exception.BadRequestException;
import com.livemart.marketplace.exception.NotFoundException;
import com.livemart.marketplace.repository.ProductFilter;
import com.livemart.marketplace.repository.ProductRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ProductServiceTest {

    @Mock
    private ProductRepository productRepository;

    private ProductService productService;

    @BeforeEach
    void setUp() {
        productService = new ProductService(productRepository);
    }

    @Test
    void shouldGenerateIdAndDefaultStockAndRatingOnCreate() {
        when(productRepository.save(any(Product.class))).thenAnswer(invocation -> invocation.getArgument(0));

        Product product = productService.create(new ProductRequest(
                null, "Tea", "beverages", new BigDecimal("5.50"), null, "seller-a", null, null, null));

        assertThat(product.getId()).isNotBlank();
        assertThat(product.getStock()).isZero();
        assertThat(product.getRating()).isZero();
    }

    @Test
    void shouldRequireNameOnCreate() {
        assertThatThrownBy(() -> productService.create(new ProductRequest(
                null, " ", null, BigDecimal.ONE, 1, null, null, null, null)))
                .isInstanceOf(BadRequestException.class);
        verify(productRepository, never()).save(any(Product.class));
    }

    @Test
    void shouldOnlyChangeProvidedFieldsOnUpdate() {
        Product existing = new Product("p1", "Tea", "beverages", new BigDecimal("5.50"), 4, "seller-a",
                "Assam", null, 4.0);
        when(productRepository.findById("p1")).thenReturn(Optional.of(existing));
        when(productRepository.save(existing)).thenReturn(existing);

        Product updated = productService.update("p1", new ProductRequest(
                null, null, null, new BigDecimal("6.00"), 10, null, null, null, null));

        assertThat(updated.getName()).isEqualTo("Tea");
        assertThat(updated.getDescription()).isEqualTo("Assam");
        assertThat(updated.getPrice()).isEqualByComparingTo("6.00");
        assertThat(updated.getStock()).isEqualTo(10);
    }

    @Test
    void shouldFailDeleteForUnknownProduct() {
        when(productRepository.existsById("p1")).thenReturn(false);

        assertThatThrownBy(() -> productService.delete("p1")).isInstanceOf(NotFoundException.class);
        verify(productRepository, never()).deleteById("p1");
    }

    @Test
    void shouldRejectInvertedPriceRange() {
        ProductFilter filter = new ProductFilter(null, null, new BigDecimal("10"), new BigDecimal("5"), true, null, 10);

        assertThatThrownBy(() -> productService.list(filter)).isInstanceOf(BadRequestException.class);
    }
}
