package com.livemart.marketplace.service;

import com.livemart.marketplace.entity.Cart;
import com.livemart.marketplace.exception.BadRequestException;
import com.livemart.marketplace.exception.NotFoundException;
import com.livemart.marketplace.repository.CartRepository;
import com.livemart.marketplace.repository.ProductRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.util.Optional;

@Service
public class CartService {

    private static final Logger log = LoggerFactory.getLogger(CartService.class);

    static final int MIN_USER_ID_LENGTH = 5;

    private final CartRepository cartRepository;
    private final ProductRepository productRepository;

    public CartService(CartRepository cartRepository, ProductRepository productRepository) {
        this.cartRepository = cartRepository;
        this.productRepository = productRepository;
    }

    public Optional<Cart> find(String userId) {
        checkUserId(userId);
        return cartRepository.findByUserId(userId);
    }

    public Cart addItem(String userId, String productId, int quantity) {
        checkUserId(userId);
        checkQuantity(quantity);
        if (!productRepository.existsById(productId)) {
            throw NotFoundException.product(productId);
        }
        try {
            return add(userId, productId, quantity);
        } catch (DuplicateKeyException e) {
            // another request created the cart first
            log.debug("Cart for user {} created concurrently, retrying add", userId);
            return add(userId, productId, quantity);
        }
    }

    public Cart updateQuantity(String userId, String productId, int quantity) {
        checkUserId(userId);
        checkQuantity(quantity);
        Cart cart = cartRepository.findByUserId(userId)
                .orElseThrow(() -> NotFoundException.cart(userId));
        if (!cart.updateQuantity(productId, quantity)) {
            throw new NotFoundException("Product " + productId + " is not in the cart");
        }
        return cartRepository.save(cart);
    }

    public Cart removeItem(String userId, String productId) {
        checkUserId(userId);
        Cart cart = cartRepository.findByUserId(userId)
                .orElseThrow(() -> NotFoundException.cart(userId));
        if (cart.removeItem(productId)) {
            cart = cartRepository.save(cart);
        }
        return cart;
    }

    public void clear(String userId) {
        checkUserId(userId);
        long deleted = cartRepository.deleteByUserId(userId);
        log.info("Cart cleared for user {} ({} document(s))", userId, deleted);
    }

    private Cart add(String userId, String productId, int quantity) {
        Cart cart = cartRepository.findByUserId(userId).orElseGet(() -> new Cart(userId));
        cart.addItem(productId, quantity);
        return cartRepository.save(cart);
    }

    private static void checkUserId(String userId) {
        if (userId == null || userId.trim().length() < MIN_USER_ID_LENGTH) {
            throw new BadRequestException("Invalid user id");
        }
    }

    private static void checkQuantity(int quantity) {
        if (quantity < 1) {
            throw new BadRequestException("Quantity must be positive");
        }
    }
}
