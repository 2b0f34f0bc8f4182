package com.livemart.marketplace.service;

import com.livemart.marketplace.dto.FeedbackRequest;
import com.livemart.marketplace.entity.Feedback;
import com.livemart.marketplace.entity.User;
import com.livemart.marketplace.exception.NotFoundException;
import com.livemart.marketplace.repository.FeedbackRepository;
import com.livemart.marketplace.repository.ProductRepository;
import com.livemart.marketplace.repository.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class FeedbackService {

    private static final Logger log = LoggerFactory.getLogger(FeedbackService.class);

    private final FeedbackRepository feedbackRepository;
    private final ProductRepository productRepository;
    private final UserRepository userRepository;

    public FeedbackService(FeedbackRepository feedbackRepository,
                           ProductRepository productRepository,
                           UserRepository userRepository) {
        this.feedbackRepository = feedbackRepository;
        this.productRepository = productRepository;
        this.userRepository = userRepository;
    }

    public Feedback submit(String userId, FeedbackRequest request) {
        if (!productRepository.existsById(request.productId())) {
            throw NotFoundException.product(request.productId());
        }
        String userName = userRepository.findById(userId)
                .map(User::getName)
                .orElse("Anonymous");

        Feedback feedback = feedbackRepository.save(
                new Feedback(userId, userName, request.productId(), request.rating(), request.comment()));
        log.info("Feedback {} saved for product {} (rating {})",
                feedback.getId(), feedback.getProductId(), feedback.getRating());
        return feedback;
    }

    public List<Feedback> forProduct(String productId) {
        return feedbackRepository.findByProductIdOrderByCreatedAtDesc(productId);
    }
}
