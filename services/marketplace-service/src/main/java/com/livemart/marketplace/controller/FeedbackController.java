package com.livemart.marketplace.controller;

import com.livemart.marketplace.dto.FeedbackRequest;
import com.livemart.marketplace.dto.FeedbackResponse;
import com.livemart.marketplace.service.FeedbackService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/feedback")
public class FeedbackController {

    private final FeedbackService feedbackService;

    public FeedbackController(FeedbackService feedbackService) {
        this.feedbackService = feedbackService;
    }

    @PostMapping("/{userId}")
    public ResponseEntity<FeedbackResponse> submit(@PathVariable String userId,
                                                   @Valid @RequestBody FeedbackRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(FeedbackResponse.from(feedbackService.submit(userId, request)));
    }

    @GetMapping("/product/{productId}")
    public ResponseEntity<List<FeedbackResponse>> forProduct(@PathVariable String productId) {
        return ResponseEntity.ok(feedbackService.forProduct(productId).stream().map(FeedbackResponse::from).toList());
    }
}
