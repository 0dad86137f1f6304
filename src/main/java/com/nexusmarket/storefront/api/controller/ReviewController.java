package com.nexusmarket.storefront.api.controller;

import com.nexusmarket.storefront.api.dto.ReviewRequest;
import com.nexusmarket.storefront.api.dto.ReviewResponse;
import com.nexusmarket.storefront.domain.model.Review;
import com.nexusmarket.storefront.security.SecurityUtils;
import com.nexusmarket.storefront.service.ReviewService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

/**
 * REST controller for product reviews.
 *
 * @author Storefront Team
 */
@RestController
@RequestMapping("/api/v1")
public class ReviewController {

    private final ReviewService reviewService;

    public ReviewController(ReviewService reviewService) {
        this.reviewService = reviewService;
    }

    /**
     * Reviews of a product, newest first. Public.
     */
    @GetMapping("/products/{productId}/reviews")
    public ResponseEntity<List<ReviewResponse>> listReviews(@PathVariable String productId) {
        List<ReviewResponse> reviews = reviewService.listReviews(productId).stream()
                .map(ReviewResponse::from)
                .collect(Collectors.toList());
        return ResponseEntity.ok(reviews);
    }

    /**
     * Review a product. Each user may review a product once.
     */
    @PostMapping("/reviews")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<ReviewResponse> createReview(@Valid @RequestBody ReviewRequest request) {
        Review review = reviewService.createReview(
                SecurityUtils.requireCurrentUserId(),
                request.getProductId(),
                request.getRating(),
                request.getComment()
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(ReviewResponse.from(review));
    }
}
