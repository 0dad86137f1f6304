package com.nexusmarket.storefront.service;

import com.nexusmarket.storefront.domain.model.Product;
import com.nexusmarket.storefront.domain.model.Review;
import com.nexusmarket.storefront.exception.DuplicateReviewException;
import com.nexusmarket.storefront.exception.ResourceNotFoundException;
import com.nexusmarket.storefront.repository.ProductRepository;
import com.nexusmarket.storefront.repository.ReviewRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Service for product reviews.
 *
 * The product's rating and review count are recomputed from all of its reviews on every new
 * review, under a row lock on the product so concurrent reviews cannot overwrite each other's totals.
 *
 * @author Storefront Team
 */
@Service
public class ReviewService {

    private static final Logger logger = LoggerFactory.getLogger(ReviewService.class);

    private final ReviewRepository reviewRepository;
    private final ProductRepository productRepository;

    public ReviewService(ReviewRepository reviewRepository, ProductRepository productRepository) {
        this.reviewRepository = reviewRepository;
        this.productRepository = productRepository;
    }

    /**
     * Review a product.
     *
     * @param userId    Reviewer ID
     * @param productId Product ID
     * @param rating    Stars, 1 to 5
     * @param comment   Free text, may be null
     * @return Saved review
     * @throws IllegalArgumentException  if the rating is out of range
     * @throws ResourceNotFoundException if the product does not exist
     * @throws DuplicateReviewException  if the user already reviewed this product
     */
    @Transactional
    public Review createReview(String userId, String productId, int rating, String comment) {
        if (rating < Review.MIN_RATING || rating > Review.MAX_RATING) {
            throw new IllegalArgumentException("Rating must be between 1 and 5: " + rating);
        }

        Product product = productRepository.findByIdWithLock(productId)
                .orElseThrow(() -> new ResourceNotFoundException("Product", productId));

        if (reviewRepository.existsByProductIdAndUserId(productId, userId)) {
            throw new DuplicateReviewException(productId, userId);
        }

        Review review = reviewRepository.saveAndFlush(Review.builder()
                .productId(productId)
                .userId(userId)
                .rating(rating)
                .comment(comment)
                .build());

        Double average = reviewRepository.averageRating(productId);
        product.setRating(roundRating(average));
        product.setReviewCount((int) reviewRepository.countByProductId(productId));

        logger.info("User {} rated product {} {} stars; average now {} over {} reviews",
                userId, productId, rating, product.getRating(), product.getReviewCount());
        return review;
    }

    /**
     * Reviews of a product, newest first.
     *
     * @throws ResourceNotFoundException if the product does not exist
     */
    @Transactional(readOnly = true)
    public List<Review> listReviews(String productId) {
        if (!productRepository.existsById(productId)) {
            throw new ResourceNotFoundException("Product", productId);
        }
        return reviewRepository.findByProductIdOrderByCreatedAtDesc(productId);
    }

    static BigDecimal roundRating(Double average) {
        if (average == null) {
            return BigDecimal.ZERO.setScale(1);
        }
        return BigDecimal.valueOf(average).setScale(1, RoundingMode.HALF_UP);
    }
}
