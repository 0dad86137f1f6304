package com.nexusmarket.storefront.service;

import com.nexusmarket.storefront.domain.model.Product;
import com.nexusmarket.storefront.domain.model.Review;
import com.nexusmarket.storefront.exception.DuplicateReviewException;
import com.nexusmarket.storefront.exception.ResourceNotFoundException;
import com.nexusmarket.storefront.repository.ProductRepository;
import com.nexusmarket.storefront.repository.ReviewRepository;
import com.nexusmarket.storefront.testutil.TestDataBuilder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for ReviewService.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("ReviewService Unit Tests")
class ReviewServiceTest {

    @Mock
    private ReviewRepository reviewRepository;

    @Mock
    private ProductRepository productRepository;

    @InjectMocks
    private ReviewService reviewService;

    // ========================================
    // createReview() Tests
    // ========================================

    @Test
    @DisplayName("createReview - Success: Should recompute rating and review count")
    void createReview_UpdatesProductAggregates() {
        // Given
        Product product = TestDataBuilder.product().productId("prod_1").build();
        when(productRepository.findByIdWithLock("prod_1")).thenReturn(Optional.of(product));
        when(reviewRepository.existsByProductIdAndUserId("prod_1", "user-1")).thenReturn(false);
        when(reviewRepository.saveAndFlush(any(Review.class))).thenAnswer(invocation -> invocation.getArgument(0));
        when(reviewRepository.averageRating("prod_1")).thenReturn(11.0 / 3);
        when(reviewRepository.countByProductId("prod_1")).thenReturn(3L);

        // When
        Review review = reviewService.createReview("user-1", "prod_1", 4, "Solid");

        // Then
        assertThat(review.getRating()).isEqualTo(4);
        assertThat(review.getUserId()).isEqualTo("user-1");
        assertThat(product.getRating()).isEqualByComparingTo("3.7");
        assertThat(product.getReviewCount()).isEqualTo(3);

        ArgumentCaptor<Review> captor = ArgumentCaptor.forClass(Review.class);
        verify(reviewRepository).saveAndFlush(captor.capture());
        assertThat(captor.getValue().getComment()).isEqualTo("Solid");
    }

    @Test
    @DisplayName("createReview - Duplicate: Should reject a second review by the same user")
    void createReview_Duplicate_Throws() {
        // Given
        Product product = TestDataBuilder.product().productId("prod_1").build();
        when(productRepository.findByIdWithLock("prod_1")).thenReturn(Optional.of(product));
        when(reviewRepository.existsByProductIdAndUserId("prod_1", "user-1")).thenReturn(true);

        // When / Then
        assertThatThrownBy(() -> reviewService.createReview("user-1", "prod_1", 5, null))
                .isInstanceOf(DuplicateReviewException.class);
        verify(reviewRepository, never()).saveAndFlush(any());
    }

    @Test
    @DisplayName("createReview - UnknownProduct: Should throw ResourceNotFoundException")
    void createReview_UnknownProduct_Throws() {
        // Given
        when(productRepository.findByIdWithLock("prod_x")).thenReturn(Optional.empty());

        // When / Then
        assertThatThrownBy(() -> reviewService.createReview("user-1", "prod_x", 3, null))
                .isInstanceOf(ResourceNotFoundException.class);
        verifyNoInteractions(reviewRepository);
    }

    @Test
    @DisplayName("createReview - RatingOutOfRange: Should throw before touching the product")
    void createReview_RatingOutOfRange_Throws() {
        // When / Then
        assertThatThrownBy(() -> reviewService.createReview("user-1", "prod_1", 6, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> reviewService.createReview("user-1", "prod_1", 0, null))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(productRepository, reviewRepository);
    }

    // ========================================
    // listReviews() / rounding Tests
    // ========================================

    @Test
    @DisplayName("listReviews - UnknownProduct: Should throw ResourceNotFoundException")
    void listReviews_UnknownProduct_Throws() {
        // Given
        when(productRepository.existsById("prod_x")).thenReturn(false);

        // When / Then
        assertThatThrownBy(() -> reviewService.listReviews("prod_x"))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    @DisplayName("listReviews - Success: Should return the repository's newest-first list")
    void listReviews_ReturnsReviews() {
        // Given
        Review newest = Review.builder().reviewId("rev_2").productId("prod_1").rating(2).build();
        Review oldest = Review.builder().reviewId("rev_1").productId("prod_1").rating(5).build();
        when(productRepository.existsById("prod_1")).thenReturn(true);
        when(reviewRepository.findByProductIdOrderByCreatedAtDesc("prod_1")).thenReturn(List.of(newest, oldest));

        // When / Then
        assertThat(reviewService.listReviews("prod_1")).extracting(Review::getReviewId)
                .containsExactly("rev_2", "rev_1");
    }

    @Test
    @DisplayName("roundRating - Rounds half up to one decimal")
    void roundRating_HalfUp() {
        assertThat(ReviewService.roundRating(4.25)).isEqualTo(new BigDecimal("4.3"));
        assertThat(ReviewService.roundRating(4.0)).isEqualTo(new BigDecimal("4.0"));
        assertThat(ReviewService.roundRating(null)).isEqualTo(new BigDecimal("0.0"));
    }
}
