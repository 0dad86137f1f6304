package com.nexusmarket.storefront.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * A buyer's rating of a product. One review per buyer and product.
 *
 * @author Storefront Team
 */
@Entity
@Table(name = "reviews",
    uniqueConstraints = @UniqueConstraint(name = "uk_reviews_product_user", columnNames = {"product_id", "user_id"}),
    indexes = @Index(name = "idx_reviews_product", columnList = "product_id, created_at")
)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Review {

    public static final int MIN_RATING = 1;
    public static final int MAX_RATING = 5;

    @Id
    @Column(name = "review_id", nullable = false, length = 36)
    private String reviewId;

    @Column(name = "product_id", nullable = false, length = 36)
    private String productId;

    @Column(name = "user_id", nullable = false, length = 64)
    private String userId;

    /**
     * Stars, 1 to 5.
     */
    @Column(name = "rating", nullable = false)
    private Integer rating;

    @Column(name = "comment", columnDefinition = "TEXT")
    private String comment;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (reviewId == null) {
            reviewId = "rev_" + UUID.randomUUID().toString().replace("-", "").substring(0, 8);
        }
        createdAt = Instant.now();
    }
}
