package com.nexusmarket.storefront.repository;

import com.nexusmarket.storefront.domain.model.Review;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository interface for Review entity.
 *
 * @author Storefront Team
 */
@Repository
public interface ReviewRepository extends JpaRepository<Review, String> {

    List<Review> findByProductIdOrderByCreatedAtDesc(String productId);

    boolean existsByProductIdAndUserId(String productId, String userId);

    long countByProductId(String productId);

    /**
     * @return Mean rating of the product's reviews, or null if it has none
     */
    @Query("SELECT AVG(r.rating) FROM Review r WHERE r.productId = :productId")
    Double averageRating(@Param("productId") String productId);
}
