package com.nexusmarket.storefront.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.DynamicUpdate;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Product entity representing an item listed by a seller.
 * Stock is only ever decremented through the conditional update in
 * {@link com.nexusmarket.storefront.repository.ProductRepository#decrementStock}.
 *
 * @author Storefront Team
 */
@Entity
@DynamicUpdate
@Table(name = "products", indexes = {
    @Index(name = "idx_products_seller", columnList = "seller_id"),
    @Index(name = "idx_products_category", columnList = "category_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Product {

    @Id
    @Column(name = "product_id", nullable = false, length = 36)
    private String productId;

    /**
     * User who listed the product. Only this seller (or an admin) may modify it.
     */
    @Column(name = "seller_id", nullable = false, length = 64)
    private String sellerId;

    @Column(name = "name", nullable = false, length = 255)
    private String name;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    /**
     * Unit price charged at order creation.
     */
    @Column(name = "price", nullable = false, precision = 10, scale = 2)
    private BigDecimal price;

    @Column(name = "category_id", length = 64)
    private String categoryId;

    /**
     * Units on hand. Never negative.
     */
    @Column(name = "stock", nullable = false)
    private Integer stock;

    /**
     * Average review rating, one decimal. Recomputed whenever a review is added.
     */
    @Column(name = "rating", nullable = false, precision = 2, scale = 1)
    private BigDecimal rating;

    @Column(name = "review_count", nullable = false)
    private Integer reviewCount;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (productId == null) {
            productId = "prod_" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
        }
        if (stock == null) {
            stock = 0;
        }
        if (rating == null) {
            rating = BigDecimal.ZERO.setScale(1);
        }
        if (reviewCount == null) {
            reviewCount = 0;
        }
        createdAt = Instant.now();
        updatedAt = Instant.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    /**
     * Check whether the requested quantity can currently be sold.
     *
     * @param quantity Requested quantity
     * @return true if stock covers the quantity
     */
    public boolean hasStockFor(int quantity) {
        return stock != null && stock >= quantity;
    }

    public boolean isOwnedBy(String userId) {
        return sellerId != null && sellerId.equals(userId);
    }
}
