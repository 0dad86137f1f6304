package com.nexusmarket.storefront.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.nexusmarket.storefront.domain.model.Product;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Response DTO for a product.
 *
 * @author Storefront Team
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ProductResponse {

    private String productId;
    private String sellerId;
    private String name;
    private String description;
    private BigDecimal price;
    private String categoryId;
    private Integer stock;
    private BigDecimal rating;
    private Integer reviewCount;
    private Instant createdAt;

    public static ProductResponse from(Product product) {
        return from(product, product.getStock());
    }

    /**
     * @param stock Stock to report, which may come from the cache rather than the entity
     */
    public static ProductResponse from(Product product, Integer stock) {
        return ProductResponse.builder()
                .productId(product.getProductId())
                .sellerId(product.getSellerId())
                .name(product.getName())
                .description(product.getDescription())
                .price(product.getPrice())
                .categoryId(product.getCategoryId())
                .stock(stock)
                .rating(product.getRating())
                .reviewCount(product.getReviewCount())
                .createdAt(product.getCreatedAt())
                .build();
    }
}
