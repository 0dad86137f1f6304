package com.nexusmarket.storefront.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Product category. Categories may nest one level under a parent.
 *
 * @author Storefront Team
 */
@Entity
@Table(name = "categories")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Category {

    @Id
    @Column(name = "category_id", nullable = false, length = 64)
    private String categoryId;

    @Column(name = "name", nullable = false, length = 255)
    private String name;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    @Column(name = "image", length = 1024)
    private String image;

    @Column(name = "parent_id", length = 64)
    private String parentId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (categoryId == null) {
            categoryId = "cat_" + UUID.randomUUID().toString().replace("-", "").substring(0, 8);
        }
        createdAt = Instant.now();
    }
}
