package com.nexusmarket.storefront.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Products a buyer saved for later. Each product appears at most once.
 *
 * @author Storefront Team
 */
@Entity
@Table(name = "wishlists")
@Getter
@NoArgsConstructor
public class Wishlist {

    @Id
    @Column(name = "user_id", nullable = false, length = 64)
    private String userId;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "wishlist_items", joinColumns = @JoinColumn(name = "user_id"))
    @OrderColumn(name = "position")
    @Column(name = "product_id", nullable = false, length = 36)
    private List<String> productIds = new ArrayList<>();

    @Version
    @Column(name = "version", nullable = false)
    private Integer version;

    public Wishlist(String userId) {
        this.userId = userId;
    }

    /**
     * @return true if the product was not on the list yet
     */
    public boolean add(String productId) {
        if (productIds.contains(productId)) {
            return false;
        }
        return productIds.add(productId);
    }

    public boolean remove(String productId) {
        return productIds.remove(productId);
    }

    public List<String> getProductIds() {
        return Collections.unmodifiableList(productIds);
    }
}
