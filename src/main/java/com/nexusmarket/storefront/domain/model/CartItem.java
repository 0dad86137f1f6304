package com.nexusmarket.storefront.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One product in a cart. Embedded in {@link Cart}.
 *
 * @author Storefront Team
 */
@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CartItem {

    @Column(name = "product_id", nullable = false, length = 36)
    private String productId;

    @Column(name = "quantity", nullable = false)
    private Integer quantity;
}
