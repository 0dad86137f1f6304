package com.nexusmarket.storefront.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * A buyer's shopping cart: one line per product, in the order products were added.
 * Carts hold no prices; they are read from the catalogue whenever the cart is shown.
 *
 * @author Storefront Team
 */
@Entity
@Table(name = "carts")
@Getter
@NoArgsConstructor
public class Cart {

    @Id
    @Column(name = "user_id", nullable = false, length = 64)
    private String userId;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "cart_items", joinColumns = @JoinColumn(name = "user_id"))
    @OrderColumn(name = "position")
    private List<CartItem> items = new ArrayList<>();

    /**
     * Optimistic locking version; concurrent edits of one cart fail instead of overwriting each other.
     */
    @Version
    @Column(name = "version", nullable = false)
    private Integer version;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public Cart(String userId) {
        this.userId = userId;
    }

    /**
     * @return Quantity of the product in the cart, 0 if absent
     */
    public int quantityOf(String productId) {
        return items.stream()
                .filter(item -> item.getProductId().equals(productId))
                .mapToInt(CartItem::getQuantity)
                .findFirst()
                .orElse(0);
    }

    /**
     * Set the quantity of a product, adding a line if the product is not in the cart yet.
     */
    public void setQuantity(String productId, int quantity) {
        for (CartItem item : items) {
            if (item.getProductId().equals(productId)) {
                item.setQuantity(quantity);
                return;
            }
        }
        items.add(new CartItem(productId, quantity));
    }

    public boolean remove(String productId) {
        return items.removeIf(item -> item.getProductId().equals(productId));
    }

    /**
     * Replace every line.
     *
     * @param quantities Quantity per product, in display order
     */
    public void replaceItems(Map<String, Integer> quantities) {
        items.clear();
        quantities.forEach((productId, quantity) -> items.add(new CartItem(productId, quantity)));
    }

    public List<CartItem> getItems() {
        return Collections.unmodifiableList(items);
    }

    @PrePersist
    @PreUpdate
    protected void touch() {
        updatedAt = Instant.now();
    }
}
