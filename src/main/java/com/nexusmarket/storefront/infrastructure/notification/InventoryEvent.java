package com.nexusmarket.storefront.infrastructure.notification;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Inventory change pushed to WebSocket observers.
 * Serialized as {@code {"type": ..., "product_id": ..., "stock": ...}}; stock is omitted for deletions.
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
@JsonInclude(JsonInclude.Include.NON_NULL)
public class InventoryEvent {

    public static final String INVENTORY_UPDATE = "inventory_update";
    public static final String PRODUCT_ADDED = "product_added";
    public static final String PRODUCT_DELETED = "product_deleted";

    private final String type;

    @JsonProperty("product_id")
    private final String productId;

    private final Integer stock;

    public static InventoryEvent stockChanged(String productId, int stock) {
        return new InventoryEvent(INVENTORY_UPDATE, productId, stock);
    }

    public static InventoryEvent productAdded(String productId, int stock) {
        return new InventoryEvent(PRODUCT_ADDED, productId, stock);
    }

    public static InventoryEvent productDeleted(String productId) {
        return new InventoryEvent(PRODUCT_DELETED, productId, null);
    }
}
