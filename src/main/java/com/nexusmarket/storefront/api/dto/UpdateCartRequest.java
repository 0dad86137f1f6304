package com.nexusmarket.storefront.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Request DTO replacing the whole cart. An empty item list empties the cart.
 *
 * @author Storefront Team
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class UpdateCartRequest {

    @NotNull(message = "Items are required")
    @Valid
    private List<CartItemRequest> items;

    /**
     * Quantity per product, summing repeated products and keeping first-seen order.
     *
     * @throws IllegalArgumentException if the summed quantity of a product does not fit in an int
     */
    public Map<String, Integer> quantitiesByProduct() {
        Map<String, Integer> quantities = new LinkedHashMap<>();
        for (CartItemRequest item : items) {
            try {
                quantities.merge(item.getProductId(), item.getQuantity(), Math::addExact);
            } catch (ArithmeticException e) {
                throw new IllegalArgumentException("Quantity for product " + item.getProductId() + " is too large", e);
            }
        }
        return quantities;
    }
}
