package com.nexusmarket.storefront.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Request DTO for placing an order. Prices are not accepted from the client.
 *
 * @author Storefront Team
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CreateOrderRequest {

    @NotEmpty(message = "Order must contain at least one item")
    @Valid
    private List<Item> items;

    @NotEmpty(message = "Shipping address is required")
    private Map<String, String> shippingAddress;

    @NotBlank(message = "Payment method is required")
    private String paymentMethod;

    /**
     * Requested quantity per product, summing repeated products and keeping first-seen order.
     *
     * @throws IllegalArgumentException if the summed quantity of a product does not fit in an int
     */
    public Map<String, Integer> quantitiesByProduct() {
        Map<String, Integer> quantities = new LinkedHashMap<>();
        for (Item item : items) {
            try {
                quantities.merge(item.getProductId(), item.getQuantity(), Math::addExact);
            } catch (ArithmeticException e) {
                throw new IllegalArgumentException("Quantity for product " + item.getProductId() + " is too large", e);
            }
        }
        return quantities;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class Item {

        @NotBlank(message = "Product ID is required")
        private String productId;

        @NotNull(message = "Quantity is required")
        @Min(value = 1, message = "Quantity must be at least 1")
        private Integer quantity;
    }
}
