package com.nexusmarket.storefront.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.nexusmarket.storefront.service.CartView;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Response DTO for a cart, priced at current catalogue prices.
 *
 * @author Storefront Team
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CartResponse {

    private List<Item> items;
    private BigDecimal total;

    public static CartResponse from(CartView cart) {
        return CartResponse.builder()
                .items(cart.getLines().stream()
                        .map(line -> new Item(line.getProductId(), line.getQuantity(),
                                new ProductSummary(line.getName(), line.getPrice(), line.getStock())))
                        .collect(Collectors.toList()))
                .total(cart.getTotal())
                .build();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class Item {

        private String productId;
        private Integer quantity;
        private ProductSummary product;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ProductSummary {

        private String name;
        private BigDecimal price;
        private Integer stock;
    }
}
