package com.nexusmarket.storefront.service;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.List;

/**
 * A cart priced against the current catalogue.
 * Lines whose product has been delisted are left out.
 */
@Getter
@Builder
@ToString
public class CartView {

    private final String userId;

    @Singular
    private final List<Line> lines;

    /**
     * Sum of price times quantity over all lines, two decimals.
     */
    private final BigDecimal total;

    @Getter
    @Builder
    @ToString
    public static class Line {

        private final String productId;
        private final int quantity;
        private final String name;
        private final BigDecimal price;
        private final Integer stock;
    }
}
