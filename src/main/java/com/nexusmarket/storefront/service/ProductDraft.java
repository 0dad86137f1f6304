package com.nexusmarket.storefront.service;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;

/**
 * Product fields supplied by a seller. On update, null fields are left unchanged.
 */
@Getter
@Builder
@ToString
public class ProductDraft {

    private final String name;
    private final String description;
    private final BigDecimal price;
    private final String categoryId;
    private final Integer stock;
}
