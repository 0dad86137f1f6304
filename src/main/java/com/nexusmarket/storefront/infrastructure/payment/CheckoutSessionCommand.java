package com.nexusmarket.storefront.infrastructure.payment;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Parameters of a hosted checkout session. The amount is in major currency units.
 */
@Getter
@Builder
@ToString
public class CheckoutSessionCommand {

    private final BigDecimal amount;
    private final String currency;
    private final String description;
    private final String successUrl;
    private final String cancelUrl;

    @Singular("metadataEntry")
    private final Map<String, String> metadata;
}
