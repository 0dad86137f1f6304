package com.nexusmarket.storefront.infrastructure.payment;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Checkout session created at the payment gateway.
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class GatewaySession {

    private final String sessionId;
    private final String url;
}
