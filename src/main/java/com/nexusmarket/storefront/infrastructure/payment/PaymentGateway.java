package com.nexusmarket.storefront.infrastructure.payment;

import com.nexusmarket.storefront.exception.PaymentGatewayException;

/**
 * Hosted-checkout payment provider.
 * Implementations make a single bounded-timeout attempt per call and never retry on their own.
 *
 * @author Storefront Team
 */
public interface PaymentGateway {

    /**
     * Create a hosted checkout session for the given amount.
     *
     * @param command Session parameters
     * @return Session ID and the URL the buyer is redirected to
     * @throws PaymentGatewayException if the provider is unreachable, times out or rejects the request
     */
    GatewaySession createSession(CheckoutSessionCommand command);

    /**
     * Read the provider's authoritative status of a session.
     *
     * @param sessionId Session ID returned by {@link #createSession}
     * @return Session status and payment status
     * @throws PaymentGatewayException if the status cannot be read
     */
    GatewaySessionStatus getStatus(String sessionId);
}
