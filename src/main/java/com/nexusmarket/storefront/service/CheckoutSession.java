package com.nexusmarket.storefront.service;

/**
 * Hosted checkout session opened for an order.
 *
 * @author Storefront Team
 */
public class CheckoutSession {

    private final String url;
    private final String sessionId;

    public CheckoutSession(String url, String sessionId) {
        this.url = url;
        this.sessionId = sessionId;
    }

    /**
     * @return Gateway page the buyer is redirected to
     */
    public String getUrl() {
        return url;
    }

    public String getSessionId() {
        return sessionId;
    }
}
