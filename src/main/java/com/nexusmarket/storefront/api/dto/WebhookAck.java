package com.nexusmarket.storefront.api.dto;

/**
 * Acknowledgement returned for every payment webhook delivery.
 */
public class WebhookAck {

    private static final WebhookAck RECEIVED = new WebhookAck(true);

    private final boolean received;

    private WebhookAck(boolean received) {
        this.received = received;
    }

    public static WebhookAck received() {
        return RECEIVED;
    }

    public boolean isReceived() {
        return received;
    }
}
