package com.nexusmarket.storefront.service;

import java.util.Objects;

/**
 * Payment state of a checkout session as reported to a polling buyer.
 *
 * @author Storefront Team
 */
public class ConfirmationResult {

    public static final String UNKNOWN = "unknown";

    /**
     * Gateway session status, or "unknown" when the gateway could not be read.
     */
    private final String status;

    /**
     * Gateway payment status, or the locally stored one as a fallback.
     */
    private final String paymentStatus;

    private final String orderId;

    public ConfirmationResult(String status, String paymentStatus, String orderId) {
        this.status = status;
        this.paymentStatus = paymentStatus;
        this.orderId = orderId;
    }

    public String getStatus() {
        return status;
    }

    public String getPaymentStatus() {
        return paymentStatus;
    }

    public String getOrderId() {
        return orderId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ConfirmationResult)) return false;
        ConfirmationResult that = (ConfirmationResult) o;
        return Objects.equals(status, that.status)
                && Objects.equals(paymentStatus, that.paymentStatus)
                && Objects.equals(orderId, that.orderId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(status, paymentStatus, orderId);
    }

    @Override
    public String toString() {
        return "ConfirmationResult{status='" + status + "', paymentStatus='" + paymentStatus +
                "', orderId='" + orderId + "'}";
    }
}
