package com.nexusmarket.storefront.exception;

/**
 * Exception thrown when a checkout session is requested for an order that is already paid.
 *
 * @author Storefront Team
 */
public class OrderAlreadyPaidException extends RuntimeException {

    private final String orderId;

    public OrderAlreadyPaidException(String orderId) {
        super("Order " + orderId + " is already paid");
        this.orderId = orderId;
    }

    public String getOrderId() {
        return orderId;
    }
}
