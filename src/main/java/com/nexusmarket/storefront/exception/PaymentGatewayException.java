package com.nexusmarket.storefront.exception;

/**
 * Exception thrown when the payment gateway cannot be reached, times out, or rejects a call.
 * Callers may retry; the service itself never retries gateway calls.
 *
 * @author Storefront Team
 */
public class PaymentGatewayException extends RuntimeException {

    private final String operation;

    public PaymentGatewayException(String operation, String message) {
        super(message);
        this.operation = operation;
    }

    public PaymentGatewayException(String operation, String message, Throwable cause) {
        super(message, cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
