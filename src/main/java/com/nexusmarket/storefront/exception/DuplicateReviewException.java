package com.nexusmarket.storefront.exception;

/**
 * Exception thrown when a buyer reviews a product they have already reviewed.
 *
 * @author Storefront Team
 */
public class DuplicateReviewException extends RuntimeException {

    private final String productId;

    public DuplicateReviewException(String productId, String userId) {
        super("User " + userId + " has already reviewed product " + productId);
        this.productId = productId;
    }

    public String getProductId() {
        return productId;
    }
}
