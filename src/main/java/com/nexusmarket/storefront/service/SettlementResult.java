package com.nexusmarket.storefront.service;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of settling one paid checkout session.
 * Only a {@link Outcome#SETTLED} result carries stock changes and loyalty points to publish.
 *
 * @author Storefront Team
 */
public class SettlementResult {

    public enum Outcome {
        /**
         * This call applied the paid-order side effects.
         */
        SETTLED,

        /**
         * The session had already been settled by another caller.
         */
        ALREADY_SETTLED,

        /**
         * The session was paid, but its order had already been paid through another session.
         */
        DUPLICATE_PAYMENT
    }

    private final Outcome outcome;
    private final String orderId;
    private final String userId;
    private final BigDecimal total;
    private final int loyaltyPoints;
    private final List<StockChange> stockChanges;

    private SettlementResult(Outcome outcome, String orderId, String userId, BigDecimal total,
                             int loyaltyPoints, List<StockChange> stockChanges) {
        this.outcome = outcome;
        this.orderId = orderId;
        this.userId = userId;
        this.total = total;
        this.loyaltyPoints = loyaltyPoints;
        this.stockChanges = stockChanges;
    }

    public static SettlementResult settled(String orderId, String userId, BigDecimal total,
                                           int loyaltyPoints, List<StockChange> stockChanges) {
        return new SettlementResult(Outcome.SETTLED, orderId, userId, total, loyaltyPoints,
                Collections.unmodifiableList(stockChanges));
    }

    public static SettlementResult alreadySettled(String orderId) {
        return new SettlementResult(Outcome.ALREADY_SETTLED, orderId, null, null, 0, List.of());
    }

    public static SettlementResult duplicatePayment(String orderId) {
        return new SettlementResult(Outcome.DUPLICATE_PAYMENT, orderId, null, null, 0, List.of());
    }

    public boolean isSettled() {
        return outcome == Outcome.SETTLED;
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public String getOrderId() {
        return orderId;
    }

    public String getUserId() {
        return userId;
    }

    public BigDecimal getTotal() {
        return total;
    }

    public int getLoyaltyPoints() {
        return loyaltyPoints;
    }

    public List<StockChange> getStockChanges() {
        return stockChanges;
    }

    /**
     * Stock of one product after a settled decrement.
     */
    public static class StockChange {

        private final String productId;
        private final int stock;

        public StockChange(String productId, int stock) {
            this.productId = productId;
            this.stock = stock;
        }

        public String getProductId() {
            return productId;
        }

        public int getStock() {
            return stock;
        }

        @Override
        public String toString() {
            return productId + "=" + stock;
        }
    }
}
