package com.nexusmarket.storefront.infrastructure.messaging.events;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Event published once an order has been settled as paid.
 * Consumed downstream for fulfilment and analytics.
 *
 * @author Storefront Team
 */
public class OrderPaidEvent {

    public static final String EVENT_TYPE = "ORDER_PAID";

    private String orderId;
    private String userId;
    private String sessionId;
    private BigDecimal total;
    private Integer loyaltyPoints;
    private String eventType;
    private Instant timestamp;

    /**
     * Default constructor for deserialization.
     */
    public OrderPaidEvent() {
    }

    public OrderPaidEvent(String orderId, String userId, String sessionId, BigDecimal total, Integer loyaltyPoints) {
        this.orderId = orderId;
        this.userId = userId;
        this.sessionId = sessionId;
        this.total = total;
        this.loyaltyPoints = loyaltyPoints;
        this.eventType = EVENT_TYPE;
        this.timestamp = Instant.now();
    }

    public String getOrderId() {
        return orderId;
    }

    public void setOrderId(String orderId) {
        this.orderId = orderId;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public String getSessionId() {
        return sessionId;
    }

    public void setSessionId(String sessionId) {
        this.sessionId = sessionId;
    }

    public BigDecimal getTotal() {
        return total;
    }

    public void setTotal(BigDecimal total) {
        this.total = total;
    }

    public Integer getLoyaltyPoints() {
        return loyaltyPoints;
    }

    public void setLoyaltyPoints(Integer loyaltyPoints) {
        this.loyaltyPoints = loyaltyPoints;
    }

    public String getEventType() {
        return eventType;
    }

    public void setEventType(String eventType) {
        this.eventType = eventType;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    @Override
    public String toString() {
        return "OrderPaidEvent{" +
                "orderId='" + orderId + '\'' +
                ", userId='" + userId + '\'' +
                ", total=" + total +
                ", loyaltyPoints=" + loyaltyPoints +
                '}';
    }
}
