package com.nexusmarket.storefront.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Locale;
import java.util.UUID;

/**
 * Record of one hosted checkout session opened for an order.
 *
 * The session ID is issued by the payment gateway and is unique. The payment status
 * becomes PAID at most once; that compare-and-set is what makes payment confirmation
 * idempotent.
 *
 * @author Storefront Team
 */
@Entity
@Table(name = "payment_transactions", indexes = {
    @Index(name = "idx_payment_tx_session", columnList = "session_id", unique = true),
    @Index(name = "idx_payment_tx_order", columnList = "order_id"),
    @Index(name = "idx_payment_tx_status_created", columnList = "payment_status, created_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentTransaction {

    @Id
    @Column(name = "transaction_id", nullable = false, length = 36)
    private String transactionId;

    @Column(name = "session_id", nullable = false, unique = true, length = 255)
    private String sessionId;

    @Column(name = "order_id", nullable = false, length = 36)
    private String orderId;

    /**
     * Buyer the session was opened for; credited with loyalty points on payment.
     */
    @Column(name = "user_id", nullable = false, length = 64)
    private String userId;

    @Column(name = "amount", nullable = false, precision = 12, scale = 2)
    private BigDecimal amount;

    @Column(name = "currency", nullable = false, length = 3)
    private String currency;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_status", nullable = false, length = 20)
    private TransactionStatus paymentStatus;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "paid_at")
    private Instant paidAt;

    @Column(name = "expired_at")
    private Instant expiredAt;

    @PrePersist
    protected void onCreate() {
        if (transactionId == null) {
            transactionId = "txn_" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
        }
        if (paymentStatus == null) {
            paymentStatus = TransactionStatus.INITIATED;
        }
        createdAt = Instant.now();
    }

    public boolean isPaid() {
        return paymentStatus == TransactionStatus.PAID;
    }

    public enum TransactionStatus {
        /**
         * Session opened, payment not yet observed.
         */
        INITIATED,

        /**
         * Payment confirmed and side effects applied.
         */
        PAID,

        /**
         * Session abandoned past its time-to-live. A late confirmation can still settle it.
         */
        EXPIRED;

        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
