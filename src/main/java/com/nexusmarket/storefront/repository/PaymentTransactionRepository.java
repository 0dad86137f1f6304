package com.nexusmarket.storefront.repository;

import com.nexusmarket.storefront.domain.model.PaymentTransaction;
import com.nexusmarket.storefront.domain.model.PaymentTransaction.TransactionStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for PaymentTransaction entity.
 *
 * @author Storefront Team
 */
@Repository
public interface PaymentTransactionRepository extends JpaRepository<PaymentTransaction, String> {

    Optional<PaymentTransaction> findBySessionId(String sessionId);

    /**
     * Transition a transaction to PAID.
     * This is the idempotency gate of payment confirmation: for a given session
     * the update matches a row at most once, however many callers race on it.
     *
     * @param sessionId Gateway session ID
     * @param paidAt Confirmation timestamp
     * @return Number of rows updated (1 for the single winning caller, 0 otherwise)
     */
    default int markPaid(String sessionId, Instant paidAt) {
        return updateStatusUnlessPaid(sessionId, TransactionStatus.PAID, paidAt);
    }

    @Transactional
    @Modifying
    @Query("UPDATE PaymentTransaction t SET t.paymentStatus = :paid, t.paidAt = :paidAt " +
           "WHERE t.sessionId = :sessionId AND t.paymentStatus <> :paid")
    int updateStatusUnlessPaid(
            @Param("sessionId") String sessionId,
            @Param("paid") TransactionStatus paid,
            @Param("paidAt") Instant paidAt
    );

    /**
     * Find sessions still INITIATED that were opened before the cutoff.
     *
     * @param status Status to match (INITIATED)
     * @param cutoff Creation time cutoff
     * @param pageable Batch size limit
     * @return Stale transactions, oldest first
     */
    @Query("SELECT t FROM PaymentTransaction t WHERE t.paymentStatus = :status " +
           "AND t.createdAt < :cutoff ORDER BY t.createdAt ASC")
    List<PaymentTransaction> findStale(
            @Param("status") TransactionStatus status,
            @Param("cutoff") Instant cutoff,
            Pageable pageable
    );

    /**
     * Expire a transaction if it is still INITIATED.
     * Never overwrites a transaction that was paid in the meantime.
     *
     * @param transactionId Transaction ID
     * @param expiredAt Expiry timestamp
     * @return Number of rows updated
     */
    default int expireIfInitiated(String transactionId, Instant expiredAt) {
        return compareAndSetExpired(transactionId, TransactionStatus.INITIATED, TransactionStatus.EXPIRED, expiredAt);
    }

    @Transactional
    @Modifying
    @Query("UPDATE PaymentTransaction t SET t.paymentStatus = :expired, t.expiredAt = :expiredAt " +
           "WHERE t.transactionId = :transactionId AND t.paymentStatus = :initiated")
    int compareAndSetExpired(
            @Param("transactionId") String transactionId,
            @Param("initiated") TransactionStatus initiated,
            @Param("expired") TransactionStatus expired,
            @Param("expiredAt") Instant expiredAt
    );
}
