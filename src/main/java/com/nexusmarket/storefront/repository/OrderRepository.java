package com.nexusmarket.storefront.repository;

import com.nexusmarket.storefront.domain.model.Order;
import com.nexusmarket.storefront.domain.model.Order.OrderStatus;
import com.nexusmarket.storefront.domain.model.Order.PaymentStatus;
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
 * Repository interface for Order entity.
 * The entity is named {@code CustomerOrder} in JPQL since ORDER is a keyword.
 *
 * @author Storefront Team
 */
@Repository
public interface OrderRepository extends JpaRepository<Order, String> {

    /**
     * Find an order only if it belongs to the given buyer.
     *
     * @param orderId Order ID
     * @param userId Buyer ID
     * @return Optional containing the order if found and owned
     */
    Optional<Order> findByOrderIdAndUserId(String orderId, String userId);

    List<Order> findByUserIdOrderByCreatedAtDesc(String userId);

    List<Order> findAllByOrderByCreatedAtDesc();

    /**
     * Mark an order paid and move it to PROCESSING.
     * Compare-and-set on the payment status: succeeds only while it is still PENDING.
     *
     * @param orderId Order ID
     * @return Number of rows updated (1 on the first call, 0 afterwards)
     */
    default int markPaid(String orderId) {
        return compareAndSetPaymentStatus(orderId, PaymentStatus.PENDING, PaymentStatus.PAID, OrderStatus.PROCESSING, Instant.now());
    }

    @Transactional
    @Modifying
    @Query("UPDATE CustomerOrder o SET " +
           "o.paymentStatus = :newPaymentStatus, " +
           "o.status = :newStatus, " +
           "o.updatedAt = :updatedAt " +
           "WHERE o.orderId = :orderId AND o.paymentStatus = :expectedPaymentStatus")
    int compareAndSetPaymentStatus(
            @Param("orderId") String orderId,
            @Param("expectedPaymentStatus") PaymentStatus expectedPaymentStatus,
            @Param("newPaymentStatus") PaymentStatus newPaymentStatus,
            @Param("newStatus") OrderStatus newStatus,
            @Param("updatedAt") Instant updatedAt
    );

    /**
     * Set the fulfilment status and, when given, the tracking number.
     * Leaves the payment status untouched.
     *
     * @return Number of rows updated (0 if the order does not exist)
     */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("UPDATE CustomerOrder o SET " +
           "o.status = :status, " +
           "o.trackingNumber = COALESCE(:trackingNumber, o.trackingNumber), " +
           "o.updatedAt = :updatedAt " +
           "WHERE o.orderId = :orderId")
    int updateFulfilmentStatus(
            @Param("orderId") String orderId,
            @Param("status") OrderStatus status,
            @Param("trackingNumber") String trackingNumber,
            @Param("updatedAt") Instant updatedAt
    );
}
