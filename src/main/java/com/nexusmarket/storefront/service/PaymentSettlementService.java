package com.nexusmarket.storefront.service;

import com.nexusmarket.storefront.domain.model.Order;
import com.nexusmarket.storefront.domain.model.OrderLine;
import com.nexusmarket.storefront.domain.model.PaymentTransaction;
import com.nexusmarket.storefront.domain.model.User;
import com.nexusmarket.storefront.infrastructure.metrics.CloudWatchMetricsService;
import com.nexusmarket.storefront.repository.OrderRepository;
import com.nexusmarket.storefront.repository.PaymentTransactionRepository;
import com.nexusmarket.storefront.repository.ProductRepository;
import com.nexusmarket.storefront.repository.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Applies the side effects of a paid checkout session in one database transaction.
 *
 * Flow:
 * 1. Compare-and-set the transaction to PAID (the idempotency gate; at most one caller wins)
 * 2. Compare-and-set the order from payment PENDING to PAID, status PROCESSING
 * 3. Conditionally decrement stock for every product on the order
 * 4. Credit the buyer with floor(total) loyalty points
 *
 * A caller that loses step 1 changes nothing. Nothing in here talks to the payment gateway or
 * the notification channel: the caller publishes the returned stock changes once this
 * transaction has committed.
 *
 * @author Storefront Team
 */
@Service
public class PaymentSettlementService {

    private static final Logger logger = LoggerFactory.getLogger(PaymentSettlementService.class);

    private final PaymentTransactionRepository transactionRepository;
    private final OrderRepository orderRepository;
    private final ProductRepository productRepository;
    private final UserRepository userRepository;
    private final CloudWatchMetricsService metricsService;

    public PaymentSettlementService(
            PaymentTransactionRepository transactionRepository,
            OrderRepository orderRepository,
            ProductRepository productRepository,
            UserRepository userRepository,
            CloudWatchMetricsService metricsService
    ) {
        this.transactionRepository = transactionRepository;
        this.orderRepository = orderRepository;
        this.productRepository = productRepository;
        this.userRepository = userRepository;
        this.metricsService = metricsService;
    }

    /**
     * Settle a checkout session the gateway reports as paid.
     *
     * @param transaction Transaction looked up by session ID
     * @return Outcome, with the stock changes to publish when this call settled the order
     */
    @Transactional
    public SettlementResult settle(PaymentTransaction transaction) {
        String sessionId = transaction.getSessionId();
        String orderId = transaction.getOrderId();

        if (transactionRepository.markPaid(sessionId, Instant.now()) == 0) {
            logger.info("Checkout session {} already settled, skipping", sessionId);
            return SettlementResult.alreadySettled(orderId);
        }

        Order order = orderRepository.findById(orderId)
                .orElseThrow(() -> new IllegalStateException(
                        "Order " + orderId + " referenced by session " + sessionId + " does not exist"));

        if (orderRepository.markPaid(orderId) == 0) {
            // Money was taken twice for one order; stock and loyalty were applied by the first session
            logger.error("Order {} was already paid; session {} is a duplicate payment and needs a refund",
                    orderId, sessionId);
            metricsService.recordDuplicatePayment(orderId);
            return SettlementResult.duplicatePayment(orderId);
        }

        List<SettlementResult.StockChange> stockChanges = decrementStock(order);

        int points = order.loyaltyPoints();
        creditLoyaltyPoints(order.getUserId(), points);

        logger.info("Settled order {} via session {}: total={}, loyalty points={}, stock changes={}",
                orderId, sessionId, order.getTotal(), points, stockChanges);
        return SettlementResult.settled(orderId, order.getUserId(), order.getTotal(), points, stockChanges);
    }

    private List<SettlementResult.StockChange> decrementStock(Order order) {
        Map<String, Integer> quantities = new LinkedHashMap<>();
        for (OrderLine line : order.getLines()) {
            quantities.merge(line.getProductId(), line.getQuantity(), Math::addExact);
        }

        List<SettlementResult.StockChange> changes = new ArrayList<>();
        for (Map.Entry<String, Integer> entry : quantities.entrySet()) {
            String productId = entry.getKey();
            int quantity = entry.getValue();
            if (quantity <= 0) {
                logger.error("Skipping stock decrement for product {} on order {}: non-positive quantity {}",
                        productId, order.getOrderId(), quantity);
                continue;
            }

            int updated = productRepository.decrementStock(productId, quantity);
            Integer stock = productRepository.findStockByProductId(productId);

            if (updated == 0) {
                // The sale stands; fulfilment reconciles the shortfall
                int shortfall = stock == null ? quantity : quantity - stock;
                logger.error("Insufficient stock for product {} on paid order {}: ordered {}, available {}",
                        productId, order.getOrderId(), quantity, stock);
                metricsService.recordStockShortfall(productId, shortfall);
                continue;
            }

            changes.add(new SettlementResult.StockChange(productId, stock));
            if (stock == 0) {
                metricsService.recordStockOut(productId);
            }
        }
        return changes;
    }

    private void creditLoyaltyPoints(String userId, int points) {
        if (userRepository.creditLoyaltyPoints(userId, points) == 0) {
            userRepository.save(User.builder().userId(userId).loyaltyPoints(points).build());
            logger.info("Registered user {} with {} loyalty points", userId, points);
        }
    }
}
