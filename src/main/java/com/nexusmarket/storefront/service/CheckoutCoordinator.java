package com.nexusmarket.storefront.service;

import com.nexusmarket.storefront.domain.model.Order;
import com.nexusmarket.storefront.domain.model.Order.OrderStatus;
import com.nexusmarket.storefront.domain.model.PaymentTransaction;
import com.nexusmarket.storefront.exception.OrderAlreadyPaidException;
import com.nexusmarket.storefront.exception.PaymentGatewayException;
import com.nexusmarket.storefront.exception.ResourceNotFoundException;
import com.nexusmarket.storefront.infrastructure.cache.RedisCacheService;
import com.nexusmarket.storefront.infrastructure.messaging.KafkaProducerService;
import com.nexusmarket.storefront.infrastructure.messaging.events.OrderPaidEvent;
import com.nexusmarket.storefront.infrastructure.metrics.CloudWatchMetricsService;
import com.nexusmarket.storefront.infrastructure.notification.InventoryEvent;
import com.nexusmarket.storefront.infrastructure.notification.NotificationChannel;
import com.nexusmarket.storefront.infrastructure.payment.CheckoutSessionCommand;
import com.nexusmarket.storefront.infrastructure.payment.GatewaySession;
import com.nexusmarket.storefront.infrastructure.payment.GatewaySessionStatus;
import com.nexusmarket.storefront.infrastructure.payment.PaymentGateway;
import com.nexusmarket.storefront.repository.OrderRepository;
import com.nexusmarket.storefront.repository.PaymentTransactionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Coordinates hosted checkout: opening gateway sessions for orders and reconciling their
 * payment status back into the order, inventory and loyalty stores.
 *
 * Buyer polling and gateway webhooks both end in {@link #confirmPayment(String)}, which always
 * trusts the gateway's own view of the session rather than the caller. The database work is
 * delegated to {@link PaymentSettlementService} so that no transaction is held open across a
 * gateway call; notifications go out only after the settlement has committed.
 *
 * @author Storefront Team
 */
@Service
public class CheckoutCoordinator {

    private static final Logger logger = LoggerFactory.getLogger(CheckoutCoordinator.class);

    static final String SUCCESS_PATH = "/order-success?session_id={CHECKOUT_SESSION_ID}";
    static final String CANCEL_PATH = "/checkout";

    private final OrderRepository orderRepository;
    private final PaymentTransactionRepository transactionRepository;
    private final PaymentGateway paymentGateway;
    private final PaymentSettlementService settlementService;
    private final NotificationChannel notificationChannel;
    private final RedisCacheService cacheService;
    private final KafkaProducerService kafkaProducerService;
    private final CloudWatchMetricsService metricsService;
    private final String currency;

    public CheckoutCoordinator(
            OrderRepository orderRepository,
            PaymentTransactionRepository transactionRepository,
            PaymentGateway paymentGateway,
            PaymentSettlementService settlementService,
            NotificationChannel notificationChannel,
            RedisCacheService cacheService,
            KafkaProducerService kafkaProducerService,
            CloudWatchMetricsService metricsService,
            @Value("${storefront.payment.currency:usd}") String currency
    ) {
        this.orderRepository = orderRepository;
        this.transactionRepository = transactionRepository;
        this.paymentGateway = paymentGateway;
        this.settlementService = settlementService;
        this.notificationChannel = notificationChannel;
        this.cacheService = cacheService;
        this.kafkaProducerService = kafkaProducerService;
        this.metricsService = metricsService;
        this.currency = currency;
    }

    /**
     * Open a hosted checkout session for a buyer's pending order.
     * The charged amount is always the stored order total.
     *
     * @param orderId   Order ID
     * @param buyerId   Authenticated buyer
     * @param originUrl Storefront origin the gateway redirects back to
     * @return Checkout URL and session ID
     * @throws ResourceNotFoundException if the order does not exist or belongs to someone else
     * @throws OrderAlreadyPaidException if the order is already paid
     * @throws PaymentGatewayException   if the gateway call fails; nothing is persisted
     */
    public CheckoutSession openSession(String orderId, String buyerId, String originUrl) {
        Order order = orderRepository.findByOrderIdAndUserId(orderId, buyerId)
                .orElseThrow(() -> new ResourceNotFoundException("Order", orderId));

        if (order.isPaid()) {
            logger.warn("Rejected checkout session for already paid order {}", orderId);
            throw new OrderAlreadyPaidException(orderId);
        }
        if (order.getStatus() == OrderStatus.CANCELLED) {
            throw new IllegalStateException("Order " + orderId + " is cancelled");
        }

        String origin = stripTrailingSlash(originUrl);
        CheckoutSessionCommand command = CheckoutSessionCommand.builder()
                .amount(order.getTotal())
                .currency(currency)
                .description("Order " + orderId)
                .successUrl(origin + SUCCESS_PATH)
                .cancelUrl(origin + CANCEL_PATH)
                .metadataEntry("order_id", orderId)
                .metadataEntry("user_id", buyerId)
                .build();

        GatewaySession session = paymentGateway.createSession(command);

        PaymentTransaction transaction = PaymentTransaction.builder()
                .sessionId(session.getSessionId())
                .orderId(orderId)
                .userId(buyerId)
                .amount(order.getTotal())
                .currency(currency)
                .build();
        transactionRepository.save(transaction);

        metricsService.recordCheckoutSessionOpened();
        logger.info("Opened checkout session {} for order {} ({} {})",
                session.getSessionId(), orderId, order.getTotal(), currency);
        return new CheckoutSession(session.getUrl(), session.getSessionId());
    }

    /**
     * Poll the payment status of a session on behalf of a buyer.
     * Sessions belonging to other buyers are reported as not found.
     *
     * @param sessionId Gateway session ID
     * @param buyerId   Authenticated buyer, or null to skip the ownership check (administrators)
     * @return Current status
     */
    public ConfirmationResult confirmPaymentFor(String sessionId, String buyerId) {
        PaymentTransaction transaction = findTransaction(sessionId);
        if (buyerId != null && !buyerId.equals(transaction.getUserId())) {
            throw new ResourceNotFoundException("Checkout session", sessionId);
        }
        return confirm(transaction);
    }

    /**
     * Reconcile a session with the gateway and settle the order if it has just been paid.
     * Safe to call any number of times, concurrently, from polling and webhooks.
     *
     * @param sessionId Gateway session ID
     * @return Current status; "unknown" when the gateway could not be read
     * @throws ResourceNotFoundException if no session with this ID was opened here
     */
    public ConfirmationResult confirmPayment(String sessionId) {
        return confirm(findTransaction(sessionId));
    }

    private ConfirmationResult confirm(PaymentTransaction transaction) {
        String sessionId = transaction.getSessionId();

        GatewaySessionStatus gatewayStatus;
        try {
            gatewayStatus = paymentGateway.getStatus(sessionId);
        } catch (PaymentGatewayException e) {
            logger.warn("Could not read gateway status for session {}: {}", sessionId, e.getMessage());
            return new ConfirmationResult(ConfirmationResult.UNKNOWN,
                    transaction.getPaymentStatus().value(), transaction.getOrderId());
        }

        ConfirmationResult result = new ConfirmationResult(
                gatewayStatus.getStatus(), gatewayStatus.getPaymentStatus(), transaction.getOrderId());

        if (transaction.isPaid() || !gatewayStatus.isPaid()) {
            return result;
        }

        SettlementResult settlement = settlementService.settle(transaction);
        if (settlement.isSettled()) {
            publish(settlement, sessionId);
        }
        return result;
    }

    private void publish(SettlementResult settlement, String sessionId) {
        metricsService.recordPaymentSettled();

        for (SettlementResult.StockChange change : settlement.getStockChanges()) {
            cacheService.invalidateStockCount(change.getProductId());
            notificationChannel.broadcast(InventoryEvent.stockChanged(change.getProductId(), change.getStock()));
            kafkaProducerService.publishInventoryUpdate(
                    change.getProductId(), change.getStock(), InventoryEvent.INVENTORY_UPDATE);
        }

        kafkaProducerService.publishOrderPaid(new OrderPaidEvent(
                settlement.getOrderId(), settlement.getUserId(), sessionId,
                settlement.getTotal(), settlement.getLoyaltyPoints()));
    }

    private PaymentTransaction findTransaction(String sessionId) {
        return transactionRepository.findBySessionId(sessionId)
                .orElseThrow(() -> new ResourceNotFoundException("Checkout session", sessionId));
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
