package com.nexusmarket.storefront.infrastructure.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

/**
 * Metrics service for the storefront checkout flow.
 * Publishes custom metrics through Micrometer; exported to CloudWatch when enabled.
 *
 * Key Metrics:
 * - Order creation and stock rejections
 * - Checkout sessions opened, settled and expired
 * - Payment gateway latency and failures
 * - Stock shortfalls at settlement and duplicate payments
 * - Cache hit/miss rates
 *
 * @author Storefront Team
 */
@Service
public class CloudWatchMetricsService {

    private static final Logger logger = LoggerFactory.getLogger(CloudWatchMetricsService.class);

    private final MeterRegistry meterRegistry;

    private static final String METRIC_PREFIX = "storefront.";
    private static final String ORDER_PREFIX = METRIC_PREFIX + "order.";
    private static final String PAYMENT_PREFIX = METRIC_PREFIX + "payment.";
    private static final String INVENTORY_PREFIX = METRIC_PREFIX + "inventory.";
    private static final String CACHE_PREFIX = METRIC_PREFIX + "cache.";

    public CloudWatchMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    /**
     * Record a successfully created order.
     */
    public void recordOrderCreated() {
        Counter.builder(ORDER_PREFIX + "created")
                .description("Orders created")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record an order rejected at creation.
     *
     * @param productId Product that caused the rejection
     * @param reason    Rejection reason (e.g., "INSUFFICIENT_STOCK")
     */
    public void recordOrderRejected(String productId, String reason) {
        Counter.builder(ORDER_PREFIX + "rejected")
                .tag("product_id", productId)
                .tag("reason", reason)
                .description("Orders rejected at creation")
                .register(meterRegistry)
                .increment();
        logger.debug("Recorded order rejection for product: {}, reason: {}", productId, reason);
    }

    public void recordCheckoutSessionOpened() {
        Counter.builder(PAYMENT_PREFIX + "session.opened")
                .description("Checkout sessions opened at the payment gateway")
                .register(meterRegistry)
                .increment();
    }

    public void recordPaymentSettled() {
        Counter.builder(PAYMENT_PREFIX + "settled")
                .description("Orders settled as paid")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record a second paid session for an order that was already settled.
     *
     * @param orderId Order ID
     */
    public void recordDuplicatePayment(String orderId) {
        Counter.builder(PAYMENT_PREFIX + "duplicate")
                .description("Paid sessions for orders already settled")
                .register(meterRegistry)
                .increment();
        logger.warn("Recorded duplicate payment for order: {}", orderId);
    }

    /**
     * Record checkout sessions expired by the scheduler.
     *
     * @param count Number of sessions expired in the run
     */
    public void recordSessionsExpired(int count) {
        Counter.builder(PAYMENT_PREFIX + "session.expired")
                .description("Abandoned checkout sessions expired")
                .register(meterRegistry)
                .increment(count);
    }

    /**
     * Record a payment gateway call failure.
     *
     * @param operation Gateway operation (e.g., "create_session", "get_status")
     */
    public void recordGatewayFailure(String operation) {
        Counter.builder(PAYMENT_PREFIX + "gateway.failure")
                .tag("operation", operation)
                .description("Payment gateway call failures")
                .register(meterRegistry)
                .increment();
        logger.warn("Recorded gateway failure: operation={}", operation);
    }

    /**
     * Record payment gateway call latency.
     *
     * @param operation  Gateway operation
     * @param durationMs Duration in milliseconds
     */
    public void recordGatewayLatency(String operation, long durationMs) {
        Timer.builder(PAYMENT_PREFIX + "gateway.latency")
                .tag("operation", operation)
                .description("Payment gateway call latency")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Record a paid order line that could not be fulfilled from stock.
     *
     * @param productId Product ID
     * @param shortfall Units sold beyond available stock
     */
    public void recordStockShortfall(String productId, int shortfall) {
        Counter.builder(INVENTORY_PREFIX + "shortfall")
                .tag("product_id", productId)
                .description("Units paid for but not available in stock")
                .register(meterRegistry)
                .increment(shortfall);
        logger.error("Recorded stock shortfall for product: {}, units: {}", productId, shortfall);
    }

    public void recordStockOut(String productId) {
        Counter.builder(INVENTORY_PREFIX + "stockout")
                .tag("product_id", productId)
                .description("Product stock out events")
                .register(meterRegistry)
                .increment();
        logger.info("Recorded stock out for product: {}", productId);
    }

    /**
     * Record cache hit.
     *
     * @param cacheType Cache type (e.g., "stock")
     */
    public void recordCacheHit(String cacheType) {
        Counter.builder(CACHE_PREFIX + "hit")
                .tag("cache_type", cacheType)
                .register(meterRegistry)
                .increment();
    }

    public void recordCacheMiss(String cacheType) {
        Counter.builder(CACHE_PREFIX + "miss")
                .tag("cache_type", cacheType)
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record error occurrence.
     *
     * @param errorType Error type (e.g., "WEBHOOK_ERROR", "CACHE_ERROR")
     * @param operation Operation where error occurred
     */
    public void recordError(String errorType, String operation) {
        Counter.builder(METRIC_PREFIX + "error")
                .tag("error_type", errorType)
                .tag("operation", operation)
                .description("System errors")
                .register(meterRegistry)
                .increment();
        logger.warn("Recorded error: type={}, operation={}", errorType, operation);
    }
}
