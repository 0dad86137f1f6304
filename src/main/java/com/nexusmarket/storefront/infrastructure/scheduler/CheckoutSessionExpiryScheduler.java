package com.nexusmarket.storefront.infrastructure.scheduler;

import com.nexusmarket.storefront.domain.model.PaymentTransaction;
import com.nexusmarket.storefront.domain.model.PaymentTransaction.TransactionStatus;
import com.nexusmarket.storefront.infrastructure.metrics.CloudWatchMetricsService;
import com.nexusmarket.storefront.repository.PaymentTransactionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Scheduled job that expires abandoned checkout sessions.
 *
 * A session still INITIATED after the configured time-to-live (default 24 hours, the lifetime
 * of a hosted checkout page) is marked EXPIRED. The order stays pending, so the buyer can open
 * a new session. Expiry is a compare-and-set from INITIATED, so a session paid in the
 * meantime is never touched, and a late paid confirmation still settles an expired session.
 *
 * @author Storefront Team
 */
@Service
public class CheckoutSessionExpiryScheduler {

    private static final Logger logger = LoggerFactory.getLogger(CheckoutSessionExpiryScheduler.class);

    private final PaymentTransactionRepository transactionRepository;
    private final CloudWatchMetricsService metricsService;

    @Value("${storefront.checkout.expiry-scheduler.enabled:true}")
    private boolean schedulerEnabled;

    @Value("${storefront.checkout.expiry-scheduler.batch-size:100}")
    private int batchSize;

    @Value("${storefront.checkout.session-ttl:PT24H}")
    private Duration sessionTtl;

    public CheckoutSessionExpiryScheduler(
            PaymentTransactionRepository transactionRepository,
            CloudWatchMetricsService metricsService
    ) {
        this.transactionRepository = transactionRepository;
        this.metricsService = metricsService;
    }

    @Scheduled(fixedDelayString = "${storefront.checkout.expiry-scheduler.interval-ms:300000}")
    public void expireAbandonedSessions() {
        if (!schedulerEnabled) {
            logger.debug("Checkout session expiry scheduler is disabled");
            return;
        }
        expireBatch();
    }

    /**
     * Expire one batch of stale sessions.
     *
     * @return Number of sessions expired
     */
    public int expireBatch() {
        Instant now = Instant.now();
        List<PaymentTransaction> stale = transactionRepository.findStale(
                TransactionStatus.INITIATED, now.minus(sessionTtl), PageRequest.of(0, batchSize));

        if (stale.isEmpty()) {
            logger.debug("No abandoned checkout sessions found");
            return 0;
        }

        int expired = 0;
        for (PaymentTransaction transaction : stale) {
            if (transactionRepository.expireIfInitiated(transaction.getTransactionId(), now) == 1) {
                expired++;
                logger.info("Expired checkout session {} for order {}",
                        transaction.getSessionId(), transaction.getOrderId());
            } else {
                logger.debug("Checkout session {} changed state before expiry, skipping", transaction.getSessionId());
            }
        }

        metricsService.recordSessionsExpired(expired);
        logger.info("Expired {} of {} abandoned checkout sessions", expired, stale.size());
        return expired;
    }
}
