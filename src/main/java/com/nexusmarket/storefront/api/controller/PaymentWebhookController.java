package com.nexusmarket.storefront.api.controller;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nexusmarket.storefront.api.dto.WebhookAck;
import com.nexusmarket.storefront.infrastructure.metrics.CloudWatchMetricsService;
import com.nexusmarket.storefront.service.CheckoutCoordinator;
import com.nexusmarket.storefront.service.ConfirmationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Set;

/**
 * Receiver for payment gateway webhooks.
 *
 * The payload only tells us which session to look at; its payment status is always re-read
 * from the gateway, so a forged call cannot mark an order paid. Every delivery is acknowledged
 * with {@code {"received": true}}, including ones that fail, so the gateway does not retry
 * indefinitely; failures are logged and counted instead.
 *
 * @author Storefront Team
 */
@RestController
@RequestMapping("/api/v1/webhook")
public class PaymentWebhookController {

    private static final Logger logger = LoggerFactory.getLogger(PaymentWebhookController.class);

    static final Set<String> SETTLEMENT_EVENTS = Set.of(
            "checkout.session.completed",
            "checkout.session.async_payment_succeeded"
    );

    private final CheckoutCoordinator checkoutCoordinator;
    private final ObjectMapper objectMapper;
    private final CloudWatchMetricsService metricsService;

    public PaymentWebhookController(
            CheckoutCoordinator checkoutCoordinator,
            ObjectMapper objectMapper,
            CloudWatchMetricsService metricsService
    ) {
        this.checkoutCoordinator = checkoutCoordinator;
        this.objectMapper = objectMapper;
        this.metricsService = metricsService;
    }

    @PostMapping("/payment")
    public ResponseEntity<WebhookAck> handlePaymentEvent(@RequestBody(required = false) String payload) {
        try {
            process(payload);
        } catch (RuntimeException e) {
            logger.error("Failed to process payment webhook", e);
            metricsService.recordError("WEBHOOK_ERROR", "payment_webhook");
        }
        return ResponseEntity.ok(WebhookAck.received());
    }

    private void process(String payload) {
        if (payload == null || payload.isBlank()) {
            logger.warn("Ignoring empty payment webhook");
            return;
        }

        JsonNode event;
        try {
            event = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            logger.warn("Ignoring unparseable payment webhook: {}", e.getOriginalMessage());
            metricsService.recordError("WEBHOOK_MALFORMED", "payment_webhook");
            return;
        }

        String type = event.path("type").asText("");
        if (!SETTLEMENT_EVENTS.contains(type)) {
            logger.debug("Ignoring payment webhook of type '{}'", type);
            return;
        }

        String sessionId = event.path("data").path("object").path("id").asText("");
        if (sessionId.isEmpty()) {
            logger.warn("Payment webhook {} carries no session ID", type);
            metricsService.recordError("WEBHOOK_MALFORMED", "payment_webhook");
            return;
        }

        ConfirmationResult result = checkoutCoordinator.confirmPayment(sessionId);
        logger.info("Payment webhook {} for session {}: status={}, payment_status={}, order={}",
                type, sessionId, result.getStatus(), result.getPaymentStatus(), result.getOrderId());
    }
}
