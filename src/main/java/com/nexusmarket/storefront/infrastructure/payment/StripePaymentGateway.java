package com.nexusmarket.storefront.infrastructure.payment;

import com.fasterxml.jackson.databind.JsonNode;
import com.nexusmarket.storefront.exception.PaymentGatewayException;
import com.nexusmarket.storefront.infrastructure.metrics.CloudWatchMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;

/**
 * Stripe Checkout adapter.
 * Talks to the Stripe REST API directly: form-encoded session creation and a session read for
 * status polling. Authentication and timeouts are configured on the injected {@link RestClient}.
 *
 * @author Storefront Team
 */
@Component
public class StripePaymentGateway implements PaymentGateway {

    private static final Logger logger = LoggerFactory.getLogger(StripePaymentGateway.class);

    static final String SESSIONS_PATH = "/v1/checkout/sessions";

    private final RestClient restClient;
    private final CloudWatchMetricsService metricsService;

    public StripePaymentGateway(
            @Qualifier("paymentGatewayRestClient") RestClient restClient,
            CloudWatchMetricsService metricsService
    ) {
        this.restClient = restClient;
        this.metricsService = metricsService;
    }

    @Override
    public GatewaySession createSession(CheckoutSessionCommand command) {
        long startTime = System.currentTimeMillis();
        MultiValueMap<String, String> form = toForm(command);

        JsonNode body;
        try {
            body = restClient.post()
                    .uri(SESSIONS_PATH)
                    .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                    .body(form)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientException e) {
            metricsService.recordGatewayFailure("create_session");
            throw new PaymentGatewayException("create_session", "Failed to create checkout session: " + e.getMessage(), e);
        } finally {
            metricsService.recordGatewayLatency("create_session", System.currentTimeMillis() - startTime);
        }

        String sessionId = text(body, "id");
        String url = text(body, "url");
        if (sessionId == null || url == null) {
            metricsService.recordGatewayFailure("create_session");
            throw new PaymentGatewayException("create_session", "Checkout session response is missing id or url");
        }

        logger.info("Created checkout session {} for {} {}", sessionId, command.getAmount(), command.getCurrency());
        return new GatewaySession(sessionId, url);
    }

    @Override
    public GatewaySessionStatus getStatus(String sessionId) {
        long startTime = System.currentTimeMillis();

        JsonNode body;
        try {
            body = restClient.get()
                    .uri(SESSIONS_PATH + "/{sessionId}", sessionId)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientException e) {
            metricsService.recordGatewayFailure("get_status");
            throw new PaymentGatewayException("get_status", "Failed to read checkout session " + sessionId + ": " + e.getMessage(), e);
        } finally {
            metricsService.recordGatewayLatency("get_status", System.currentTimeMillis() - startTime);
        }

        String status = text(body, "status");
        String paymentStatus = text(body, "payment_status");
        if (paymentStatus == null) {
            metricsService.recordGatewayFailure("get_status");
            throw new PaymentGatewayException("get_status", "Checkout session " + sessionId + " has no payment_status");
        }

        logger.debug("Checkout session {} status={}, payment_status={}", sessionId, status, paymentStatus);
        return new GatewaySessionStatus(status, paymentStatus);
    }

    /**
     * One line item carrying the whole order total; Stripe amounts are in minor units.
     */
    static MultiValueMap<String, String> toForm(CheckoutSessionCommand command) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("mode", "payment");
        form.add("line_items[0][quantity]", "1");
        form.add("line_items[0][price_data][currency]", command.getCurrency().toLowerCase(Locale.ROOT));
        form.add("line_items[0][price_data][unit_amount]", String.valueOf(toMinorUnits(command.getAmount())));
        form.add("line_items[0][price_data][product_data][name]", command.getDescription());
        form.add("success_url", command.getSuccessUrl());
        form.add("cancel_url", command.getCancelUrl());
        command.getMetadata().forEach((key, value) -> form.add("metadata[" + key + "]", value));
        return form;
    }

    static long toMinorUnits(BigDecimal amount) {
        return amount.movePointRight(2).setScale(0, RoundingMode.HALF_UP).longValueExact();
    }

    private static String text(JsonNode body, String field) {
        if (body == null) {
            return null;
        }
        JsonNode node = body.get(field);
        return node == null || node.isNull() ? null : node.asText();
    }
}
