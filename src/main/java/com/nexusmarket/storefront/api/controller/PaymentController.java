package com.nexusmarket.storefront.api.controller;

import com.nexusmarket.storefront.api.dto.CheckoutSessionResponse;
import com.nexusmarket.storefront.api.dto.CreateSessionRequest;
import com.nexusmarket.storefront.api.dto.PaymentStatusResponse;
import com.nexusmarket.storefront.security.SecurityUtils;
import com.nexusmarket.storefront.service.CheckoutCoordinator;
import com.nexusmarket.storefront.service.CheckoutSession;
import com.nexusmarket.storefront.service.ConfirmationResult;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for hosted checkout.
 *
 * Flow:
 * 1. Buyer places an order (pending)
 * 2. Buyer opens a checkout session here and is redirected to the gateway
 * 3. Buyer's browser polls the session status here; the first poll that sees the payment
 *    settles the order (the gateway webhook may get there first)
 *
 * @author Storefront Team
 */
@RestController
@RequestMapping("/api/v1/payments")
public class PaymentController {

    private static final Logger logger = LoggerFactory.getLogger(PaymentController.class);

    private final CheckoutCoordinator checkoutCoordinator;

    public PaymentController(CheckoutCoordinator checkoutCoordinator) {
        this.checkoutCoordinator = checkoutCoordinator;
    }

    /**
     * Open a hosted checkout session for one of the caller's pending orders.
     *
     * @param request Order ID and storefront origin
     * @return Checkout URL and session ID
     */
    @PostMapping("/create-session")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<CheckoutSessionResponse> createSession(@Valid @RequestBody CreateSessionRequest request) {
        String buyerId = SecurityUtils.requireCurrentUserId();
        logger.info("Opening checkout session for order {} by buyer {}", request.getOrderId(), buyerId);

        CheckoutSession session = checkoutCoordinator.openSession(request.getOrderId(), buyerId, request.getOriginUrl());
        return ResponseEntity.ok(new CheckoutSessionResponse(session.getUrl(), session.getSessionId()));
    }

    /**
     * Poll the payment status of a checkout session, settling the order if it was just paid.
     *
     * @param sessionId Gateway session ID
     * @return Gateway status and payment status, or "unknown" if the gateway is unreachable
     */
    @GetMapping("/status/{sessionId}")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<PaymentStatusResponse> getPaymentStatus(@PathVariable String sessionId) {
        String buyerId = SecurityUtils.isAdmin() ? null : SecurityUtils.requireCurrentUserId();
        ConfirmationResult result = checkoutCoordinator.confirmPaymentFor(sessionId, buyerId);
        return ResponseEntity.ok(PaymentStatusResponse.from(result));
    }
}
