package com.nexusmarket.storefront.api.controller;

import com.nexusmarket.storefront.api.exception.GlobalExceptionHandler;
import com.nexusmarket.storefront.config.SecurityConfig;
import com.nexusmarket.storefront.exception.OrderAlreadyPaidException;
import com.nexusmarket.storefront.exception.PaymentGatewayException;
import com.nexusmarket.storefront.exception.ResourceNotFoundException;
import com.nexusmarket.storefront.service.CheckoutCoordinator;
import com.nexusmarket.storefront.service.CheckoutSession;
import com.nexusmarket.storefront.service.ConfirmationResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ContextConfiguration;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Unit tests for PaymentController using MockMvc.
 */
@WebMvcTest(PaymentController.class)
@ContextConfiguration(classes = {PaymentController.class, GlobalExceptionHandler.class, SecurityConfig.class})
@DisplayName("PaymentController Tests")
class PaymentControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private CheckoutCoordinator checkoutCoordinator;

    private static final String SESSION_REQUEST = """
            {
                "order_id": "ord_1",
                "origin_url": "https://shop.example.com"
            }
            """;

    // ========================================
    // POST /api/v1/payments/create-session Tests
    // ========================================

    @Test
    @DisplayName("POST /create-session - Pending order returns checkout URL and session ID")
    void createSession_Success() throws Exception {
        // Given
        when(checkoutCoordinator.openSession("ord_1", "buyer-1", "https://shop.example.com"))
                .thenReturn(new CheckoutSession("https://checkout.stripe.com/c/pay/cs_1", "cs_1"));

        // When / Then
        mockMvc.perform(post("/api/v1/payments/create-session")
                        .header("X-User-Id", "buyer-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(SESSION_REQUEST))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.url").value("https://checkout.stripe.com/c/pay/cs_1"))
                .andExpect(jsonPath("$.session_id").value("cs_1"));
    }

    @Test
    @DisplayName("POST /create-session - Paid order returns 409")
    void createSession_AlreadyPaid_Returns409() throws Exception {
        // Given
        when(checkoutCoordinator.openSession(anyString(), anyString(), anyString()))
                .thenThrow(new OrderAlreadyPaidException("ord_1"));

        // When / Then
        mockMvc.perform(post("/api/v1/payments/create-session")
                        .header("X-User-Id", "buyer-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(SESSION_REQUEST))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.details.orderId").value("ord_1"));
    }

    @Test
    @DisplayName("POST /create-session - Gateway down returns 503 marked retryable")
    void createSession_GatewayDown_Returns503() throws Exception {
        // Given
        when(checkoutCoordinator.openSession(anyString(), anyString(), anyString()))
                .thenThrow(new PaymentGatewayException("create_session", "connection refused"));

        // When / Then
        mockMvc.perform(post("/api/v1/payments/create-session")
                        .header("X-User-Id", "buyer-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(SESSION_REQUEST))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.details.retryable").value(true));
    }

    @Test
    @DisplayName("POST /create-session - Origin that is not an http(s) URL returns 400")
    void createSession_BadOrigin_Returns400() throws Exception {
        String requestBody = """
                {
                    "order_id": "ord_1",
                    "origin_url": "javascript:alert(1)"
                }
                """;

        mockMvc.perform(post("/api/v1/payments/create-session")
                        .header("X-User-Id", "buyer-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(requestBody))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(checkoutCoordinator);
    }

    @Test
    @DisplayName("POST /create-session - Anonymous caller returns 401")
    void createSession_Anonymous_Returns401() throws Exception {
        mockMvc.perform(post("/api/v1/payments/create-session")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(SESSION_REQUEST))
                .andExpect(status().isUnauthorized());
    }

    // ========================================
    // GET /api/v1/payments/status/{sessionId} Tests
    // ========================================

    @Test
    @DisplayName("GET /status/{sessionId} - Returns the reconciled status")
    void getStatus_Success() throws Exception {
        // Given
        when(checkoutCoordinator.confirmPaymentFor("cs_1", "buyer-1"))
                .thenReturn(new ConfirmationResult("complete", "paid", "ord_1"));

        // When / Then
        mockMvc.perform(get("/api/v1/payments/status/{sessionId}", "cs_1").header("X-User-Id", "buyer-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("complete"))
                .andExpect(jsonPath("$.payment_status").value("paid"))
                .andExpect(jsonPath("$.order_id").value("ord_1"));
    }

    @Test
    @DisplayName("GET /status/{sessionId} - Gateway unreachable still returns 200 with unknown status")
    void getStatus_GatewayUnknown_Returns200() throws Exception {
        // Given
        when(checkoutCoordinator.confirmPaymentFor("cs_1", "buyer-1"))
                .thenReturn(new ConfirmationResult(ConfirmationResult.UNKNOWN, "initiated", "ord_1"));

        // When / Then
        mockMvc.perform(get("/api/v1/payments/status/{sessionId}", "cs_1").header("X-User-Id", "buyer-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("unknown"))
                .andExpect(jsonPath("$.payment_status").value("initiated"));
    }

    @Test
    @DisplayName("GET /status/{sessionId} - Another buyer's session returns 404")
    void getStatus_OtherBuyer_Returns404() throws Exception {
        // Given
        when(checkoutCoordinator.confirmPaymentFor("cs_1", "buyer-2"))
                .thenThrow(new ResourceNotFoundException("Checkout session", "cs_1"));

        // When / Then
        mockMvc.perform(get("/api/v1/payments/status/{sessionId}", "cs_1").header("X-User-Id", "buyer-2"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("GET /status/{sessionId} - Administrator is not scoped to a buyer")
    void getStatus_Admin_Unscoped() throws Exception {
        // Given
        when(checkoutCoordinator.confirmPaymentFor("cs_1", null))
                .thenReturn(new ConfirmationResult("open", "unpaid", "ord_1"));

        // When / Then
        mockMvc.perform(get("/api/v1/payments/status/{sessionId}", "cs_1")
                        .header("X-User-Id", "admin-1")
                        .header("X-User-Role", "ADMIN"))
                .andExpect(status().isOk());

        verify(checkoutCoordinator).confirmPaymentFor("cs_1", null);
    }
}
