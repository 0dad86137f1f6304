package com.nexusmarket.storefront.infrastructure.payment;

import com.nexusmarket.storefront.exception.PaymentGatewayException;
import com.nexusmarket.storefront.infrastructure.metrics.CloudWatchMetricsService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.math.BigDecimal;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

/**
 * Tests for the Stripe Checkout adapter against a mocked HTTP server.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("StripePaymentGateway Tests")
class StripePaymentGatewayTest {

    private static final String BASE_URL = "https://api.stripe.test";

    @Mock
    private CloudWatchMetricsService metricsService;

    private MockRestServiceServer server;
    private StripePaymentGateway gateway;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl(BASE_URL);
        server = MockRestServiceServer.bindTo(builder).build();
        gateway = new StripePaymentGateway(builder.build(), metricsService);
    }

    // ========================================
    // createSession() Tests
    // ========================================

    @Test
    @DisplayName("createSession - Posts the total in minor units with redirect URLs and metadata")
    void createSession_Success() {
        // Given
        server.expect(requestTo(BASE_URL + "/v1/checkout/sessions"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_FORM_URLENCODED))
                .andExpect(content().formDataContains(Map.of(
                        "mode", "payment",
                        "line_items[0][quantity]", "1",
                        "line_items[0][price_data][currency]", "usd",
                        "line_items[0][price_data][unit_amount]", "10900",
                        "success_url", "https://shop.example.com/order-success?session_id={CHECKOUT_SESSION_ID}",
                        "cancel_url", "https://shop.example.com/checkout",
                        "metadata[order_id]", "ord_1")))
                .andRespond(withSuccess("""
                        {"id": "cs_test_1", "url": "https://checkout.stripe.com/c/pay/cs_test_1", "status": "open"}
                        """, MediaType.APPLICATION_JSON));

        // When
        GatewaySession session = gateway.createSession(command());

        // Then
        assertThat(session.getSessionId()).isEqualTo("cs_test_1");
        assertThat(session.getUrl()).isEqualTo("https://checkout.stripe.com/c/pay/cs_test_1");
        server.verify();
        verify(metricsService).recordGatewayLatency(eq("create_session"), anyLong());
        verify(metricsService, never()).recordGatewayFailure(anyString());
    }

    @Test
    @DisplayName("createSession - Gateway error: Should raise PaymentGatewayException")
    void createSession_ServerError_Throws() {
        // Given
        server.expect(requestTo(BASE_URL + "/v1/checkout/sessions"))
                .andRespond(withServerError());

        // When / Then
        assertThatThrownBy(() -> gateway.createSession(command()))
                .isInstanceOf(PaymentGatewayException.class)
                .extracting("operation")
                .isEqualTo("create_session");
        verify(metricsService).recordGatewayFailure("create_session");
    }

    @Test
    @DisplayName("createSession - Response without a URL: Should raise PaymentGatewayException")
    void createSession_IncompleteResponse_Throws() {
        // Given
        server.expect(requestTo(BASE_URL + "/v1/checkout/sessions"))
                .andRespond(withSuccess("{\"id\": \"cs_test_1\"}", MediaType.APPLICATION_JSON));

        // When / Then
        assertThatThrownBy(() -> gateway.createSession(command()))
                .isInstanceOf(PaymentGatewayException.class);
    }

    // ========================================
    // getStatus() Tests
    // ========================================

    @Test
    @DisplayName("getStatus - Paid session")
    void getStatus_Paid() {
        // Given
        server.expect(requestTo(BASE_URL + "/v1/checkout/sessions/cs_test_1"))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess("""
                        {"id": "cs_test_1", "status": "complete", "payment_status": "paid"}
                        """, MediaType.APPLICATION_JSON));

        // When
        GatewaySessionStatus status = gateway.getStatus("cs_test_1");

        // Then
        assertThat(status.getStatus()).isEqualTo("complete");
        assertThat(status.getPaymentStatus()).isEqualTo("paid");
        assertThat(status.isPaid()).isTrue();
    }

    @Test
    @DisplayName("getStatus - Open session is not paid")
    void getStatus_Unpaid() {
        // Given
        server.expect(requestTo(BASE_URL + "/v1/checkout/sessions/cs_test_1"))
                .andRespond(withSuccess("""
                        {"id": "cs_test_1", "status": "open", "payment_status": "unpaid"}
                        """, MediaType.APPLICATION_JSON));

        // When / Then
        assertThat(gateway.getStatus("cs_test_1").isPaid()).isFalse();
    }

    @Test
    @DisplayName("getStatus - Unknown session: Should raise PaymentGatewayException")
    void getStatus_NotFound_Throws() {
        // Given
        server.expect(requestTo(BASE_URL + "/v1/checkout/sessions/cs_missing"))
                .andRespond(withStatus(HttpStatus.NOT_FOUND));

        // When / Then
        assertThatThrownBy(() -> gateway.getStatus("cs_missing"))
                .isInstanceOf(PaymentGatewayException.class);
        verify(metricsService).recordGatewayFailure("get_status");
    }

    // ========================================
    // Amount Conversion Tests
    // ========================================

    @Test
    @DisplayName("toMinorUnits - Converts major units to cents")
    void toMinorUnits() {
        assertThat(StripePaymentGateway.toMinorUnits(new BigDecimal("109.00"))).isEqualTo(10900L);
        assertThat(StripePaymentGateway.toMinorUnits(new BigDecimal("0.5"))).isEqualTo(50L);
        assertThat(StripePaymentGateway.toMinorUnits(new BigDecimal("12.345"))).isEqualTo(1235L);
    }

    private static CheckoutSessionCommand command() {
        return CheckoutSessionCommand.builder()
                .amount(new BigDecimal("109.00"))
                .currency("USD")
                .description("Order ord_1")
                .successUrl("https://shop.example.com/order-success?session_id={CHECKOUT_SESSION_ID}")
                .cancelUrl("https://shop.example.com/checkout")
                .metadataEntry("order_id", "ord_1")
                .metadataEntry("user_id", "buyer-1")
                .build();
    }
}
