package com.nexusmarket.storefront.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Duration;

/**
 * HTTP client for the payment gateway.
 * Every call is bounded by the connect and read timeouts; there is no retry layer.
 *
 * @author Storefront Team
 */
@Configuration
public class PaymentGatewayConfig {

    @Value("${storefront.payment.base-url:https://api.stripe.com}")
    private String baseUrl;

    @Value("${storefront.payment.api-key:}")
    private String apiKey;

    @Value("${storefront.payment.connect-timeout:PT2S}")
    private Duration connectTimeout;

    @Value("${storefront.payment.read-timeout:PT5S}")
    private Duration readTimeout;

    @Bean
    public RestClient paymentGatewayRestClient(RestClient.Builder builder) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) connectTimeout.toMillis());
        requestFactory.setReadTimeout((int) readTimeout.toMillis());

        return builder
                .baseUrl(baseUrl)
                .requestFactory(requestFactory)
                .defaultHeaders(headers -> headers.setBasicAuth(apiKey, ""))
                .build();
    }
}
