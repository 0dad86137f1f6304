package com.nexusmarket.storefront;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Main Spring Boot application class for the storefront service.
 *
 * System Overview:
 * - Product catalogue with real-time inventory pushed over WebSocket
 * - Order placement with server-side pricing (tax, shipping, totals)
 * - Hosted checkout sessions through an external payment gateway
 * - Payment confirmation by polling or gateway webhook, settled exactly once
 * - Loyalty points credited per paid order
 *
 * Architecture:
 * - API Layer: REST controllers, webhook endpoint, WebSocket handler
 * - Service Layer: order placement, checkout coordination, payment settlement
 * - Data Access Layer: JPA repositories with conditional (compare-and-set) updates
 * - Infrastructure Layer: payment gateway adapter, Redis cache, Kafka events, CloudWatch metrics
 *
 * @author Storefront Team
 */
@SpringBootApplication
@EnableJpaRepositories
@EnableTransactionManagement
@EnableScheduling
public class StorefrontApplication {

    public static void main(String[] args) {
        SpringApplication.run(StorefrontApplication.class, args);
    }
}
