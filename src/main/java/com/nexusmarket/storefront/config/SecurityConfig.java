package com.nexusmarket.storefront.config;

import com.nexusmarket.storefront.security.HeaderAuthenticationFilter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.security.config.annotation.method.configuration.EnableMethodSecurity;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.HttpStatusEntryPoint;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

/**
 * Security configuration for the storefront service.
 *
 * Authentication Strategy:
 * - Identity headers from the API gateway (see {@link HeaderAuthenticationFilter})
 * - Stateless, no server-side sessions
 *
 * Authorization:
 * - Method-level security using @PreAuthorize annotations
 * - Buyers see only their own orders, checkout sessions, cart and wishlist
 * - Sellers manage their own products; ADMIN manages everything
 *
 * Public Endpoints:
 * - GET /api/v1/products/** (catalogue reads, including reviews)
 * - GET /api/v1/categories
 * - /api/v1/webhook/** (payment gateway callbacks; the payload is never trusted)
 * - /ws/** (inventory feed handshake)
 * - /actuator/** (health checks, metrics)
 *
 * @author Storefront Team
 */
@Configuration
@EnableWebSecurity
@EnableMethodSecurity
public class SecurityConfig {

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        http
            .csrf(csrf -> csrf.disable())
            .authorizeHttpRequests(auth -> auth
                .requestMatchers("/actuator/**").permitAll()
                .requestMatchers(HttpMethod.GET, "/api/v1/products", "/api/v1/products/**").permitAll()
                .requestMatchers(HttpMethod.GET, "/api/v1/categories").permitAll()
                .requestMatchers("/api/v1/webhook/**").permitAll()
                .requestMatchers("/ws/**").permitAll()
                .requestMatchers("/error").permitAll()
                .anyRequest().authenticated()
            )
            .sessionManagement(session -> session
                .sessionCreationPolicy(SessionCreationPolicy.STATELESS)
            )
            .exceptionHandling(exceptions -> exceptions
                .authenticationEntryPoint(new HttpStatusEntryPoint(HttpStatus.UNAUTHORIZED))
            )
            // Not a bean: runs only inside the security chain
            .addFilterBefore(new HeaderAuthenticationFilter(), UsernamePasswordAuthenticationFilter.class);

        return http.build();
    }
}
