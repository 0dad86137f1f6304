package com.nexusmarket.storefront.config;

import com.nexusmarket.storefront.infrastructure.notification.InventoryWebSocketHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * Raw WebSocket endpoint for live inventory updates.
 * Clients connect with: ws://host:port/ws/inventory
 *
 * @author Storefront Team
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final InventoryWebSocketHandler inventoryWebSocketHandler;

    @Value("${storefront.websocket.allowed-origins:*}")
    private String[] allowedOrigins;

    public WebSocketConfig(InventoryWebSocketHandler inventoryWebSocketHandler) {
        this.inventoryWebSocketHandler = inventoryWebSocketHandler;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(inventoryWebSocketHandler, "/ws/inventory")
                .setAllowedOriginPatterns(allowedOrigins);
    }
}
