package com.nexusmarket.storefront.infrastructure.notification;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * Handler for {@code /ws/inventory}. The channel is push-only; inbound text frames are ignored.
 *
 * @author Storefront Team
 */
@Component
public class InventoryWebSocketHandler extends TextWebSocketHandler {

    private static final Logger logger = LoggerFactory.getLogger(InventoryWebSocketHandler.class);

    private final NotificationChannel notificationChannel;

    public InventoryWebSocketHandler(NotificationChannel notificationChannel) {
        this.notificationChannel = notificationChannel;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        notificationChannel.subscribe(session);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        logger.debug("Ignoring inbound message on inventory channel from {}", session.getId());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        logger.warn("Transport error on inventory observer {}: {}", session.getId(), exception.getMessage());
        notificationChannel.unsubscribe(session);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        notificationChannel.unsubscribe(session);
    }
}
