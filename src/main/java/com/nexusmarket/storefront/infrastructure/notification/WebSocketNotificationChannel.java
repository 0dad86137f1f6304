package com.nexusmarket.storefront.infrastructure.notification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of open WebSocket sessions on the inventory channel.
 *
 * Sessions are wrapped in {@link ConcurrentWebSocketSessionDecorator} so that broadcasts from
 * different request threads never interleave on one connection, and a slow client is cut off
 * once its send time or buffer limit is exceeded. A session whose send fails is closed and
 * removed from the registry.
 *
 * @author Storefront Team
 */
@Component
public class WebSocketNotificationChannel implements NotificationChannel {

    private static final Logger logger = LoggerFactory.getLogger(WebSocketNotificationChannel.class);

    private final Map<String, WebSocketSession> sessions = new ConcurrentHashMap<>();
    private final ObjectMapper objectMapper;
    private final int sendTimeLimitMs;
    private final int bufferSizeLimit;

    public WebSocketNotificationChannel(
            ObjectMapper objectMapper,
            @Value("${storefront.websocket.send-time-limit-ms:5000}") int sendTimeLimitMs,
            @Value("${storefront.websocket.buffer-size-limit:65536}") int bufferSizeLimit
    ) {
        this.objectMapper = objectMapper;
        this.sendTimeLimitMs = sendTimeLimitMs;
        this.bufferSizeLimit = bufferSizeLimit;
    }

    @Override
    public void subscribe(WebSocketSession session) {
        sessions.put(session.getId(),
                new ConcurrentWebSocketSessionDecorator(session, sendTimeLimitMs, bufferSizeLimit));
        logger.info("Inventory observer connected: {} ({} connected)", session.getId(), sessions.size());
    }

    @Override
    public void unsubscribe(WebSocketSession session) {
        if (sessions.remove(session.getId()) != null) {
            logger.info("Inventory observer disconnected: {} ({} connected)", session.getId(), sessions.size());
        }
    }

    @Override
    public void broadcast(InventoryEvent event) {
        TextMessage message;
        try {
            message = new TextMessage(objectMapper.writeValueAsString(event));
        } catch (JsonProcessingException e) {
            logger.error("Error serializing inventory event {}", event, e);
            return;
        }

        List<WebSocketSession> snapshot = new ArrayList<>(sessions.values());
        int delivered = 0;
        for (WebSocketSession session : snapshot) {
            if (send(session, message)) {
                delivered++;
            }
        }
        logger.debug("Broadcast {} for product {} to {}/{} observers",
                event.getType(), event.getProductId(), delivered, snapshot.size());
    }

    @Override
    public int subscriberCount() {
        return sessions.size();
    }

    private boolean send(WebSocketSession session, TextMessage message) {
        if (!session.isOpen()) {
            sessions.remove(session.getId());
            return false;
        }
        try {
            session.sendMessage(message);
            return true;
        } catch (IOException | RuntimeException e) {
            logger.warn("Dropping inventory observer {} after failed send: {}", session.getId(), e.getMessage());
            sessions.remove(session.getId());
            closeQuietly(session);
            return false;
        }
    }

    private void closeQuietly(WebSocketSession session) {
        try {
            session.close(CloseStatus.SESSION_NOT_RELIABLE);
        } catch (IOException e) {
            logger.debug("Error closing inventory observer {}", session.getId(), e);
        }
    }
}
