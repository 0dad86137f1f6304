package com.nexusmarket.storefront.infrastructure.notification;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;

import static org.mockito.Mockito.*;

/**
 * Unit tests for InventoryWebSocketHandler.
 * The registry is replaced through the NotificationChannel interface.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("InventoryWebSocketHandler Unit Tests")
class InventoryWebSocketHandlerTest {

    @Mock
    private NotificationChannel notificationChannel;

    @Mock
    private WebSocketSession session;

    @InjectMocks
    private InventoryWebSocketHandler handler;

    @Test
    @DisplayName("afterConnectionEstablished - Subscribes the session")
    void connect_Subscribes() {
        // When
        handler.afterConnectionEstablished(session);

        // Then
        verify(notificationChannel).subscribe(session);
        verifyNoMoreInteractions(notificationChannel);
    }

    @Test
    @DisplayName("afterConnectionClosed - Unsubscribes the session")
    void close_Unsubscribes() {
        // When
        handler.afterConnectionClosed(session, CloseStatus.NORMAL);

        // Then
        verify(notificationChannel).unsubscribe(session);
    }

    @Test
    @DisplayName("handleTransportError - Unsubscribes the session")
    void transportError_Unsubscribes() {
        // Given
        when(session.getId()).thenReturn("ws-1");

        // When
        handler.handleTransportError(session, new IOException("connection reset"));

        // Then
        verify(notificationChannel).unsubscribe(session);
    }

    @Test
    @DisplayName("handleTextMessage - Inbound frames are ignored")
    void inboundMessage_Ignored() throws Exception {
        // When
        handler.handleMessage(session, new TextMessage("{\"type\":\"ping\"}"));

        // Then
        verifyNoInteractions(notificationChannel);
    }
}
