package com.nexusmarket.storefront.infrastructure.notification;

import org.springframework.web.socket.WebSocketSession;

/**
 * Registry of connected inventory observers and fan-out of inventory change events to them.
 * Subscribe, unsubscribe and broadcast may run concurrently from any thread.
 * Delivery is best effort: {@link #broadcast} never throws because an observer went away.
 *
 * @author Storefront Team
 */
public interface NotificationChannel {

    /**
     * Add an observer. It receives every event broadcast after this call returns.
     *
     * @param session Open WebSocket session
     */
    void subscribe(WebSocketSession session);

    /**
     * Remove an observer. Unknown sessions are ignored.
     *
     * @param session WebSocket session
     */
    void unsubscribe(WebSocketSession session);

    /**
     * Send an event to every observer connected at the time of the call.
     *
     * @param event Inventory event
     */
    void broadcast(InventoryEvent event);

    /**
     * @return number of currently connected observers
     */
    int subscriberCount();
}
