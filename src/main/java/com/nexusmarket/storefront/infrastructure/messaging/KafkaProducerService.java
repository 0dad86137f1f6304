package com.nexusmarket.storefront.infrastructure.messaging;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nexusmarket.storefront.infrastructure.messaging.events.OrderPaidEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;

/**
 * Kafka producer for order and inventory domain events.
 *
 * Topic partitioning strategy:
 * - Order events are keyed by order_id
 * - Inventory events are keyed by product_id, so updates for one product stay ordered
 *
 * Publishing is fire-and-forget: the outcome is logged and never fails the caller.
 *
 * @author Storefront Team
 */
@Service
public class KafkaProducerService {

    private static final Logger logger = LoggerFactory.getLogger(KafkaProducerService.class);

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final String orderTopic;
    private final String inventoryTopic;

    public KafkaProducerService(
            KafkaTemplate<String, String> kafkaTemplate,
            ObjectMapper objectMapper,
            @Value("${storefront.kafka.topics.orders:storefront-orders}") String orderTopic,
            @Value("${storefront.kafka.topics.inventory:storefront-inventory-updates}") String inventoryTopic
    ) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.orderTopic = orderTopic;
        this.inventoryTopic = inventoryTopic;
    }

    /**
     * Publish order paid event.
     *
     * @param event Order paid event
     */
    public void publishOrderPaid(OrderPaidEvent event) {
        try {
            String payload = objectMapper.writeValueAsString(event);
            send(orderTopic, event.getOrderId(), payload, "order paid event for order " + event.getOrderId());
        } catch (JsonProcessingException e) {
            logger.error("Error serializing order paid event for order {}", event.getOrderId(), e);
        }
    }

    /**
     * Publish inventory update event.
     *
     * @param productId Product ID
     * @param stock     Stock after the change, null when the product was removed
     * @param eventType Event type (e.g., "inventory_update", "product_added", "product_deleted")
     */
    public void publishInventoryUpdate(String productId, Integer stock, String eventType) {
        try {
            String payload = objectMapper.writeValueAsString(new InventoryUpdateEvent(productId, stock, eventType));
            send(inventoryTopic, productId, payload, eventType + " event for product " + productId);
        } catch (JsonProcessingException e) {
            logger.error("Error serializing inventory update event for product: {}", productId, e);
        }
    }

    private void send(String topic, String key, String payload, String description) {
        try {
            CompletableFuture<SendResult<String, String>> future = kafkaTemplate.send(topic, key, payload);
            future.whenComplete((result, ex) -> {
                if (ex == null) {
                    logger.debug("Published {} to partition {}", description,
                            result.getRecordMetadata().partition());
                } else {
                    logger.error("Failed to publish {}", description, ex);
                }
            });
        } catch (RuntimeException e) {
            logger.error("Failed to hand {} to the Kafka producer", description, e);
        }
    }

    private static class InventoryUpdateEvent {
        private final String productId;
        private final Integer stock;
        private final String eventType;
        private final long timestamp;

        InventoryUpdateEvent(String productId, Integer stock, String eventType) {
            this.productId = productId;
            this.stock = stock;
            this.eventType = eventType;
            this.timestamp = System.currentTimeMillis();
        }

        public String getProductId() { return productId; }
        public Integer getStock() { return stock; }
        public String getEventType() { return eventType; }
        public long getTimestamp() { return timestamp; }
    }
}
