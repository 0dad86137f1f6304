package com.nexusmarket.storefront.infrastructure.notification;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nexusmarket.storefront.domain.model.Product;
import com.nexusmarket.storefront.infrastructure.cache.RedisCacheService;
import com.nexusmarket.storefront.infrastructure.messaging.KafkaProducerService;
import com.nexusmarket.storefront.infrastructure.payment.PaymentGateway;
import com.nexusmarket.storefront.repository.ProductRepository;
import com.nexusmarket.storefront.service.ProductDraft;
import com.nexusmarket.storefront.service.ProductService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

/**
 * Live WebSocket tests: a real client connected to {@code /ws/inventory} on a random port
 * receives the inventory events produced by product writes.
 */
@SpringBootTest(
        webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
        properties = {
            "spring.datasource.url=jdbc:h2:mem:inventoryfeed;MODE=PostgreSQL;DB_CLOSE_DELAY=-1;LOCK_TIMEOUT=10000"
        }
)
@DisplayName("Inventory WebSocket Integration Tests")
class InventoryWebSocketIntegrationTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    @LocalServerPort
    private int port;

    @Autowired
    private ProductService productService;

    @Autowired
    private ProductRepository productRepository;

    @Autowired
    private WebSocketNotificationChannel notificationChannel;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private PaymentGateway paymentGateway;

    @MockBean
    private KafkaProducerService kafkaProducerService;

    @MockBean
    private RedisCacheService redisCacheService;

    private final BlockingQueue<String> received = new LinkedBlockingQueue<>();
    private WebSocketSession clientSession;

    @BeforeEach
    void connect() throws Exception {
        productRepository.deleteAll();

        int before = notificationChannel.subscriberCount();
        clientSession = new StandardWebSocketClient()
                .execute(new TextWebSocketHandler() {
                    @Override
                    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
                        received.add(message.getPayload());
                    }
                }, "ws://localhost:" + port + "/ws/inventory")
                .get(10, TimeUnit.SECONDS);

        await().atMost(TIMEOUT).until(() -> notificationChannel.subscriberCount() == before + 1);
    }

    @AfterEach
    void disconnect() throws Exception {
        if (clientSession != null && clientSession.isOpen()) {
            clientSession.close(CloseStatus.NORMAL);
        }
    }

    @Test
    @DisplayName("Listing a product pushes product_added with its stock")
    void createProduct_PushesProductAdded() throws Exception {
        // When
        Product product = productService.createProduct("seller-ws", ProductDraft.builder()
                .name("Desk Fan")
                .price(new BigDecimal("30.00"))
                .categoryId("home")
                .stock(12)
                .build());

        // Then
        JsonNode event = nextEvent();
        assertThat(event.get("type").asText()).isEqualTo("product_added");
        assertThat(event.get("product_id").asText()).isEqualTo(product.getProductId());
        assertThat(event.get("stock").asInt()).isEqualTo(12);
    }

    @Test
    @DisplayName("Stock decrement pushes inventory_update with the remaining stock")
    void decrementStock_PushesInventoryUpdate() throws Exception {
        // Given
        Product product = productService.createProduct("seller-ws", ProductDraft.builder()
                .name("Kettle")
                .price(new BigDecimal("20.00"))
                .categoryId("kitchen")
                .stock(4)
                .build());
        nextEvent();

        // When
        productService.decrementStock(product.getProductId(), 3);

        // Then
        JsonNode event = nextEvent();
        assertThat(event.get("type").asText()).isEqualTo("inventory_update");
        assertThat(event.get("product_id").asText()).isEqualTo(product.getProductId());
        assertThat(event.get("stock").asInt()).isEqualTo(1);
    }

    @Test
    @DisplayName("Deleting a product pushes product_deleted without a stock field")
    void deleteProduct_PushesProductDeleted() throws Exception {
        // Given
        Product product = productService.createProduct("seller-ws", ProductDraft.builder()
                .name("Toaster")
                .price(new BigDecimal("25.00"))
                .categoryId("kitchen")
                .stock(2)
                .build());
        nextEvent();

        // When
        productService.deleteProduct(product.getProductId(), "seller-ws", false);

        // Then
        JsonNode event = nextEvent();
        assertThat(event.get("type").asText()).isEqualTo("product_deleted");
        assertThat(event.get("product_id").asText()).isEqualTo(product.getProductId());
        assertThat(event.has("stock")).isFalse();
    }

    @Test
    @DisplayName("Closed client is removed from the channel")
    void closeClient_Unsubscribes() throws Exception {
        // Given
        int connected = notificationChannel.subscriberCount();

        // When
        clientSession.close(CloseStatus.NORMAL);

        // Then
        await().atMost(TIMEOUT).until(() -> notificationChannel.subscriberCount() == connected - 1);
    }

    private JsonNode nextEvent() throws Exception {
        String payload = received.poll(TIMEOUT.toSeconds(), TimeUnit.SECONDS);
        assertThat(payload).as("inventory event within %s", TIMEOUT).isNotNull();
        return objectMapper.readTree(payload);
    }
}
