package com.nexusmarket.storefront.service;

import com.nexusmarket.storefront.domain.model.Order;
import com.nexusmarket.storefront.domain.model.Order.OrderStatus;
import com.nexusmarket.storefront.domain.model.Order.PaymentStatus;
import com.nexusmarket.storefront.domain.model.Product;
import com.nexusmarket.storefront.exception.InsufficientStockException;
import com.nexusmarket.storefront.exception.ResourceNotFoundException;
import com.nexusmarket.storefront.infrastructure.metrics.CloudWatchMetricsService;
import com.nexusmarket.storefront.repository.OrderRepository;
import com.nexusmarket.storefront.repository.ProductRepository;
import com.nexusmarket.storefront.testutil.TestDataBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for OrderService.
 * Tests order placement, visibility rules and fulfilment status changes.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("OrderService Unit Tests")
class OrderServiceTest {

    @Mock
    private OrderRepository orderRepository;

    @Mock
    private ProductRepository productRepository;

    @Mock
    private UserService userService;

    @Mock
    private CloudWatchMetricsService metricsService;

    @InjectMocks
    private OrderService orderService;

    private Product lamp;
    private Product shade;
    private Map<String, String> address;

    @BeforeEach
    void setUp() {
        lamp = TestDataBuilder.product().productId("prod_lamp").name("Lamp").price("40.00").stock(5).build();
        shade = TestDataBuilder.product().productId("prod_shade").name("Shade").price("10.00").stock(1).build();
        address = Map.of("line1", "1 Main St", "city", "Springfield");
    }

    // ========================================
    // createOrder() Tests
    // ========================================

    @Test
    @DisplayName("createOrder - Stock available: Should persist a pending order priced from the catalogue")
    void createOrder_Success() {
        // Given
        Map<String, Integer> quantities = new LinkedHashMap<>();
        quantities.put("prod_lamp", 2);
        quantities.put("prod_shade", 1);
        when(productRepository.findById("prod_lamp")).thenReturn(Optional.of(lamp));
        when(productRepository.findById("prod_shade")).thenReturn(Optional.of(shade));
        when(orderRepository.save(any(Order.class))).thenAnswer(invocation -> invocation.getArgument(0));

        // When
        Order order = orderService.createOrder("buyer-1", quantities, address, "card");

        // Then
        assertThat(order.getUserId()).isEqualTo("buyer-1");
        assertThat(order.getLines()).hasSize(2);
        assertThat(order.getLines().get(0).getUnitPrice()).isEqualByComparingTo("40.00");
        assertThat(order.getSubtotal()).isEqualByComparingTo("90.00");
        assertThat(order.getTax()).isEqualByComparingTo("9.00");
        assertThat(order.getShipping()).isEqualByComparingTo("10.00");
        assertThat(order.getTotal()).isEqualByComparingTo("109.00");
        assertThat(order.getStatus()).isEqualTo(OrderStatus.PENDING);
        assertThat(order.getPaymentStatus()).isEqualTo(PaymentStatus.PENDING);
        assertThat(order.getShippingAddress()).containsEntry("city", "Springfield");

        verify(userService).registerIfAbsent("buyer-1");
        verify(metricsService).recordOrderCreated();
        verify(productRepository, never()).decrementStock(anyString(), anyInt());
    }

    @Test
    @DisplayName("createOrder - Insufficient stock: Should reject and persist nothing")
    void createOrder_InsufficientStock_Throws() {
        // Given
        Map<String, Integer> quantities = new LinkedHashMap<>();
        quantities.put("prod_lamp", 1);
        quantities.put("prod_shade", 2);
        when(productRepository.findById("prod_lamp")).thenReturn(Optional.of(lamp));
        when(productRepository.findById("prod_shade")).thenReturn(Optional.of(shade));

        // When / Then
        assertThatThrownBy(() -> orderService.createOrder("buyer-1", quantities, address, "card"))
                .isInstanceOf(InsufficientStockException.class)
                .satisfies(e -> {
                    InsufficientStockException ex = (InsufficientStockException) e;
                    assertThat(ex.getProductId()).isEqualTo("prod_shade");
                    assertThat(ex.getRequestedQuantity()).isEqualTo(2);
                    assertThat(ex.getAvailableQuantity()).isEqualTo(1);
                });

        verify(orderRepository, never()).save(any());
        verifyNoInteractions(userService);
        verify(metricsService).recordOrderRejected("prod_shade", "INSUFFICIENT_STOCK");
    }

    @Test
    @DisplayName("createOrder - Negative quantity: Should reject before pricing or persisting")
    void createOrder_NegativeQuantity_Throws() {
        // Given
        Map<String, Integer> quantities = Map.of("prod_lamp", -2);

        // When / Then
        assertThatThrownBy(() -> orderService.createOrder("buyer-1", quantities, address, "card"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("prod_lamp");

        verifyNoInteractions(productRepository);
        verify(orderRepository, never()).save(any());
    }

    @Test
    @DisplayName("createOrder - Unknown product: Should report not found")
    void createOrder_UnknownProduct_Throws() {
        // Given
        when(productRepository.findById("prod_missing")).thenReturn(Optional.empty());

        // When / Then
        assertThatThrownBy(() -> orderService.createOrder("buyer-1", Map.of("prod_missing", 1), address, "card"))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessageContaining("prod_missing");
        verify(orderRepository, never()).save(any());
    }

    // ========================================
    // getOrder() / listOrders() Tests
    // ========================================

    @Test
    @DisplayName("getOrder - Buyer lookup is scoped to their own orders")
    void getOrder_ScopedToBuyer() {
        // Given
        when(orderRepository.findByOrderIdAndUserId("ord_1", "buyer-2")).thenReturn(Optional.empty());

        // When / Then
        assertThatThrownBy(() -> orderService.getOrder("ord_1", "buyer-2"))
                .isInstanceOf(ResourceNotFoundException.class);
        verify(orderRepository, never()).findById(anyString());
    }

    @Test
    @DisplayName("listOrders - Administrator sees all orders")
    void listOrders_Admin_ListsAll() {
        // Given
        Order order = TestDataBuilder.order().build();
        when(orderRepository.findAllByOrderByCreatedAtDesc()).thenReturn(List.of(order));

        // When
        List<Order> orders = orderService.listOrders(null);

        // Then
        assertThat(orders).containsExactly(order);
        verify(orderRepository, never()).findByUserIdOrderByCreatedAtDesc(anyString());
    }

    // ========================================
    // updateStatus() Tests
    // ========================================

    @Test
    @DisplayName("updateStatus - Valid status: Should update fulfilment fields only")
    void updateStatus_Success() {
        // Given
        Order order = TestDataBuilder.order().build();
        order.setStatus(OrderStatus.SHIPPED);
        order.setTrackingNumber("1Z999");
        when(orderRepository.updateFulfilmentStatus(eq(order.getOrderId()), eq(OrderStatus.SHIPPED),
                eq("1Z999"), any(Instant.class))).thenReturn(1);
        when(orderRepository.findById(order.getOrderId())).thenReturn(Optional.of(order));

        // When
        Order updated = orderService.updateStatus(order.getOrderId(), "shipped", "1Z999");

        // Then
        assertThat(updated.getStatus()).isEqualTo(OrderStatus.SHIPPED);
        assertThat(updated.getTrackingNumber()).isEqualTo("1Z999");
        verify(orderRepository, never()).markPaid(anyString());
    }

    @Test
    @DisplayName("updateStatus - Unknown status: Should reject before touching the database")
    void updateStatus_InvalidStatus_Throws() {
        assertThatThrownBy(() -> orderService.updateStatus("ord_1", "teleported", null))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(orderRepository);
    }

    @Test
    @DisplayName("updateStatus - Missing order: Should report not found")
    void updateStatus_MissingOrder_Throws() {
        // Given
        when(orderRepository.updateFulfilmentStatus(eq("ord_missing"), eq(OrderStatus.DELIVERED),
                isNull(), any(Instant.class))).thenReturn(0);

        // When / Then
        assertThatThrownBy(() -> orderService.updateStatus("ord_missing", "delivered", null))
                .isInstanceOf(ResourceNotFoundException.class);
    }
}
