package com.nexusmarket.storefront.domain.model;

import com.nexusmarket.storefront.domain.model.Order.OrderStatus;
import com.nexusmarket.storefront.domain.model.Order.PaymentStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for Order domain logic.
 */
@DisplayName("Order Tests")
class OrderTest {

    @Test
    @DisplayName("place - New order is pending/pending with computed totals")
    void place_ComputesTotalsAndStartsPending() {
        Order order = Order.place(
                "user-1",
                List.of(new OrderLine("prod_a", "Lamp", new BigDecimal("45.00"), 2)),
                "card",
                Map.of("city", "Springfield")
        );

        assertThat(order.getOrderId()).startsWith("ord_");
        assertThat(order.getStatus()).isEqualTo(OrderStatus.PENDING);
        assertThat(order.getPaymentStatus()).isEqualTo(PaymentStatus.PENDING);
        assertThat(order.getSubtotal()).isEqualByComparingTo("90.00");
        assertThat(order.getTotal()).isEqualByComparingTo("109.00");
        assertThat(order.isPaid()).isFalse();
        assertThat(order.getUserId()).isEqualTo("user-1");
    }

    @Test
    @DisplayName("place - Empty order is rejected")
    void place_NoLines_Throws() {
        assertThatThrownBy(() -> Order.place("user-1", List.of(), "card", Map.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("place - Zero or negative line quantity is rejected")
    void place_NonPositiveQuantity_Throws() {
        List<OrderLine> negative = List.of(new OrderLine("prod_a", "Lamp", new BigDecimal("45.00"), -2));
        List<OrderLine> zero = List.of(new OrderLine("prod_a", "Lamp", new BigDecimal("45.00"), 0));

        assertThatThrownBy(() -> Order.place("user-1", negative, "card", Map.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("prod_a");
        assertThatThrownBy(() -> Order.place("user-1", zero, "card", Map.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("loyaltyPoints - Whole currency units of the total")
    void loyaltyPoints_FloorsTotal() {
        Order order = Order.place(
                "user-1",
                List.of(new OrderLine("prod_a", "Pen", new BigDecimal("1.99"), 1)),
                "card",
                Map.of()
        );

        // 1.99 + 0.20 tax + 10.00 shipping = 12.19
        assertThat(order.getTotal()).isEqualByComparingTo("12.19");
        assertThat(order.loyaltyPoints()).isEqualTo(12);
    }

    @Test
    @DisplayName("OrderStatus.fromValue - Parses wire values case-insensitively")
    void orderStatus_FromValue() {
        assertThat(OrderStatus.fromValue("shipped")).isEqualTo(OrderStatus.SHIPPED);
        assertThat(OrderStatus.fromValue("DELIVERED")).isEqualTo(OrderStatus.DELIVERED);
        assertThat(OrderStatus.SHIPPED.value()).isEqualTo("shipped");

        assertThatThrownBy(() -> OrderStatus.fromValue("lost"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("lost");
    }
}
