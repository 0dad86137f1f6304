package com.nexusmarket.storefront.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.nexusmarket.storefront.domain.model.Order;
import com.nexusmarket.storefront.domain.model.OrderLine;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Response DTO for an order.
 *
 * @author Storefront Team
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class OrderResponse {

    private String orderId;
    private String userId;
    private List<Line> items;
    private BigDecimal subtotal;
    private BigDecimal tax;
    private BigDecimal shipping;
    private BigDecimal total;
    private String status;
    private String paymentStatus;
    private String paymentMethod;
    private Map<String, String> shippingAddress;
    private String trackingNumber;
    private Instant createdAt;
    private Instant updatedAt;

    public static OrderResponse from(Order order) {
        return OrderResponse.builder()
                .orderId(order.getOrderId())
                .userId(order.getUserId())
                .items(order.getLines().stream().map(Line::from).collect(Collectors.toList()))
                .subtotal(order.getSubtotal())
                .tax(order.getTax())
                .shipping(order.getShipping())
                .total(order.getTotal())
                .status(order.getStatus().value())
                .paymentStatus(order.getPaymentStatus().value())
                .paymentMethod(order.getPaymentMethod())
                .shippingAddress(order.getShippingAddress())
                .trackingNumber(order.getTrackingNumber())
                .createdAt(order.getCreatedAt())
                .updatedAt(order.getUpdatedAt())
                .build();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class Line {

        private String productId;
        private String productName;
        private BigDecimal unitPrice;
        private Integer quantity;

        static Line from(OrderLine line) {
            return new Line(line.getProductId(), line.getProductName(), line.getUnitPrice(), line.getQuantity());
        }
    }
}
