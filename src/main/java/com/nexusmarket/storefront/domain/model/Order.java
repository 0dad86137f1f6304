package com.nexusmarket.storefront.domain.model;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.DynamicUpdate;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Order entity placed by a buyer before payment.
 *
 * Monetary fields are computed once by {@link #place} and are not updatable.
 * The payment status moves from PENDING to PAID exactly once, through the conditional
 * update in {@link com.nexusmarket.storefront.repository.OrderRepository#markPaid}.
 * Orders are never deleted.
 *
 * @author Storefront Team
 */
@Entity(name = "CustomerOrder")
@DynamicUpdate
@Table(name = "orders", indexes = {
    @Index(name = "idx_orders_user_id", columnList = "user_id"),
    @Index(name = "idx_orders_status", columnList = "status"),
    @Index(name = "idx_orders_created_at", columnList = "created_at")
})
@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Order {

    @Id
    @Column(name = "order_id", nullable = false, length = 36)
    private String orderId;

    /**
     * Buyer who placed the order.
     */
    @Column(name = "user_id", nullable = false, length = 64)
    private String userId;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "order_lines", joinColumns = @JoinColumn(name = "order_id"))
    @OrderColumn(name = "line_index")
    @Setter(AccessLevel.NONE)
    private List<OrderLine> lines = new ArrayList<>();

    @Column(name = "subtotal", nullable = false, updatable = false, precision = 12, scale = 2)
    @Setter(AccessLevel.NONE)
    private BigDecimal subtotal;

    @Column(name = "tax", nullable = false, updatable = false, precision = 12, scale = 2)
    @Setter(AccessLevel.NONE)
    private BigDecimal tax;

    @Column(name = "shipping", nullable = false, updatable = false, precision = 12, scale = 2)
    @Setter(AccessLevel.NONE)
    private BigDecimal shipping;

    @Column(name = "total", nullable = false, updatable = false, precision = 12, scale = 2)
    @Setter(AccessLevel.NONE)
    private BigDecimal total;

    /**
     * Fulfilment status, changed by administrators once the order is paid.
     */
    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private OrderStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_status", nullable = false, length = 20)
    private PaymentStatus paymentStatus;

    /**
     * Payment method chosen at checkout (e.g. "card").
     */
    @Column(name = "payment_method", length = 50)
    private String paymentMethod;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "order_shipping_address", joinColumns = @JoinColumn(name = "order_id"))
    @MapKeyColumn(name = "field_name", length = 64)
    @Column(name = "field_value", length = 500)
    private Map<String, String> shippingAddress = new LinkedHashMap<>();

    @Column(name = "tracking_number", length = 100)
    private String trackingNumber;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    /**
     * Create a new pending order and compute its totals.
     *
     * @param userId Buyer ID
     * @param lines Order lines with unit prices captured from the catalogue
     * @param paymentMethod Payment method
     * @param shippingAddress Shipping address fields
     * @return Unsaved order with status PENDING and payment status PENDING
     * @throws IllegalArgumentException if there are no lines or a line quantity is not positive
     */
    public static Order place(
            String userId,
            List<OrderLine> lines,
            String paymentMethod,
            Map<String, String> shippingAddress
    ) {
        if (lines == null || lines.isEmpty()) {
            throw new IllegalArgumentException("Order must contain at least one line");
        }
        for (OrderLine line : lines) {
            if (line.getQuantity() == null || line.getQuantity() <= 0) {
                throw new IllegalArgumentException(
                        "Quantity for product " + line.getProductId() + " must be positive: " + line.getQuantity());
            }
        }

        OrderTotals totals = OrderTotals.of(lines);

        Order order = new Order();
        order.orderId = "ord_" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
        order.userId = userId;
        order.lines = new ArrayList<>(lines);
        order.subtotal = totals.getSubtotal();
        order.tax = totals.getTax();
        order.shipping = totals.getShipping();
        order.total = totals.getTotal();
        order.status = OrderStatus.PENDING;
        order.paymentStatus = PaymentStatus.PENDING;
        order.paymentMethod = paymentMethod;
        if (shippingAddress != null) {
            order.shippingAddress = new LinkedHashMap<>(shippingAddress);
        }
        return order;
    }

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
        updatedAt = Instant.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    public boolean isPaid() {
        return paymentStatus == PaymentStatus.PAID;
    }

    /**
     * Loyalty points earned by paying this order: the whole-currency part of the total.
     */
    public int loyaltyPoints() {
        return total.setScale(0, RoundingMode.FLOOR).intValueExact();
    }

    /**
     * Order fulfilment status.
     */
    public enum OrderStatus {
        PENDING,
        PROCESSING,
        SHIPPED,
        DELIVERED,
        CANCELLED;

        /**
         * Parse a wire value such as "shipped".
         *
         * @throws IllegalArgumentException for unknown statuses
         */
        public static OrderStatus fromValue(String value) {
            if (value != null) {
                for (OrderStatus status : values()) {
                    if (status.name().equalsIgnoreCase(value.trim())) {
                        return status;
                    }
                }
            }
            throw new IllegalArgumentException("Invalid order status: " + value);
        }

        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public enum PaymentStatus {
        PENDING,
        PAID;

        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
