package com.nexusmarket.storefront.service;

import com.nexusmarket.storefront.domain.model.Order;
import com.nexusmarket.storefront.domain.model.Order.OrderStatus;
import com.nexusmarket.storefront.domain.model.OrderLine;
import com.nexusmarket.storefront.domain.model.Product;
import com.nexusmarket.storefront.exception.InsufficientStockException;
import com.nexusmarket.storefront.exception.ResourceNotFoundException;
import com.nexusmarket.storefront.infrastructure.metrics.CloudWatchMetricsService;
import com.nexusmarket.storefront.repository.OrderRepository;
import com.nexusmarket.storefront.repository.ProductRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Service for placing and managing orders.
 *
 * Orders are placed before payment: stock is checked but not reserved, and prices come
 * from the catalogue. Stock is only taken when the payment is settled.
 *
 * @author Storefront Team
 */
@Service
public class OrderService {

    private static final Logger logger = LoggerFactory.getLogger(OrderService.class);

    private final OrderRepository orderRepository;
    private final ProductRepository productRepository;
    private final UserService userService;
    private final CloudWatchMetricsService metricsService;

    public OrderService(
            OrderRepository orderRepository,
            ProductRepository productRepository,
            UserService userService,
            CloudWatchMetricsService metricsService
    ) {
        this.orderRepository = orderRepository;
        this.productRepository = productRepository;
        this.userService = userService;
        this.metricsService = metricsService;
    }

    /**
     * Place a pending order.
     *
     * Flow:
     * 1. Load every product and check the requested quantity against current stock
     * 2. Capture unit prices and compute totals
     * 3. Persist the order as pending / pending
     * 4. Register the buyer for loyalty points if this is their first order
     *
     * @param buyerId         Buyer ID
     * @param quantities      Requested quantity per product ID, in line order
     * @param shippingAddress Shipping address fields
     * @param paymentMethod   Payment method
     * @return Persisted order
     * @throws IllegalArgumentException   if a quantity is not positive
     * @throws ResourceNotFoundException  if a product does not exist
     * @throws InsufficientStockException if a product has fewer units than requested; nothing is persisted
     */
    public Order createOrder(
            String buyerId,
            Map<String, Integer> quantities,
            Map<String, String> shippingAddress,
            String paymentMethod
    ) {
        List<OrderLine> lines = new ArrayList<>();
        for (Map.Entry<String, Integer> entry : quantities.entrySet()) {
            String productId = entry.getKey();
            Integer quantity = entry.getValue();
            if (quantity == null || quantity <= 0) {
                throw new IllegalArgumentException("Quantity for product " + productId + " must be positive: " + quantity);
            }

            Product product = productRepository.findById(productId)
                    .orElseThrow(() -> new ResourceNotFoundException("Product", productId));

            if (!product.hasStockFor(quantity)) {
                logger.warn("Rejected order for buyer {}: product {} has {} units, {} requested",
                        buyerId, productId, product.getStock(), quantity);
                metricsService.recordOrderRejected(productId, "INSUFFICIENT_STOCK");
                throw new InsufficientStockException(productId, quantity, product.getStock());
            }

            lines.add(new OrderLine(productId, product.getName(), product.getPrice(), quantity));
        }

        Order order = orderRepository.save(Order.place(buyerId, lines, paymentMethod, shippingAddress));
        userService.registerIfAbsent(buyerId);

        metricsService.recordOrderCreated();
        logger.info("Created order {} for buyer {}: {} lines, total={}",
                order.getOrderId(), buyerId, lines.size(), order.getTotal());
        return order;
    }

    /**
     * Get an order visible to the caller.
     *
     * @param orderId   Order ID
     * @param requester Buyer ID, or null for administrators
     * @return Order
     * @throws ResourceNotFoundException if absent or owned by someone else
     */
    @Transactional(readOnly = true)
    public Order getOrder(String orderId, String requester) {
        return (requester == null
                ? orderRepository.findById(orderId)
                : orderRepository.findByOrderIdAndUserId(orderId, requester))
                .orElseThrow(() -> new ResourceNotFoundException("Order", orderId));
    }

    /**
     * List orders newest first.
     *
     * @param requester Buyer ID, or null for administrators to list all orders
     */
    @Transactional(readOnly = true)
    public List<Order> listOrders(String requester) {
        return requester == null
                ? orderRepository.findAllByOrderByCreatedAtDesc()
                : orderRepository.findByUserIdOrderByCreatedAtDesc(requester);
    }

    /**
     * Update the fulfilment status of an order. Payment status is never changed here.
     *
     * @param orderId        Order ID
     * @param status         New status (e.g. "shipped")
     * @param trackingNumber Tracking number, or null to keep the current one
     * @return Updated order
     * @throws IllegalArgumentException  for an unknown status
     * @throws ResourceNotFoundException if the order does not exist
     */
    @Transactional
    public Order updateStatus(String orderId, String status, String trackingNumber) {
        OrderStatus newStatus = OrderStatus.fromValue(status);

        if (orderRepository.updateFulfilmentStatus(orderId, newStatus, trackingNumber, Instant.now()) == 0) {
            throw new ResourceNotFoundException("Order", orderId);
        }

        logger.info("Order {} moved to {}{}", orderId, newStatus,
                trackingNumber != null ? " (tracking " + trackingNumber + ")" : "");
        return orderRepository.findById(orderId)
                .orElseThrow(() -> new ResourceNotFoundException("Order", orderId));
    }
}
