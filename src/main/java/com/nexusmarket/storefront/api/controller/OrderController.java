package com.nexusmarket.storefront.api.controller;

import com.nexusmarket.storefront.api.dto.CreateOrderRequest;
import com.nexusmarket.storefront.api.dto.OrderResponse;
import com.nexusmarket.storefront.domain.model.Order;
import com.nexusmarket.storefront.security.SecurityUtils;
import com.nexusmarket.storefront.service.OrderService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

/**
 * REST controller for order operations.
 * Buyers place and view their own orders; administrators see all orders and move them
 * through fulfilment.
 *
 * @author Storefront Team
 */
@RestController
@RequestMapping("/api/v1/orders")
public class OrderController {

    private final OrderService orderService;

    public OrderController(OrderService orderService) {
        this.orderService = orderService;
    }

    /**
     * Place a pending order. Payment happens afterwards through a checkout session.
     *
     * @param request Items, shipping address and payment method
     * @return Created order with computed totals
     */
    @PostMapping
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<OrderResponse> createOrder(@Valid @RequestBody CreateOrderRequest request) {
        Order order = orderService.createOrder(
                SecurityUtils.requireCurrentUserId(),
                request.quantitiesByProduct(),
                request.getShippingAddress(),
                request.getPaymentMethod()
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(OrderResponse.from(order));
    }

    /**
     * List the caller's orders, newest first. Administrators get every order.
     */
    @GetMapping
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<List<OrderResponse>> listOrders() {
        List<OrderResponse> orders = orderService.listOrders(SecurityUtils.buyerScope()).stream()
                .map(OrderResponse::from)
                .collect(Collectors.toList());
        return ResponseEntity.ok(orders);
    }

    @GetMapping("/{orderId}")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<OrderResponse> getOrder(@PathVariable String orderId) {
        return ResponseEntity.ok(OrderResponse.from(orderService.getOrder(orderId, SecurityUtils.buyerScope())));
    }

    /**
     * Move an order through fulfilment.
     *
     * @param orderId        Order ID
     * @param status         pending, processing, shipped, delivered or cancelled
     * @param trackingNumber Optional carrier tracking number
     */
    @PutMapping("/{orderId}/status")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<OrderResponse> updateOrderStatus(
            @PathVariable String orderId,
            @RequestParam String status,
            @RequestParam(name = "tracking_number", required = false) String trackingNumber
    ) {
        return ResponseEntity.ok(OrderResponse.from(orderService.updateStatus(orderId, status, trackingNumber)));
    }
}
