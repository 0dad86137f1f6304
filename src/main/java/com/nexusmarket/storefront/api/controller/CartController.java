package com.nexusmarket.storefront.api.controller;

import com.nexusmarket.storefront.api.dto.CartItemRequest;
import com.nexusmarket.storefront.api.dto.CartResponse;
import com.nexusmarket.storefront.api.dto.UpdateCartRequest;
import com.nexusmarket.storefront.security.SecurityUtils;
import com.nexusmarket.storefront.service.CartService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for the caller's cart.
 *
 * @author Storefront Team
 */
@RestController
@RequestMapping("/api/v1/cart")
@PreAuthorize("isAuthenticated()")
public class CartController {

    private final CartService cartService;

    public CartController(CartService cartService) {
        this.cartService = cartService;
    }

    @GetMapping
    public ResponseEntity<CartResponse> getCart() {
        return ResponseEntity.ok(CartResponse.from(cartService.getCart(SecurityUtils.requireCurrentUserId())));
    }

    /**
     * Add units of a product. Units already in the cart count against the stock check.
     */
    @PostMapping("/items")
    public ResponseEntity<CartResponse> addItem(@Valid @RequestBody CartItemRequest request) {
        return ResponseEntity.ok(CartResponse.from(cartService.addItem(
                SecurityUtils.requireCurrentUserId(), request.getProductId(), request.getQuantity())));
    }

    @PutMapping
    public ResponseEntity<CartResponse> replaceItems(@Valid @RequestBody UpdateCartRequest request) {
        return ResponseEntity.ok(CartResponse.from(cartService.replaceItems(
                SecurityUtils.requireCurrentUserId(), request.quantitiesByProduct())));
    }

    @DeleteMapping("/items/{productId}")
    public ResponseEntity<CartResponse> removeItem(@PathVariable String productId) {
        return ResponseEntity.ok(CartResponse.from(
                cartService.removeItem(SecurityUtils.requireCurrentUserId(), productId)));
    }

    @DeleteMapping
    public ResponseEntity<Void> clearCart() {
        cartService.clearCart(SecurityUtils.requireCurrentUserId());
        return ResponseEntity.noContent().build();
    }
}
