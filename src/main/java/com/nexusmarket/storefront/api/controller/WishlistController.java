package com.nexusmarket.storefront.api.controller;

import com.nexusmarket.storefront.api.dto.ProductResponse;
import com.nexusmarket.storefront.security.SecurityUtils;
import com.nexusmarket.storefront.service.WishlistService;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

/**
 * REST controller for the caller's wishlist.
 *
 * @author Storefront Team
 */
@RestController
@RequestMapping("/api/v1/wishlist")
@PreAuthorize("isAuthenticated()")
public class WishlistController {

    private final WishlistService wishlistService;

    public WishlistController(WishlistService wishlistService) {
        this.wishlistService = wishlistService;
    }

    @GetMapping
    public ResponseEntity<List<ProductResponse>> getWishlist() {
        List<ProductResponse> products = wishlistService.getWishlist(SecurityUtils.requireCurrentUserId()).stream()
                .map(ProductResponse::from)
                .collect(Collectors.toList());
        return ResponseEntity.ok(products);
    }

    @PostMapping("/{productId}")
    public ResponseEntity<Void> addProduct(@PathVariable String productId) {
        wishlistService.addProduct(SecurityUtils.requireCurrentUserId(), productId);
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/{productId}")
    public ResponseEntity<Void> removeProduct(@PathVariable String productId) {
        wishlistService.removeProduct(SecurityUtils.requireCurrentUserId(), productId);
        return ResponseEntity.noContent().build();
    }
}
