package com.nexusmarket.storefront.api.controller;

import com.nexusmarket.storefront.api.dto.ProductResponse;
import com.nexusmarket.storefront.security.SecurityUtils;
import com.nexusmarket.storefront.service.ProductService;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

/**
 * The caller's own listings.
 *
 * @author Storefront Team
 */
@RestController
@RequestMapping("/api/v1/seller/products")
public class SellerProductController {

    private final ProductService productService;

    public SellerProductController(ProductService productService) {
        this.productService = productService;
    }

    @GetMapping
    @PreAuthorize("hasAnyRole('SELLER', 'ADMIN')")
    public ResponseEntity<List<ProductResponse>> listOwnProducts() {
        List<ProductResponse> products = productService.listSellerProducts(SecurityUtils.requireCurrentUserId()).stream()
                .map(ProductResponse::from)
                .collect(Collectors.toList());
        return ResponseEntity.ok(products);
    }
}
