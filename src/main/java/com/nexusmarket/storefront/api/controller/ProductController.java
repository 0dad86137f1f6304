package com.nexusmarket.storefront.api.controller;

import com.nexusmarket.storefront.api.dto.ProductRequest;
import com.nexusmarket.storefront.api.dto.ProductResponse;
import com.nexusmarket.storefront.domain.model.Product;
import com.nexusmarket.storefront.security.SecurityUtils;
import com.nexusmarket.storefront.service.ProductService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
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
 * REST controller for the product catalogue.
 * Reads are public; sellers manage their own listings and administrators manage all of them.
 *
 * @author Storefront Team
 */
@RestController
@RequestMapping("/api/v1/products")
public class ProductController {

    private final ProductService productService;

    public ProductController(ProductService productService) {
        this.productService = productService;
    }

    @GetMapping
    public ResponseEntity<List<ProductResponse>> listProducts(
            @RequestParam(name = "category_id", required = false) String categoryId
    ) {
        List<ProductResponse> products = productService.listProducts(categoryId).stream()
                .map(ProductResponse::from)
                .collect(Collectors.toList());
        return ResponseEntity.ok(products);
    }

    /**
     * Get a product. Stock is served from the cache when available.
     */
    @GetMapping("/{productId}")
    public ResponseEntity<ProductResponse> getProduct(@PathVariable String productId) {
        Product product = productService.getProduct(productId);
        return ResponseEntity.ok(ProductResponse.from(product, productService.getStock(productId)));
    }

    @PostMapping
    @PreAuthorize("hasAnyRole('SELLER', 'ADMIN')")
    public ResponseEntity<ProductResponse> createProduct(
            @Validated(ProductRequest.Create.class) @RequestBody ProductRequest request
    ) {
        Product product = productService.createProduct(SecurityUtils.requireCurrentUserId(), request.toDraft());
        return ResponseEntity.status(HttpStatus.CREATED).body(ProductResponse.from(product));
    }

    @PutMapping("/{productId}")
    @PreAuthorize("hasAnyRole('SELLER', 'ADMIN')")
    public ResponseEntity<ProductResponse> updateProduct(
            @PathVariable String productId,
            @Valid @RequestBody ProductRequest request
    ) {
        Product product = productService.updateProduct(
                productId, SecurityUtils.requireCurrentUserId(), SecurityUtils.isAdmin(), request.toDraft());
        return ResponseEntity.ok(ProductResponse.from(product));
    }

    @DeleteMapping("/{productId}")
    @PreAuthorize("hasAnyRole('SELLER', 'ADMIN')")
    public ResponseEntity<Void> deleteProduct(@PathVariable String productId) {
        productService.deleteProduct(productId, SecurityUtils.requireCurrentUserId(), SecurityUtils.isAdmin());
        return ResponseEntity.noContent().build();
    }
}
