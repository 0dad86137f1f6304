package com.nexusmarket.storefront.service;

import com.nexusmarket.storefront.domain.model.Product;
import com.nexusmarket.storefront.domain.model.Wishlist;
import com.nexusmarket.storefront.exception.ResourceNotFoundException;
import com.nexusmarket.storefront.repository.ProductRepository;
import com.nexusmarket.storefront.repository.WishlistRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Service for buyer wishlists.
 *
 * @author Storefront Team
 */
@Service
public class WishlistService {

    private static final Logger logger = LoggerFactory.getLogger(WishlistService.class);

    private final WishlistRepository wishlistRepository;
    private final ProductRepository productRepository;

    public WishlistService(WishlistRepository wishlistRepository, ProductRepository productRepository) {
        this.wishlistRepository = wishlistRepository;
        this.productRepository = productRepository;
    }

    /**
     * Products on the buyer's wishlist, in the order they were added. Delisted products are left out.
     */
    @Transactional(readOnly = true)
    public List<Product> getWishlist(String userId) {
        List<String> productIds = wishlistRepository.findById(userId)
                .map(Wishlist::getProductIds)
                .orElse(List.of());
        if (productIds.isEmpty()) {
            return List.of();
        }

        Map<String, Product> products = productRepository.findByProductIdIn(productIds).stream()
                .collect(Collectors.toMap(Product::getProductId, Function.identity()));
        return productIds.stream()
                .map(products::get)
                .filter(Objects::nonNull)
                .collect(Collectors.toList());
    }

    /**
     * Save a product to the wishlist. Adding a product twice keeps one entry.
     *
     * @throws ResourceNotFoundException if the product does not exist
     */
    @Transactional
    public void addProduct(String userId, String productId) {
        if (!productRepository.existsById(productId)) {
            throw new ResourceNotFoundException("Product", productId);
        }

        Wishlist wishlist = wishlistRepository.findById(userId).orElseGet(() -> new Wishlist(userId));
        if (wishlist.add(productId)) {
            wishlistRepository.save(wishlist);
            logger.debug("User {} wishlisted {}", userId, productId);
        }
    }

    @Transactional
    public void removeProduct(String userId, String productId) {
        wishlistRepository.findById(userId).ifPresent(wishlist -> {
            if (wishlist.remove(productId)) {
                wishlistRepository.save(wishlist);
            }
        });
    }
}
