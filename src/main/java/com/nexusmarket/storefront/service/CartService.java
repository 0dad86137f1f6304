package com.nexusmarket.storefront.service;

import com.nexusmarket.storefront.domain.model.Cart;
import com.nexusmarket.storefront.domain.model.CartItem;
import com.nexusmarket.storefront.domain.model.Product;
import com.nexusmarket.storefront.exception.InsufficientStockException;
import com.nexusmarket.storefront.exception.ResourceNotFoundException;
import com.nexusmarket.storefront.repository.CartRepository;
import com.nexusmarket.storefront.repository.ProductRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Service for buyer carts.
 *
 * Quantities are checked against stock when they are put in the cart, but nothing is reserved:
 * stock is only taken when an order is paid.
 *
 * @author Storefront Team
 */
@Service
public class CartService {

    private static final Logger logger = LoggerFactory.getLogger(CartService.class);

    private final CartRepository cartRepository;
    private final ProductRepository productRepository;

    public CartService(CartRepository cartRepository, ProductRepository productRepository) {
        this.cartRepository = cartRepository;
        this.productRepository = productRepository;
    }

    /**
     * Get a buyer's cart. A buyer without a cart gets an empty one.
     */
    @Transactional(readOnly = true)
    public CartView getCart(String userId) {
        return cartRepository.findById(userId)
                .map(this::price)
                .orElseGet(() -> CartView.builder().userId(userId).total(zero()).build());
    }

    /**
     * Add units of a product to the cart.
     *
     * @param userId    Buyer ID
     * @param productId Product ID
     * @param quantity  Units to add (positive)
     * @return Cart after the change
     * @throws IllegalArgumentException   if the quantity is not positive or the new total does not fit in an int
     * @throws ResourceNotFoundException  if the product does not exist
     * @throws InsufficientStockException if the cart would hold more units than are in stock
     */
    @Transactional
    public CartView addItem(String userId, String productId, int quantity) {
        requirePositive(productId, quantity);
        Product product = productRepository.findById(productId)
                .orElseThrow(() -> new ResourceNotFoundException("Product", productId));

        Cart cart = cartRepository.findById(userId).orElseGet(() -> new Cart(userId));
        int newQuantity;
        try {
            newQuantity = Math.addExact(cart.quantityOf(productId), quantity);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Quantity for product " + productId + " is too large", e);
        }
        requireStock(product, newQuantity);

        cart.setQuantity(productId, newQuantity);
        Cart saved = cartRepository.save(cart);
        logger.debug("User {} added {} x {} to cart ({} in cart)", userId, quantity, productId, newQuantity);
        return price(saved);
    }

    /**
     * Replace the whole cart.
     *
     * @param quantities Quantity per product, in display order
     * @throws IllegalArgumentException   if a quantity is not positive
     * @throws ResourceNotFoundException  if a product does not exist
     * @throws InsufficientStockException if a quantity exceeds the product's stock
     */
    @Transactional
    public CartView replaceItems(String userId, Map<String, Integer> quantities) {
        Map<String, Product> products = productsById(List.copyOf(quantities.keySet()));
        quantities.forEach((productId, quantity) -> {
            requirePositive(productId, quantity);
            Product product = products.get(productId);
            if (product == null) {
                throw new ResourceNotFoundException("Product", productId);
            }
            requireStock(product, quantity);
        });

        Cart cart = cartRepository.findById(userId).orElseGet(() -> new Cart(userId));
        cart.replaceItems(quantities);
        Cart saved = cartRepository.save(cart);
        logger.debug("User {} replaced cart with {} lines", userId, quantities.size());
        return price(saved);
    }

    /**
     * Remove a product from the cart. Removing a product that is not in the cart changes nothing.
     */
    @Transactional
    public CartView removeItem(String userId, String productId) {
        Cart cart = cartRepository.findById(userId).orElse(null);
        if (cart == null) {
            return getCart(userId);
        }
        if (cart.remove(productId)) {
            cart = cartRepository.save(cart);
        }
        return price(cart);
    }

    @Transactional
    public void clearCart(String userId) {
        cartRepository.findById(userId).ifPresent(cartRepository::delete);
        logger.debug("User {} cleared cart", userId);
    }

    private CartView price(Cart cart) {
        Map<String, Product> products = productsById(cart.getItems().stream()
                .map(CartItem::getProductId)
                .collect(Collectors.toList()));

        CartView.CartViewBuilder view = CartView.builder().userId(cart.getUserId());
        BigDecimal total = BigDecimal.ZERO;
        for (CartItem item : cart.getItems()) {
            Product product = products.get(item.getProductId());
            if (product == null) {
                continue;
            }
            view.line(CartView.Line.builder()
                    .productId(product.getProductId())
                    .quantity(item.getQuantity())
                    .name(product.getName())
                    .price(product.getPrice())
                    .stock(product.getStock())
                    .build());
            total = total.add(product.getPrice().multiply(BigDecimal.valueOf(item.getQuantity())));
        }
        return view.total(total.setScale(2, RoundingMode.HALF_UP)).build();
    }

    private Map<String, Product> productsById(List<String> productIds) {
        if (productIds.isEmpty()) {
            return Map.of();
        }
        return productRepository.findByProductIdIn(productIds).stream()
                .collect(Collectors.toMap(Product::getProductId, Function.identity()));
    }

    private static void requirePositive(String productId, Integer quantity) {
        if (quantity == null || quantity <= 0) {
            throw new IllegalArgumentException("Quantity for product " + productId + " must be positive: " + quantity);
        }
    }

    private static void requireStock(Product product, int quantity) {
        if (!product.hasStockFor(quantity)) {
            throw new InsufficientStockException(product.getProductId(), quantity, product.getStock());
        }
    }

    private static BigDecimal zero() {
        return BigDecimal.ZERO.setScale(2);
    }
}
