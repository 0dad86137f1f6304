package com.nexusmarket.storefront.service;

import com.nexusmarket.storefront.domain.model.Product;
import com.nexusmarket.storefront.exception.InsufficientStockException;
import com.nexusmarket.storefront.exception.ResourceNotFoundException;
import com.nexusmarket.storefront.infrastructure.cache.RedisCacheService;
import com.nexusmarket.storefront.infrastructure.messaging.KafkaProducerService;
import com.nexusmarket.storefront.infrastructure.metrics.CloudWatchMetricsService;
import com.nexusmarket.storefront.infrastructure.notification.InventoryEvent;
import com.nexusmarket.storefront.infrastructure.notification.NotificationChannel;
import com.nexusmarket.storefront.repository.ProductRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Service for the product catalogue and stock.
 *
 * Every stock change is published to inventory observers and Kafka, and evicts the cached stock,
 * but only after the change has committed. The cache is refilled from the database on the next read.
 *
 * @author Storefront Team
 */
@Service
public class ProductService {

    private static final Logger logger = LoggerFactory.getLogger(ProductService.class);

    private final ProductRepository productRepository;
    private final RedisCacheService cacheService;
    private final NotificationChannel notificationChannel;
    private final KafkaProducerService kafkaProducerService;
    private final CloudWatchMetricsService metricsService;

    public ProductService(
            ProductRepository productRepository,
            RedisCacheService cacheService,
            NotificationChannel notificationChannel,
            KafkaProducerService kafkaProducerService,
            CloudWatchMetricsService metricsService
    ) {
        this.productRepository = productRepository;
        this.cacheService = cacheService;
        this.notificationChannel = notificationChannel;
        this.kafkaProducerService = kafkaProducerService;
        this.metricsService = metricsService;
    }

    @Transactional(readOnly = true)
    public Product getProduct(String productId) {
        return productRepository.findById(productId)
                .orElseThrow(() -> new ResourceNotFoundException("Product", productId));
    }

    /**
     * Get current stock, served from cache when possible.
     *
     * @param productId Product ID
     * @return Stock count
     * @throws ResourceNotFoundException if the product does not exist
     */
    public int getStock(String productId) {
        Optional<Integer> cached = cacheService.getStockCount(productId);
        if (cached.isPresent()) {
            metricsService.recordCacheHit("stock");
            return cached.get();
        }
        metricsService.recordCacheMiss("stock");

        Integer stock = productRepository.findStockByProductId(productId);
        if (stock == null) {
            throw new ResourceNotFoundException("Product", productId);
        }
        cacheService.setStockCount(productId, stock);
        return stock;
    }

    /**
     * List products newest first.
     *
     * @param categoryId Category filter, or null for all products
     */
    @Transactional(readOnly = true)
    public List<Product> listProducts(String categoryId) {
        return categoryId == null || categoryId.isBlank()
                ? productRepository.findAllByOrderByCreatedAtDesc()
                : productRepository.findByCategoryIdOrderByCreatedAtDesc(categoryId);
    }

    /**
     * Products listed by one seller, newest first.
     */
    @Transactional(readOnly = true)
    public List<Product> listSellerProducts(String sellerId) {
        return productRepository.findBySellerIdOrderByCreatedAtDesc(sellerId);
    }

    /**
     * List a product for sale and announce it to inventory observers.
     *
     * @param sellerId Seller ID
     * @param draft    Product fields
     * @return Persisted product
     */
    @Transactional
    public Product createProduct(String sellerId, ProductDraft draft) {
        Product product = productRepository.save(Product.builder()
                .sellerId(sellerId)
                .name(draft.getName())
                .description(draft.getDescription())
                .price(draft.getPrice())
                .categoryId(draft.getCategoryId())
                .stock(draft.getStock() != null ? draft.getStock() : 0)
                .build());

        String productId = product.getProductId();
        int stock = product.getStock();
        afterCommit(() -> {
            cacheService.invalidateStockCount(productId);
            notificationChannel.broadcast(InventoryEvent.productAdded(productId, stock));
            kafkaProducerService.publishInventoryUpdate(productId, stock, InventoryEvent.PRODUCT_ADDED);
        });

        logger.info("Seller {} listed product {} with stock {}", sellerId, productId, stock);
        return product;
    }

    /**
     * Update a product. Observers are told about the new stock only when it changed.
     *
     * @param productId   Product ID
     * @param requesterId Caller ID
     * @param admin       Whether the caller is an administrator
     * @param draft       Fields to change
     * @return Updated product
     * @throws ResourceNotFoundException if the product does not exist
     * @throws AccessDeniedException     if the caller neither owns the product nor is an administrator
     */
    @Transactional
    public Product updateProduct(String productId, String requesterId, boolean admin, ProductDraft draft) {
        Product product = getOwnedProduct(productId, requesterId, admin);

        if (draft.getName() != null) {
            product.setName(draft.getName());
        }
        if (draft.getDescription() != null) {
            product.setDescription(draft.getDescription());
        }
        if (draft.getPrice() != null) {
            product.setPrice(draft.getPrice());
        }
        if (draft.getCategoryId() != null) {
            product.setCategoryId(draft.getCategoryId());
        }

        boolean stockChanged = draft.getStock() != null && !Objects.equals(draft.getStock(), product.getStock());
        if (stockChanged) {
            product.setStock(draft.getStock());
            int stock = draft.getStock();
            afterCommit(() -> publishStockChange(productId, stock));
        }

        logger.info("Product {} updated by {}{}", productId, requesterId,
                stockChanged ? ", stock now " + draft.getStock() : "");
        return product;
    }

    /**
     * Delist a product.
     *
     * @throws ResourceNotFoundException if the product does not exist
     * @throws AccessDeniedException     if the caller neither owns the product nor is an administrator
     */
    @Transactional
    public void deleteProduct(String productId, String requesterId, boolean admin) {
        Product product = getOwnedProduct(productId, requesterId, admin);
        productRepository.delete(product);

        afterCommit(() -> {
            cacheService.invalidateStockCount(productId);
            notificationChannel.broadcast(InventoryEvent.productDeleted(productId));
            kafkaProducerService.publishInventoryUpdate(productId, null, InventoryEvent.PRODUCT_DELETED);
        });
        logger.info("Product {} deleted by {}", productId, requesterId);
    }

    /**
     * Atomically take units out of stock.
     *
     * @param productId Product ID
     * @param quantity  Units to take (positive)
     * @return Stock after the decrement
     * @throws ResourceNotFoundException  if the product does not exist
     * @throws InsufficientStockException if fewer than {@code quantity} units are left; stock is unchanged
     */
    @Transactional
    public int decrementStock(String productId, int quantity) {
        if (quantity <= 0) {
            throw new IllegalArgumentException("Quantity must be positive: " + quantity);
        }

        int updated = productRepository.decrementStock(productId, quantity);
        Integer stock = productRepository.findStockByProductId(productId);
        if (stock == null) {
            throw new ResourceNotFoundException("Product", productId);
        }
        if (updated == 0) {
            throw new InsufficientStockException(productId, quantity, stock);
        }

        int newStock = stock;
        afterCommit(() -> publishStockChange(productId, newStock));
        logger.debug("Decremented stock of {} by {}: {} left", productId, quantity, newStock);
        return newStock;
    }

    private Product getOwnedProduct(String productId, String requesterId, boolean admin) {
        Product product = productRepository.findById(productId)
                .orElseThrow(() -> new ResourceNotFoundException("Product", productId));
        if (!admin && !product.isOwnedBy(requesterId)) {
            throw new AccessDeniedException("User " + requesterId + " does not own product " + productId);
        }
        return product;
    }

    private void publishStockChange(String productId, int stock) {
        cacheService.invalidateStockCount(productId);
        notificationChannel.broadcast(InventoryEvent.stockChanged(productId, stock));
        kafkaProducerService.publishInventoryUpdate(productId, stock, InventoryEvent.INVENTORY_UPDATE);
    }

    private static void afterCommit(Runnable action) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            action.run();
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                action.run();
            }
        });
    }
}
