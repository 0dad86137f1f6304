package com.nexusmarket.storefront.repository;

import com.nexusmarket.storefront.domain.model.Product;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Product entity.
 * Stock changes go through single-statement conditional updates so concurrent
 * purchases can never lose an update or drive stock below zero.
 *
 * @author Storefront Team
 */
@Repository
public interface ProductRepository extends JpaRepository<Product, String> {

    List<Product> findByCategoryIdOrderByCreatedAtDesc(String categoryId);

    List<Product> findAllByOrderByCreatedAtDesc();

    List<Product> findBySellerIdOrderByCreatedAtDesc(String sellerId);

    List<Product> findByProductIdIn(List<String> productIds);

    /**
     * Find a product with a pessimistic write lock.
     * Serializes read-modify-write of the review aggregates on one product.
     *
     * @param productId Product ID
     * @return Product with lock
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM Product p WHERE p.productId = :productId")
    Optional<Product> findByIdWithLock(@Param("productId") String productId);

    /**
     * Atomically decrement stock.
     * The row is only updated if it still holds at least {@code quantity} units and the quantity is positive.
     *
     * @param productId Product ID
     * @param quantity Quantity to remove
     * @return Number of rows updated (1 if successful, 0 if product missing or stock insufficient)
     */
    @Transactional
    @Modifying
    @Query("UPDATE Product p SET " +
           "p.stock = p.stock - :quantity " +
           "WHERE p.productId = :productId AND p.stock >= :quantity AND :quantity > 0")
    int decrementStock(@Param("productId") String productId, @Param("quantity") Integer quantity);

    /**
     * Get current stock for a product.
     * Scalar query, always read from the database rather than the persistence context.
     *
     * @param productId Product ID
     * @return Stock, or null if the product does not exist
     */
    @Query("SELECT p.stock FROM Product p WHERE p.productId = :productId")
    Integer findStockByProductId(@Param("productId") String productId);
}
