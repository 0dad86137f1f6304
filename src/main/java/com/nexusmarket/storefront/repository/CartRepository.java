package com.nexusmarket.storefront.repository;

import com.nexusmarket.storefront.domain.model.Cart;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository interface for Cart entity, keyed by buyer ID.
 *
 * @author Storefront Team
 */
@Repository
public interface CartRepository extends JpaRepository<Cart, String> {
}
