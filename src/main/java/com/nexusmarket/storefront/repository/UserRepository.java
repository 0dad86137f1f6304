package com.nexusmarket.storefront.repository;

import com.nexusmarket.storefront.domain.model.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/**
 * Repository interface for User entity.
 *
 * @author Storefront Team
 */
@Repository
public interface UserRepository extends JpaRepository<User, String> {

    /**
     * Atomically add loyalty points to a user.
     *
     * @param userId User ID
     * @param points Points to add (non-negative)
     * @return Number of rows updated (0 if the user does not exist)
     */
    @Transactional
    @Modifying
    @Query("UPDATE User u SET u.loyaltyPoints = u.loyaltyPoints + :points WHERE u.userId = :userId")
    int creditLoyaltyPoints(@Param("userId") String userId, @Param("points") int points);
}
