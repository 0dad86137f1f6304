package com.nexusmarket.storefront.service;

import com.nexusmarket.storefront.domain.model.User;
import com.nexusmarket.storefront.repository.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

/**
 * Buyer records and loyalty balances.
 *
 * @author Storefront Team
 */
@Service
public class UserService {

    private static final Logger logger = LoggerFactory.getLogger(UserService.class);

    private final UserRepository userRepository;

    public UserService(UserRepository userRepository) {
        this.userRepository = userRepository;
    }

    /**
     * Create the buyer's record with zero points unless it already exists.
     * Runs in its own repository transaction; losing an insert race to a concurrent
     * first order is fine.
     *
     * @param userId Buyer ID
     */
    public void registerIfAbsent(String userId) {
        if (userRepository.existsById(userId)) {
            return;
        }
        try {
            userRepository.save(User.builder().userId(userId).build());
            logger.info("Registered user {}", userId);
        } catch (DataIntegrityViolationException e) {
            logger.debug("User {} registered concurrently", userId);
        }
    }

    /**
     * Get a user's loyalty record; users with no orders yet have zero points.
     *
     * @param userId User ID
     * @return Persisted user, or an unsaved user with zero points
     */
    public User getUser(String userId) {
        return userRepository.findById(userId)
                .orElseGet(() -> User.builder().userId(userId).loyaltyPoints(0).build());
    }
}
