package com.nexusmarket.storefront.infrastructure.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * Redis cache of product stock counts.
 * The database stays the source of truth; every cache failure is logged and treated as a miss.
 *
 * Cache Keys:
 * - stock:{product_id} -> Current stock count (Integer)
 *
 * @author Storefront Team
 */
@Service
public class RedisCacheService {

    private static final Logger logger = LoggerFactory.getLogger(RedisCacheService.class);

    private static final String STOCK_PREFIX = "stock:";
    private static final Duration STOCK_TTL = Duration.ofMinutes(5);

    private final StringRedisTemplate redisTemplate;

    public RedisCacheService(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    /**
     * Get stock count from cache.
     *
     * @param productId Product ID
     * @return Optional containing stock count if cached
     */
    public Optional<Integer> getStockCount(String productId) {
        try {
            String value = redisTemplate.opsForValue().get(STOCK_PREFIX + productId);
            if (value != null) {
                logger.debug("Cache hit for stock count: {}", productId);
                return Optional.of(Integer.parseInt(value));
            }
            logger.debug("Cache miss for stock count: {}", productId);
            return Optional.empty();
        } catch (Exception e) {
            logger.error("Error getting stock count from cache for product: {}", productId, e);
            return Optional.empty();
        }
    }

    /**
     * Set stock count in cache.
     *
     * @param productId Product ID
     * @param count     Current stock count
     */
    public void setStockCount(String productId, Integer count) {
        try {
            redisTemplate.opsForValue().set(STOCK_PREFIX + productId, count.toString(), STOCK_TTL);
            logger.debug("Cached stock count for {}: {}", productId, count);
        } catch (Exception e) {
            logger.error("Error setting stock count in cache for product: {}", productId, e);
        }
    }

    public void invalidateStockCount(String productId) {
        try {
            redisTemplate.delete(STOCK_PREFIX + productId);
            logger.debug("Invalidated stock count cache for: {}", productId);
        } catch (Exception e) {
            logger.error("Error invalidating stock count cache for product: {}", productId, e);
        }
    }
}
