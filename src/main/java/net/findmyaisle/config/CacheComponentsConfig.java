/**
 * Configuration class for the aggregation cache backing store
 * - Caffeine store with per-entry TTL when {@code app.cache.enabled} is true
 * - Always-miss store otherwise, so aggregation simply recomputes
 */
package net.findmyaisle.config;

import net.findmyaisle.support.cache.CacheStore;
import net.findmyaisle.support.cache.CaffeineCacheStore;
import net.findmyaisle.support.cache.DisabledCacheStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class CacheComponentsConfig {
    private static final Logger logger = LoggerFactory.getLogger(CacheComponentsConfig.class);

    @Bean
    public CacheStore aggregationCacheStore(@Value("${app.cache.enabled:true}") boolean enabled,
                                            @Value("${app.cache.maximum-size:10000}") long maximumSize) {
        if (!enabled) {
            logger.warn("Aggregation cache disabled (app.cache.enabled=false); every request will hit the sources");
            return new DisabledCacheStore();
        }
        logger.info("Aggregation cache backed by Caffeine, maximum {} entries", maximumSize);
        return new CaffeineCacheStore(maximumSize);
    }
}
