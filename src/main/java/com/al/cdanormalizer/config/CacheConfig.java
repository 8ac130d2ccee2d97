package com.al.cdanormalizer.config;

import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.concurrent.ConcurrentMapCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Local cache configuration for terminology lookups.
 *
 * <p>
 * Catalogue concepts are read-only for the lifetime of the process, so
 * lookups are cached without expiry.
 *
 * @author CDA Normalizer Team
 * @version 1.0.0
 * @since 1.0.0
 */
@Configuration
@EnableCaching
public class CacheConfig {

    public static final String CONCEPTS_BY_CODE = "conceptsByCode";
    public static final String CONCEPTS_BY_DISPLAY = "conceptsByDisplay";

    @Bean
    public CacheManager cacheManager() {
        ConcurrentMapCacheManager manager = new ConcurrentMapCacheManager(CONCEPTS_BY_CODE, CONCEPTS_BY_DISPLAY);
        manager.setAllowNullValues(true);
        return manager;
    }
}
