package net.neurod3.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import net.neurod3.model.CatalogSnapshot;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Factory for the Caffeine caches used by the catalog layer.
 */
@Configuration
public class CacheFactory {

    /** Single key under which the current catalog snapshot is cached. */
    public static final String SNAPSHOT_KEY = "catalog";

    /**
     * Create a cache with specified configuration.
     */
    public <K, V> Cache<K, V> createCache(int maxSize, Duration ttl) {
        return Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfterWrite(ttl)
            .recordStats()
            .build();
    }

    @Bean
    public Cache<String, CatalogSnapshot> catalogSnapshotCache(CatalogProperties catalogProperties) {
        return createCache(1, catalogProperties.getSnapshotCacheTtl());
    }
}
