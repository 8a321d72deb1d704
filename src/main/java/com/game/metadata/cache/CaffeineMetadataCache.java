package com.game.metadata.cache;

import com.game.metadata.provider.GameMetadata;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Caffeine-backed metadata cache.
 */
public class CaffeineMetadataCache implements MetadataCache {
    private static final Logger log = LoggerFactory.getLogger(CaffeineMetadataCache.class);

    private final Cache<CacheKey, GameMetadata> cache;

    public CaffeineMetadataCache(CacheConfig config) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxEntries())
                .expireAfterWrite(config.ttl())
                .recordStats()
                .build();
        log.info("CaffeineMetadataCache initialized: maxEntries={}, ttl={}", config.maxEntries(), config.ttl());
    }

    /**
     * Builds the cache the configuration asks for.
     */
    public static MetadataCache create(CacheConfig config) {
        return config.enabled() ? new CaffeineMetadataCache(config) : new NoOpMetadataCache();
    }

    @Override
    public Optional<GameMetadata> get(String providerId, String externalId) {
        return Optional.ofNullable(cache.getIfPresent(new CacheKey(providerId, externalId)));
    }

    @Override
    public void put(String providerId, String externalId, GameMetadata metadata) {
        cache.put(new CacheKey(providerId, externalId), metadata);
    }

    @Override
    public void invalidate(String providerId, String externalId) {
        cache.invalidate(new CacheKey(providerId, externalId));
    }

    @Override
    public void invalidateProvider(String providerId) {
        cache.asMap().keySet().removeIf(key -> key.providerId().equals(providerId));
        log.debug("Invalidated cache entries for provider {}", providerId);
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        log.debug("Invalidated all cache entries");
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats caffeineStats = cache.stats();
        return new CacheStats(
                caffeineStats.hitCount(),
                caffeineStats.missCount(),
                caffeineStats.evictionCount(),
                cache.estimatedSize()
        );
    }

    record CacheKey(String providerId, String externalId) {}
}
