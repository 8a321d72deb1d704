package com.game.metadata.cache;

import com.game.metadata.provider.GameMetadata;

import java.util.Optional;

/**
 * Used when caching is disabled.
 */
public class NoOpMetadataCache implements MetadataCache {

    @Override
    public Optional<GameMetadata> get(String providerId, String externalId) {
        return Optional.empty();
    }

    @Override
    public void put(String providerId, String externalId, GameMetadata metadata) {
        // no-op
    }

    @Override
    public void invalidate(String providerId, String externalId) {
        // no-op
    }

    @Override
    public void invalidateProvider(String providerId) {
        // no-op
    }

    @Override
    public void invalidateAll() {
        // no-op
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }
}
