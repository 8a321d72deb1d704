package com.game.metadata.cache;

import com.game.metadata.provider.GameMetadata;

import java.util.Optional;

/**
 * Cache of full provider records, keyed by provider id and external id.
 * Only successful fetches are cached; misses and failures are not.
 */
public interface MetadataCache {

    Optional<GameMetadata> get(String providerId, String externalId);

    void put(String providerId, String externalId, GameMetadata metadata);

    void invalidate(String providerId, String externalId);

    /**
     * Drops every entry fetched from the given provider.
     */
    void invalidateProvider(String providerId);

    void invalidateAll();

    CacheStats getStats();
}
