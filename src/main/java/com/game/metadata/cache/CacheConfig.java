package com.game.metadata.cache;

import java.time.Duration;
import java.util.Objects;

/**
 * Sizing for the fetched-record cache. Records are keyed by provider and external id
 * and expire a fixed time after they were fetched.
 *
 * @param maxEntries most records kept before the least useful are evicted
 * @param ttl        how long a fetched record stays valid
 * @param enabled    false to skip caching entirely
 */
public record CacheConfig(int maxEntries, Duration ttl, boolean enabled) {

    public static final int DEFAULT_MAX_ENTRIES = 5_000;
    public static final Duration DEFAULT_TTL = Duration.ofHours(1);

    public CacheConfig {
        Objects.requireNonNull(ttl, "ttl is required");
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be > 0");
        }
        if (ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
    }

    /**
     * Builds a configuration from the flat property values the CDI producer reads.
     */
    public static CacheConfig of(int maxEntries, int ttlSeconds, boolean enabled) {
        return new CacheConfig(maxEntries, Duration.ofSeconds(ttlSeconds), enabled);
    }

    public static CacheConfig defaults() {
        return new CacheConfig(DEFAULT_MAX_ENTRIES, DEFAULT_TTL, true);
    }

    public static CacheConfig disabled() {
        return new CacheConfig(1, DEFAULT_TTL, false);
    }
}
