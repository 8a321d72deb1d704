package com.game.metadata.metrics;

import com.game.metadata.provider.TitleDomain;

import java.time.Duration;

/**
 * Interface for recording metadata engine metrics.
 * The default {@link NoOpMetricsService} does nothing, so the engine works without a
 * meter registry.
 */
public interface MetricsService {

    /**
     * @param outcome {@code found}, {@code miss} or {@code error}
     */
    void recordProviderCall(String providerId, String operation, String outcome, Duration duration);

    /**
     * @param kind {@code rate_limited}, {@code transient} or {@code permanent}
     */
    void incrementProviderFailure(String providerId, String kind);

    void incrementEnrichment(String providerId);

    void incrementNotFound(TitleDomain domain);

    void incrementPlatformMerged();

    void recordBatchSize(int size);

    void recordCacheHit();

    void recordCacheMiss();
}
