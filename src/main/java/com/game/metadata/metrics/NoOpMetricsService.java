package com.game.metadata.metrics;

import com.game.metadata.provider.TitleDomain;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordProviderCall(String providerId, String operation, String outcome, Duration duration) {
    }

    @Override
    public void incrementProviderFailure(String providerId, String kind) {
    }

    @Override
    public void incrementEnrichment(String providerId) {
    }

    @Override
    public void incrementNotFound(TitleDomain domain) {
    }

    @Override
    public void incrementPlatformMerged() {
    }

    @Override
    public void recordBatchSize(int size) {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }
}
