package com.game.metadata.metrics;

import com.game.metadata.provider.TitleDomain;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code metadata.provider.call} Timer (tags: provider, operation, outcome)</li>
 *   <li>{@code metadata.provider.failure} Counter (tags: provider, kind)</li>
 *   <li>{@code metadata.enrichment} Counter (tag: provider)</li>
 *   <li>{@code metadata.not_found} Counter (tag: domain)</li>
 *   <li>{@code metadata.platform.merged} Counter</li>
 *   <li>{@code metadata.batch.size} DistributionSummary</li>
 *   <li>{@code metadata.cache.hit}, {@code metadata.cache.miss} Counters</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final DistributionSummary batchSizeSummary;
    private final Counter platformMergedCounter;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.batchSizeSummary = DistributionSummary.builder("metadata.batch.size")
                .description("Number of games per sync batch")
                .register(registry);
        this.platformMergedCounter = Counter.builder("metadata.platform.merged")
                .description("Number of platform merges committed")
                .register(registry);
        this.cacheHitCounter = Counter.builder("metadata.cache.hit")
                .description("Number of metadata cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("metadata.cache.miss")
                .description("Number of metadata cache misses")
                .register(registry);
    }

    @Override
    public void recordProviderCall(String providerId, String operation, String outcome, Duration duration) {
        String key = providerId + ":" + operation + ":" + outcome;
        Timer timer = timerCache.computeIfAbsent(key, k ->
                Timer.builder("metadata.provider.call")
                        .description("Duration of provider calls")
                        .tag("provider", providerId)
                        .tag("operation", operation)
                        .tag("outcome", outcome)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementProviderFailure(String providerId, String kind) {
        String key = "failure:" + providerId + ":" + kind;
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("metadata.provider.failure")
                        .description("Number of failed provider calls")
                        .tag("provider", providerId)
                        .tag("kind", kind)
                        .register(registry));
        counter.increment();
    }

    @Override
    public void incrementEnrichment(String providerId) {
        String key = "enrichment:" + providerId;
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("metadata.enrichment")
                        .description("Number of player count enrichments")
                        .tag("provider", providerId)
                        .register(registry));
        counter.increment();
    }

    @Override
    public void incrementNotFound(TitleDomain domain) {
        String key = "notfound:" + domain.name();
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("metadata.not_found")
                        .description("Number of lookups no provider could answer")
                        .tag("domain", domain.name())
                        .register(registry));
        counter.increment();
    }

    @Override
    public void incrementPlatformMerged() {
        platformMergedCounter.increment();
    }

    @Override
    public void recordBatchSize(int size) {
        batchSizeSummary.record(size);
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }
}
