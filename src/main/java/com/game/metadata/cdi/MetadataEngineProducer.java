package com.game.metadata.cdi;

import com.game.metadata.cache.CacheConfig;
import com.game.metadata.cache.CaffeineMetadataCache;
import com.game.metadata.cache.MetadataCache;
import com.game.metadata.config.MicroProfileSettingsStore;
import com.game.metadata.config.ProviderCredentials;
import com.game.metadata.metrics.MetricsService;
import com.game.metadata.metrics.MicrometerMetricsService;
import com.game.metadata.metrics.NoOpMetricsService;
import com.game.metadata.platform.GameReleaseRepository;
import com.game.metadata.platform.InMemoryGameReleaseRepository;
import com.game.metadata.platform.InMemoryPlatformRepository;
import com.game.metadata.platform.PlatformRepository;
import com.game.metadata.platform.PlatformService;
import com.game.metadata.provider.ProviderManifest;
import com.game.metadata.provider.http.HttpTransport;
import com.game.metadata.provider.http.JdkHttpTransport;
import com.game.metadata.provider.bga.BoardGameAtlasMetadataProvider;
import com.game.metadata.provider.bgg.BoardGameGeekMetadataProvider;
import com.game.metadata.provider.igdb.IgdbMetadataProvider;
import com.game.metadata.provider.rawg.RawgMetadataProvider;
import com.game.metadata.provider.steam.SteamMetadataProvider;
import com.game.metadata.provider.wikidata.WikidataMetadataProvider;
import com.game.metadata.registry.ProviderRegistry;
import com.game.metadata.service.MetadataService;
import com.game.metadata.service.MetadataSyncPipeline;
import com.game.metadata.title.GameTitleRepository;
import com.game.metadata.title.InMemoryGameTitleRepository;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * CDI producer that wires the metadata engine from MicroProfile Config properties.
 *
 * <p>Adapter credentials are read as {@code game-metadata.settings.<key>} with an
 * environment variable fallback (see {@link ProviderCredentials}). The host application
 * supplies its own {@link GameTitleRepository}, {@link PlatformRepository} and
 * {@link GameReleaseRepository} beans; in-memory versions are used when it does not.</p>
 *
 * <pre>
 * game-metadata.settings.rawgApiKey=...
 * game-metadata.cache.enabled=true
 * game-metadata.cache.max-size=5000
 * game-metadata.http.connect-timeout-seconds=10
 * </pre>
 */
@ApplicationScoped
public class MetadataEngineProducer {

    private static final Logger log = LoggerFactory.getLogger(MetadataEngineProducer.class);

    // ── HTTP ──────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "game-metadata.http.connect-timeout-seconds", defaultValue = "10")
    int connectTimeoutSeconds;

    // ── Cache ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "game-metadata.cache.enabled", defaultValue = "true")
    boolean cacheEnabled;

    @Inject
    @ConfigProperty(name = "game-metadata.cache.max-size", defaultValue = "5000")
    int cacheMaxSize;

    @Inject
    @ConfigProperty(name = "game-metadata.cache.ttl-seconds", defaultValue = "3600")
    int cacheTtlSeconds;

    // ── Metrics ───────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "game-metadata.metrics.enabled", defaultValue = "true")
    boolean metricsEnabled;

    @Inject
    Config config;

    @Inject
    Instance<MeterRegistry> meterRegistry;

    @Inject
    Instance<GameTitleRepository> titleRepository;

    @Inject
    Instance<PlatformRepository> platformRepository;

    @Inject
    Instance<GameReleaseRepository> releaseRepository;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public ProviderCredentials providerCredentials() {
        return new ProviderCredentials(new MicroProfileSettingsStore(config));
    }

    @Produces
    @ApplicationScoped
    public ProviderRegistry providerRegistry(ProviderCredentials credentials) {
        HttpTransport transport = new JdkHttpTransport(Duration.ofSeconds(connectTimeoutSeconds));
        ProviderRegistry registry = defaultRegistry(transport, credentials);
        log.info("Producing ProviderRegistry: providers={}", registry.getManifests().stream()
                .map(ProviderManifest::id)
                .collect(Collectors.joining(",")));
        return registry;
    }

    @Produces
    @ApplicationScoped
    public MetricsService metricsService() {
        if (metricsEnabled && meterRegistry.isResolvable()) {
            log.info("Metrics enabled: Micrometer");
            return new MicrometerMetricsService(meterRegistry.get());
        }
        log.info("Metrics disabled");
        return new NoOpMetricsService();
    }

    @Produces
    @ApplicationScoped
    public MetadataCache metadataCache() {
        CacheConfig cacheConfig = CacheConfig.of(cacheMaxSize, cacheTtlSeconds, cacheEnabled);
        log.info("Metadata cache: enabled={} maxSize={} ttlSeconds={}", cacheEnabled, cacheMaxSize, cacheTtlSeconds);
        return CaffeineMetadataCache.create(cacheConfig);
    }

    @Produces
    @ApplicationScoped
    public MetadataService metadataService(ProviderRegistry registry, MetadataCache cache, MetricsService metrics) {
        return MetadataService.builder()
                .registry(registry)
                .titleRepository(resolveOrDefault(titleRepository, InMemoryGameTitleRepository::new,
                        "GameTitleRepository"))
                .cache(cache)
                .metricsService(metrics)
                .build();
    }

    @Produces
    @ApplicationScoped
    public MetadataSyncPipeline metadataSyncPipeline(ProviderRegistry registry, MetricsService metrics) {
        return MetadataSyncPipeline.builder()
                .registry(registry)
                .metricsService(metrics)
                .build();
    }

    @Produces
    @ApplicationScoped
    public PlatformService platformService(MetricsService metrics) {
        return new PlatformService(
                resolveOrDefault(platformRepository, InMemoryPlatformRepository::new, "PlatformRepository"),
                resolveOrDefault(releaseRepository, InMemoryGameReleaseRepository::new, "GameReleaseRepository"),
                metrics);
    }

    // ══════════════════════════════════════════════════════════
    //  Internal
    // ══════════════════════════════════════════════════════════

    /**
     * All adapters in fallback order: Steam, IGDB, RAWG for video games, then
     * BoardGameGeek, Board Game Atlas, Wikidata for tabletop titles.
     */
    public static ProviderRegistry defaultRegistry(HttpTransport transport, ProviderCredentials credentials) {
        return ProviderRegistry.builder()
                .registerAll(List.of(
                        new SteamMetadataProvider(transport),
                        new IgdbMetadataProvider(transport, credentials),
                        new RawgMetadataProvider(transport, credentials),
                        new BoardGameGeekMetadataProvider(transport),
                        new BoardGameAtlasMetadataProvider(transport, credentials),
                        new WikidataMetadataProvider(transport)))
                .build();
    }

    private static <T> T resolveOrDefault(Instance<T> instance, Supplier<T> fallback,
                                          String beanName) {
        if (instance != null && instance.isResolvable()) {
            return instance.get();
        }
        log.warn("No {} bean found, using in-memory storage", beanName);
        return fallback.get();
    }
}
