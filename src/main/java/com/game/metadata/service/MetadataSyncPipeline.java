package com.game.metadata.service;

import com.game.metadata.logging.LogContext;
import com.game.metadata.metrics.MetricsService;
import com.game.metadata.metrics.NoOpMetricsService;
import com.game.metadata.provider.GameMetadata;
import com.game.metadata.provider.MetadataProvider;
import com.game.metadata.provider.MetadataProviderException;
import com.game.metadata.provider.MetadataRateLimitException;
import com.game.metadata.provider.MetadataSearchResult;
import com.game.metadata.provider.PlayerInfo;
import com.game.metadata.provider.ProviderCapability;
import com.game.metadata.provider.RetryingCaller;
import com.game.metadata.provider.TitleDomain;
import com.game.metadata.registry.ProviderRegistry;
import com.game.metadata.text.HtmlText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Bulk metadata lookup for the games a library connector reported.
 *
 * <p>A batch runs in three phases, all under one deadline:</p>
 * <ol>
 *   <li>Each game is fetched from the primary provider by its connector id.</li>
 *   <li>Games still without metadata are searched by name on the other search-capable
 *   providers of the same domain. Hits are re-keyed to the connector id.</li>
 *   <li>Multiplayer records without per-mode counts are enriched from providers of the
 *   same domain with accurate player counts.</li>
 * </ol>
 *
 * <p>Within a batch, a provider that rate-limits us, or fails
 * {@code maxConsecutiveErrors} times in a row, is not called again.</p>
 */
public class MetadataSyncPipeline {
    private static final Logger log = LoggerFactory.getLogger(MetadataSyncPipeline.class);

    static final long DEFAULT_TIMEOUT_PER_GAME_MS = 1000;

    private final ProviderRegistry registry;
    private final MetricsService metrics;
    private final Clock clock;

    private MetadataSyncPipeline(Builder builder) {
        this.registry = builder.registry;
        this.metrics = builder.metricsService != null ? builder.metricsService : new NoOpMetricsService();
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    }

    /**
     * Looks up metadata for a batch of connector games.
     *
     * @param games             games reported by the connector
     * @param primaryProviderId provider whose ids the connector reports
     * @param timeout           overall budget; one second per game when null
     * @return metadata keyed by connector game id, in input order; games without a match are absent
     */
    public Map<String, GameMetadata> processGameBatch(List<ExternalGame> games, String primaryProviderId,
                                                      Duration timeout) {
        Map<String, GameMetadata> found = new LinkedHashMap<>();
        if (games.isEmpty()) {
            return found;
        }
        Duration budget = timeout != null ? timeout : Duration.ofMillis(games.size() * DEFAULT_TIMEOUT_PER_GAME_MS);
        Instant deadline = clock.instant().plus(budget);
        ProviderHealthTracker health = new ProviderHealthTracker();
        Optional<MetadataProvider> primary = registry.getById(primaryProviderId);
        TitleDomain domain = primary.map(p -> p.getManifest().domain()).orElse(TitleDomain.VIDEO_GAME);

        try (LogContext ctx = LogContext.forSync(LogContext.generateCorrelationId(), primaryProviderId)) {
            log.info("sync.batch.start games={} primaryProvider={} timeoutMs={}",
                    games.size(), primaryProviderId, budget.toMillis());
            metrics.recordBatchSize(games.size());

            if (primary.isPresent()) {
                for (ExternalGame game : games) {
                    if (expired(deadline, "primary")) {
                        break;
                    }
                    fetch(primary.get(), game.getExternalGameId(), health)
                            .ifPresent(m -> found.put(game.getExternalGameId(), m));
                }
            } else {
                log.warn("sync.batch.primary_missing provider={}", primaryProviderId);
            }

            List<ExternalGame> missing = games.stream()
                    .filter(g -> !found.containsKey(g.getExternalGameId()))
                    .collect(Collectors.toList());
            if (!missing.isEmpty() && !expired(deadline, "search")) {
                List<MetadataProvider> fallbacks = registry.getAllByCapability(ProviderCapability.SEARCH).stream()
                        .filter(p -> !p.getManifest().id().equals(primaryProviderId))
                        .filter(p -> p.getManifest().domain() == domain)
                        .collect(Collectors.toList());
                for (ExternalGame game : missing) {
                    if (expired(deadline, "search")) {
                        break;
                    }
                    searchFallbacks(fallbacks, game, health)
                            .ifPresent(m -> found.put(game.getExternalGameId(), m.withExternalId(game.getExternalGameId())));
                }
            }

            for (ExternalGame game : games) {
                GameMetadata metadata = found.get(game.getExternalGameId());
                if (metadata == null || !needsPlayerCounts(metadata)) {
                    continue;
                }
                if (expired(deadline, "enrich")) {
                    break;
                }
                found.put(game.getExternalGameId(), enrichPlayerCounts(game.getName(), metadata, domain, health));
            }

            log.info("sync.batch.complete found={} total={}", found.size(), games.size());
            return found;
        }
    }

    /**
     * Copies metadata into fields the connector left unset. Only valid player counts are
     * copied, and physical support is never set.
     */
    public static ExternalGame enrichGameWithMetadata(ExternalGame game, GameMetadata metadata) {
        ExternalGame.Builder enriched = game.toBuilder();
        if (game.getDescription() == null && metadata.getDescription() != null) {
            enriched.description(HtmlText.normalizeDescription(metadata.getDescription()));
        }
        if (game.getReleaseDate() == null && metadata.getReleaseDate() != null) {
            enriched.releaseDate(metadata.getReleaseDate());
        }
        if (game.getDeveloper() == null && !metadata.getDevelopers().isEmpty()) {
            enriched.developer(metadata.getDevelopers().get(0));
        }
        if (game.getPublisher() == null && !metadata.getPublishers().isEmpty()) {
            enriched.publisher(metadata.getPublishers().get(0));
        }
        if (game.getGenres() == null && !metadata.getGenres().isEmpty()) {
            enriched.genres(metadata.getGenres());
        }
        if (game.getStoreUrl() == null && metadata.getStoreUrl() != null) {
            enriched.storeUrl(metadata.getStoreUrl());
        }
        if (game.getCoverImageUrl() == null && metadata.getCoverImageUrl() != null) {
            enriched.coverImageUrl(metadata.getCoverImageUrl());
        }

        PlayerInfo info = metadata.getPlayerInfo();
        if (info != null) {
            if (game.getOverallMinPlayers() == null && PlayerCounts.isValid(info.getOverallMinPlayers())) {
                enriched.overallMinPlayers(info.getOverallMinPlayers());
            }
            if (game.getOverallMaxPlayers() == null && PlayerCounts.isValid(info.getOverallMaxPlayers())) {
                enriched.overallMaxPlayers(info.getOverallMaxPlayers());
            }
            if (game.getSupportsOnline() == null) {
                enriched.supportsOnline(info.getSupportsOnline());
            }
            if (game.getSupportsLocal() == null) {
                enriched.supportsLocal(info.getSupportsLocal());
            }
            if (game.getOnlineMaxPlayers() == null && PlayerCounts.isValid(info.getOnlineMaxPlayers())) {
                enriched.onlineMaxPlayers(info.getOnlineMaxPlayers());
            }
            if (game.getLocalMaxPlayers() == null && PlayerCounts.isValid(info.getLocalMaxPlayers())) {
                enriched.localMaxPlayers(info.getLocalMaxPlayers());
            }
        }
        return enriched.build();
    }

    private Optional<GameMetadata> searchFallbacks(List<MetadataProvider> fallbacks, ExternalGame game,
                                                   ProviderHealthTracker health) {
        for (MetadataProvider provider : fallbacks) {
            List<MetadataSearchResult> results = search(provider, game.getName(), health);
            if (results.isEmpty()) {
                continue;
            }
            Optional<GameMetadata> metadata = fetch(provider, results.get(0).externalId(), health);
            if (metadata.isPresent()) {
                log.debug("sync.search.found provider={} game='{}'", provider.getManifest().id(), game.getName());
                return metadata;
            }
        }
        return Optional.empty();
    }

    private GameMetadata enrichPlayerCounts(String gameName, GameMetadata metadata, TitleDomain domain,
                                            ProviderHealthTracker health) {
        for (MetadataProvider provider : registry.getAllByCapability(ProviderCapability.ACCURATE_PLAYER_COUNTS)) {
            if (provider.getManifest().domain() != domain) {
                continue;
            }
            List<MetadataSearchResult> results = search(provider, gameName, health);
            if (results.isEmpty()) {
                continue;
            }
            Optional<GameMetadata> counts = fetch(provider, results.get(0).externalId(), health);
            if (counts.isPresent() && counts.get().getPlayerInfo() != null) {
                metrics.incrementEnrichment(provider.getManifest().id());
                log.info("sync.enrich.applied provider={} game='{}'", provider.getManifest().id(), gameName);
                return metadata.withPlayerInfo(PlayerCounts.merge(metadata.getPlayerInfo(),
                        counts.get().getPlayerInfo()));
            }
        }
        return metadata;
    }

    private List<MetadataSearchResult> search(MetadataProvider provider, String name, ProviderHealthTracker health) {
        List<MetadataSearchResult> results = call(provider, "searchGames", health,
                () -> provider.searchGames(name, 1, null));
        return results != null ? results : List.of();
    }

    private Optional<GameMetadata> fetch(MetadataProvider provider, String externalId, ProviderHealthTracker health) {
        Optional<GameMetadata> metadata = call(provider, "getGameMetadata", health,
                () -> provider.getGameMetadata(externalId, null));
        return metadata != null ? metadata : Optional.empty();
    }

    /**
     * Runs one provider call unless the provider has been dropped for this batch.
     * Returns null when the call was skipped or failed.
     */
    private <T> T call(MetadataProvider provider, String operation, ProviderHealthTracker health,
                       Supplier<T> request) {
        String providerId = provider.getManifest().id();
        if (!health.isUsable(providerId)) {
            return null;
        }
        long start = System.nanoTime();
        try {
            T result = RetryingCaller.call(providerId, provider.getRateLimitConfig(), operation, request);
            health.recordSuccess(providerId);
            metrics.recordProviderCall(providerId, operation, "ok", Duration.ofNanos(System.nanoTime() - start));
            return result;
        } catch (MetadataRateLimitException e) {
            metrics.incrementProviderFailure(providerId, "rate_limited");
            health.markRateLimited(providerId);
            return null;
        } catch (MetadataProviderException e) {
            metrics.incrementProviderFailure(providerId, e.isTransient() ? "transient" : "permanent");
            log.warn("sync.provider.failed provider={} operation={} error={}", providerId, operation, e.getMessage());
            health.recordFailure(providerId, provider.getRateLimitConfig().maxConsecutiveErrors());
            return null;
        } catch (RuntimeException e) {
            metrics.incrementProviderFailure(providerId, "unexpected");
            log.error("sync.provider.error provider={} operation={}", providerId, operation, e);
            health.recordFailure(providerId, provider.getRateLimitConfig().maxConsecutiveErrors());
            return null;
        }
    }

    private static boolean needsPlayerCounts(GameMetadata metadata) {
        PlayerInfo info = metadata.getPlayerInfo();
        return info != null && info.claimsMultiplayer() && !info.hasModePlayerCounts();
    }

    private boolean expired(Instant deadline, String phase) {
        if (clock.instant().isBefore(deadline)) {
            return false;
        }
        log.info("sync.batch.timeout phase={}", phase);
        return true;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private ProviderRegistry registry;
        private MetricsService metricsService;
        private Clock clock;

        public Builder registry(ProviderRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public MetadataSyncPipeline build() {
            Objects.requireNonNull(registry, "registry is required");
            return new MetadataSyncPipeline(this);
        }
    }
}
