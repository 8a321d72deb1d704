package com.game.metadata.service;

import com.game.metadata.cache.MetadataCache;
import com.game.metadata.cache.NoOpMetadataCache;
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
import com.game.metadata.title.GameTitle;
import com.game.metadata.title.GameTitleRepository;
import com.game.metadata.title.TitleField;
import com.game.metadata.title.TitleUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Looks up metadata for catalog titles across the registered providers and turns it
 * into field-level title updates.
 *
 * <p>Providers for a title's domain are tried in registration order until one returns a
 * record. Provider failures are logged and the next provider is tried; they never
 * propagate to the caller. When the record claims multiplayer support without per-mode
 * counts, providers with {@link ProviderCapability#ACCURATE_PLAYER_COUNTS} are asked for
 * the counts. Only providers of the same domain as the record's source are asked, so a
 * video game is never enriched from a tabletop database.</p>
 *
 * <pre>
 * MetadataService service = MetadataService.builder()
 *     .registry(registry)
 *     .titleRepository(titles)
 *     .build();
 *
 * MetadataFetchResult result = service.fetchMetadata(title, null);
 * if (result.found()) {
 *     service.applyMetadataToTitle(title.getId(), title, result.metadata());
 * }
 * </pre>
 */
public class MetadataService {
    private static final Logger log = LoggerFactory.getLogger(MetadataService.class);

    public static final int MIN_VALID_DESCRIPTION_LENGTH = 50;
    static final int FETCH_SEARCH_LIMIT = 5;
    static final int ENRICHMENT_SEARCH_LIMIT = 1;
    static final int OPTIONS_SEARCH_LIMIT = 10;
    static final int MAX_OPTIONS = 15;

    static final String NO_PROVIDERS = "No metadata providers available for this game type";
    static final String NOT_FOUND = "No metadata found from any provider";

    private final ProviderRegistry registry;
    private final GameTitleRepository titleRepository;
    private final MetadataCache cache;
    private final MetricsService metrics;

    private MetadataService(Builder builder) {
        this.registry = builder.registry;
        this.titleRepository = builder.titleRepository;
        this.cache = builder.cache != null ? builder.cache : new NoOpMetadataCache();
        this.metrics = builder.metricsService != null ? builder.metricsService : new NoOpMetricsService();
    }

    /**
     * Finds metadata for a title by searching its domain's providers in fallback order.
     * Missing per-mode player counts are filled from capability-flagged providers of the
     * same domain only.
     *
     * @param title       the catalog title
     * @param searchQuery search text; the title's name when null or blank
     */
    public MetadataFetchResult fetchMetadata(GameTitle title, String searchQuery) {
        try (LogContext ctx = LogContext.forFetch(LogContext.generateCorrelationId(), title.getId(),
                title.getType().getLabel())) {
            List<MetadataProvider> providers = registry.getByTitleType(title.getType());
            if (providers.isEmpty()) {
                return MetadataFetchResult.notFound(NO_PROVIDERS);
            }
            String query = searchQuery != null && !searchQuery.isBlank() ? searchQuery.trim() : title.getName();

            GameMetadata found = null;
            String providerName = null;
            for (MetadataProvider provider : providers) {
                Optional<GameMetadata> metadata = searchAndFetch(provider, query, FETCH_SEARCH_LIMIT);
                if (metadata.isPresent()) {
                    found = metadata.get();
                    providerName = provider.getManifest().name();
                    log.info("metadata.fetch.found provider={} title='{}' externalId={}",
                            provider.getManifest().id(), title.getName(), found.getExternalId());
                    break;
                }
            }

            if (found == null) {
                metrics.incrementNotFound(title.getType().getDomain());
                log.info("metadata.fetch.notfound title='{}' providersTried={}", title.getName(), providers.size());
                return MetadataFetchResult.notFound(NOT_FOUND);
            }
            return enrich(found, providerName, query, title.getType().getDomain());
        }
    }

    /**
     * Fetches one provider's record by its external id, then runs the same enrichment
     * as {@link #fetchMetadata}.
     */
    public MetadataFetchResult fetchMetadataFromProvider(String providerId, String externalId) {
        Optional<MetadataProvider> provider = registry.getById(providerId);
        if (provider.isEmpty()) {
            return MetadataFetchResult.notFound("Provider '" + providerId + "' not found");
        }
        String providerName = provider.get().getManifest().name();
        Optional<GameMetadata> metadata;
        try {
            metadata = fetchById(provider.get(), externalId);
        } catch (MetadataProviderException e) {
            recordFailure(providerId, e);
            log.warn("metadata.fetch.failed provider={} externalId={} error={}", providerId, externalId,
                    e.getMessage());
            return MetadataFetchResult.notFound("Failed to fetch metadata from " + providerName);
        }
        if (metadata.isEmpty()) {
            return MetadataFetchResult.notFound("No metadata found for ID " + externalId);
        }
        return enrich(metadata.get(), providerName, metadata.get().getName(), provider.get().getManifest().domain());
    }

    /**
     * Collects candidates from every provider for the title's domain so a person can
     * pick the right one. Duplicate names are dropped, keeping the first occurrence, and
     * the rest are ordered exact match first, then prefix match, then shorter names.
     */
    public List<MetadataSearchResult> searchMetadataOptions(GameTitle title, String searchQuery) {
        List<MetadataProvider> providers = registry.getByTitleType(title.getType());
        if (providers.isEmpty()) {
            return List.of();
        }
        String query = searchQuery != null && !searchQuery.isBlank() ? searchQuery.trim() : title.getName();

        List<MetadataSearchResult> all = new ArrayList<>();
        for (MetadataProvider provider : providers) {
            all.addAll(search(provider, query, OPTIONS_SEARCH_LIMIT));
        }

        Set<String> seen = new HashSet<>();
        List<MetadataSearchResult> unique = all.stream()
                .filter(r -> seen.add(r.name().trim().toLowerCase(Locale.ROOT)))
                .collect(Collectors.toList());

        String normalizedQuery = query.trim().toLowerCase(Locale.ROOT);
        Comparator<MetadataSearchResult> relevance = Comparator
                .comparingInt((MetadataSearchResult r) -> lower(r).equals(normalizedQuery) ? 0 : 1)
                .thenComparingInt(r -> lower(r).startsWith(normalizedQuery) ? 0 : 1)
                .thenComparingInt(r -> lower(r).length());
        return unique.stream()
                .sorted(relevance)
                .limit(MAX_OPTIONS)
                .collect(Collectors.toList());
    }

    /**
     * Computes the patch metadata implies for a title and persists it when non-empty.
     *
     * <ul>
     *   <li>The description is replaced only when the cleaned new one is non-empty and the
     *   current one is missing, shorter than {@value #MIN_VALID_DESCRIPTION_LENGTH}
     *   characters or equal to the title's name.</li>
     *   <li>The cover image is set only when the title has none.</li>
     *   <li>A mode's maximum is written only when that mode is, or is becoming, supported.
     *   Marking a mode unsupported clears its counts.</li>
     *   <li>The physical mode is only touched on tabletop titles.</li>
     * </ul>
     */
    public TitleUpdateResult applyMetadataToTitle(String titleId, GameTitle title, GameMetadata metadata) {
        TitleUpdate update = new TitleUpdate();

        String rawDescription = metadata.getShortDescription() != null && !metadata.getShortDescription().isBlank()
                ? metadata.getShortDescription() : metadata.getDescription();
        String description = HtmlText.normalizeDescription(rawDescription);
        String current = title.getDescription();
        if (!description.isEmpty() && (current == null || current.isEmpty()
                || current.length() < MIN_VALID_DESCRIPTION_LENGTH || current.equals(title.getName()))) {
            update.set(TitleField.DESCRIPTION, description);
        }

        if (metadata.getCoverImageUrl() != null && (title.getCoverImageUrl() == null
                || title.getCoverImageUrl().isEmpty())) {
            update.set(TitleField.COVER_IMAGE_URL, metadata.getCoverImageUrl());
        }

        PlayerInfo info = metadata.getPlayerInfo();
        if (info != null) {
            if (PlayerCounts.isValid(info.getOverallMinPlayers())) {
                update.set(TitleField.OVERALL_MIN_PLAYERS, info.getOverallMinPlayers());
            }
            if (PlayerCounts.isValid(info.getOverallMaxPlayers())) {
                update.set(TitleField.OVERALL_MAX_PLAYERS, info.getOverallMaxPlayers());
            }
            applyMode(update, info.getSupportsOnline(), title.getSupportsOnline(), info.getOnlineMaxPlayers(),
                    TitleField.SUPPORTS_ONLINE, TitleField.ONLINE_MIN_PLAYERS, TitleField.ONLINE_MAX_PLAYERS);
            applyMode(update, info.getSupportsLocal(), title.getSupportsLocal(), info.getLocalMaxPlayers(),
                    TitleField.SUPPORTS_LOCAL, TitleField.LOCAL_MIN_PLAYERS, TitleField.LOCAL_MAX_PLAYERS);
            if (title.getType().isTabletop()) {
                applyMode(update, info.getSupportsPhysical(), title.getSupportsPhysical(),
                        info.getPhysicalMaxPlayers(), TitleField.SUPPORTS_PHYSICAL,
                        TitleField.PHYSICAL_MIN_PLAYERS, TitleField.PHYSICAL_MAX_PLAYERS);
            }
        }

        if (!update.isEmpty()) {
            titleRepository.applyUpdate(titleId, update);
            log.info("metadata.apply titleId={} fields={}", titleId, update.fieldNames());
        }
        return new TitleUpdateResult(update, update.fieldNames());
    }

    /**
     * Merges enrichment counts into an existing record; see {@link PlayerCounts#merge}.
     */
    public PlayerInfo mergePlayerCounts(PlayerInfo existing, PlayerInfo enrichment) {
        return PlayerCounts.merge(existing, enrichment);
    }

    private static void applyMode(TitleUpdate update, Boolean supports, Boolean currentlySupports, Integer maxPlayers,
                                  TitleField flagField, TitleField minField, TitleField maxField) {
        if (supports != null) {
            update.set(flagField, supports);
            if (!supports) {
                update.clear(minField);
                update.clear(maxField);
            }
        }
        Boolean willSupport = supports != null ? supports : currentlySupports;
        if (Boolean.TRUE.equals(willSupport) && PlayerCounts.isValid(maxPlayers)) {
            update.set(maxField, maxPlayers);
        }
    }

    /**
     * Asks player-count providers for the counts a multiplayer record lacks. Stops at the
     * first provider that answers.
     */
    private MetadataFetchResult enrich(GameMetadata metadata, String providerName, String query, TitleDomain domain) {
        PlayerInfo info = metadata.getPlayerInfo();
        if (info == null || !info.claimsMultiplayer() || info.hasModePlayerCounts()) {
            return MetadataFetchResult.found(metadata, providerName);
        }

        for (MetadataProvider enricher : registry.getAllByCapability(ProviderCapability.ACCURATE_PLAYER_COUNTS)) {
            if (enricher.getManifest().domain() != domain) {
                continue;
            }
            String enricherName = enricher.getManifest().name();
            log.debug("metadata.enrich.attempt provider={} query='{}'", enricher.getManifest().id(), query);
            Optional<GameMetadata> counts = searchAndFetch(enricher, query, ENRICHMENT_SEARCH_LIMIT);
            if (counts.isPresent() && counts.get().getPlayerInfo() != null) {
                metrics.incrementEnrichment(enricher.getManifest().id());
                log.info("metadata.enrich.applied provider={} query='{}'", enricher.getManifest().id(), query);
                return MetadataFetchResult.found(
                        metadata.withPlayerInfo(mergePlayerCounts(info, counts.get().getPlayerInfo())),
                        providerName + " + " + enricherName);
            }
        }
        return MetadataFetchResult.found(metadata, providerName);
    }

    /**
     * Searches and fetches the top hit. Failures are logged and reported as a miss.
     */
    private Optional<GameMetadata> searchAndFetch(MetadataProvider provider, String query, int limit) {
        String providerId = provider.getManifest().id();
        try {
            List<MetadataSearchResult> results = timed(providerId, "searchGames", () ->
                    RetryingCaller.call(providerId, provider.getRateLimitConfig(), "searchGames",
                            () -> provider.searchGames(query, limit, null)));
            if (results.isEmpty()) {
                return Optional.empty();
            }
            return fetchById(provider, results.get(0).externalId());
        } catch (MetadataProviderException e) {
            recordFailure(providerId, e);
            log.warn("metadata.provider.failed provider={} query='{}' error={}", providerId, query, e.getMessage());
            return Optional.empty();
        } catch (RuntimeException e) {
            metrics.incrementProviderFailure(providerId, "unexpected");
            log.error("metadata.provider.error provider={} query='{}'", providerId, query, e);
            return Optional.empty();
        }
    }

    private List<MetadataSearchResult> search(MetadataProvider provider, String query, int limit) {
        String providerId = provider.getManifest().id();
        try {
            return timed(providerId, "searchGames", () ->
                    RetryingCaller.call(providerId, provider.getRateLimitConfig(), "searchGames",
                            () -> provider.searchGames(query, limit, null)));
        } catch (MetadataProviderException e) {
            recordFailure(providerId, e);
            log.warn("metadata.search.failed provider={} query='{}' error={}", providerId, query, e.getMessage());
            return List.of();
        } catch (RuntimeException e) {
            metrics.incrementProviderFailure(providerId, "unexpected");
            log.error("metadata.search.error provider={} query='{}'", providerId, query, e);
            return List.of();
        }
    }

    /**
     * Cache-aware fetch by external id with transient failures retried.
     *
     * @throws MetadataProviderException when the provider fails after retries
     */
    Optional<GameMetadata> fetchById(MetadataProvider provider, String externalId) {
        String providerId = provider.getManifest().id();
        Optional<GameMetadata> cached = cache.get(providerId, externalId);
        if (cached.isPresent()) {
            metrics.recordCacheHit();
            return cached;
        }
        metrics.recordCacheMiss();
        Optional<GameMetadata> metadata = timed(providerId, "getGameMetadata", () ->
                RetryingCaller.call(providerId, provider.getRateLimitConfig(), "getGameMetadata",
                        () -> provider.getGameMetadata(externalId, null)));
        metadata.ifPresent(m -> cache.put(providerId, externalId, m));
        return metadata;
    }

    private <T> T timed(String providerId, String operation, Supplier<T> call) {
        long start = System.nanoTime();
        String outcome = "error";
        try {
            T result = call.get();
            outcome = isEmptyResult(result) ? "miss" : "found";
            return result;
        } finally {
            metrics.recordProviderCall(providerId, operation, outcome, Duration.ofNanos(System.nanoTime() - start));
        }
    }

    private static boolean isEmptyResult(Object result) {
        if (result instanceof Optional<?> optional) {
            return optional.isEmpty();
        }
        if (result instanceof List<?> list) {
            return list.isEmpty();
        }
        return result == null;
    }

    private void recordFailure(String providerId, MetadataProviderException e) {
        String kind;
        if (e instanceof MetadataRateLimitException) {
            kind = "rate_limited";
        } else if (e.isTransient()) {
            kind = "transient";
        } else {
            kind = "permanent";
        }
        metrics.incrementProviderFailure(providerId, kind);
    }

    private static String lower(MetadataSearchResult result) {
        return result.name().trim().toLowerCase(Locale.ROOT);
    }

    public ProviderRegistry getRegistry() {
        return registry;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private ProviderRegistry registry;
        private GameTitleRepository titleRepository;
        private MetadataCache cache;
        private MetricsService metricsService;

        public Builder registry(ProviderRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder titleRepository(GameTitleRepository titleRepository) {
            this.titleRepository = titleRepository;
            return this;
        }

        public Builder cache(MetadataCache cache) {
            this.cache = cache;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public MetadataService build() {
            Objects.requireNonNull(registry, "registry is required");
            Objects.requireNonNull(titleRepository, "titleRepository is required");
            return new MetadataService(this);
        }
    }
}
