package com.game.metadata.provider.bga;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.game.metadata.config.ProviderCredentials;
import com.game.metadata.provider.GameMetadata;
import com.game.metadata.provider.MetadataProvider;
import com.game.metadata.provider.MetadataSearchResult;
import com.game.metadata.provider.PlayerInfo;
import com.game.metadata.provider.ProviderCapabilities;
import com.game.metadata.provider.ProviderCapability;
import com.game.metadata.provider.ProviderManifest;
import com.game.metadata.provider.RateLimitConfig;
import com.game.metadata.provider.TitleDomain;
import com.game.metadata.provider.http.HttpTransport;
import com.game.metadata.provider.http.JsonPayloads;
import com.game.metadata.provider.http.ProviderHttpClient;
import com.game.metadata.provider.http.ProviderRequest;
import com.game.metadata.ratelimit.RequestThrottle;
import com.game.metadata.text.HtmlText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Board Game Atlas adapter. Needs a client id, taken from the call, the
 * {@code boardGameAtlasClientId} setting or the {@code BOARD_GAME_ATLAS_CLIENT_ID}
 * environment variable.
 */
public class BoardGameAtlasMetadataProvider implements MetadataProvider {
    private static final Logger log = LoggerFactory.getLogger(BoardGameAtlasMetadataProvider.class);

    public static final String ID = "bga";

    static final String SEARCH_URL = "https://api.boardgameatlas.com/api/search";
    static final int MAX_MECHANICS_AS_GENRES = 3;
    static final int MAX_DESIGNERS = 5;
    static final int MAX_PUBLISHERS = 3;

    private static final ProviderManifest MANIFEST = new ProviderManifest(
            ID, "Board Game Atlas", "Board game metadata with reliable player counts from Board Game Atlas",
            "1.0.0", true, "https://www.boardgameatlas.com/game/{id}", TitleDomain.TABLETOP);

    private static final ProviderCapabilities CAPABILITIES = ProviderCapabilities.of(
            ProviderCapability.ACCURATE_PLAYER_COUNTS, ProviderCapability.SEARCH,
            ProviderCapability.DESCRIPTIONS, ProviderCapability.COVER_IMAGES);

    public static final RateLimitConfig RATE_LIMIT = RateLimitConfig.defaults().withRequestDelayMs(600);

    private final ProviderHttpClient http;
    private final ObjectMapper mapper;
    private final ProviderCredentials credentials;
    private final RateLimitConfig rateLimit;

    public BoardGameAtlasMetadataProvider(HttpTransport transport, ProviderCredentials credentials) {
        this(transport, credentials, new ObjectMapper(), RATE_LIMIT);
    }

    public BoardGameAtlasMetadataProvider(HttpTransport transport, ProviderCredentials credentials,
                                          ObjectMapper mapper, RateLimitConfig rateLimit) {
        this.credentials = credentials;
        this.mapper = mapper;
        this.rateLimit = rateLimit;
        this.http = new ProviderHttpClient(ID, transport, new RequestThrottle(ID, rateLimit.requestDelayMs()));
    }

    @Override
    public ProviderManifest getManifest() {
        return MANIFEST;
    }

    @Override
    public ProviderCapabilities getCapabilities() {
        return CAPABILITIES;
    }

    @Override
    public RateLimitConfig getRateLimitConfig() {
        return rateLimit;
    }

    @Override
    public boolean isAvailable() {
        return credentials.boardGameAtlasClientId().isPresent();
    }

    @Override
    public List<MetadataSearchResult> searchGames(String query, int limit, String apiKey) {
        Optional<String> clientId = clientId(apiKey);
        if (clientId.isEmpty() || query == null || query.trim().length() < 2) {
            return List.of();
        }
        Map<String, String> params = new LinkedHashMap<>();
        params.put("client_id", clientId.get());
        params.put("name", query.trim());
        params.put("limit", String.valueOf(limit));
        params.put("fuzzy_match", "true");

        return fetch(params).stream()
                .filter(game -> game.id() != null && game.name() != null)
                .map(game -> new MetadataSearchResult(game.id(), game.name(), game.yearPublished(),
                        game.thumbUrl() != null ? game.thumbUrl() : game.imageUrl(), ID))
                .collect(Collectors.toList());
    }

    @Override
    public Optional<GameMetadata> getGameMetadata(String externalId, String apiKey) {
        Optional<String> clientId = clientId(apiKey);
        if (clientId.isEmpty() || externalId == null || externalId.isBlank()) {
            return Optional.empty();
        }
        Map<String, String> params = new LinkedHashMap<>();
        params.put("client_id", clientId.get());
        params.put("ids", externalId.trim());

        return fetch(params).stream()
                .filter(game -> game.id() != null && game.name() != null)
                .findFirst()
                .map(this::toMetadata);
    }

    private List<BgaGame> fetch(Map<String, String> params) {
        return http.fetchBody(ProviderRequest.get(ProviderRequest.url(SEARCH_URL, params)))
                .map(body -> JsonPayloads.read(mapper, ID, body, BgaGame.SearchResponse.class).gamesOrEmpty())
                .orElse(List.of());
    }

    private Optional<String> clientId(String callKey) {
        if (callKey != null && !callKey.isBlank()) {
            return Optional.of(callKey);
        }
        Optional<String> configured = credentials.boardGameAtlasClientId();
        if (configured.isEmpty()) {
            log.warn("bga.credentials.missing setting={} env={}", ProviderCredentials.BOARD_GAME_ATLAS_CLIENT_ID,
                    ProviderCredentials.BOARD_GAME_ATLAS_CLIENT_ID_ENV);
        }
        return configured;
    }

    private GameMetadata toMetadata(BgaGame game) {
        String preview = game.descriptionPreview() != null && !game.descriptionPreview().isBlank()
                ? game.descriptionPreview() : game.description();
        String description = HtmlText.stripHtml(preview);

        List<String> genres = new ArrayList<>(names(game.categories()));
        names(game.mechanics()).stream().limit(MAX_MECHANICS_AS_GENRES).forEach(genres::add);

        int minPlayers = game.minPlayers() != null && game.minPlayers() > 0 ? game.minPlayers() : 1;
        int maxPlayers = game.maxPlayers() != null && game.maxPlayers() > 0 ? game.maxPlayers() : minPlayers;
        boolean supportsLocal = maxPlayers > 1;
        Double average = game.averageUserRating();

        return GameMetadata.builder()
                .externalId(game.id())
                .name(game.name())
                .description(description.isEmpty() ? null : description)
                .shortDescription(description.isEmpty() ? null
                        : HtmlText.truncate(description, HtmlText.SHORT_DESCRIPTION_LENGTH))
                .coverImageUrl(game.imageUrl() != null ? game.imageUrl() : game.thumbUrl())
                .headerImageUrl(game.imageUrl())
                .genres(genres.isEmpty() ? List.of("Board Game") : genres)
                .developers(primaryFirst(game.primaryDesigner(), game.designers(), MAX_DESIGNERS))
                .publishers(primaryFirst(game.primaryPublisher(), game.publishers(), MAX_PUBLISHERS))
                .releaseDate(game.yearPublished() == null ? null : game.yearPublished().toString())
                .platforms(List.of("Physical"))
                .metacriticScore(average == null || average <= 0 ? null : (int) Math.round(average * 20))
                .storeUrl(getGameUrl(game.id()))
                .playerInfo(PlayerInfo.builder()
                        .overallMinPlayers(minPlayers)
                        .overallMaxPlayers(maxPlayers)
                        .supportsPhysical(true)
                        .supportsLocal(supportsLocal)
                        .supportsOnline(false)
                        .physicalMaxPlayers(maxPlayers)
                        .localMaxPlayers(supportsLocal ? maxPlayers : null)
                        .build())
                .rawPayload(JsonPayloads.snippet(game.toString()))
                .build();
    }

    private static List<String> primaryFirst(BgaGame.Named primary, List<BgaGame.Named> others, int max) {
        Set<String> names = new LinkedHashSet<>();
        if (primary != null && primary.name() != null) {
            names.add(primary.name());
        }
        names.addAll(names(others));
        return names.stream().limit(max).collect(Collectors.toList());
    }

    private static List<String> names(List<BgaGame.Named> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream()
                .map(BgaGame.Named::name)
                .filter(name -> name != null && !name.isBlank())
                .collect(Collectors.toList());
    }
}
