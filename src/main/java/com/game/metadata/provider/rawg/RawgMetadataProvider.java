package com.game.metadata.provider.rawg;

import com.fasterxml.jackson.databind.JsonNode;
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
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * RAWG.io adapter. Needs an API key, taken from the call, the {@code rawgApiKey} setting
 * or the {@code RAWG_API_KEY} environment variable, in that order.
 *
 * <p>Player support is inferred from community tags; RAWG has no player counts.</p>
 */
public class RawgMetadataProvider implements MetadataProvider {
    private static final Logger log = LoggerFactory.getLogger(RawgMetadataProvider.class);

    public static final String ID = "rawg";

    static final String API_BASE = "https://api.rawg.io/api";
    static final int MAX_PAGE_SIZE = 40;

    private static final Set<String> MULTIPLAYER_TAGS = Set.of("multiplayer", "online-multiplayer", "co-op",
            "local-co-op", "split-screen", "online-co-op", "local-multiplayer");
    private static final Set<String> ONLINE_TAGS = Set.of("online-multiplayer", "online-co-op", "mmo",
            "massively-multiplayer");
    private static final Set<String> LOCAL_TAGS = Set.of("local-co-op", "local-multiplayer", "split-screen");

    private static final ProviderManifest MANIFEST = new ProviderManifest(
            ID, "RAWG", "RAWG.io video game database", "1.0.0", true,
            "https://rawg.io/games/{id}", TitleDomain.VIDEO_GAME);

    private static final ProviderCapabilities CAPABILITIES = ProviderCapabilities.of(
            ProviderCapability.SEARCH, ProviderCapability.DESCRIPTIONS, ProviderCapability.COVER_IMAGES);

    public static final RateLimitConfig RATE_LIMIT = RateLimitConfig.defaults().withRequestDelayMs(100);

    private final ProviderHttpClient http;
    private final ObjectMapper mapper;
    private final ProviderCredentials credentials;
    private final RateLimitConfig rateLimit;

    public RawgMetadataProvider(HttpTransport transport, ProviderCredentials credentials) {
        this(transport, credentials, new ObjectMapper(), RATE_LIMIT);
    }

    public RawgMetadataProvider(HttpTransport transport, ProviderCredentials credentials, ObjectMapper mapper,
                                RateLimitConfig rateLimit) {
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
        return credentials.rawgApiKey().isPresent();
    }

    @Override
    public List<MetadataSearchResult> searchGames(String query, int limit, String apiKey) {
        Optional<String> key = apiKey(apiKey);
        if (key.isEmpty() || query == null || query.isBlank()) {
            return List.of();
        }
        Map<String, String> params = new LinkedHashMap<>();
        params.put("key", key.get());
        params.put("search", query.trim());
        params.put("page_size", String.valueOf(Math.min(limit, MAX_PAGE_SIZE)));

        Optional<String> body = http.fetchBody(ProviderRequest.get(ProviderRequest.url(API_BASE + "/games", params)));
        if (body.isEmpty()) {
            return List.of();
        }
        List<MetadataSearchResult> results = new ArrayList<>();
        for (JsonNode game : JsonPayloads.parse(mapper, ID, body.get()).path("results")) {
            String id = JsonPayloads.text(game, "id");
            String name = JsonPayloads.text(game, "name");
            if (id != null && name != null) {
                results.add(new MetadataSearchResult(id, name, year(JsonPayloads.text(game, "released")),
                        JsonPayloads.text(game, "background_image"), ID));
            }
        }
        return results;
    }

    @Override
    public Optional<GameMetadata> getGameMetadata(String externalId, String apiKey) {
        Optional<String> key = apiKey(apiKey);
        if (key.isEmpty() || externalId == null || externalId.isBlank()) {
            return Optional.empty();
        }
        String url = ProviderRequest.url(API_BASE + "/games/" + ProviderRequest.encode(externalId.trim()),
                Map.of("key", key.get()));
        return http.fetchBody(ProviderRequest.get(url))
                .map(body -> toMetadata(JsonPayloads.parse(mapper, ID, body), body));
    }

    private Optional<String> apiKey(String callKey) {
        if (callKey != null && !callKey.isBlank()) {
            return Optional.of(callKey);
        }
        Optional<String> configured = credentials.rawgApiKey();
        if (configured.isEmpty()) {
            log.warn("rawg.credentials.missing setting={} env={}",
                    ProviderCredentials.RAWG_API_KEY, ProviderCredentials.RAWG_API_KEY_ENV);
        }
        return configured;
    }

    private GameMetadata toMetadata(JsonNode game, String rawBody) {
        String raw = JsonPayloads.text(game, "description_raw");
        String description = raw != null ? raw : HtmlText.stripHtml(JsonPayloads.text(game, "description"));
        String background = JsonPayloads.text(game, "background_image");
        String additional = JsonPayloads.text(game, "background_image_additional");

        List<String> platforms = new ArrayList<>();
        for (JsonNode entry : game.path("platforms")) {
            String name = JsonPayloads.text(entry.path("platform"), "name");
            if (name != null) {
                platforms.add(name);
            }
        }

        String id = game.path("id").asText();
        return GameMetadata.builder()
                .externalId(id)
                .name(JsonPayloads.text(game, "name"))
                .description(description.isEmpty() ? null : description)
                .shortDescription(description.isEmpty() ? null
                        : HtmlText.truncate(description, HtmlText.SHORT_DESCRIPTION_LENGTH))
                .coverImageUrl(background)
                .headerImageUrl(additional != null ? additional : background)
                .screenshots(JsonPayloads.texts(game.path("short_screenshots"), "image"))
                .genres(JsonPayloads.texts(game.path("genres"), "name"))
                .developers(JsonPayloads.texts(game.path("developers"), "name"))
                .publishers(JsonPayloads.texts(game.path("publishers"), "name"))
                .releaseDate(JsonPayloads.text(game, "released"))
                .platforms(platforms)
                .metacriticScore(JsonPayloads.integer(game, "metacritic"))
                .ageRating(JsonPayloads.text(game.path("esrb_rating"), "name"))
                .storeUrl(getGameUrl(id))
                .playerInfo(playerInfo(JsonPayloads.texts(game.path("tags"), "slug")))
                .rawPayload(JsonPayloads.snippet(rawBody))
                .build();
    }

    static PlayerInfo playerInfo(List<String> tagSlugs) {
        Set<String> tags = new HashSet<>();
        tagSlugs.forEach(slug -> tags.add(slug.toLowerCase(Locale.ROOT)));
        boolean multiplayer = tags.stream().anyMatch(MULTIPLAYER_TAGS::contains);
        return PlayerInfo.builder()
                .overallMinPlayers(1)
                .overallMaxPlayers(multiplayer ? null : 1)
                .supportsOnline(tags.stream().anyMatch(ONLINE_TAGS::contains))
                .supportsLocal(tags.stream().anyMatch(LOCAL_TAGS::contains))
                .build();
    }

    private static Integer year(String date) {
        if (date == null || date.length() < 4 || !date.substring(0, 4).matches("\\d{4}")) {
            return null;
        }
        return Integer.parseInt(date.substring(0, 4));
    }
}
