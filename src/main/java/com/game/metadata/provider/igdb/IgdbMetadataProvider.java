package com.game.metadata.provider.igdb;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.game.metadata.config.ProviderCredentials;
import com.game.metadata.provider.GameMetadata;
import com.game.metadata.provider.MetadataProvider;
import com.game.metadata.provider.MetadataProviderException;
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
import com.game.metadata.provider.http.ProviderResponse;
import com.game.metadata.ratelimit.RequestThrottle;
import com.game.metadata.text.HtmlText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * IGDB adapter. Queries are written in IGDB's Apicalypse syntax and sent as plain-text
 * POST bodies; authentication uses a Twitch app token.
 *
 * <p>IGDB is the reference source for per-mode player counts: {@code multiplayer_modes}
 * carries online and offline maxima, so this provider is used for enrichment.</p>
 */
public class IgdbMetadataProvider implements MetadataProvider {
    private static final Logger log = LoggerFactory.getLogger(IgdbMetadataProvider.class);

    public static final String ID = "igdb";

    static final String GAMES_URL = "https://api.igdb.com/v4/games";
    static final String IMAGE_URL = "https://images.igdb.com/igdb/image/upload/%s/%s.jpg";
    static final int MAX_SEARCH_LIMIT = 50;
    static final int MAX_BATCH_LIMIT = 500;
    // splitscreen is a flag without a count
    static final int DEFAULT_SPLITSCREEN_MAX_PLAYERS = 4;
    static final int ESRB_CATEGORY = 1;

    private static final Pattern NUMERIC_ID = Pattern.compile("\\d+");

    private static final String DETAIL_FIELDS = "fields id, name, slug, summary, storyline, first_release_date, "
            + "cover.image_id, screenshots.image_id, videos.video_id, "
            + "genres.name, themes.name, platforms.name, platforms.abbreviation, "
            + "involved_companies.company.name, involved_companies.developer, involved_companies.publisher, "
            + "game_modes.name, game_modes.slug, "
            + "multiplayer_modes.campaigncoop, multiplayer_modes.dropin, multiplayer_modes.lancoop, "
            + "multiplayer_modes.offlinecoop, multiplayer_modes.offlinecoopmax, multiplayer_modes.offlinemax, "
            + "multiplayer_modes.onlinecoop, multiplayer_modes.onlinecoopmax, multiplayer_modes.onlinemax, "
            + "multiplayer_modes.splitscreen, "
            + "age_ratings.category, age_ratings.rating, "
            + "aggregated_rating, total_rating;";

    private static final Map<Integer, String> ESRB_RATINGS = Map.of(
            6, "RP", 7, "EC", 8, "E", 9, "E10+", 10, "T", 11, "M", 12, "AO");

    private static final ProviderManifest MANIFEST = new ProviderManifest(
            ID, "IGDB", "Internet Game Database, known for accurate player count data", "1.0.0", true,
            "https://www.igdb.com/games/{id}", TitleDomain.VIDEO_GAME);

    private static final ProviderCapabilities CAPABILITIES = ProviderCapabilities.of(
            ProviderCapability.ACCURATE_PLAYER_COUNTS, ProviderCapability.BATCH_REQUESTS,
            ProviderCapability.SEARCH, ProviderCapability.DESCRIPTIONS, ProviderCapability.COVER_IMAGES);

    public static final RateLimitConfig RATE_LIMIT = new RateLimitConfig(300, 50, 500, 1000, 1000, 5, 2);

    private final ProviderHttpClient http;
    private final ObjectMapper mapper;
    private final ProviderCredentials credentials;
    private final TwitchTokenProvider tokens;
    private final RateLimitConfig rateLimit;

    public IgdbMetadataProvider(HttpTransport transport, ProviderCredentials credentials) {
        this(transport, credentials, new ObjectMapper(), RATE_LIMIT);
    }

    public IgdbMetadataProvider(HttpTransport transport, ProviderCredentials credentials, ObjectMapper mapper,
                                RateLimitConfig rateLimit) {
        this.credentials = credentials;
        this.mapper = mapper;
        this.rateLimit = rateLimit;
        this.http = new ProviderHttpClient(ID, transport, new RequestThrottle(ID, rateLimit.requestDelayMs()));
        this.tokens = new TwitchTokenProvider(http, mapper);
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
        return credentials.twitchClientId().isPresent() && credentials.twitchClientSecret().isPresent();
    }

    @Override
    public List<MetadataSearchResult> searchGames(String query, int limit, String apiKey) {
        if (query == null || query.trim().length() < 2) {
            return List.of();
        }
        String body = "search \"" + escape(query) + "\"; "
                + "fields id, name, cover.image_id, first_release_date; "
                + "limit " + Math.min(limit, MAX_SEARCH_LIMIT) + ";";

        List<MetadataSearchResult> results = new ArrayList<>();
        for (JsonNode game : query(body)) {
            String id = JsonPayloads.text(game, "id");
            String name = JsonPayloads.text(game, "name");
            if (id == null || name == null) {
                continue;
            }
            String releaseDate = releaseDate(game);
            results.add(new MetadataSearchResult(id, name,
                    releaseDate == null ? null : Integer.parseInt(releaseDate.substring(0, 4)),
                    image(game.path("cover"), "t_cover_big"), ID));
        }
        return results;
    }

    @Override
    public Optional<GameMetadata> getGameMetadata(String externalId, String apiKey) {
        if (externalId == null || !NUMERIC_ID.matcher(externalId.trim()).matches()) {
            return Optional.empty();
        }
        List<JsonNode> games = query("where id = " + externalId.trim() + "; " + DETAIL_FIELDS + " limit 1;");
        return games.isEmpty() ? Optional.empty() : Optional.of(toMetadata(games.get(0)));
    }

    /**
     * Fetches all ids with a single {@code where id = (a,b,...)} query.
     * Non-numeric ids are skipped.
     */
    @Override
    public List<GameMetadata> getGamesMetadata(List<String> externalIds, String apiKey) {
        List<String> ids = externalIds.stream()
                .filter(id -> id != null && NUMERIC_ID.matcher(id.trim()).matches())
                .map(String::trim)
                .limit(MAX_BATCH_LIMIT)
                .collect(Collectors.toList());
        if (ids.isEmpty()) {
            return List.of();
        }
        String body = "where id = (" + String.join(",", ids) + "); " + DETAIL_FIELDS
                + " limit " + ids.size() + ";";
        return query(body).stream().map(this::toMetadata).collect(Collectors.toList());
    }

    static String escape(String query) {
        return query.replace("\\", "\\\\").replace("\"", "\\\"");
    }

    private List<JsonNode> query(String body) {
        Optional<String> clientId = credentials.twitchClientId();
        Optional<String> clientSecret = credentials.twitchClientSecret();
        if (clientId.isEmpty() || clientSecret.isEmpty()) {
            log.warn("igdb.credentials.missing settings=[{}, {}]",
                    ProviderCredentials.TWITCH_CLIENT_ID, ProviderCredentials.TWITCH_CLIENT_SECRET);
            return List.of();
        }

        String token = tokens.getToken(clientId.get(), clientSecret.get());
        ProviderRequest request = ProviderRequest.post(GAMES_URL, "text/plain", body.trim())
                .withHeader("Client-ID", clientId.get())
                .withHeader("Authorization", "Bearer " + token);
        ProviderResponse response = http.send(request);
        if (response.statusCode() == 401) {
            // token revoked before its expiry
            tokens.invalidate(clientId.get());
        }
        if (!response.isSuccess()) {
            throw http.failure(response);
        }

        JsonNode root = JsonPayloads.parse(mapper, ID, response.body());
        if (!root.isArray()) {
            throw new MetadataProviderException(ID, "Expected a JSON array from /games");
        }
        List<JsonNode> games = new ArrayList<>();
        root.forEach(games::add);
        return games;
    }

    private GameMetadata toMetadata(JsonNode game) {
        String summary = JsonPayloads.text(game, "summary");
        String description = HtmlText.stripHtml(summary != null ? summary : JsonPayloads.text(game, "storyline"));

        List<String> developers = new ArrayList<>();
        List<String> publishers = new ArrayList<>();
        for (JsonNode company : game.path("involved_companies")) {
            String name = JsonPayloads.text(company.path("company"), "name");
            if (name == null) {
                continue;
            }
            if (JsonPayloads.flag(company, "developer")) {
                developers.add(name);
            }
            if (JsonPayloads.flag(company, "publisher")) {
                publishers.add(name);
            }
        }

        List<String> platforms = new ArrayList<>();
        for (JsonNode platform : game.path("platforms")) {
            String abbreviation = JsonPayloads.text(platform, "abbreviation");
            String name = abbreviation != null ? abbreviation : JsonPayloads.text(platform, "name");
            if (name != null) {
                platforms.add(name);
            }
        }

        List<String> screenshots = new ArrayList<>();
        for (JsonNode screenshot : game.path("screenshots")) {
            String url = image(screenshot, "t_screenshot_big");
            if (url != null) {
                screenshots.add(url);
            }
        }

        String id = game.path("id").asText();
        return GameMetadata.builder()
                .externalId(id)
                .name(JsonPayloads.text(game, "name"))
                .description(description.isEmpty() ? null : description)
                .shortDescription(description.isEmpty() ? null
                        : HtmlText.truncate(description, HtmlText.SHORT_DESCRIPTION_LENGTH))
                .coverImageUrl(image(game.path("cover"), "t_cover_big"))
                .headerImageUrl(image(game.path("cover"), "t_720p"))
                .screenshots(screenshots)
                .videos(JsonPayloads.texts(game.path("videos"), "video_id").stream()
                        .map(videoId -> "https://www.youtube.com/watch?v=" + videoId)
                        .collect(Collectors.toList()))
                .genres(JsonPayloads.texts(game.path("genres"), "name"))
                .developers(developers)
                .publishers(publishers)
                .releaseDate(releaseDate(game))
                .platforms(platforms)
                .metacriticScore(score(game))
                .ageRating(esrbRating(game.path("age_ratings")))
                .storeUrl(getGameUrl(id))
                .playerInfo(playerInfo(game))
                .rawPayload(JsonPayloads.snippet(game.toString()))
                .build();
    }

    static PlayerInfo playerInfo(JsonNode game) {
        List<String> modes = JsonPayloads.texts(game.path("game_modes"), "slug");
        boolean singlePlayer = modes.contains("single-player");
        boolean multiplayer = modes.contains("multiplayer") || modes.contains("co-operative")
                || modes.contains("split-screen");
        boolean mmo = modes.contains("massively-multiplayer-online-mmo");

        Integer onlineMax = null;
        Integer localMax = null;
        boolean online = false;
        boolean local = false;

        for (JsonNode mode : game.path("multiplayer_modes")) {
            for (String field : List.of("onlinemax", "onlinecoopmax")) {
                Integer count = JsonPayloads.integer(mode, field);
                if (count != null && count > 0) {
                    online = true;
                    onlineMax = onlineMax == null ? count : Math.max(onlineMax, count);
                }
            }
            for (String field : List.of("offlinemax", "offlinecoopmax")) {
                Integer count = JsonPayloads.integer(mode, field);
                if (count != null && count > 0) {
                    local = true;
                    localMax = localMax == null ? count : Math.max(localMax, count);
                }
            }
            if (JsonPayloads.flag(mode, "splitscreen")) {
                local = true;
                if (localMax == null || localMax < DEFAULT_SPLITSCREEN_MAX_PLAYERS) {
                    localMax = DEFAULT_SPLITSCREEN_MAX_PLAYERS;
                }
            }
            if (JsonPayloads.flag(mode, "lancoop")) {
                local = true;
            }
        }

        Integer overallMax = null;
        if (onlineMax != null && localMax != null) {
            overallMax = Math.max(onlineMax, localMax);
        } else if (onlineMax != null) {
            overallMax = onlineMax;
        } else if (localMax != null) {
            overallMax = localMax;
        } else if (singlePlayer && !multiplayer) {
            overallMax = 1;
        } else if (mmo) {
            online = true;
        }

        Integer overallMin = singlePlayer || (overallMax != null && overallMax > 0) ? 1 : null;
        return PlayerInfo.builder()
                .overallMinPlayers(overallMin)
                .overallMaxPlayers(overallMax)
                .supportsOnline(online)
                .supportsLocal(local)
                .onlineMaxPlayers(online ? onlineMax : null)
                .localMaxPlayers(local ? localMax : null)
                .build();
    }

    static String esrbRating(JsonNode ageRatings) {
        for (JsonNode rating : ageRatings) {
            Integer category = JsonPayloads.integer(rating, "category");
            if (category != null && category == ESRB_CATEGORY) {
                Integer value = JsonPayloads.integer(rating, "rating");
                return value == null ? null : ESRB_RATINGS.get(value);
            }
        }
        return null;
    }

    private static Integer score(JsonNode game) {
        Double aggregated = JsonPayloads.decimal(game, "aggregated_rating");
        if (aggregated != null && aggregated > 0) {
            return (int) Math.round(aggregated);
        }
        Double total = JsonPayloads.decimal(game, "total_rating");
        return total != null && total > 0 ? (int) Math.round(total) : null;
    }

    private static String releaseDate(JsonNode game) {
        JsonNode timestamp = game.get("first_release_date");
        if (JsonPayloads.isAbsent(timestamp) || !timestamp.isNumber()) {
            return null;
        }
        return Instant.ofEpochSecond(timestamp.longValue()).atZone(ZoneOffset.UTC).toLocalDate().toString();
    }

    private static String image(JsonNode image, String size) {
        String imageId = JsonPayloads.text(image, "image_id");
        return imageId == null ? null : String.format(IMAGE_URL, size, imageId);
    }
}
