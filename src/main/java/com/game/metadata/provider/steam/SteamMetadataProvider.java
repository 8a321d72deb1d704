package com.game.metadata.provider.steam;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.game.metadata.provider.GameMetadata;
import com.game.metadata.provider.MetadataProvider;
import com.game.metadata.provider.MetadataSearchResult;
import com.game.metadata.provider.PlayerInfo;
import com.game.metadata.provider.PriceInfo;
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
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Steam storefront adapter. Search scrapes the store's suggestion endpoint (HTML),
 * details come from the public {@code appdetails} JSON API. No credential is needed.
 */
public class SteamMetadataProvider implements MetadataProvider {
    private static final Logger log = LoggerFactory.getLogger(SteamMetadataProvider.class);

    public static final String ID = "steam";

    static final String SEARCH_URL = "https://store.steampowered.com/search/suggest";
    static final String DETAILS_URL = "https://store.steampowered.com/api/appdetails";
    static final String HEADER_IMAGE_URL = "https://cdn.cloudflare.steamstatic.com/steam/apps/%s/header.jpg";

    private static final Pattern APP_ID = Pattern.compile("\\d+");

    // Steam store category ids
    static final int CATEGORY_MULTI_PLAYER = 1;
    static final int CATEGORY_SINGLE_PLAYER = 2;
    static final int CATEGORY_MMO = 20;
    static final int CATEGORY_CO_OP = 9;
    static final int CATEGORY_LOCAL_CO_OP = 24;
    static final int CATEGORY_ONLINE_PVP = 36;
    static final int CATEGORY_SHARED_SPLIT_SCREEN_PVP = 37;
    static final int CATEGORY_ONLINE_CO_OP = 38;
    static final int CATEGORY_SHARED_SPLIT_SCREEN = 39;
    static final int CATEGORY_CROSS_PLATFORM_MULTIPLAYER = 27;
    static final int CATEGORY_PVP = 49;

    private static final Set<Integer> MULTIPLAYER_CATEGORIES =
            Set.of(CATEGORY_MULTI_PLAYER, CATEGORY_CO_OP, CATEGORY_MMO, CATEGORY_PVP);
    private static final Set<Integer> ONLINE_CATEGORIES =
            Set.of(CATEGORY_ONLINE_PVP, CATEGORY_ONLINE_CO_OP, CATEGORY_CROSS_PLATFORM_MULTIPLAYER, CATEGORY_MMO);
    private static final Set<Integer> LOCAL_CATEGORIES =
            Set.of(CATEGORY_LOCAL_CO_OP, CATEGORY_SHARED_SPLIT_SCREEN_PVP, CATEGORY_SHARED_SPLIT_SCREEN);

    private static final ProviderManifest MANIFEST = new ProviderManifest(
            ID, "Steam", "Steam store listings for PC games", "1.0.0", false,
            "https://store.steampowered.com/app/{id}", TitleDomain.VIDEO_GAME);

    private static final ProviderCapabilities CAPABILITIES = ProviderCapabilities.of(
            ProviderCapability.STORE_URLS, ProviderCapability.SEARCH,
            ProviderCapability.DESCRIPTIONS, ProviderCapability.COVER_IMAGES);

    public static final RateLimitConfig RATE_LIMIT = new RateLimitConfig(400, 5, 1500, 500, 5000, 5, 2);

    private final ProviderHttpClient http;
    private final ObjectMapper mapper;
    private final RateLimitConfig rateLimit;

    public SteamMetadataProvider(HttpTransport transport) {
        this(transport, new ObjectMapper(), RATE_LIMIT);
    }

    public SteamMetadataProvider(HttpTransport transport, ObjectMapper mapper, RateLimitConfig rateLimit) {
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
    public List<MetadataSearchResult> searchGames(String query, int limit, String apiKey) {
        if (query == null || query.trim().length() < 2) {
            return List.of();
        }
        Map<String, String> params = new LinkedHashMap<>();
        params.put("term", query.trim());
        params.put("f", "games");
        params.put("cc", "US");
        params.put("l", "english");

        Optional<String> body = http.fetchBody(ProviderRequest.get(ProviderRequest.url(SEARCH_URL, params)));
        List<MetadataSearchResult> results = body.map(html -> parseSuggestions(html, limit)).orElse(List.of());
        log.debug("steam.search query='{}' results={}", query, results.size());
        return results;
    }

    List<MetadataSearchResult> parseSuggestions(String html, int limit) {
        Document document = Jsoup.parse(html);
        List<MetadataSearchResult> results = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (Element entry : document.select("[data-ds-appid]")) {
            if (results.size() >= limit) {
                break;
            }
            String appId = entry.attr("data-ds-appid").trim();
            if (!APP_ID.matcher(appId).matches() || !seen.add(appId)) {
                continue;
            }
            Element nameElement = entry.selectFirst(".match_name");
            String name = nameElement == null ? "" : nameElement.text().trim();
            if (name.isEmpty()) {
                name = "Steam App " + appId;
            }
            results.add(new MetadataSearchResult(appId, name, null, String.format(HEADER_IMAGE_URL, appId), ID));
        }
        return results;
    }

    @Override
    public Optional<GameMetadata> getGameMetadata(String externalId, String apiKey) {
        if (externalId == null || !APP_ID.matcher(externalId.trim()).matches()) {
            return Optional.empty();
        }
        String appId = externalId.trim();
        Map<String, String> params = new LinkedHashMap<>();
        params.put("appids", appId);
        params.put("cc", "us");
        params.put("l", "english");

        Optional<String> body = http.fetchBody(ProviderRequest.get(ProviderRequest.url(DETAILS_URL, params)));
        if (body.isEmpty()) {
            return Optional.empty();
        }
        JsonNode entry = JsonPayloads.parse(mapper, ID, body.get()).path(appId);
        if (!JsonPayloads.flag(entry, "success") || !entry.path("data").isObject()) {
            log.debug("steam.details.miss appId={}", appId);
            return Optional.empty();
        }
        return Optional.of(toMetadata(appId, entry.path("data"), body.get()));
    }

    private GameMetadata toMetadata(String appId, JsonNode data, String rawBody) {
        String fullDescription = firstText(data, "about_the_game", "detailed_description");
        String description = fullDescription == null ? null : HtmlText.stripHtml(fullDescription);
        String shortDescription = JsonPayloads.text(data, "short_description");
        shortDescription = shortDescription != null
                ? HtmlText.stripHtml(shortDescription)
                : HtmlText.truncate(description, HtmlText.SHORT_DESCRIPTION_LENGTH);

        List<String> videos = new ArrayList<>();
        for (JsonNode movie : data.path("movies")) {
            String url = JsonPayloads.text(movie.path("webm"), "max");
            if (url == null) {
                url = JsonPayloads.text(movie, "thumbnail");
            }
            if (url != null) {
                videos.add(url);
            }
        }

        JsonNode metacritic = data.path("metacritic");

        return GameMetadata.builder()
                .externalId(appId)
                .name(JsonPayloads.text(data, "name") != null ? JsonPayloads.text(data, "name") : "Steam App " + appId)
                .description(description)
                .shortDescription(shortDescription)
                .coverImageUrl(firstText(data, "capsule_imagev5", "capsule_image"))
                .headerImageUrl(JsonPayloads.text(data, "header_image"))
                .screenshots(JsonPayloads.texts(data.path("screenshots"), "path_full"))
                .videos(videos)
                .genres(JsonPayloads.texts(data.path("genres"), "description"))
                .categories(JsonPayloads.texts(data.path("categories"), "description"))
                .developers(JsonPayloads.texts(data.path("developers"), null))
                .publishers(JsonPayloads.texts(data.path("publishers"), null))
                .releaseDate(JsonPayloads.text(data.path("release_date"), "date"))
                .platforms(platforms(data.path("platforms")))
                .metacriticScore(JsonPayloads.integer(metacritic, "score"))
                .metacriticUrl(JsonPayloads.text(metacritic, "url"))
                .ageRating(ageRating(data.get("required_age")))
                .storeUrl(getGameUrl(appId))
                .playerInfo(playerInfo(categoryIds(data.path("categories"))))
                .priceInfo(priceInfo(data))
                .rawPayload(JsonPayloads.snippet(rawBody))
                .build();
    }

    static PlayerInfo playerInfo(Set<Integer> categories) {
        boolean single = categories.contains(CATEGORY_SINGLE_PLAYER);
        boolean multi = categories.stream().anyMatch(MULTIPLAYER_CATEGORIES::contains);
        boolean online = categories.stream().anyMatch(ONLINE_CATEGORIES::contains);
        boolean local = categories.stream().anyMatch(LOCAL_CATEGORIES::contains);

        // Steam does not publish per-mode counts
        return PlayerInfo.builder()
                .overallMinPlayers(1)
                .overallMaxPlayers(single && !multi && !online && !local ? 1 : null)
                .supportsOnline(online)
                .supportsLocal(local)
                .build();
    }

    private static Set<Integer> categoryIds(JsonNode categories) {
        Set<Integer> ids = new HashSet<>();
        for (JsonNode category : categories) {
            Integer id = JsonPayloads.integer(category, "id");
            if (id != null) {
                ids.add(id);
            }
        }
        return ids;
    }

    static String ageRating(JsonNode requiredAge) {
        if (JsonPayloads.isAbsent(requiredAge)) {
            return null;
        }
        int age = requiredAge.isNumber() ? requiredAge.intValue() : parseAge(requiredAge.asText());
        return age > 0 ? age + "+" : null;
    }

    private static int parseAge(String text) {
        try {
            return Integer.parseInt(text.trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    private static List<String> platforms(JsonNode platforms) {
        List<String> names = new ArrayList<>();
        if (JsonPayloads.flag(platforms, "windows")) {
            names.add("Windows");
        }
        if (JsonPayloads.flag(platforms, "mac")) {
            names.add("macOS");
        }
        if (JsonPayloads.flag(platforms, "linux")) {
            names.add("Linux");
        }
        return names;
    }

    private static PriceInfo priceInfo(JsonNode data) {
        JsonNode price = data.path("price_overview");
        boolean free = JsonPayloads.flag(data, "is_free");
        if (!price.isObject()) {
            return free ? PriceInfo.freeToPlay() : null;
        }
        return new PriceInfo(
                JsonPayloads.text(price, "currency"),
                cents(JsonPayloads.integer(price, "initial")),
                cents(JsonPayloads.integer(price, "final")),
                JsonPayloads.integer(price, "discount_percent"),
                free);
    }

    private static Double cents(Integer cents) {
        return cents == null ? null : cents / 100.0;
    }

    private static String firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            String value = JsonPayloads.text(node, field);
            if (value != null) {
                return value;
            }
        }
        return null;
    }
}
