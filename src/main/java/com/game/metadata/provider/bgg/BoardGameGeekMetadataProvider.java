package com.game.metadata.provider.bgg;

import com.game.metadata.provider.GameMetadata;
import com.game.metadata.provider.MetadataProvider;
import com.game.metadata.provider.MetadataSearchResult;
import com.game.metadata.provider.MetadataTransientException;
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
import com.game.metadata.rules.SearchRanker;
import com.game.metadata.rules.SearchRankingRules;
import com.game.metadata.text.HtmlText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * BoardGameGeek XML API 2 adapter.
 *
 * <p>BGG answers 202 while it prepares a response; such requests are repeated up to
 * {@value #MAX_QUEUED_ATTEMPTS} times. Player counts come from {@code minplayers} and
 * {@code maxplayers}, so this provider is also used for enrichment of tabletop titles.</p>
 */
public class BoardGameGeekMetadataProvider implements MetadataProvider {
    private static final Logger log = LoggerFactory.getLogger(BoardGameGeekMetadataProvider.class);

    public static final String ID = "bgg";

    static final String API_BASE = "https://boardgamegeek.com/xmlapi2";
    static final int MAX_QUEUED_ATTEMPTS = 4;
    static final long DEFAULT_QUEUED_DELAY_MS = 2500;
    static final int MAX_DESIGNERS = 5;
    static final int MAX_PUBLISHERS = 3;

    private static final Pattern NUMERIC_ID = Pattern.compile("\\d+");

    private static final ProviderManifest MANIFEST = new ProviderManifest(
            ID, "BoardGameGeek", "Board game and card game metadata from BoardGameGeek", "1.0.0", false,
            "https://boardgamegeek.com/boardgame/{id}", TitleDomain.TABLETOP);

    private static final ProviderCapabilities CAPABILITIES = ProviderCapabilities.of(
            ProviderCapability.ACCURATE_PLAYER_COUNTS, ProviderCapability.SEARCH,
            ProviderCapability.DESCRIPTIONS, ProviderCapability.COVER_IMAGES);

    public static final RateLimitConfig RATE_LIMIT = RateLimitConfig.defaults().withRequestDelayMs(1200);

    private final ProviderHttpClient http;
    private final RateLimitConfig rateLimit;
    private final SearchRanker ranker;
    private final long queuedDelayMs;

    public BoardGameGeekMetadataProvider(HttpTransport transport) {
        this(transport, RATE_LIMIT, DEFAULT_QUEUED_DELAY_MS);
    }

    public BoardGameGeekMetadataProvider(HttpTransport transport, RateLimitConfig rateLimit, long queuedDelayMs) {
        this.rateLimit = rateLimit;
        this.queuedDelayMs = queuedDelayMs;
        // BGG search carries no descriptions; rank by name without dropping anything
        this.ranker = new SearchRanker(SearchRankingRules.getNonGameIndicators(), SearchRankingRules.getGameTerms(), 0);
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
        params.put("query", query.trim());
        params.put("type", "boardgame,boardgameexpansion");
        params.put("exact", "0");

        Optional<String> body = fetchXml(ProviderRequest.url(API_BASE + "/search", params));
        if (body.isEmpty()) {
            return List.of();
        }

        List<SearchRanker.Candidate<MetadataSearchResult>> candidates = new ArrayList<>();
        Document document = BggXml.parse(ID, body.get());
        for (Element item : BggXml.children(document.getDocumentElement(), "item")) {
            String id = item.getAttribute("id");
            String name = primaryName(item);
            if (!NUMERIC_ID.matcher(id).matches() || name == null) {
                continue;
            }
            MetadataSearchResult result = new MetadataSearchResult(id, name,
                    parseInteger(BggXml.childValue(item, "yearpublished")), null, ID);
            candidates.add(new SearchRanker.Candidate<>(result, name, null));
        }

        return ranker.rank(query, candidates).stream()
                .limit(limit)
                .map(SearchRanker.Ranked::item)
                .collect(Collectors.toList());
    }

    @Override
    public Optional<GameMetadata> getGameMetadata(String externalId, String apiKey) {
        if (externalId == null || !NUMERIC_ID.matcher(externalId).matches()) {
            return Optional.empty();
        }
        Map<String, String> params = new LinkedHashMap<>();
        params.put("id", externalId);
        params.put("stats", "1");

        Optional<String> body = fetchXml(ProviderRequest.url(API_BASE + "/thing", params));
        if (body.isEmpty()) {
            return Optional.empty();
        }
        Document document = BggXml.parse(ID, body.get());
        for (Element item : BggXml.children(document.getDocumentElement(), "item")) {
            if (externalId.equals(item.getAttribute("id"))) {
                return Optional.of(toMetadata(externalId, item, body.get()));
            }
        }
        return Optional.empty();
    }

    /**
     * GETs an XML document, repeating the request while BGG reports it as queued.
     */
    private Optional<String> fetchXml(String url) {
        ProviderRequest request = ProviderRequest.get(url);
        for (int attempt = 1; attempt <= MAX_QUEUED_ATTEMPTS; attempt++) {
            ProviderResponse response = http.send(request);
            if (response.statusCode() != 202) {
                if (response.isSuccess()) {
                    return Optional.of(response.body());
                }
                if (response.statusCode() == 404) {
                    return Optional.empty();
                }
                throw http.failure(response);
            }
            log.debug("bgg.queued attempt={}/{} uri={}", attempt, MAX_QUEUED_ATTEMPTS, request.uri());
            if (attempt < MAX_QUEUED_ATTEMPTS) {
                sleep(queuedDelayMs);
            }
        }
        throw new MetadataTransientException(ID, "Response still queued after " + MAX_QUEUED_ATTEMPTS + " attempts",
                202);
    }

    private GameMetadata toMetadata(String externalId, Element item, String rawXml) {
        String name = primaryName(item);
        String rawDescription = BggXml.childText(item, "description");
        // the parser already resolved the XML layer; what remains is escaped HTML
        String description = HtmlText.stripHtml(rawDescription);

        int minPlayers = playerCount(item, "minplayers", 1);
        int maxPlayers = playerCount(item, "maxplayers", minPlayers);
        boolean supportsLocal = maxPlayers > 1;

        String image = BggXml.childText(item, "image");
        if (image == null) {
            image = BggXml.childText(item, "thumbnail");
        }

        List<String> genres = links(item, "boardgamecategory");
        Element average = BggXml.firstDescendant(item, "average");
        Integer rating = null;
        if (average != null) {
            try {
                rating = (int) Math.round(Double.parseDouble(average.getAttribute("value")) * 10);
            } catch (NumberFormatException e) {
                log.debug("bgg.rating.unparseable id={} value='{}'", externalId, average.getAttribute("value"));
            }
        }

        return GameMetadata.builder()
                .externalId(externalId)
                .name(name != null ? name : "BoardGame " + externalId)
                .description(description.isEmpty() ? null : description)
                .shortDescription(description.isEmpty() ? null
                        : HtmlText.truncate(description, HtmlText.SHORT_DESCRIPTION_LENGTH))
                .coverImageUrl(image)
                .headerImageUrl(image)
                .genres(genres.isEmpty() ? List.of("Board Game") : genres)
                .developers(limit(links(item, "boardgamedesigner"), MAX_DESIGNERS))
                .publishers(limit(links(item, "boardgamepublisher"), MAX_PUBLISHERS))
                .releaseDate(BggXml.childValue(item, "yearpublished"))
                .platforms(List.of("Physical"))
                .metacriticScore(rating)
                .storeUrl(getGameUrl(externalId))
                .playerInfo(PlayerInfo.builder()
                        .overallMinPlayers(minPlayers)
                        .overallMaxPlayers(maxPlayers)
                        .supportsPhysical(true)
                        .supportsLocal(supportsLocal)
                        .supportsOnline(false)
                        .physicalMaxPlayers(maxPlayers)
                        .localMaxPlayers(supportsLocal ? maxPlayers : null)
                        .build())
                .rawPayload(JsonPayloads.snippet(rawXml))
                .build();
    }

    private static String primaryName(Element item) {
        String fallback = null;
        for (Element name : BggXml.children(item, "name")) {
            String value = HtmlText.decodeEntities(name.getAttribute("value")).trim();
            if (value.isEmpty()) {
                continue;
            }
            if ("primary".equals(name.getAttribute("type"))) {
                return value;
            }
            if (fallback == null) {
                fallback = value;
            }
        }
        return fallback;
    }

    private static List<String> links(Element item, String type) {
        List<String> values = new ArrayList<>();
        for (Element link : BggXml.children(item, "link")) {
            if (type.equals(link.getAttribute("type"))) {
                String value = HtmlText.decodeEntities(link.getAttribute("value")).trim();
                if (!value.isEmpty()) {
                    values.add(value);
                }
            }
        }
        return values;
    }

    private static List<String> limit(List<String> values, int max) {
        return values.size() <= max ? values : values.subList(0, max);
    }

    private static Integer parseInteger(String value) {
        if (value == null || !NUMERIC_ID.matcher(value).matches()) {
            return null;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static int playerCount(Element item, String field, int fallback) {
        Integer count = parseInteger(BggXml.childValue(item, field));
        return count != null && count > 0 ? count : fallback;
    }

    private static void sleep(long delayMs) {
        if (delayMs <= 0) {
            return;
        }
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MetadataTransientException(ID, "Interrupted while waiting for queued response", e);
        }
    }
}
