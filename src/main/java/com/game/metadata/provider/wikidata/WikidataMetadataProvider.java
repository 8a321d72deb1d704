package com.game.metadata.provider.wikidata;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
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
import com.game.metadata.rules.SearchRanker;
import com.game.metadata.rules.SearchRankingRules;
import com.game.metadata.text.HtmlText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Board and card games from Wikidata.
 *
 * <p>Search first asks the entity search API and keeps items whose description names a
 * tabletop game. If that finds nothing, a SPARQL label search over instances of the
 * board game and card game classes is tried. Both candidate sets are ranked with
 * {@link SearchRanker}. Details come from a single SPARQL query.</p>
 */
public class WikidataMetadataProvider implements MetadataProvider {
    private static final Logger log = LoggerFactory.getLogger(WikidataMetadataProvider.class);

    public static final String ID = "wikidata";

    static final String SEARCH_API = "https://www.wikidata.org/w/api.php";
    static final String SPARQL_ENDPOINT = "https://query.wikidata.org/sparql";
    static final String SPARQL_ACCEPT = "application/sparql-results+json";

    private static final Pattern ENTITY_ID = Pattern.compile("^Q\\d+$");
    private static final Pattern YEAR = Pattern.compile("^\\d{4}");

    static final int MAX_GENRES = 5;
    static final int MAX_DESIGNERS = 5;
    static final int MAX_PUBLISHERS = 3;

    private static final String DETAIL_QUERY = "SELECT ?item ?itemLabel ?itemDescription ?image ?minPlayers "
            + "?maxPlayers ?designerLabel ?publisherLabel ?genreLabel ?publication WHERE {\n"
            + "  BIND(wd:%s AS ?item)\n"
            + "  SERVICE wikibase:label { bd:serviceParam wikibase:language \"en\". }\n"
            + "  OPTIONAL { ?item wdt:P18 ?image. }\n"
            + "  OPTIONAL { ?item wdt:P1872 ?minPlayers. }\n"
            + "  OPTIONAL { ?item wdt:P1873 ?maxPlayers. }\n"
            + "  OPTIONAL { ?item wdt:P178 ?designer. ?designer rdfs:label ?designerLabel. "
            + "FILTER(LANG(?designerLabel) = \"en\") }\n"
            + "  OPTIONAL { ?item wdt:P123 ?publisher. ?publisher rdfs:label ?publisherLabel. "
            + "FILTER(LANG(?publisherLabel) = \"en\") }\n"
            + "  OPTIONAL { ?item wdt:P136 ?genre. ?genre rdfs:label ?genreLabel. "
            + "FILTER(LANG(?genreLabel) = \"en\") }\n"
            + "  OPTIONAL { ?item wdt:P577 ?publication. }\n"
            + "}\nLIMIT 50";

    // Q131436 board game, Q142714 card game
    private static final String LABEL_SEARCH_QUERY = "SELECT DISTINCT ?item ?itemLabel ?itemDescription WHERE {\n"
            + "  VALUES ?type { wd:Q131436 wd:Q142714 }\n"
            + "  ?item wdt:P31 ?type; rdfs:label ?label.\n"
            + "  FILTER(LANG(?label) = \"en\")\n"
            + "  FILTER(CONTAINS(LCASE(?label), \"%s\"))\n"
            + "  SERVICE wikibase:label { bd:serviceParam wikibase:language \"en\". }\n"
            + "}\nLIMIT %d";

    private static final ProviderManifest MANIFEST = new ProviderManifest(
            ID, "Wikidata Board Games", "Board game player counts, designers and publishers from Wikidata",
            "1.0.0", false, "https://www.wikidata.org/wiki/{id}", TitleDomain.TABLETOP);

    private static final ProviderCapabilities CAPABILITIES = ProviderCapabilities.of(
            ProviderCapability.SEARCH, ProviderCapability.DESCRIPTIONS, ProviderCapability.COVER_IMAGES);

    public static final RateLimitConfig RATE_LIMIT = RateLimitConfig.defaults();

    private final ProviderHttpClient http;
    private final ObjectMapper mapper;
    private final RateLimitConfig rateLimit;
    private final SearchRanker ranker;

    public WikidataMetadataProvider(HttpTransport transport) {
        this(transport, new ObjectMapper(), RATE_LIMIT);
    }

    public WikidataMetadataProvider(HttpTransport transport, ObjectMapper mapper, RateLimitConfig rateLimit) {
        this.mapper = mapper;
        this.rateLimit = rateLimit;
        this.ranker = new SearchRanker();
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
        String trimmed = query.trim();
        List<SearchRanker.Candidate<String>> candidates = entitySearch(trimmed, limit);
        String strategy = "entity";
        if (candidates.isEmpty()) {
            candidates = labelSearch(trimmed, limit);
            strategy = "sparql";
        }

        List<MetadataSearchResult> results = ranker.rank(trimmed, candidates).stream()
                .limit(limit)
                .map(r -> MetadataSearchResult.of(ID, r.item(), r.name()))
                .collect(Collectors.toList());
        log.debug("wikidata.search query='{}' strategy={} candidates={} results={}",
                trimmed, strategy, candidates.size(), results.size());
        return results;
    }

    private List<SearchRanker.Candidate<String>> entitySearch(String query, int limit) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("action", "wbsearchentities");
        params.put("search", query);
        params.put("language", "en");
        params.put("format", "json");
        params.put("type", "item");
        params.put("limit", String.valueOf(limit * 2));

        Optional<String> body = http.fetchBody(ProviderRequest.get(ProviderRequest.url(SEARCH_API, params)));
        List<SearchRanker.Candidate<String>> candidates = new ArrayList<>();
        if (body.isEmpty()) {
            return candidates;
        }
        List<String> tabletopTerms = SearchRankingRules.getTabletopDescriptionTerms();
        for (JsonNode item : JsonPayloads.parse(mapper, ID, body.get()).path("search")) {
            String id = JsonPayloads.text(item, "id");
            String label = JsonPayloads.text(item, "label");
            String description = JsonPayloads.text(item, "description");
            if (id != null && label != null && SearchRankingRules.containsAny(description, tabletopTerms)) {
                candidates.add(new SearchRanker.Candidate<>(id, label, description));
            }
        }
        return candidates;
    }

    private List<SearchRanker.Candidate<String>> labelSearch(String query, int limit) {
        String needle = escapeLiteral(query.toLowerCase(Locale.ROOT));
        List<SearchRanker.Candidate<String>> candidates = new ArrayList<>();
        for (Map<String, SparqlResults.Binding> row : sparql(String.format(LABEL_SEARCH_QUERY, needle, limit * 2))) {
            String id = entityId(SparqlResults.value(row, "item"));
            String label = SparqlResults.value(row, "itemLabel");
            if (id != null && label != null) {
                candidates.add(new SearchRanker.Candidate<>(id, label, SparqlResults.value(row, "itemDescription")));
            }
        }
        return candidates;
    }

    @Override
    public Optional<GameMetadata> getGameMetadata(String externalId, String apiKey) {
        if (externalId == null || !ENTITY_ID.matcher(externalId).matches()) {
            return Optional.empty();
        }
        List<Map<String, SparqlResults.Binding>> rows = sparql(String.format(DETAIL_QUERY, externalId));
        if (rows.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(toMetadata(externalId, rows));
    }

    private List<Map<String, SparqlResults.Binding>> sparql(String query) {
        ProviderRequest request = ProviderRequest.post(SPARQL_ENDPOINT, "application/x-www-form-urlencoded",
                        ProviderRequest.formEncode(Map.of("query", query)))
                .withHeader("Accept", SPARQL_ACCEPT);
        return http.fetchBody(request)
                .map(body -> JsonPayloads.read(mapper, ID, body, SparqlResults.class).bindings())
                .orElse(List.of());
    }

    private GameMetadata toMetadata(String externalId, List<Map<String, SparqlResults.Binding>> rows) {
        Map<String, SparqlResults.Binding> first = rows.get(0);
        String label = SparqlResults.value(first, "itemLabel");
        String description = SparqlResults.value(first, "itemDescription");
        String image = SparqlResults.value(first, "image");

        int minPlayers = parseCount(SparqlResults.value(first, "minPlayers"), 1);
        int maxPlayers = parseCount(SparqlResults.value(first, "maxPlayers"), minPlayers);
        boolean supportsLocal = maxPlayers > 1;

        Set<String> designers = new LinkedHashSet<>();
        Set<String> publishers = new LinkedHashSet<>();
        Set<String> genres = new LinkedHashSet<>();
        String releaseYear = null;
        for (Map<String, SparqlResults.Binding> row : rows) {
            addIfPresent(designers, SparqlResults.value(row, "designerLabel"));
            addIfPresent(publishers, SparqlResults.value(row, "publisherLabel"));
            addIfPresent(genres, SparqlResults.value(row, "genreLabel"));
            String publication = SparqlResults.value(row, "publication");
            if (releaseYear == null && publication != null && YEAR.matcher(publication).find()) {
                releaseYear = publication.substring(0, 4);
            }
        }

        return GameMetadata.builder()
                .externalId(externalId)
                .name(label != null ? label : "Game " + externalId)
                .description(description)
                .shortDescription(HtmlText.truncate(description, HtmlText.SHORT_DESCRIPTION_LENGTH))
                .coverImageUrl(image)
                .headerImageUrl(image)
                .genres(genres.isEmpty() ? List.of("Board Game") : first(genres, MAX_GENRES))
                .developers(first(designers, MAX_DESIGNERS))
                .publishers(first(publishers, MAX_PUBLISHERS))
                .releaseDate(releaseYear)
                .platforms(List.of("Physical"))
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
                .rawPayload(JsonPayloads.snippet(rows.subList(0, Math.min(rows.size(), 10)).toString()))
                .build();
    }

    static String escapeLiteral(String value) {
        return value.replace("\\", "\\\\").replace("\"", "\\\"");
    }

    private static String entityId(String entityUri) {
        if (entityUri == null) {
            return null;
        }
        String id = entityUri.substring(entityUri.lastIndexOf('/') + 1);
        return ENTITY_ID.matcher(id).matches() ? id : null;
    }

    private static int parseCount(String value, int fallback) {
        if (value == null) {
            return fallback;
        }
        try {
            // quantities come back as decimals, e.g. "2" or "+4"
            double count = Double.parseDouble(value.trim());
            return count >= 1 && count <= Integer.MAX_VALUE ? (int) count : fallback;
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    private static void addIfPresent(Set<String> values, String value) {
        if (value != null) {
            values.add(value);
        }
    }

    private static List<String> first(Set<String> values, int max) {
        return values.stream().limit(max).collect(Collectors.toList());
    }
}
