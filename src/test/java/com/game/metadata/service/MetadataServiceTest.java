package com.game.metadata.service;

import com.game.metadata.cache.CacheConfig;
import com.game.metadata.cache.CaffeineMetadataCache;
import com.game.metadata.metrics.MicrometerMetricsService;
import com.game.metadata.provider.GameMetadata;
import com.game.metadata.provider.MetadataProviderException;
import com.game.metadata.provider.MetadataRateLimitException;
import com.game.metadata.provider.MetadataSearchResult;
import com.game.metadata.provider.MetadataTransientException;
import com.game.metadata.provider.PlayerInfo;
import com.game.metadata.provider.ProviderCapability;
import com.game.metadata.provider.StubProvider;
import com.game.metadata.provider.TitleDomain;
import com.game.metadata.registry.ProviderRegistry;
import com.game.metadata.title.GameTitle;
import com.game.metadata.title.GameTitleRepository;
import com.game.metadata.title.InMemoryGameTitleRepository;
import com.game.metadata.title.TitleField;
import com.game.metadata.title.TitleType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@DisplayName("MetadataService Tests")
class MetadataServiceTest {

    private SimpleMeterRegistry meterRegistry;
    private InMemoryGameTitleRepository titles;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        titles = new InMemoryGameTitleRepository();
    }

    private MetadataService service(StubProvider... providers) {
        ProviderRegistry.Builder registry = ProviderRegistry.builder();
        for (StubProvider provider : providers) {
            registry.register(provider);
        }
        return MetadataService.builder()
                .registry(registry.build())
                .titleRepository(titles)
                .metricsService(new MicrometerMetricsService(meterRegistry))
                .build();
    }

    private static GameTitle videoGame(String name) {
        return GameTitle.builder().id("t-1").name(name).type(TitleType.VIDEO_GAME).build();
    }

    private static GameMetadata game(String id, String name) {
        return GameMetadata.builder().externalId(id).name(name).build();
    }

    private double failures(String provider, String kind) {
        Counter counter = meterRegistry.find("metadata.provider.failure")
                .tag("provider", provider).tag("kind", kind).counter();
        return counter == null ? 0.0 : counter.count();
    }

    @Nested
    @DisplayName("Fallback lookup")
    class FallbackLookup {

        @Test
        @DisplayName("Should stop at the first provider that returns a record")
        void firstProviderWins() {
            StubProvider steam = new StubProvider("steam", TitleDomain.VIDEO_GAME, ProviderCapability.SEARCH)
                    .withGame(game("620", "Portal 2"));
            StubProvider rawg = new StubProvider("rawg", TitleDomain.VIDEO_GAME, ProviderCapability.SEARCH)
                    .withGame(game("4200", "Portal 2"));

            MetadataFetchResult result = service(steam, rawg).fetchMetadata(videoGame("Portal 2"), null);

            assertTrue(result.found());
            assertEquals("Found metadata from Steam", result.message());
            assertEquals("Steam", result.providerName());
            assertEquals("620", result.metadata().getExternalId());
            assertTrue(rawg.getCalls().isEmpty());
        }

        @Test
        @DisplayName("Should fall through to the next provider on a miss")
        void fallsThroughOnMiss() {
            StubProvider steam = new StubProvider("steam", TitleDomain.VIDEO_GAME, ProviderCapability.SEARCH);
            StubProvider rawg = new StubProvider("rawg", TitleDomain.VIDEO_GAME, ProviderCapability.SEARCH)
                    .withGame(game("4200", "Portal 2"));

            MetadataFetchResult result = service(steam, rawg).fetchMetadata(videoGame("Portal 2"), null);

            assertEquals("Found metadata from Rawg", result.message());
            assertEquals(List.of("search:Portal 2"), steam.getCalls());
            assertEquals(List.of("search:Portal 2", "fetch:4200"), rawg.getCalls());
        }

        @Test
        @DisplayName("Should treat a search hit whose record is gone as a miss")
        void hitWithoutRecord() {
            StubProvider steam = new StubProvider("steam", TitleDomain.VIDEO_GAME, ProviderCapability.SEARCH)
                    .withSearchResult("Portal 2", MetadataSearchResult.of("steam", "620", "Portal 2"));
            StubProvider rawg = new StubProvider("rawg", TitleDomain.VIDEO_GAME, ProviderCapability.SEARCH)
                    .withGame(game("4200", "Portal 2"));

            MetadataFetchResult result = service(steam, rawg).fetchMetadata(videoGame("Portal 2"), null);

            assertEquals("Rawg", result.providerName());
            assertEquals(1, steam.countCalls("fetch:620"));
        }

        @Test
        @DisplayName("Should continue past failing providers and count each failure kind")
        void failuresDoNotPropagate() {
            StubProvider steam = new StubProvider("steam", TitleDomain.VIDEO_GAME, ProviderCapability.SEARCH)
                    .failingSearch(q -> new MetadataRateLimitException("steam", 1000L));
            StubProvider igdb = new StubProvider("igdb", TitleDomain.VIDEO_GAME, ProviderCapability.SEARCH)
                    .failingSearch(q -> new MetadataTransientException("igdb", "Server error 503", 503));
            StubProvider broken = new StubProvider("broken", TitleDomain.VIDEO_GAME, ProviderCapability.SEARCH)
                    .failingSearch(q -> new IllegalStateException("bug"));
            StubProvider rawg = new StubProvider("rawg", TitleDomain.VIDEO_GAME, ProviderCapability.SEARCH)
                    .withGame(game("4200", "Portal 2"));

            MetadataFetchResult result = service(steam, igdb, broken, rawg)
                    .fetchMetadata(videoGame("Portal 2"), null);

            assertTrue(result.found());
            assertEquals("Rawg", result.providerName());
            assertEquals(1.0, failures("steam", "rate_limited"));
            assertEquals(1.0, failures("igdb", "transient"));
            assertEquals(1.0, failures("broken", "unexpected"));
        }

        @Test
        @DisplayName("Should search with the trimmed query when one is given")
        void usesExplicitQuery() {
            StubProvider steam = new StubProvider("steam", TitleDomain.VIDEO_GAME, ProviderCapability.SEARCH)
                    .withGame(game("620", "Portal 2"));

            MetadataFetchResult result = service(steam).fetchMetadata(videoGame("portal two"), "  Portal 2  ");

            assertTrue(result.found());
            assertEquals("search:Portal 2", steam.getCalls().get(0));
        }

        @Test
        @DisplayName("Should report when no provider has a record")
        void notFound() {
            StubProvider steam = new StubProvider("steam", TitleDomain.VIDEO_GAME, ProviderCapability.SEARCH);

            MetadataFetchResult result = service(steam).fetchMetadata(videoGame("Unknown Game"), null);

            assertFalse(result.found());
            assertEquals("No metadata found from any provider", result.message());
            assertNull(result.metadata());
            assertNull(result.providerName());
            assertEquals(1.0, meterRegistry.find("metadata.not_found").tag("domain", "VIDEO_GAME")
                    .counter().count());
        }

        @Test
        @DisplayName("Should report when no provider serves the title's domain")
        void noProviders() {
            StubProvider steam = new StubProvider("steam", TitleDomain.VIDEO_GAME, ProviderCapability.SEARCH)
                    .withGame(game("13", "Catan"));
            GameTitle boardGame = GameTitle.builder().id("t-2").name("Catan").type(TitleType.BOARD_GAME).build();

            MetadataFetchResult result = service(steam).fetchMetadata(boardGame, null);

            assertFalse(result.found());
            assertEquals("No metadata providers available for this game type", result.message());
            assertTrue(steam.getCalls().isEmpty());
        }

        @Test
        @DisplayName("Should serve a repeated fetch from the cache")
        void cachedFetch() {
            StubProvider steam = new StubProvider("steam", TitleDomain.VIDEO_GAME, ProviderCapability.SEARCH)
                    .withGame(game("620", "Portal 2"));
            MetadataService service = MetadataService.builder()
                    .registry(ProviderRegistry.builder().register(steam).build())
                    .titleRepository(titles)
                    .cache(new CaffeineMetadataCache(CacheConfig.defaults()))
                    .metricsService(new MicrometerMetricsService(meterRegistry))
                    .build();

            service.fetchMetadata(videoGame("Portal 2"), null);
            MetadataFetchResult second = service.fetchMetadata(videoGame("Portal 2"), null);

            assertTrue(second.found());
            assertEquals(2, steam.countCalls("search:"));
            assertEquals(1, steam.countCalls("fetch:"));
            assertEquals(1.0, meterRegistry.find("metadata.cache.hit").counter().count());
            assertEquals(1.0, meterRegistry.find("metadata.cache.miss").counter().count());
        }
    }

    @Nested
    @DisplayName("Player count enrichment")
    class Enrichment {

        private final PlayerInfo flagsOnly = PlayerInfo.builder()
                .supportsOnline(true)
                .supportsLocal(true)
                .build();

        @Test
        @DisplayName("Should fill missing mode counts from a player-count provider")
        void enrichesMultiplayerRecord() {
            StubProvider steam = new StubProvider("steam", TitleDomain.VIDEO_GAME, ProviderCapability.SEARCH)
                    .withGame(game("620", "Portal 2").toBuilder().playerInfo(flagsOnly).build());
            StubProvider igdb = new StubProvider("igdb", TitleDomain.VIDEO_GAME,
                    ProviderCapability.SEARCH, ProviderCapability.ACCURATE_PLAYER_COUNTS)
                    .withGame(game("72", "Portal 2").toBuilder().playerInfo(PlayerInfo.builder()
                            .supportsOnline(false)
                            .onlineMaxPlayers(2)
                            .localMaxPlayers(2)
                            .build()).build());

            MetadataFetchResult result = service(steam, igdb).fetchMetadata(videoGame("Portal 2"), null);

            assertEquals("Found metadata from Steam + Igdb", result.message());
            assertEquals("620", result.metadata().getExternalId());
            PlayerInfo merged = result.metadata().getPlayerInfo();
            assertEquals(2, merged.getOnlineMaxPlayers());
            assertEquals(2, merged.getLocalMaxPlayers());
            assertEquals(Boolean.TRUE, merged.getSupportsOnline());
            assertEquals(1.0, meterRegistry.find("metadata.enrichment").tag("provider", "igdb")
                    .counter().count());
        }

        @Test
        @DisplayName("Should skip enrichment when mode counts are already known")
        void skipsWhenCountsKnown() {
            PlayerInfo withCounts = flagsOnly.toBuilder().onlineMaxPlayers(4).build();
            StubProvider steam = new StubProvider("steam", TitleDomain.VIDEO_GAME, ProviderCapability.SEARCH)
                    .withGame(game("620", "Portal 2").toBuilder().playerInfo(withCounts).build());
            StubProvider igdb = new StubProvider("igdb", TitleDomain.VIDEO_GAME,
                    ProviderCapability.SEARCH, ProviderCapability.ACCURATE_PLAYER_COUNTS);

            MetadataFetchResult result = service(steam, igdb).fetchMetadata(videoGame("Portal 2"), null);

            assertEquals("Found metadata from Steam", result.message());
            assertTrue(igdb.getCalls().isEmpty());
        }

        @Test
        @DisplayName("Should ignore player-count providers of another domain")
        void sameDomainOnly() {
            StubProvider steam = new StubProvider("steam", TitleDomain.VIDEO_GAME, ProviderCapability.SEARCH)
                    .withGame(game("620", "Portal 2").toBuilder().playerInfo(flagsOnly).build());
            StubProvider bgg = new StubProvider("bgg", TitleDomain.TABLETOP,
                    ProviderCapability.SEARCH, ProviderCapability.ACCURATE_PLAYER_COUNTS)
                    .withGame(game("1", "Portal 2"));

            MetadataFetchResult result = service(steam, bgg).fetchMetadata(videoGame("Portal 2"), null);

            assertEquals("Found metadata from Steam", result.message());
            assertTrue(bgg.getCalls().isEmpty());
        }

        @Test
        @DisplayName("Should keep the primary record when the enricher fails")
        void enricherFailure() {
            StubProvider steam = new StubProvider("steam", TitleDomain.VIDEO_GAME, ProviderCapability.SEARCH)
                    .withGame(game("620", "Portal 2").toBuilder().playerInfo(flagsOnly).build());
            StubProvider igdb = new StubProvider("igdb", TitleDomain.VIDEO_GAME,
                    ProviderCapability.SEARCH, ProviderCapability.ACCURATE_PLAYER_COUNTS)
                    .failingSearch(q -> new MetadataProviderException("igdb", "Unexpected status 403", 403));

            MetadataFetchResult result = service(steam, igdb).fetchMetadata(videoGame("Portal 2"), null);

            assertTrue(result.found());
            assertEquals("Found metadata from Steam", result.message());
            assertEquals(flagsOnly, result.metadata().getPlayerInfo());
            assertEquals(1.0, failures("igdb", "permanent"));
        }
    }

    @Nested
    @DisplayName("Fetch by provider id")
    class FetchFromProvider {

        @Test
        @DisplayName("Should report an unknown provider")
        void unknownProvider() {
            MetadataFetchResult result = service().fetchMetadataFromProvider("nope", "1");

            assertFalse(result.found());
            assertEquals("Provider 'nope' not found", result.message());
        }

        @Test
        @DisplayName("Should report a failing provider by name")
        void providerFailure() {
            StubProvider steam = new StubProvider("steam", TitleDomain.VIDEO_GAME, ProviderCapability.SEARCH)
                    .failingFetch(id -> new MetadataProviderException("steam", "boom"));

            MetadataFetchResult result = service(steam).fetchMetadataFromProvider("steam", "620");

            assertEquals("Failed to fetch metadata from Steam", result.message());
            assertEquals(1.0, failures("steam", "permanent"));
        }

        @Test
        @DisplayName("Should report a missing record")
        void missingRecord() {
            StubProvider steam = new StubProvider("steam", TitleDomain.VIDEO_GAME, ProviderCapability.SEARCH);

            MetadataFetchResult result = service(steam).fetchMetadataFromProvider("steam", "999");

            assertEquals("No metadata found for ID 999", result.message());
        }

        @Test
        @DisplayName("Should return the record and enrich it by its name")
        void found() {
            StubProvider steam = new StubProvider("steam", TitleDomain.VIDEO_GAME, ProviderCapability.SEARCH)
                    .withGame(game("620", "Portal 2").toBuilder()
                            .playerInfo(PlayerInfo.builder().supportsOnline(true).build()).build());
            StubProvider igdb = new StubProvider("igdb", TitleDomain.VIDEO_GAME,
                    ProviderCapability.ACCURATE_PLAYER_COUNTS)
                    .withGame(game("72", "Portal 2").toBuilder()
                            .playerInfo(PlayerInfo.builder().onlineMaxPlayers(2).build()).build());

            MetadataFetchResult result = service(steam, igdb).fetchMetadataFromProvider("steam", "620");

            assertTrue(result.found());
            assertEquals("Steam + Igdb", result.providerName());
            assertEquals(List.of("fetch:620"), steam.getCalls());
            assertEquals(List.of("search:Portal 2", "fetch:72"), igdb.getCalls());
        }
    }

    @Nested
    @DisplayName("Search options")
    class SearchOptions {

        private List<String> names(List<MetadataSearchResult> results) {
            return results.stream().map(MetadataSearchResult::name).collect(Collectors.toList());
        }

        @Test
        @DisplayName("Should drop duplicate names and rank exact, then prefix, then shorter")
        void dedupesAndRanks() {
            StubProvider steam = new StubProvider("steam", TitleDomain.VIDEO_GAME, ProviderCapability.SEARCH)
                    .withSearchResult("Portal", MetadataSearchResult.of("steam", "1", "Portal 2 Deluxe"))
                    .withSearchResult("Portal", MetadataSearchResult.of("steam", "2", "The Portal"))
                    .withSearchResult("Portal", MetadataSearchResult.of("steam", "3", "Portal"));
            StubProvider rawg = new StubProvider("rawg", TitleDomain.VIDEO_GAME, ProviderCapability.SEARCH)
                    .withSearchResult("Portal", MetadataSearchResult.of("rawg", "10", "PORTAL "))
                    .withSearchResult("Portal", MetadataSearchResult.of("rawg", "11", "Portal 2"))
                    .withSearchResult("Portal", MetadataSearchResult.of("rawg", "12", "Portal Stories: Mel"));

            List<MetadataSearchResult> options = service(steam, rawg)
                    .searchMetadataOptions(videoGame("Portal"), null);

            assertEquals(List.of("Portal", "Portal 2", "Portal 2 Deluxe", "Portal Stories: Mel", "The Portal"),
                    names(options));
            assertEquals("steam", options.get(0).providerId());
        }

        @Test
        @DisplayName("Should cap the number of options")
        void capsOptions() {
            StubProvider steam = new StubProvider("steam", TitleDomain.VIDEO_GAME, ProviderCapability.SEARCH);
            StubProvider rawg = new StubProvider("rawg", TitleDomain.VIDEO_GAME, ProviderCapability.SEARCH);
            for (int i = 0; i < 12; i++) {
                steam.withSearchResult("Game", MetadataSearchResult.of("steam", "s" + i, "Game S" + i));
                rawg.withSearchResult("Game", MetadataSearchResult.of("rawg", "r" + i, "Game R" + i));
            }

            List<MetadataSearchResult> options = service(steam, rawg).searchMetadataOptions(videoGame("Game"), null);

            assertEquals(15, options.size());
        }

        @Test
        @DisplayName("Should return nothing for a domain without providers")
        void noProviders() {
            GameTitle boardGame = GameTitle.builder().id("t-2").name("Catan").type(TitleType.BOARD_GAME).build();

            assertTrue(service().searchMetadataOptions(boardGame, "Catan").isEmpty());
        }

        @Test
        @DisplayName("Should skip a provider whose search fails")
        void skipsFailingProvider() {
            StubProvider steam = new StubProvider("steam", TitleDomain.VIDEO_GAME, ProviderCapability.SEARCH)
                    .failingSearch(q -> new MetadataTransientException("steam", "Server error 500", 500));
            StubProvider rawg = new StubProvider("rawg", TitleDomain.VIDEO_GAME, ProviderCapability.SEARCH)
                    .withGame(game("4200", "Portal 2"));

            List<MetadataSearchResult> options = service(steam, rawg)
                    .searchMetadataOptions(videoGame("Portal 2"), null);

            assertEquals(List.of("Portal 2"), names(options));
        }
    }

    @Nested
    @DisplayName("Applying metadata to a title")
    class ApplyMetadata {

        @Test
        @DisplayName("Should build and persist a patch from a full record")
        void appliesFullRecord() {
            GameTitle title = GameTitle.builder().id("t-1").name("Portal 2").description("Short").build();
            titles.save(title);
            GameMetadata metadata = game("620", "Portal 2").toBuilder()
                    .description("<p>A <b>puzzle</b> game&nbsp;sequel</p>")
                    .coverImageUrl("https://img.example/p2.jpg")
                    .playerInfo(PlayerInfo.builder()
                            .overallMinPlayers(1)
                            .overallMaxPlayers(2)
                            .supportsOnline(true)
                            .onlineMaxPlayers(2)
                            .supportsLocal(false)
                            .localMaxPlayers(2)
                            .build())
                    .build();

            TitleUpdateResult result = service().applyMetadataToTitle("t-1", title, metadata);

            assertEquals(List.of("description", "coverImageUrl", "overallMinPlayers", "overallMaxPlayers",
                    "supportsOnline", "onlineMaxPlayers", "supportsLocal", "localMinPlayers", "localMaxPlayers"),
                    result.fieldsUpdated());
            GameTitle stored = titles.findById("t-1").orElseThrow();
            assertEquals("A puzzle game sequel", stored.getDescription());
            assertEquals("https://img.example/p2.jpg", stored.getCoverImageUrl());
            assertEquals(2, stored.getOnlineMaxPlayers());
            assertEquals(Boolean.FALSE, stored.getSupportsLocal());
            assertNull(stored.getLocalMaxPlayers());
        }

        @Test
        @DisplayName("Should clear a mode's counts when it becomes unsupported")
        void unsupportedClearsCounts() {
            GameTitle title = GameTitle.builder().id("t-1").name("Portal 2")
                    .supportsOnline(true).onlineMinPlayers(2).onlineMaxPlayers(8).build();
            titles.save(title);
            GameMetadata metadata = game("620", "Portal 2").toBuilder()
                    .playerInfo(PlayerInfo.builder().supportsOnline(false).onlineMaxPlayers(4).build())
                    .build();

            TitleUpdateResult result = service().applyMetadataToTitle("t-1", title, metadata);

            assertEquals(Boolean.FALSE, result.update().getBoolean(TitleField.SUPPORTS_ONLINE));
            assertTrue(result.update().contains(TitleField.ONLINE_MAX_PLAYERS));
            assertNull(result.update().get(TitleField.ONLINE_MAX_PLAYERS));
            GameTitle stored = titles.findById("t-1").orElseThrow();
            assertNull(stored.getOnlineMinPlayers());
            assertNull(stored.getOnlineMaxPlayers());
        }

        @Test
        @DisplayName("Should write a maximum when the title already supports the mode")
        void maxFromCurrentFlag() {
            GameTitle title = GameTitle.builder().id("t-1").name("Portal 2").supportsLocal(true).build();
            titles.save(title);
            GameMetadata metadata = game("620", "Portal 2").toBuilder()
                    .playerInfo(PlayerInfo.builder().localMaxPlayers(4).onlineMaxPlayers(16).overallMaxPlayers(0)
                            .build())
                    .build();

            TitleUpdateResult result = service().applyMetadataToTitle("t-1", title, metadata);

            assertEquals(List.of("localMaxPlayers"), result.fieldsUpdated());
            assertEquals(4, result.update().getInteger(TitleField.LOCAL_MAX_PLAYERS));
        }

        @Test
        @DisplayName("Should only touch the physical mode on tabletop titles")
        void physicalOnlyForTabletop() {
            PlayerInfo physical = PlayerInfo.builder().supportsPhysical(true).physicalMaxPlayers(4).build();
            GameMetadata metadata = game("13", "Catan").toBuilder().playerInfo(physical).build();
            GameTitle video = GameTitle.builder().id("t-1").name("Catan").type(TitleType.VIDEO_GAME).build();
            GameTitle board = GameTitle.builder().id("t-2").name("Catan").type(TitleType.BOARD_GAME).build();
            titles.save(video);
            titles.save(board);

            MetadataService service = service();
            TitleUpdateResult videoResult = service.applyMetadataToTitle("t-1", video, metadata);
            TitleUpdateResult boardResult = service.applyMetadataToTitle("t-2", board, metadata);

            assertTrue(videoResult.isEmpty());
            assertEquals(List.of("supportsPhysical", "physicalMaxPlayers"), boardResult.fieldsUpdated());
        }

        @Test
        @DisplayName("Should prefer the short description")
        void prefersShortDescription() {
            GameTitle title = GameTitle.builder().id("t-1").name("Portal 2").build();
            titles.save(title);
            GameMetadata metadata = game("620", "Portal 2").toBuilder()
                    .shortDescription("Cooperative puzzles.")
                    .description("A much longer description of the game.")
                    .build();

            TitleUpdateResult result = service().applyMetadataToTitle("t-1", title, metadata);

            assertEquals("Cooperative puzzles.", result.update().getString(TitleField.DESCRIPTION));
        }

        @Test
        @DisplayName("Should keep a substantial existing description")
        void keepsLongDescription() {
            String current = "A long-form description that somebody wrote for this title by hand.";
            GameTitle title = GameTitle.builder().id("t-1").name("Portal 2").description(current).build();
            titles.save(title);
            GameMetadata metadata = game("620", "Portal 2").toBuilder().description("Provider text.").build();

            TitleUpdateResult result = service().applyMetadataToTitle("t-1", title, metadata);

            assertFalse(result.update().contains(TitleField.DESCRIPTION));
        }

        @Test
        @DisplayName("Should replace a description that only repeats the name")
        void replacesNameAsDescription() {
            String name = "The Legend of Zelda: Tears of the Kingdom Collector's Edition Bundle";
            GameTitle title = GameTitle.builder().id("t-1").name(name).description(name).build();
            titles.save(title);
            GameMetadata metadata = game("1", name).toBuilder().description("Explore Hyrule.").build();

            TitleUpdateResult result = service().applyMetadataToTitle("t-1", title, metadata);

            assertEquals("Explore Hyrule.", result.update().getString(TitleField.DESCRIPTION));
        }

        @Test
        @DisplayName("Should keep an existing cover image")
        void keepsCover() {
            GameTitle title = GameTitle.builder().id("t-1").name("Portal 2")
                    .coverImageUrl("https://mine.example/cover.png").build();
            titles.save(title);
            GameMetadata metadata = game("620", "Portal 2").toBuilder()
                    .coverImageUrl("https://img.example/p2.jpg").build();

            TitleUpdateResult result = service().applyMetadataToTitle("t-1", title, metadata);

            assertTrue(result.isEmpty());
        }

        @Test
        @DisplayName("Should not persist an empty patch")
        void emptyPatchNotPersisted() {
            GameTitleRepository repository = mock(GameTitleRepository.class);
            MetadataService service = MetadataService.builder()
                    .registry(ProviderRegistry.builder().build())
                    .titleRepository(repository)
                    .build();
            GameTitle title = GameTitle.builder().id("t-1").name("Portal 2").build();

            TitleUpdateResult result = service.applyMetadataToTitle("t-1", title, game("620", "Portal 2"));

            assertTrue(result.isEmpty());
            verify(repository, never()).applyUpdate(any(), any());
        }
    }

    @Nested
    @DisplayName("Player count merge")
    class MergePlayerCounts {

        private final PlayerInfo existing = PlayerInfo.builder()
                .supportsOnline(true)
                .onlineMaxPlayers(4)
                .localMaxPlayers(2)
                .build();

        @Test
        @DisplayName("Should keep an existing count the enrichment lacks")
        void keepsExisting() {
            PlayerInfo merged = service().mergePlayerCounts(existing, PlayerInfo.builder().build());

            assertEquals(4, merged.getOnlineMaxPlayers());
            assertEquals(2, merged.getLocalMaxPlayers());
        }

        @Test
        @DisplayName("Should prefer the enrichment count and keep existing flags")
        void enrichmentWins() {
            PlayerInfo enrichment = PlayerInfo.builder().supportsOnline(false).onlineMaxPlayers(2).build();

            PlayerInfo merged = service().mergePlayerCounts(existing, enrichment);

            assertEquals(2, merged.getOnlineMaxPlayers());
            assertEquals(2, merged.getLocalMaxPlayers());
            assertEquals(Boolean.TRUE, merged.getSupportsOnline());
        }

        @Test
        @DisplayName("Should return the other side when one is missing")
        void nullSides() {
            MetadataService service = service();

            assertSame(existing, service.mergePlayerCounts(existing, null));
            assertSame(existing, service.mergePlayerCounts(null, existing));
            assertNull(service.mergePlayerCounts(null, null));
        }
    }
}
