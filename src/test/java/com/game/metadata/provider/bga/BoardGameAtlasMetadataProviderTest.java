package com.game.metadata.provider.bga;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.game.metadata.config.InMemorySettingsStore;
import com.game.metadata.config.ProviderCredentials;
import com.game.metadata.provider.GameMetadata;
import com.game.metadata.provider.MetadataSearchResult;
import com.game.metadata.provider.PlayerInfo;
import com.game.metadata.provider.RateLimitConfig;
import com.game.metadata.provider.http.StubTransport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("BoardGameAtlasMetadataProvider Tests")
class BoardGameAtlasMetadataProviderTest {

    private static final RateLimitConfig NO_DELAY = RateLimitConfig.defaults().withRequestDelayMs(0).withRetries(0, 0);

    private static final String GAMES = """
            {"games": [
              {"id": "OIXt3DmJU0", "name": "Catan", "year_published": 1995,
               "description_preview": " Trade, build and settle the island of Catan. ",
               "description": "<p>Long description</p>",
               "image_url": "https://s3.example/catan.jpg", "thumb_url": "https://s3.example/catan-thumb.jpg",
               "min_players": 3, "max_players": 4,
               "primary_publisher": {"id": "p1", "name": "KOSMOS"},
               "publishers": [{"name": "KOSMOS"}, {"name": "Catan Studio"}],
               "primary_designer": {"name": "Klaus Teuber"},
               "designers": [{"name": "Klaus Teuber"}],
               "categories": [{"id": "c1", "name": null}],
               "mechanics": [{"name": "Dice Rolling"}, {"name": "Trading"}, {"name": "Modular Board"}, {"name": "Route Building"}],
               "average_user_rating": 3.6,
               "unknown_field": {"nested": true}},
              {"id": null, "name": "Broken"}]}
            """;

    private static ProviderCredentials credentials(String clientId) {
        InMemorySettingsStore settings = new InMemorySettingsStore();
        if (clientId != null) {
            settings.put(ProviderCredentials.BOARD_GAME_ATLAS_CLIENT_ID, clientId);
        }
        return new ProviderCredentials(settings, name -> null);
    }

    private static BoardGameAtlasMetadataProvider provider(StubTransport transport, String clientId) {
        return new BoardGameAtlasMetadataProvider(transport, credentials(clientId), new ObjectMapper(), NO_DELAY);
    }

    @Test
    @DisplayName("Without a client id nothing is requested")
    void noClientId() {
        StubTransport transport = new StubTransport();
        BoardGameAtlasMetadataProvider bga = provider(transport, null);

        assertFalse(bga.isAvailable());
        assertTrue(bga.searchGames("Catan", 5).isEmpty());
        assertTrue(bga.getGameMetadata("OIXt3DmJU0").isEmpty());
        assertTrue(transport.getRequests().isEmpty());
    }

    @Test
    @DisplayName("Search skips games without an id and prefers thumbnails")
    void search() {
        StubTransport transport = new StubTransport().on("/api/search", 200, GAMES);

        List<MetadataSearchResult> results = provider(transport, "cid").searchGames("Catan", 5);

        assertEquals(1, results.size());
        assertEquals("OIXt3DmJU0", results.get(0).externalId());
        assertEquals(1995, results.get(0).releaseYear());
        assertEquals("https://s3.example/catan-thumb.jpg", results.get(0).coverImageUrl());
        String uri = transport.lastRequest().uri().toString();
        assertTrue(uri.contains("client_id=cid"));
        assertTrue(uri.contains("fuzzy_match=true"));
    }

    @Test
    @DisplayName("Maps a game looked up by id")
    void details() {
        StubTransport transport = new StubTransport().on("/api/search", 200, GAMES);

        GameMetadata metadata = provider(transport, "cid").getGameMetadata("OIXt3DmJU0").orElseThrow();

        assertTrue(transport.lastRequest().uri().toString().contains("ids=OIXt3DmJU0"));
        assertEquals("Trade, build and settle the island of Catan.", metadata.getDescription());
        assertEquals("https://s3.example/catan.jpg", metadata.getCoverImageUrl());
        assertEquals(List.of("Dice Rolling", "Trading", "Modular Board"), metadata.getGenres());
        assertEquals(List.of("Klaus Teuber"), metadata.getDevelopers());
        assertEquals(List.of("KOSMOS", "Catan Studio"), metadata.getPublishers());
        assertEquals("1995", metadata.getReleaseDate());
        assertEquals(72, metadata.getMetacriticScore());
        assertEquals("https://www.boardgameatlas.com/game/OIXt3DmJU0", metadata.getStoreUrl());

        PlayerInfo players = metadata.getPlayerInfo();
        assertEquals(3, players.getOverallMinPlayers());
        assertEquals(4, players.getOverallMaxPlayers());
        assertTrue(players.getSupportsPhysical());
        assertFalse(players.getSupportsOnline());
    }

    @Test
    @DisplayName("A solo game has no local play")
    void soloGame() {
        String games = GAMES.replace("\"min_players\": 3, \"max_players\": 4",
                "\"min_players\": 1, \"max_players\": 1");
        StubTransport transport = new StubTransport().on("/api/search", 200, games);

        PlayerInfo players = provider(transport, "cid").getGameMetadata("OIXt3DmJU0").orElseThrow().getPlayerInfo();

        assertFalse(players.getSupportsLocal());
        assertNull(players.getLocalMaxPlayers());
        assertEquals(1, players.getPhysicalMaxPlayers());
    }

    @Test
    @DisplayName("A zero maximum falls back to the minimum")
    void zeroMaximum() {
        String games = GAMES.replace("\"max_players\": 4", "\"max_players\": 0");
        StubTransport transport = new StubTransport().on("/api/search", 200, games);

        PlayerInfo players = provider(transport, "cid").getGameMetadata("OIXt3DmJU0").orElseThrow().getPlayerInfo();

        assertEquals(3, players.getOverallMaxPlayers());
        assertEquals(3, players.getLocalMaxPlayers());
        assertTrue(players.getSupportsLocal());
    }

    @Test
    @DisplayName("An empty game list is a miss")
    void emptyList() {
        StubTransport transport = new StubTransport().on("/api/search", 200, "{\"games\": [], \"count\": 0}");
        assertTrue(provider(transport, "cid").getGameMetadata("missing").isEmpty());
    }
}
