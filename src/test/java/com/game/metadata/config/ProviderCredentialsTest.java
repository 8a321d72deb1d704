package com.game.metadata.config;

import org.eclipse.microprofile.config.Config;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("ProviderCredentials Tests")
class ProviderCredentialsTest {

    @Test
    @DisplayName("Settings take precedence over the environment")
    void settingsFirst() {
        InMemorySettingsStore settings = new InMemorySettingsStore(Map.of(ProviderCredentials.RAWG_API_KEY, "from-settings"));
        ProviderCredentials credentials = new ProviderCredentials(settings,
                Map.of(ProviderCredentials.RAWG_API_KEY_ENV, "from-env")::get);

        assertEquals(Optional.of("from-settings"), credentials.rawgApiKey());
    }

    @Test
    @DisplayName("Falls back to the trimmed environment value")
    void environmentFallback() {
        ProviderCredentials credentials = new ProviderCredentials(new InMemorySettingsStore(),
                Map.of(ProviderCredentials.TWITCH_CLIENT_ID_ENV, "  abc123  ")::get);

        assertEquals(Optional.of("abc123"), credentials.twitchClientId());
    }

    @Test
    @DisplayName("Blank values count as missing")
    void blankIsMissing() {
        InMemorySettingsStore settings = new InMemorySettingsStore();
        settings.put(ProviderCredentials.TWITCH_CLIENT_SECRET, "   ");
        ProviderCredentials credentials = new ProviderCredentials(settings,
                Map.of(ProviderCredentials.TWITCH_CLIENT_SECRET_ENV, " ")::get);

        assertTrue(credentials.twitchClientSecret().isEmpty());
        assertTrue(credentials.boardGameAtlasClientId().isEmpty());
    }

    @Test
    @DisplayName("Settings store removes a key when given null")
    void settingsStoreRemoval() {
        InMemorySettingsStore settings = new InMemorySettingsStore();
        settings.put("key", "value");
        settings.put("key", null);
        assertTrue(settings.get("key").isEmpty());
        assertThrows(IllegalArgumentException.class, () -> settings.put(" ", "value"));
    }

    @Test
    @DisplayName("MicroProfile settings are read under the game-metadata.settings prefix")
    void microProfileSettings() {
        Config config = mock(Config.class);
        when(config.getOptionalValue("game-metadata.settings.rawgApiKey", String.class))
                .thenReturn(Optional.of(" rawg-key "));
        when(config.getOptionalValue("game-metadata.settings.boardGameAtlasClientId", String.class))
                .thenReturn(Optional.of(""));
        when(config.getOptionalValue("game-metadata.settings.twitchClientId", String.class))
                .thenReturn(Optional.empty());
        ProviderCredentials credentials = new ProviderCredentials(new MicroProfileSettingsStore(config),
                Map.of(ProviderCredentials.BOARD_GAME_ATLAS_CLIENT_ID_ENV, "atlas-env")::get);

        assertEquals(Optional.of("rawg-key"), credentials.rawgApiKey());
        assertEquals(Optional.of("atlas-env"), credentials.boardGameAtlasClientId());
        assertTrue(credentials.twitchClientId().isEmpty());
    }
}
