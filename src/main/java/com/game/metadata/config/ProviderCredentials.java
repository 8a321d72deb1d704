package com.game.metadata.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.function.Function;

/**
 * Resolves provider credentials: the settings store first, then environment variables.
 */
public class ProviderCredentials {
    private static final Logger log = LoggerFactory.getLogger(ProviderCredentials.class);

    public static final String RAWG_API_KEY = "rawgApiKey";
    public static final String TWITCH_CLIENT_ID = "twitchClientId";
    public static final String TWITCH_CLIENT_SECRET = "twitchClientSecret";
    public static final String BOARD_GAME_ATLAS_CLIENT_ID = "boardGameAtlasClientId";

    public static final String RAWG_API_KEY_ENV = "RAWG_API_KEY";
    public static final String TWITCH_CLIENT_ID_ENV = "TWITCH_CLIENT_ID";
    public static final String TWITCH_CLIENT_SECRET_ENV = "TWITCH_CLIENT_SECRET";
    public static final String BOARD_GAME_ATLAS_CLIENT_ID_ENV = "BOARD_GAME_ATLAS_CLIENT_ID";

    private final SettingsStore settings;
    private final Function<String, String> environment;

    public ProviderCredentials(SettingsStore settings) {
        this(settings, System::getenv);
    }

    public ProviderCredentials(SettingsStore settings, Function<String, String> environment) {
        this.settings = settings;
        this.environment = environment;
    }

    /**
     * Credentials from environment variables only.
     */
    public static ProviderCredentials fromEnvironment() {
        return new ProviderCredentials(key -> Optional.empty());
    }

    public Optional<String> resolve(String settingKey, String envVar) {
        Optional<String> fromSettings = settings.get(settingKey);
        if (fromSettings.isPresent()) {
            return fromSettings;
        }
        String fromEnv = environment.apply(envVar);
        if (fromEnv != null && !fromEnv.isBlank()) {
            log.debug("Credential {} resolved from environment variable {}", settingKey, envVar);
            return Optional.of(fromEnv.trim());
        }
        return Optional.empty();
    }

    public Optional<String> rawgApiKey() {
        return resolve(RAWG_API_KEY, RAWG_API_KEY_ENV);
    }

    public Optional<String> twitchClientId() {
        return resolve(TWITCH_CLIENT_ID, TWITCH_CLIENT_ID_ENV);
    }

    public Optional<String> twitchClientSecret() {
        return resolve(TWITCH_CLIENT_SECRET, TWITCH_CLIENT_SECRET_ENV);
    }

    public Optional<String> boardGameAtlasClientId() {
        return resolve(BOARD_GAME_ATLAS_CLIENT_ID, BOARD_GAME_ATLAS_CLIENT_ID_ENV);
    }
}
