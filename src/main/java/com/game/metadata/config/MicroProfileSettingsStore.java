package com.game.metadata.config;

import org.eclipse.microprofile.config.Config;

import java.util.Optional;

/**
 * {@link SettingsStore} backed by MicroProfile Config.
 * A setting {@code rawgApiKey} is read from the property {@code game-metadata.settings.rawgApiKey}.
 */
public class MicroProfileSettingsStore implements SettingsStore {

    public static final String PREFIX = "game-metadata.settings.";

    private final Config config;

    public MicroProfileSettingsStore(Config config) {
        this.config = config;
    }

    @Override
    public Optional<String> get(String key) {
        return config.getOptionalValue(PREFIX + key, String.class)
                .map(String::trim)
                .filter(v -> !v.isEmpty());
    }
}
