package com.game.metadata.config;

import java.util.Optional;

/**
 * Read access to application settings such as provider credentials.
 */
public interface SettingsStore {

    /**
     * Returns the setting's value, or empty if it is unset or blank.
     */
    Optional<String> get(String key);
}
