package com.game.metadata.config;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory implementation of {@link SettingsStore}.
 */
public class InMemorySettingsStore implements SettingsStore {

    private final ConcurrentMap<String, String> values = new ConcurrentHashMap<>();

    public InMemorySettingsStore() {
    }

    public InMemorySettingsStore(Map<String, String> initial) {
        initial.forEach(this::put);
    }

    public void put(String key, String value) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key must not be null or blank");
        }
        if (value == null) {
            values.remove(key);
        } else {
            values.put(key, value);
        }
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(values.get(key)).filter(v -> !v.isBlank());
    }
}
