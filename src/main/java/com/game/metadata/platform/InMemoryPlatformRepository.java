package com.game.metadata.platform;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of PlatformRepository.
 * Writes are synchronized so the per-owner name check and the insert are atomic.
 */
public class InMemoryPlatformRepository implements PlatformRepository {

    private final Map<String, Platform> platforms = new ConcurrentHashMap<>();

    @Override
    public Optional<Platform> findById(String id) {
        return Optional.ofNullable(platforms.get(id));
    }

    @Override
    public List<Platform> findByOwner(String ownerId) {
        return platforms.values().stream()
                .filter(p -> p.ownerId().equals(ownerId))
                .sorted(Comparator.comparing(Platform::isDefault).reversed()
                        .thenComparing(Platform::name, String.CASE_INSENSITIVE_ORDER))
                .collect(Collectors.toList());
    }

    @Override
    public Optional<Platform> findByName(String ownerId, String name) {
        return platforms.values().stream()
                .filter(p -> p.ownerId().equals(ownerId) && p.hasName(name))
                .findFirst();
    }

    @Override
    public synchronized Platform save(Platform platform) {
        Optional<Platform> clash = findByName(platform.ownerId(), platform.name());
        if (clash.isPresent() && !clash.get().id().equals(platform.id())) {
            throw new IllegalArgumentException("Platform \"" + platform.name() + "\" already exists");
        }
        platforms.put(platform.id(), platform);
        return platform;
    }

    @Override
    public synchronized void delete(String id) {
        if (platforms.remove(id) == null) {
            throw new IllegalArgumentException("Platform not found: " + id);
        }
    }

    public int size() {
        return platforms.size();
    }
}
