package com.game.metadata.platform;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of GameReleaseRepository.
 */
public class InMemoryGameReleaseRepository implements GameReleaseRepository {

    private final Map<String, GameRelease> releases = new ConcurrentHashMap<>();

    @Override
    public GameRelease save(GameRelease release) {
        releases.put(release.id(), release);
        return release;
    }

    @Override
    public Optional<GameRelease> findById(String id) {
        return Optional.ofNullable(releases.get(id));
    }

    @Override
    public List<GameRelease> findByPlatform(String platformId) {
        return releases.values().stream()
                .filter(r -> r.platformId().equals(platformId))
                .collect(Collectors.toList());
    }

    @Override
    public synchronized int repointPlatform(String fromPlatformId, String toPlatformId) {
        int moved = 0;
        for (GameRelease release : findByPlatform(fromPlatformId)) {
            releases.put(release.id(), release.withPlatform(toPlatformId));
            moved++;
        }
        return moved;
    }

    @Override
    public synchronized void assignPlatform(Collection<String> releaseIds, String platformId) {
        for (String releaseId : releaseIds) {
            GameRelease release = releases.get(releaseId);
            if (release == null) {
                throw new IllegalArgumentException("Release not found: " + releaseId);
            }
            releases.put(releaseId, release.withPlatform(platformId));
        }
    }
}
