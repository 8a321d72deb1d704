package com.game.metadata.platform;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for the releases that reference platforms.
 */
public interface GameReleaseRepository {

    GameRelease save(GameRelease release);

    Optional<GameRelease> findById(String id);

    List<GameRelease> findByPlatform(String platformId);

    /**
     * Moves every release of {@code fromPlatformId} to {@code toPlatformId}.
     *
     * @return the number of releases moved
     */
    int repointPlatform(String fromPlatformId, String toPlatformId);

    /**
     * Points the given releases at a platform. Used to undo a repoint.
     */
    void assignPlatform(Collection<String> releaseIds, String platformId);
}
