package com.game.metadata.platform;

import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for platforms.
 */
public interface PlatformRepository {

    Optional<Platform> findById(String id);

    List<Platform> findByOwner(String ownerId);

    /**
     * Finds an owner's platform by name, case-insensitively.
     */
    Optional<Platform> findByName(String ownerId, String name);

    /**
     * Inserts or replaces a platform.
     *
     * @throws IllegalArgumentException if another platform of the same owner has that name
     */
    Platform save(Platform platform);

    /**
     * @throws IllegalArgumentException if the platform does not exist
     */
    void delete(String id);
}
