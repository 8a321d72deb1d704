package com.game.metadata.platform;

import java.util.Objects;

/**
 * A release of a title on one platform.
 */
public record GameRelease(String id, String gameTitleId, String platformId) {

    public GameRelease {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(gameTitleId, "gameTitleId is required");
        Objects.requireNonNull(platformId, "platformId is required");
    }

    public GameRelease withPlatform(String newPlatformId) {
        return new GameRelease(id, gameTitleId, newPlatformId);
    }
}
