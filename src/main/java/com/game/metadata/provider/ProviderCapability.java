package com.game.metadata.provider;

/**
 * Capability flags a provider may declare. Callers select providers by flag,
 * never by provider id.
 */
public enum ProviderCapability {
    ACCURATE_PLAYER_COUNTS,
    STORE_URLS,
    BATCH_REQUESTS,
    SEARCH,
    DESCRIPTIONS,
    COVER_IMAGES
}
