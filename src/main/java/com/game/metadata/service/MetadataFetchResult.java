package com.game.metadata.service;

import com.game.metadata.provider.GameMetadata;

/**
 * Outcome of a metadata lookup.
 *
 * @param found        whether a provider supplied a record
 * @param message      provenance message for the user, e.g. {@code "Found metadata from Steam + IGDB"}
 * @param metadata     the merged record, null when nothing was found
 * @param providerName contributing provider names joined with {@code " + "}, null when nothing was found
 */
public record MetadataFetchResult(boolean found, String message, GameMetadata metadata, String providerName) {

    public static MetadataFetchResult found(GameMetadata metadata, String providerName) {
        return new MetadataFetchResult(true, "Found metadata from " + providerName, metadata, providerName);
    }

    public static MetadataFetchResult notFound(String message) {
        return new MetadataFetchResult(false, message, null, null);
    }
}
