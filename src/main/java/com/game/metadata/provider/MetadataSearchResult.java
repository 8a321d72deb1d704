package com.game.metadata.provider;

import java.util.Objects;

/**
 * A lightweight search hit used for ranking before a full fetch.
 *
 * @param externalId    provider-scoped identifier
 * @param name          title as the provider spells it
 * @param releaseYear   release year when the provider reports one
 * @param coverImageUrl cover image when the provider reports one
 * @param providerId    id of the provider that produced this hit
 */
public record MetadataSearchResult(String externalId, String name, Integer releaseYear, String coverImageUrl,
                                   String providerId) {

    public MetadataSearchResult {
        Objects.requireNonNull(externalId, "externalId is required");
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(providerId, "providerId is required");
    }

    public static MetadataSearchResult of(String providerId, String externalId, String name) {
        return new MetadataSearchResult(externalId, name, null, null, providerId);
    }
}
