package com.game.metadata.provider;

import java.util.List;
import java.util.Optional;

/**
 * Contract every external metadata source implements.
 *
 * <p>Error discipline for {@link #getGameMetadata}: a populated result on success,
 * {@link Optional#empty()} for a permanent miss (malformed id, source says "not found"),
 * and a {@link MetadataTransientException} for rate limiting or server failures so the
 * caller can retry. Transient failures must never be reported as an empty result.</p>
 *
 * <p>A provider whose required credential is missing reports {@link #isAvailable()} as
 * false and returns empty results instead of throwing.</p>
 */
public interface MetadataProvider {

    ProviderManifest getManifest();

    ProviderCapabilities getCapabilities();

    RateLimitConfig getRateLimitConfig();

    /**
     * Searches the source by title.
     *
     * @param query  free-text title
     * @param limit  maximum number of results
     * @param apiKey per-call credential overriding the configured one, may be null
     */
    List<MetadataSearchResult> searchGames(String query, int limit, String apiKey);

    Optional<GameMetadata> getGameMetadata(String externalId, String apiKey);

    /**
     * Fetches several titles. Providers without a native batch endpoint fetch them one
     * by one through {@link BatchFetcher}.
     */
    default List<GameMetadata> getGamesMetadata(List<String> externalIds, String apiKey) {
        return BatchFetcher.fetchSequentially(this, externalIds, apiKey);
    }

    default String getGameUrl(String externalId) {
        return getManifest().gameUrl(externalId);
    }

    default boolean isAvailable() {
        return true;
    }

    default List<MetadataSearchResult> searchGames(String query, int limit) {
        return searchGames(query, limit, null);
    }

    default Optional<GameMetadata> getGameMetadata(String externalId) {
        return getGameMetadata(externalId, null);
    }
}
