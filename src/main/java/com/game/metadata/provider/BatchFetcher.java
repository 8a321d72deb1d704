package com.game.metadata.provider;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Sequential batch fetch for providers without a native batch endpoint.
 *
 * <p>Ids are fetched one at a time with transient failures retried. After every
 * {@link RateLimitConfig#maxBatchSize()} ids the fetcher pauses for
 * {@link RateLimitConfig#batchDelayMs()}. Once
 * {@link RateLimitConfig#maxConsecutiveErrors()} ids in a row have failed, the rest of the
 * batch is abandoned. A permanent miss is not a failure and resets the count.</p>
 */
public final class BatchFetcher {
    private static final Logger log = LoggerFactory.getLogger(BatchFetcher.class);

    private BatchFetcher() {
        // Utility class
    }

    public static List<GameMetadata> fetchSequentially(MetadataProvider provider, List<String> externalIds,
                                                       String apiKey) {
        String providerId = provider.getManifest().id();
        RateLimitConfig config = provider.getRateLimitConfig();
        List<GameMetadata> results = new ArrayList<>();
        int consecutiveErrors = 0;
        int processed = 0;

        for (String externalId : externalIds) {
            if (processed > 0 && processed % config.maxBatchSize() == 0) {
                RetryingCaller.pause(providerId, config.batchDelayMs());
            }
            processed++;
            try {
                Optional<GameMetadata> metadata = RetryingCaller.call(providerId, config, "getGameMetadata",
                        () -> provider.getGameMetadata(externalId, apiKey));
                metadata.ifPresent(results::add);
                consecutiveErrors = 0;
            } catch (MetadataProviderException e) {
                consecutiveErrors++;
                log.warn("batch.fetch.failed provider={} externalId={} consecutiveErrors={} error={}",
                        providerId, externalId, consecutiveErrors, e.getMessage());
                if (consecutiveErrors >= config.maxConsecutiveErrors()) {
                    log.warn("batch.fetch.aborted provider={} processed={} remaining={}",
                            providerId, processed, externalIds.size() - processed);
                    break;
                }
            }
        }
        return results;
    }
}
