package com.game.metadata.provider;

/**
 * Per-provider request policy.
 *
 * @param requestDelayMs       minimum interval between two requests to the provider
 * @param maxBatchSize         number of items fetched before pausing for {@code batchDelayMs}
 * @param batchDelayMs         pause between batches
 * @param maxGamesPerSync      cap on items fetched from the provider in one sync run
 * @param retryDelayMs         base wait before retrying a transient failure
 * @param maxConsecutiveErrors consecutive failures after which a batch is abandoned
 * @param maxRetries           retries allowed for one transient failure
 */
public record RateLimitConfig(long requestDelayMs, int maxBatchSize, long batchDelayMs, int maxGamesPerSync,
                              long retryDelayMs, int maxConsecutiveErrors, int maxRetries) {

    public static final int DEFAULT_MAX_RETRIES = 2;

    public RateLimitConfig {
        if (requestDelayMs < 0) {
            throw new IllegalArgumentException("requestDelayMs must be >= 0");
        }
        if (maxBatchSize <= 0) {
            throw new IllegalArgumentException("maxBatchSize must be > 0");
        }
        if (batchDelayMs < 0) {
            throw new IllegalArgumentException("batchDelayMs must be >= 0");
        }
        if (maxGamesPerSync <= 0) {
            throw new IllegalArgumentException("maxGamesPerSync must be > 0");
        }
        if (retryDelayMs < 0) {
            throw new IllegalArgumentException("retryDelayMs must be >= 0");
        }
        if (maxConsecutiveErrors <= 0) {
            throw new IllegalArgumentException("maxConsecutiveErrors must be > 0");
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
    }

    public RateLimitConfig(long requestDelayMs, int maxBatchSize, long batchDelayMs, int maxGamesPerSync,
                           long retryDelayMs, int maxConsecutiveErrors) {
        this(requestDelayMs, maxBatchSize, batchDelayMs, maxGamesPerSync, retryDelayMs,
                maxConsecutiveErrors, DEFAULT_MAX_RETRIES);
    }

    /**
     * Default policy: 1s between requests, batches of 10 with 1s pauses, 100 items per sync,
     * 1s retry delay, 5 consecutive errors, 2 retries.
     */
    public static RateLimitConfig defaults() {
        return new RateLimitConfig(1000, 10, 1000, 100, 1000, 5, DEFAULT_MAX_RETRIES);
    }

    public RateLimitConfig withRequestDelayMs(long delayMs) {
        return new RateLimitConfig(delayMs, maxBatchSize, batchDelayMs, maxGamesPerSync, retryDelayMs,
                maxConsecutiveErrors, maxRetries);
    }

    public RateLimitConfig withRetries(int retries, long delayMs) {
        return new RateLimitConfig(requestDelayMs, maxBatchSize, batchDelayMs, maxGamesPerSync, delayMs,
                maxConsecutiveErrors, retries);
    }
}
