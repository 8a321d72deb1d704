package com.game.metadata.provider;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * Retries provider calls that fail with a {@link MetadataTransientException}.
 *
 * <p>Up to {@link RateLimitConfig#maxRetries()} retries are made. The wait before a retry
 * is the provider's {@code Retry-After} when it sent one, otherwise
 * {@link RateLimitConfig#retryDelayMs()} multiplied by the attempt number.
 * Any other exception propagates immediately.</p>
 */
public final class RetryingCaller {
    private static final Logger log = LoggerFactory.getLogger(RetryingCaller.class);

    private RetryingCaller() {
        // Utility class
    }

    public static <T> T call(String providerId, RateLimitConfig config, String operation, Supplier<T> call) {
        int attempt = 0;
        while (true) {
            try {
                return call.get();
            } catch (MetadataTransientException e) {
                if (attempt >= config.maxRetries()) {
                    log.warn("provider.retry.exhausted provider={} operation={} attempts={} error={}",
                            providerId, operation, attempt + 1, e.getMessage());
                    throw e;
                }
                attempt++;
                long delay = e.getRetryAfterMs() != null ? e.getRetryAfterMs() : config.retryDelayMs() * attempt;
                log.info("provider.retry provider={} operation={} attempt={} delayMs={}",
                        providerId, operation, attempt, delay);
                pause(providerId, delay);
            }
        }
    }

    static void pause(String providerId, long delayMs) {
        if (delayMs <= 0) {
            return;
        }
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MetadataTransientException(providerId, "Interrupted while waiting to retry", e);
        }
    }
}
