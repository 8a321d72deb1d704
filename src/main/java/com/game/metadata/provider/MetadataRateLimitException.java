package com.game.metadata.provider;

/**
 * The provider rejected the request with HTTP 429.
 */
public class MetadataRateLimitException extends MetadataTransientException {

    private final Long retryAfterMs;

    public MetadataRateLimitException(String providerId, Long retryAfterMs) {
        super(providerId, "Rate limit exceeded for " + providerId + " (429)", 429);
        this.retryAfterMs = retryAfterMs;
    }

    @Override
    public Long getRetryAfterMs() {
        return retryAfterMs;
    }
}
