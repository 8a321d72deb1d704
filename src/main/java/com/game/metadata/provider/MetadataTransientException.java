package com.game.metadata.provider;

/**
 * A retryable provider failure: server error, network failure or rate limiting.
 */
public class MetadataTransientException extends MetadataProviderException {

    public MetadataTransientException(String providerId, String message, Integer statusCode) {
        super(providerId, message, statusCode);
    }

    public MetadataTransientException(String providerId, String message, Throwable cause) {
        super(providerId, message, cause);
    }

    /**
     * Delay the provider asked for before the next attempt, or {@code null}.
     */
    public Long getRetryAfterMs() {
        return null;
    }

    @Override
    public boolean isTransient() {
        return true;
    }
}
