package com.game.metadata.provider;

/**
 * A provider request failed in a way that retrying will not fix: an unexpected
 * client error status or a payload that could not be parsed.
 * Permanent misses (unknown id, malformed id) are not exceptions; adapters report
 * them as an empty result.
 */
public class MetadataProviderException extends RuntimeException {

    private final String providerId;
    private final Integer statusCode;

    public MetadataProviderException(String providerId, String message) {
        this(providerId, message, (Integer) null);
    }

    public MetadataProviderException(String providerId, String message, Integer statusCode) {
        super(providerId + " API error: " + message);
        this.providerId = providerId;
        this.statusCode = statusCode;
    }

    public MetadataProviderException(String providerId, String message, Throwable cause) {
        super(providerId + " API error: " + message, cause);
        this.providerId = providerId;
        this.statusCode = null;
    }

    public String getProviderId() {
        return providerId;
    }

    /**
     * HTTP status that caused the failure, or {@code null} if none was received.
     */
    public Integer getStatusCode() {
        return statusCode;
    }

    public boolean isTransient() {
        return false;
    }
}
