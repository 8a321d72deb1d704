package com.game.metadata.ratelimit;

import com.game.metadata.provider.MetadataTransientException;

/**
 * Thrown when a caller cannot obtain a provider's request slot within the configured
 * timeout, or is interrupted while waiting.
 */
public class ThrottleAcquisitionException extends MetadataTransientException {

    public ThrottleAcquisitionException(String providerId, String message) {
        super(providerId, message, (Integer) null);
    }

    public ThrottleAcquisitionException(String providerId, String message, Throwable cause) {
        super(providerId, message, cause);
    }
}
