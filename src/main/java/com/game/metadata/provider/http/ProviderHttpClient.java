package com.game.metadata.provider.http;

import com.game.metadata.provider.MetadataProviderException;
import com.game.metadata.provider.MetadataRateLimitException;
import com.game.metadata.provider.MetadataTransientException;
import com.game.metadata.ratelimit.RequestThrottle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Optional;

/**
 * One provider's view of the network: every request passes through the provider's
 * {@link RequestThrottle}, and response statuses are mapped onto the shared error taxonomy.
 */
public class ProviderHttpClient {
    private static final Logger log = LoggerFactory.getLogger(ProviderHttpClient.class);

    private final String providerId;
    private final HttpTransport transport;
    private final RequestThrottle throttle;

    public ProviderHttpClient(String providerId, HttpTransport transport, RequestThrottle throttle) {
        this.providerId = providerId;
        this.transport = transport;
        this.throttle = throttle;
    }

    /**
     * Sends the request and returns the raw response whatever its status.
     *
     * @throws MetadataTransientException on I/O failure or interruption
     */
    public ProviderResponse send(ProviderRequest request) {
        return throttle.execute(() -> {
            log.debug("provider.request provider={} method={} uri={}", providerId, request.method(), request.uri());
            try {
                return transport.send(request);
            } catch (IOException e) {
                throw new MetadataTransientException(providerId, "Request to " + request.uri().getHost()
                        + " failed: " + e.getMessage(), e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new MetadataTransientException(providerId, "Interrupted during request", e);
            }
        });
    }

    /**
     * Sends the request and returns the body of a successful response.
     * A 404 is a permanent miss and yields an empty result.
     *
     * @throws MetadataRateLimitException on 429
     * @throws MetadataTransientException on 5xx or I/O failure
     * @throws MetadataProviderException  on any other unsuccessful status
     */
    public Optional<String> fetchBody(ProviderRequest request) {
        ProviderResponse response = send(request);
        if (response.isSuccess()) {
            return Optional.of(response.body());
        }
        if (response.statusCode() == 404) {
            return Optional.empty();
        }
        throw failure(response);
    }

    /**
     * Maps an unsuccessful response onto the error taxonomy.
     */
    public MetadataProviderException failure(ProviderResponse response) {
        int status = response.statusCode();
        if (status == 429) {
            return new MetadataRateLimitException(providerId, retryAfterMs(response));
        }
        if (status >= 500) {
            return new MetadataTransientException(providerId, "Server error " + status, status);
        }
        return new MetadataProviderException(providerId, "Unexpected status " + status, status);
    }

    public String getProviderId() {
        return providerId;
    }

    public RequestThrottle getThrottle() {
        return throttle;
    }

    private static Long retryAfterMs(ProviderResponse response) {
        return response.header("Retry-After")
                .map(String::trim)
                .filter(v -> v.matches("\\d+"))
                .map(v -> Long.parseLong(v) * 1000L)
                .orElse(null);
    }
}
