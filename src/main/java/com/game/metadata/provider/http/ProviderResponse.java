package com.game.metadata.provider.http;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A response received from a metadata source.
 */
public record ProviderResponse(int statusCode, String body, Map<String, List<String>> headers) {

    public ProviderResponse {
        body = body == null ? "" : body;
        headers = headers == null ? Map.of() : headers;
    }

    public static ProviderResponse of(int statusCode, String body) {
        return new ProviderResponse(statusCode, body, Map.of());
    }

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }

    public Optional<String> header(String name) {
        return headers.entrySet().stream()
                .filter(e -> e.getKey() != null && e.getKey().equalsIgnoreCase(name))
                .flatMap(e -> e.getValue().stream())
                .findFirst();
    }
}
