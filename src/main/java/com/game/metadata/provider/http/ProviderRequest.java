package com.game.metadata.provider.http;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * An outbound request to a metadata source.
 *
 * @param method  {@code GET} or {@code POST}
 * @param uri     target URI
 * @param headers request headers
 * @param body    request body for POST, null for GET
 * @param timeout per-request timeout
 */
public record ProviderRequest(String method, URI uri, Map<String, String> headers, String body,
                              Duration timeout) {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);
    public static final String USER_AGENT = "GameMetadataEngine/1.0";

    public ProviderRequest {
        Objects.requireNonNull(method, "method is required");
        Objects.requireNonNull(uri, "uri is required");
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        timeout = timeout == null ? DEFAULT_TIMEOUT : timeout;
    }

    public static ProviderRequest get(String url) {
        return new ProviderRequest("GET", URI.create(url), Map.of("User-Agent", USER_AGENT), null, null);
    }

    public static ProviderRequest post(String url, String contentType, String body) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("User-Agent", USER_AGENT);
        headers.put("Content-Type", contentType);
        return new ProviderRequest("POST", URI.create(url), headers, body, null);
    }

    public ProviderRequest withHeader(String name, String value) {
        Map<String, String> copy = new LinkedHashMap<>(headers);
        copy.put(name, value);
        return new ProviderRequest(method, uri, copy, body, timeout);
    }

    /**
     * Builds a URL with form-encoded query parameters, keeping parameter order.
     */
    public static String url(String base, Map<String, String> params) {
        if (params.isEmpty()) {
            return base;
        }
        return base + "?" + formEncode(params);
    }

    public static String formEncode(Map<String, String> params) {
        return params.entrySet().stream()
                .map(e -> encode(e.getKey()) + "=" + encode(e.getValue()))
                .collect(Collectors.joining("&"));
    }

    public static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
