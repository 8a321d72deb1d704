package com.game.metadata.provider.http;

import com.game.metadata.provider.MetadataProviderException;
import com.game.metadata.provider.MetadataRateLimitException;
import com.game.metadata.provider.MetadataTransientException;
import com.game.metadata.ratelimit.RequestThrottle;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ProviderHttpClient Tests")
class ProviderHttpClientTest {

    private static final String URL = "https://api.example.com/games";

    private ProviderHttpClient client(StubTransport transport) {
        return new ProviderHttpClient("example", transport, new RequestThrottle("example", 0));
    }

    @Test
    @DisplayName("Returns the body of a successful response")
    void success() {
        StubTransport transport = new StubTransport().on("/games", 200, "{\"ok\":true}");
        assertEquals("{\"ok\":true}", client(transport).fetchBody(ProviderRequest.get(URL)).orElseThrow());
    }

    @Test
    @DisplayName("A 404 is a permanent miss")
    void notFound() {
        assertTrue(client(new StubTransport()).fetchBody(ProviderRequest.get(URL)).isEmpty());
    }

    @Test
    @DisplayName("A 429 becomes a rate limit failure carrying Retry-After")
    void rateLimited() {
        StubTransport transport = new StubTransport().on("/games",
                r -> new ProviderResponse(429, "", Map.of("retry-after", List.of("7"))));

        MetadataRateLimitException e = assertThrows(MetadataRateLimitException.class,
                () -> client(transport).fetchBody(ProviderRequest.get(URL)));
        assertEquals(7000L, e.getRetryAfterMs());
        assertTrue(e.isTransient());
        assertEquals("example", e.getProviderId());
    }

    @Test
    @DisplayName("A 5xx is transient")
    void serverError() {
        StubTransport transport = new StubTransport().on("/games", 503, "unavailable");
        MetadataTransientException e = assertThrows(MetadataTransientException.class,
                () -> client(transport).fetchBody(ProviderRequest.get(URL)));
        assertEquals(503, e.getStatusCode());
    }

    @Test
    @DisplayName("Any other status is permanent")
    void clientError() {
        StubTransport transport = new StubTransport().on("/games", 403, "forbidden");
        MetadataProviderException e = assertThrows(MetadataProviderException.class,
                () -> client(transport).fetchBody(ProviderRequest.get(URL)));
        assertFalse(e.isTransient());
        assertEquals(403, e.getStatusCode());
    }

    @Test
    @DisplayName("I/O failures are transient")
    void ioFailure() {
        StubTransport transport = new StubTransport().failWith(new IOException("connection reset"));
        MetadataTransientException e = assertThrows(MetadataTransientException.class,
                () -> client(transport).fetchBody(ProviderRequest.get(URL)));
        assertInstanceOf(IOException.class, e.getCause());
    }

    @Test
    @DisplayName("Query parameters are form-encoded in order")
    void urlEncoding() {
        Map<String, String> params = new java.util.LinkedHashMap<>();
        params.put("search", "Tom Clancy's The Division");
        params.put("page", "1");
        assertEquals("https://x.test/s?search=Tom+Clancy%27s+The+Division&page=1",
                ProviderRequest.url("https://x.test/s", params));
    }
}
