package com.game.metadata.provider.http;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * {@link HttpTransport} backed by the JDK {@link HttpClient}.
 */
public class JdkHttpTransport implements HttpTransport {

    private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);

    private final HttpClient httpClient;

    public JdkHttpTransport() {
        this(DEFAULT_CONNECT_TIMEOUT);
    }

    public JdkHttpTransport(Duration connectTimeout) {
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Override
    public ProviderResponse send(ProviderRequest request) throws IOException, InterruptedException {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(request.uri())
                .timeout(request.timeout());
        request.headers().forEach(builder::header);

        if ("POST".equalsIgnoreCase(request.method())) {
            builder.POST(HttpRequest.BodyPublishers.ofString(request.body() == null ? "" : request.body()));
        } else {
            builder.GET();
        }

        HttpResponse<String> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        return new ProviderResponse(response.statusCode(), response.body(), response.headers().map());
    }
}
