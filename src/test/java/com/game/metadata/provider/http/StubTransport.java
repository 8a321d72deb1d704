package com.game.metadata.provider.http;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Canned transport for adapter tests. Responses are matched by a substring of the request
 * URI, first registration wins. Unmatched requests get a 404.
 */
public class StubTransport implements HttpTransport {

    private final Map<String, Function<ProviderRequest, ProviderResponse>> routes = new LinkedHashMap<>();
    private final List<ProviderRequest> requests = Collections.synchronizedList(new ArrayList<>());
    private IOException ioFailure;

    public StubTransport on(String uriFragment, int status, String body) {
        return on(uriFragment, request -> ProviderResponse.of(status, body));
    }

    public StubTransport on(String uriFragment, Function<ProviderRequest, ProviderResponse> handler) {
        routes.put(uriFragment, handler);
        return this;
    }

    public StubTransport failWith(IOException failure) {
        this.ioFailure = failure;
        return this;
    }

    public List<ProviderRequest> getRequests() {
        return List.copyOf(requests);
    }

    public ProviderRequest lastRequest() {
        return requests.get(requests.size() - 1);
    }

    public long count(String uriFragment) {
        return getRequests().stream().filter(r -> r.uri().toString().contains(uriFragment)).count();
    }

    @Override
    public ProviderResponse send(ProviderRequest request) throws IOException {
        requests.add(request);
        if (ioFailure != null) {
            throw ioFailure;
        }
        String uri = request.uri().toString();
        for (Map.Entry<String, Function<ProviderRequest, ProviderResponse>> route : routes.entrySet()) {
            if (uri.contains(route.getKey())) {
                return route.getValue().apply(request);
            }
        }
        return ProviderResponse.of(404, "");
    }
}
