package com.game.metadata.provider.http;

import java.io.IOException;

/**
 * Sends provider requests over the network.
 */
@FunctionalInterface
public interface HttpTransport {

    ProviderResponse send(ProviderRequest request) throws IOException, InterruptedException;
}
