package com.game.metadata.provider.igdb;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.game.metadata.provider.MetadataProviderException;
import com.game.metadata.provider.http.JsonPayloads;
import com.game.metadata.provider.http.ProviderHttpClient;
import com.game.metadata.provider.http.ProviderRequest;
import com.game.metadata.provider.http.ProviderResponse;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Obtains Twitch app access tokens for the IGDB API through the client-credentials grant.
 * Tokens are cached per client id until ten minutes before they expire.
 */
public class TwitchTokenProvider {
    private static final Logger log = LoggerFactory.getLogger(TwitchTokenProvider.class);

    static final String TOKEN_URL = "https://id.twitch.tv/oauth2/token";
    static final long EXPIRY_MARGIN_SECONDS = 600;

    private final ProviderHttpClient http;
    private final ObjectMapper mapper;
    private final Cache<String, AccessToken> tokens;

    public TwitchTokenProvider(ProviderHttpClient http, ObjectMapper mapper) {
        this.http = http;
        this.mapper = mapper;
        this.tokens = Caffeine.newBuilder()
                .maximumSize(16)
                .expireAfter(new Expiry<String, AccessToken>() {
                    @Override
                    public long expireAfterCreate(String key, AccessToken token, long currentTime) {
                        return token.lifetime().toNanos();
                    }

                    @Override
                    public long expireAfterUpdate(String key, AccessToken token, long currentTime,
                                                  long currentDuration) {
                        return token.lifetime().toNanos();
                    }

                    @Override
                    public long expireAfterRead(String key, AccessToken token, long currentTime,
                                                long currentDuration) {
                        return currentDuration;
                    }
                })
                .build();
    }

    /**
     * Returns a valid bearer token, requesting a new one when none is cached.
     *
     * @throws MetadataProviderException if Twitch rejects the credentials or answers malformed JSON
     */
    public String getToken(String clientId, String clientSecret) {
        return tokens.get(clientId, id -> requestToken(id, clientSecret)).value();
    }

    public void invalidate(String clientId) {
        tokens.invalidate(clientId);
    }

    private AccessToken requestToken(String clientId, String clientSecret) {
        Map<String, String> form = new LinkedHashMap<>();
        form.put("client_id", clientId);
        form.put("client_secret", clientSecret);
        form.put("grant_type", "client_credentials");

        ProviderResponse response = http.send(ProviderRequest.post(TOKEN_URL,
                "application/x-www-form-urlencoded", ProviderRequest.formEncode(form)));
        if (!response.isSuccess()) {
            log.error("igdb.token.failed status={}", response.statusCode());
            throw http.failure(response);
        }

        JsonNode body = JsonPayloads.parse(mapper, http.getProviderId(), response.body());
        String token = JsonPayloads.text(body, "access_token");
        if (token == null) {
            throw new MetadataProviderException(http.getProviderId(), "Token response without access_token");
        }
        Integer expiresIn = JsonPayloads.integer(body, "expires_in");
        long lifetime = Math.max(0, (expiresIn == null ? 0 : expiresIn) - EXPIRY_MARGIN_SECONDS);
        log.info("igdb.token.issued lifetimeSeconds={}", lifetime);
        return new AccessToken(token, Duration.ofSeconds(lifetime));
    }

    record AccessToken(String value, Duration lifetime) {}
}
