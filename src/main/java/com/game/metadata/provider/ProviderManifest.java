package com.game.metadata.provider;

import java.util.Objects;

/**
 * Static identity of a metadata provider.
 *
 * @param id             stable identifier, e.g. {@code "steam"}
 * @param name           display name used in provenance messages
 * @param description    short human-readable description
 * @param version        adapter version
 * @param requiresApiKey whether the provider needs a credential to return anything
 * @param gameUrlPattern deep-link template; {@code {id}} is replaced by the external id
 * @param domain         the kind of titles this provider describes
 */
public record ProviderManifest(String id, String name, String description, String version,
                               boolean requiresApiKey, String gameUrlPattern, TitleDomain domain) {

    public ProviderManifest {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(gameUrlPattern, "gameUrlPattern is required");
        Objects.requireNonNull(domain, "domain is required");
        if (id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
    }

    public String gameUrl(String externalId) {
        return gameUrlPattern.replace("{id}", externalId);
    }
}
