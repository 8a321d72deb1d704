package com.game.metadata.registry;

import com.game.metadata.provider.MetadataProvider;
import com.game.metadata.provider.ProviderCapability;
import com.game.metadata.provider.ProviderManifest;
import com.game.metadata.provider.TitleDomain;
import com.game.metadata.title.TitleType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * The set of metadata providers known to the engine, fixed at construction.
 *
 * <p>Registration order is fallback order: every list returned here keeps it.
 * Providers are selected by title domain and by capability, never by id.</p>
 */
public class ProviderRegistry {
    private static final Logger log = LoggerFactory.getLogger(ProviderRegistry.class);

    private final Map<String, MetadataProvider> providers;

    private ProviderRegistry(Builder builder) {
        this.providers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.providers));
        log.info("Provider registry initialized: providers={}", providers.keySet());
    }

    public Optional<MetadataProvider> getById(String providerId) {
        return Optional.ofNullable(providers.get(providerId));
    }

    public List<MetadataProvider> getAll() {
        return List.copyOf(providers.values());
    }

    public List<ProviderManifest> getManifests() {
        return providers.values().stream()
                .map(MetadataProvider::getManifest)
                .collect(Collectors.toUnmodifiableList());
    }

    /**
     * Providers able to describe titles of the given type, in fallback order.
     */
    public List<MetadataProvider> getByTitleType(TitleType titleType) {
        TitleDomain domain = (titleType == null ? TitleType.VIDEO_GAME : titleType).getDomain();
        return providers.values().stream()
                .filter(p -> p.getManifest().domain() == domain)
                .collect(Collectors.toUnmodifiableList());
    }

    /**
     * Providers declaring the capability, in registration order.
     */
    public List<MetadataProvider> getAllByCapability(ProviderCapability capability) {
        return providers.values().stream()
                .filter(p -> p.getCapabilities().has(capability))
                .collect(Collectors.toUnmodifiableList());
    }

    public int size() {
        return providers.size();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<String, MetadataProvider> providers = new LinkedHashMap<>();

        /**
         * Adds a provider after those already registered.
         *
         * @throws IllegalArgumentException if a provider with the same id is already registered
         */
        public Builder register(MetadataProvider provider) {
            Objects.requireNonNull(provider, "provider is required");
            String id = provider.getManifest().id();
            if (providers.containsKey(id)) {
                throw new IllegalArgumentException("Provider already registered: " + id);
            }
            providers.put(id, provider);
            return this;
        }

        public Builder registerAll(List<? extends MetadataProvider> all) {
            all.forEach(this::register);
            return this;
        }

        public ProviderRegistry build() {
            return new ProviderRegistry(this);
        }
    }
}
