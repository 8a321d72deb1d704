package com.game.metadata.provider;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Immutable set of {@link ProviderCapability} flags.
 */
public final class ProviderCapabilities {

    private final Set<ProviderCapability> flags;

    private ProviderCapabilities(Set<ProviderCapability> flags) {
        this.flags = Collections.unmodifiableSet(flags);
    }

    public static ProviderCapabilities of(ProviderCapability... capabilities) {
        EnumSet<ProviderCapability> set = EnumSet.noneOf(ProviderCapability.class);
        Collections.addAll(set, capabilities);
        return new ProviderCapabilities(set);
    }

    public static ProviderCapabilities none() {
        return new ProviderCapabilities(EnumSet.noneOf(ProviderCapability.class));
    }

    public boolean has(ProviderCapability capability) {
        return flags.contains(capability);
    }

    public Set<ProviderCapability> asSet() {
        return flags;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ProviderCapabilities that)) return false;
        return flags.equals(that.flags);
    }

    @Override
    public int hashCode() {
        return flags.hashCode();
    }

    @Override
    public String toString() {
        return "ProviderCapabilities" + flags;
    }
}
