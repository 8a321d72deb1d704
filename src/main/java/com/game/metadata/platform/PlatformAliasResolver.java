package com.game.metadata.platform;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Maps free-text platform names to one canonical name per user.
 *
 * <p>Resolution order:</p>
 * <ol>
 *   <li>an existing platform whose own name equals the input, so a user-created platform
 *   is never remapped by an alias;</li>
 *   <li>an existing platform listing the input among its aliases;</li>
 *   <li>the built-in {@link DefaultPlatformAliases} table.</li>
 * </ol>
 * All comparisons are case-insensitive on the trimmed input. Unmatched input is returned
 * trimmed but otherwise unchanged.
 */
public class PlatformAliasResolver {
    private static final Logger log = LoggerFactory.getLogger(PlatformAliasResolver.class);

    private final PlatformRepository platformRepository;

    public PlatformAliasResolver(PlatformRepository platformRepository) {
        this.platformRepository = platformRepository;
    }

    public String resolve(String ownerId, String rawName) {
        if (rawName == null) {
            return "";
        }
        String trimmed = rawName.trim();
        if (trimmed.isEmpty()) {
            return trimmed;
        }

        List<Platform> platforms = platformRepository.findByOwner(ownerId);
        for (Platform platform : platforms) {
            if (platform.hasName(trimmed)) {
                return platform.name();
            }
        }
        for (Platform platform : platforms) {
            if (platform.hasAlias(trimmed)) {
                log.debug("platform.alias.user input='{}' platform='{}'", trimmed, platform.name());
                return platform.name();
            }
        }
        return normalizePlatformName(trimmed);
    }

    /**
     * Finds the owner's platform the name resolves to, if it exists.
     */
    public Optional<Platform> resolvePlatform(String ownerId, String rawName) {
        String resolved = resolve(ownerId, rawName);
        if (resolved.isEmpty()) {
            return Optional.empty();
        }
        return platformRepository.findByName(ownerId, resolved);
    }

    /**
     * Resolves against the built-in table only.
     */
    public static String normalizePlatformName(String rawName) {
        if (rawName == null) {
            return "";
        }
        String trimmed = rawName.trim();
        return DefaultPlatformAliases.lookup(trimmed).orElse(trimmed);
    }
}
