package com.game.metadata.platform;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * A user's canonical platform. Names are unique per owner, case-insensitively.
 *
 * @param id          platform id
 * @param ownerId     the user who owns the platform
 * @param name        canonical display name
 * @param description optional description
 * @param isDefault   true for the system-seeded platforms
 * @param aliases     comma-joined alternative names, or null when there are none
 */
public record Platform(String id, String ownerId, String name, String description, boolean isDefault,
                       String aliases) {

    public Platform {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(ownerId, "ownerId is required");
        Objects.requireNonNull(name, "name is required");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Platform name is required");
        }
    }

    public static Platform create(String ownerId, String name, String description, boolean isDefault,
                                  String aliases) {
        return new Platform(UUID.randomUUID().toString(), ownerId, name, description, isDefault, aliases);
    }

    public List<String> aliasList() {
        return splitAliases(aliases);
    }

    public boolean hasName(String candidate) {
        return candidate != null && name.equalsIgnoreCase(candidate.trim());
    }

    public boolean hasAlias(String candidate) {
        if (candidate == null) {
            return false;
        }
        String trimmed = candidate.trim();
        return aliasList().stream().anyMatch(a -> a.equalsIgnoreCase(trimmed));
    }

    public Platform withName(String newName, String newDescription) {
        return new Platform(id, ownerId, newName, newDescription, isDefault, aliases);
    }

    public Platform withAliases(String newAliases) {
        return new Platform(id, ownerId, name, description, isDefault, newAliases);
    }

    /**
     * Splits a comma-joined alias list: entries are trimmed, blanks dropped and
     * case-insensitive duplicates removed, keeping the first spelling.
     */
    public static List<String> splitAliases(String aliases) {
        if (aliases == null || aliases.isBlank()) {
            return List.of();
        }
        return dedupe(Arrays.asList(aliases.split(",")));
    }

    /**
     * Joins aliases back into the stored form, or null when nothing remains.
     */
    public static String joinAliases(List<String> aliases) {
        List<String> unique = dedupe(aliases);
        return unique.isEmpty() ? null : String.join(",", unique);
    }

    private static List<String> dedupe(List<String> values) {
        Set<String> seen = new LinkedHashSet<>();
        List<String> result = new ArrayList<>();
        for (String value : values) {
            if (value == null) {
                continue;
            }
            String trimmed = value.trim();
            if (!trimmed.isEmpty() && seen.add(trimmed.toLowerCase(Locale.ROOT))) {
                result.add(trimmed);
            }
        }
        return result;
    }

    @Override
    public String toString() {
        return "Platform{id='" + id + "', name='" + name + "', isDefault=" + isDefault
                + ", aliases=" + String.join("|", aliasList()) + "}";
    }
}
