package com.game.metadata.platform;

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Built-in table of manufacturer and shorthand platform names. Keys are lower case.
 * A bare "PlayStation" is its own platform and never maps to a numbered console.
 */
public final class DefaultPlatformAliases {

    private static final Map<String, String> ALIASES;

    static {
        Map<String, String> m = new HashMap<>();
        add(m, "PlayStation 5", "playstation 5", "playstation5", "ps5", "ps 5", "sony playstation 5", "sony ps5");
        add(m, "PlayStation 4", "playstation 4", "playstation4", "ps4", "ps 4", "sony playstation 4", "sony ps4",
                "ps4 pro");
        add(m, "PlayStation 3", "playstation 3", "playstation3", "ps3", "ps 3", "sony playstation 3");
        add(m, "PlayStation 2", "playstation 2", "playstation2", "ps2", "ps 2", "sony playstation 2");
        add(m, "PlayStation", "playstation", "ps1", "psx", "psone", "ps one", "playstation 1", "sony playstation");
        add(m, "PlayStation Vita", "playstation vita", "psvita", "ps vita", "vita");
        add(m, "PlayStation Portable", "playstation portable", "psp");
        add(m, "Xbox Series X|S", "xbox series x|s", "xbox series x/s", "xbox series x", "xbox series s",
                "xbox series", "xsx", "xss");
        add(m, "Xbox One", "xbox one", "xbone", "xb1", "xbox one x", "xbox one s");
        add(m, "Xbox 360", "xbox 360", "x360", "xb360");
        add(m, "Xbox", "xbox", "original xbox");
        add(m, "Nintendo Switch", "nintendo switch", "switch", "ns", "switch lite", "switch oled",
                "nintendo switch lite", "nintendo switch oled");
        add(m, "Nintendo 3DS", "nintendo 3ds", "3ds", "new 3ds", "new nintendo 3ds", "2ds", "new 2ds",
                "nintendo 2ds");
        add(m, "Nintendo DS", "nintendo ds", "nds", "ds", "ds lite", "dsi");
        add(m, "Nintendo Wii U", "nintendo wii u", "wii u", "wiiu");
        add(m, "Nintendo Wii", "nintendo wii", "wii");
        add(m, "Nintendo GameCube", "nintendo gamecube", "gamecube", "gc", "ngc");
        add(m, "Nintendo 64", "nintendo 64", "n64");
        add(m, "Super Nintendo", "super nintendo", "snes", "super nes", "super famicom");
        add(m, "Nintendo Entertainment System", "nintendo entertainment system", "nes", "famicom");
        add(m, "Game Boy Advance", "game boy advance", "gameboy advance", "gba");
        add(m, "Game Boy", "game boy", "gameboy", "gb", "game boy color", "gbc");
        add(m, "PC", "pc", "windows", "windows pc", "win", "mac", "macos", "mac os", "osx", "os x", "linux",
                "computer", "steamos");
        add(m, "Mobile", "mobile", "ios", "android", "iphone", "ipad", "phone", "tablet");
        add(m, "Physical Only", "physical only", "physical", "tabletop");
        ALIASES = Collections.unmodifiableMap(m);
    }

    private DefaultPlatformAliases() {
        // Utility class
    }

    private static void add(Map<String, String> table, String canonical, String... aliases) {
        for (String alias : aliases) {
            String previous = table.put(alias, canonical);
            if (previous != null && !previous.equals(canonical)) {
                throw new IllegalStateException("Alias '" + alias + "' maps to both " + previous + " and " + canonical);
            }
        }
    }

    /**
     * Looks up a canonical name; the input is trimmed and compared case-insensitively.
     */
    public static Optional<String> lookup(String rawName) {
        if (rawName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(ALIASES.get(rawName.trim().toLowerCase(Locale.ROOT)));
    }

    public static Map<String, String> asMap() {
        return ALIASES;
    }
}
