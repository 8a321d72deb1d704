package com.game.metadata.platform;

import java.util.List;

/**
 * Platforms seeded for every user.
 */
public final class DefaultPlatforms {

    public record Definition(String name, String description, String aliases) {
    }

    public static final List<Definition> ALL = List.of(
            new Definition("PC", "Windows/Mac/Linux", null),
            new Definition("PlayStation 5", "Sony PlayStation 5", null),
            new Definition("PlayStation 4", "Sony PlayStation 4", null),
            new Definition("Xbox Series X|S", "Microsoft Xbox Series X|S", null),
            new Definition("Xbox One", "Microsoft Xbox One", null),
            new Definition("Nintendo Switch", "Nintendo Switch/Switch Lite/Switch OLED", "Switch Lite,Switch OLED"),
            new Definition("Mobile", "iOS/Android", "iOS,Android"),
            new Definition("Physical Only", "Board games, card games, etc.", null)
    );

    private DefaultPlatforms() {
        // Utility class
    }
}
