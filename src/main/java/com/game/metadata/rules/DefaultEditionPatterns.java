package com.game.metadata.rules;

import java.util.ArrayList;
import java.util.List;

/**
 * Built-in edition qualifiers. Order matters: each full phrase precedes its
 * abbreviation and the more specific qualifiers precede the generic ones.
 */
public final class DefaultEditionPatterns {

    private static final String SEPARATOR = "\\s*[-–—:]\\s*";

    private DefaultEditionPatterns() {
        // Utility class
    }

    public static List<EditionPattern> getPatterns() {
        List<EditionPattern> patterns = new ArrayList<>();
        patterns.addAll(getGameOfTheYearPatterns());
        patterns.addAll(getCollectionPatterns());
        patterns.addAll(getSpecialEditionPatterns());
        patterns.addAll(getRemasterPatterns());
        return List.copyOf(patterns);
    }

    public static List<EditionPattern> getGameOfTheYearPatterns() {
        return List.of(
                pattern("goty-full", SEPARATOR + "Game of the Year Edition$", "Game of the Year Edition", 10),
                pattern("goty-abbrev", "\\s+GOTY(?:\\s+Edition)?$", "Game of the Year Edition", 11),
                pattern("goty-bare", "\\s+Game of the Year$", "Game of the Year Edition", 12)
        );
    }

    public static List<EditionPattern> getCollectionPatterns() {
        return List.of(
                pattern("gold-full", SEPARATOR + "Gold Edition$", "Gold Edition", 20),
                pattern("gold-bare", "\\s+Gold$", "Gold Edition", 21),
                pattern("complete-full", SEPARATOR + "Complete Edition$", "Complete Edition", 22),
                pattern("complete-bare", "\\s+Complete$", "Complete Edition", 23),
                pattern("definitive", SEPARATOR + "Definitive Edition$", "Definitive Edition", 24),
                pattern("ultimate", SEPARATOR + "Ultimate Edition$", "Ultimate Edition", 25),
                pattern("enhanced", SEPARATOR + "Enhanced Edition$", "Enhanced Edition", 26)
        );
    }

    public static List<EditionPattern> getSpecialEditionPatterns() {
        return List.of(
                pattern("deluxe", SEPARATOR + "Deluxe Edition$", "Deluxe Edition", 30),
                pattern("premium", SEPARATOR + "Premium Edition$", "Premium Edition", 31),
                pattern("collectors", SEPARATOR + "Collector['’]?s Edition$", "Collector's Edition", 32),
                pattern("limited", SEPARATOR + "Limited Edition$", "Limited Edition", 33),
                pattern("special", SEPARATOR + "Special Edition$", "Special Edition", 34),
                pattern("anniversary", SEPARATOR + "Anniversary Edition$", "Anniversary Edition", 35),
                pattern("directors-cut", SEPARATOR + "Director['’]?s Cut$", "Director's Cut", 36)
        );
    }

    public static List<EditionPattern> getRemasterPatterns() {
        return List.of(
                pattern("remastered", SEPARATOR + "Remastered$", "Remastered", 40),
                pattern("hd-remaster", SEPARATOR + "HD Remaster$", "HD Remaster", 41),
                pattern("remake", SEPARATOR + "Remake$", "Remake", 42),
                pattern("standard", SEPARATOR + "Standard Edition$", "Standard Edition", 43)
        );
    }

    private static EditionPattern pattern(String name, String regex, String edition, int priority) {
        return EditionPattern.builder()
                .name(name)
                .pattern(regex)
                .edition(edition)
                .priority(priority)
                .build();
    }
}
