package com.game.metadata.rules;

import java.util.List;
import java.util.Locale;

/**
 * Phrase tables used to rank search candidates from sources whose own search is unreliable.
 * Phrases are matched as lower-case substrings of a candidate's description.
 */
public final class SearchRankingRules {

    private SearchRankingRules() {
        // Utility class
    }

    /**
     * Descriptions containing one of these are almost never games.
     */
    public static List<String> getNonGameIndicators() {
        return List.of(
                "city in",
                "town in",
                "village in",
                "commune in",
                "municipality in",
                "river in",
                "mountain in",
                "film by",
                "film directed by",
                "television series",
                "tv series",
                "album by",
                "song by",
                "novel by",
                "book by",
                "species of",
                "genus of",
                "family name",
                "given name",
                "disambiguation page",
                "wikimedia"
        );
    }

    /**
     * Game-domain vocabulary that raises a candidate's score.
     */
    public static List<String> getGameTerms() {
        return List.of(
                "board game",
                "card game",
                "tabletop game",
                "dice game",
                "tile game",
                "role-playing game",
                "party game",
                "strategy game",
                "wargame",
                "expansion",
                "video game"
        );
    }

    /**
     * Descriptions a knowledge-graph entity must mention to count as a tabletop title.
     */
    public static List<String> getTabletopDescriptionTerms() {
        return List.of(
                "board game",
                "card game",
                "tabletop game",
                "dice game",
                "tile game"
        );
    }

    public static boolean containsAny(String description, List<String> phrases) {
        if (description == null || description.isBlank()) {
            return false;
        }
        String lower = description.toLowerCase(Locale.ROOT);
        return phrases.stream().anyMatch(lower::contains);
    }
}
