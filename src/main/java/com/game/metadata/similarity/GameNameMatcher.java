package com.game.metadata.similarity;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Fuzzy matching of game titles.
 *
 * <p>Titles are compared on a search-normalized form: lower case, no trademark
 * symbols, apostrophes or punctuation, dashes as spaces, {@code &} spelled "and",
 * single spaces. This lets "Assassins Creed" find "Assassin's Creed" and
 * "Ratchet and Clank" find "Ratchet &amp; Clank".</p>
 */
public final class GameNameMatcher {

    /** Default minimum score for {@link #fuzzySearch(List, String, Function)}. */
    public static final double DEFAULT_MIN_SCORE = 0.3;

    private static final Pattern TRADEMARKS = Pattern.compile("[™®©]");
    private static final Pattern APOSTROPHES = Pattern.compile("['‘’`´]");
    private static final Pattern PUNCTUATION = Pattern.compile("[.,:;!?]");
    private static final Pattern DASHES = Pattern.compile("[-–—]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final SimilarityAlgorithm EDIT_DISTANCE = new LevenshteinSimilarity();

    private GameNameMatcher() {
        // Utility class
    }

    /**
     * Reduces a title to its search-normalized form.
     */
    public static String normalizeForSearch(String name) {
        if (name == null) {
            return "";
        }
        String result = name.toLowerCase(Locale.ROOT);
        result = TRADEMARKS.matcher(result).replaceAll("");
        result = APOSTROPHES.matcher(result).replaceAll("");
        result = PUNCTUATION.matcher(result).replaceAll("");
        result = DASHES.matcher(result).replaceAll(" ");
        result = result.replace("&", "and");
        return WHITESPACE.matcher(result).replaceAll(" ").trim();
    }

    /**
     * Edit-distance similarity of the normalized forms. Always 1.0 for equal inputs,
     * including two empty strings.
     */
    public static double similarity(String first, String second) {
        return EDIT_DISTANCE.compute(normalizeForSearch(first), normalizeForSearch(second));
    }

    /**
     * True if the normalized target contains the normalized query, or if every query
     * word is a substring or superstring of some target word.
     */
    public static boolean fuzzyMatch(String query, String target) {
        String normalizedQuery = normalizeForSearch(query);
        String normalizedTarget = normalizeForSearch(target);

        if (normalizedTarget.contains(normalizedQuery)) {
            return true;
        }

        List<String> targetWords = Arrays.asList(normalizedTarget.split(" "));
        return Arrays.stream(normalizedQuery.split(" "))
                .filter(word -> !word.isEmpty())
                .allMatch(word -> targetWords.stream()
                        .anyMatch(tw -> tw.contains(word) || word.contains(tw)));
    }

    /**
     * Relevance of {@code target} for the search {@code query}, between 0 and 1.
     * Exact matches score 1, prefix matches at least 0.9, word-boundary prefixes 0.85,
     * contained matches 0.6 to 0.8. Plain edit-distance similarity is capped at 0.5 so
     * it never outranks a structural match.
     */
    public static double relevance(String query, String target) {
        String a = normalizeForSearch(query);
        String b = normalizeForSearch(target);

        if (a.equals(b)) {
            return 1.0;
        }
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }

        double coverage = (double) a.length() / b.length();
        double score = 0.0;
        if (b.startsWith(a)) {
            score = Math.max(score, 0.9 + coverage * 0.1);
            if (b.length() > a.length() && b.charAt(a.length()) == ' ') {
                score = Math.max(score, 0.85);
            }
        }
        if (b.contains(a)) {
            score = Math.max(score, 0.6 + coverage * 0.2);
        }
        return Math.max(score, Math.min(EDIT_DISTANCE.compute(a, b), 0.5));
    }

    /**
     * Filters and orders items by relevance to the search, using {@link #DEFAULT_MIN_SCORE}.
     */
    public static <T> List<T> fuzzySearch(List<T> items, String search, Function<T, String> nameOf) {
        return fuzzySearch(items, search, nameOf, DEFAULT_MIN_SCORE);
    }

    /**
     * Keeps items whose relevance reaches {@code minScore} or that fuzzy-match the search,
     * most relevant first. A blank search returns every item in its original order.
     */
    public static <T> List<T> fuzzySearch(List<T> items, String search, Function<T, String> nameOf,
                                          double minScore) {
        Objects.requireNonNull(items, "items is required");
        if (search == null || search.isBlank()) {
            return List.copyOf(items);
        }

        List<Scored<T>> scored = new ArrayList<>();
        for (T item : items) {
            String name = nameOf.apply(item);
            double score = relevance(search, name);
            if (score >= minScore || fuzzyMatch(search, name)) {
                scored.add(new Scored<>(item, score));
            }
        }
        scored.sort(Comparator.comparingDouble((Scored<T> s) -> s.score).reversed());
        return scored.stream().map(Scored::item).toList();
    }

    private record Scored<T>(T item, double score) {}
}
