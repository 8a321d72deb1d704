package com.game.metadata.rules;

import com.game.metadata.similarity.GameNameMatcher;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Scores and orders search candidates by how well their name matches a query.
 *
 * <p>Exact names outrank prefix or expansion matches, which outrank substring matches.
 * Descriptions with non-game indicators are penalized and game vocabulary is boosted.
 * Shorter names win ties. Candidates scoring below the floor are dropped even when
 * nothing better exists.</p>
 */
public class SearchRanker {

    public static final int EXACT_SCORE = 100;
    public static final int PREFIX_SCORE = 60;
    public static final int SUBSTRING_SCORE = 30;
    public static final int NON_GAME_PENALTY = 70;
    public static final int GAME_TERM_BOOST = 25;
    public static final int DEFAULT_MIN_SCORE = 40;

    private final List<String> nonGameIndicators;
    private final List<String> gameTerms;
    private final int minScore;

    public SearchRanker() {
        this(SearchRankingRules.getNonGameIndicators(), SearchRankingRules.getGameTerms(), DEFAULT_MIN_SCORE);
    }

    public SearchRanker(List<String> nonGameIndicators, List<String> gameTerms, int minScore) {
        this.nonGameIndicators = List.copyOf(nonGameIndicators);
        this.gameTerms = List.copyOf(gameTerms);
        this.minScore = minScore;
    }

    /**
     * A candidate to rank. The description may be null.
     */
    public record Candidate<T>(T item, String name, String description) {
        public Candidate {
            Objects.requireNonNull(name, "name is required");
        }
    }

    public record Ranked<T>(T item, String name, int score) {}

    public int score(String query, String name, String description) {
        String q = GameNameMatcher.normalizeForSearch(query);
        String n = GameNameMatcher.normalizeForSearch(name);
        if (q.isEmpty() || n.isEmpty()) {
            return 0;
        }

        int score;
        if (n.equals(q)) {
            score = EXACT_SCORE;
        } else if (n.startsWith(q + " ") || q.startsWith(n + " ")) {
            score = PREFIX_SCORE;
        } else if (n.contains(q)) {
            score = SUBSTRING_SCORE;
        } else {
            score = 0;
        }

        if (SearchRankingRules.containsAny(description, nonGameIndicators)) {
            score -= NON_GAME_PENALTY;
        }
        if (SearchRankingRules.containsAny(description, gameTerms)) {
            score += GAME_TERM_BOOST;
        }
        return score;
    }

    /**
     * Returns the candidates that reach the score floor, best first.
     */
    public <T> List<Ranked<T>> rank(String query, List<Candidate<T>> candidates) {
        List<Ranked<T>> ranked = new ArrayList<>();
        for (Candidate<T> candidate : candidates) {
            int score = score(query, candidate.name(), candidate.description());
            if (score >= minScore) {
                ranked.add(new Ranked<>(candidate.item(), candidate.name(), score));
            }
        }
        ranked.sort(Comparator.comparingInt((Ranked<T> r) -> r.score()).reversed()
                .thenComparingInt(r -> r.name().length()));
        return ranked;
    }
}
