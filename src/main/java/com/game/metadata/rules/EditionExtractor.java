package com.game.metadata.rules;

import com.game.metadata.similarity.GameNameMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Strips edition qualifiers from game titles using an ordered table of {@link EditionPattern}s.
 *
 * <p>Patterns are tried in priority order, so a full phrase ("Game of the Year Edition")
 * must carry a lower priority than its abbreviation ("GOTY"). Stripping repeats until no
 * pattern matches, which makes extraction idempotent on the returned base name; the
 * reported edition is the outermost qualifier.</p>
 */
public class EditionExtractor {
    private static final Logger log = LoggerFactory.getLogger(EditionExtractor.class);

    public static final String STANDARD_EDITION = "Standard Edition";

    private final List<EditionPattern> patterns;

    public EditionExtractor() {
        this(DefaultEditionPatterns.getPatterns());
    }

    public EditionExtractor(List<EditionPattern> patterns) {
        this.patterns = new ArrayList<>(patterns);
        this.patterns.sort(Comparator.comparingInt(EditionPattern::getPriority));
    }

    /**
     * Adds a pattern, keeping priority order. Equal priorities keep insertion order.
     */
    public void addPattern(EditionPattern pattern) {
        patterns.add(pattern);
        patterns.sort(Comparator.comparingInt(EditionPattern::getPriority));
    }

    public List<EditionPattern> getPatterns() {
        return List.copyOf(patterns);
    }

    public EditionMatch extract(String title) {
        if (title == null || title.isBlank()) {
            return new EditionMatch(title == null ? "" : title.trim(), STANDARD_EDITION);
        }

        String baseName = title.trim();
        String edition = null;
        boolean stripped = true;
        while (stripped) {
            stripped = false;
            for (EditionPattern pattern : patterns) {
                String candidate = pattern.strip(baseName);
                if (candidate != null && !candidate.isEmpty()) {
                    log.debug("Edition pattern '{}' matched '{}'", pattern.getName(), baseName);
                    if (edition == null) {
                        edition = pattern.getEdition();
                    }
                    baseName = candidate;
                    stripped = true;
                    break;
                }
            }
        }
        return new EditionMatch(baseName, edition != null ? edition : STANDARD_EDITION);
    }

    /**
     * True if both titles name the same base work, ignoring edition and search-normalization
     * differences.
     */
    public boolean sameBaseWork(String first, String second) {
        String a = GameNameMatcher.normalizeForSearch(extract(first).baseName());
        String b = GameNameMatcher.normalizeForSearch(extract(second).baseName());
        return !a.isEmpty() && a.equals(b);
    }
}
