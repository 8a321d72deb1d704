package com.game.metadata.rules;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A trailing edition qualifier on a game title, such as "- Deluxe Edition" or " GOTY".
 * Patterns are matched case-insensitively and must be anchored at the end of the title.
 * Lower priority values are tried first.
 */
public class EditionPattern {
    private final String name;
    private final Pattern pattern;
    private final String edition;
    private final int priority;

    private EditionPattern(Builder builder) {
        this.name = builder.name;
        this.pattern = Pattern.compile(builder.pattern, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
        this.edition = builder.edition;
        this.priority = builder.priority;
    }

    public String getName() {
        return name;
    }

    public Pattern getPattern() {
        return pattern;
    }

    /**
     * Canonical edition label reported when this pattern matches.
     */
    public String getEdition() {
        return edition;
    }

    public int getPriority() {
        return priority;
    }

    /**
     * Returns the title with this qualifier removed, or {@code null} if it does not match.
     */
    public String strip(String title) {
        if (title == null) {
            return null;
        }
        Matcher matcher = pattern.matcher(title);
        if (!matcher.find()) {
            return null;
        }
        return (title.substring(0, matcher.start()) + title.substring(matcher.end())).trim();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EditionPattern that = (EditionPattern) o;
        return Objects.equals(name, that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name);
    }

    @Override
    public String toString() {
        return "EditionPattern{" +
                "name='" + name + '\'' +
                ", edition='" + edition + '\'' +
                ", priority=" + priority +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private String pattern;
        private String edition;
        private int priority = 100;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder pattern(String pattern) {
            this.pattern = pattern;
            return this;
        }

        public Builder edition(String edition) {
            this.edition = edition;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public EditionPattern build() {
            Objects.requireNonNull(name, "name is required");
            Objects.requireNonNull(pattern, "pattern is required");
            Objects.requireNonNull(edition, "edition is required");
            if (!pattern.endsWith("$")) {
                throw new IllegalArgumentException("Edition pattern '" + name + "' must be anchored with $");
            }
            return new EditionPattern(this);
        }
    }
}
