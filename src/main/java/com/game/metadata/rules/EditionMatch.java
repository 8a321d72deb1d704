package com.game.metadata.rules;

/**
 * Result of edition extraction.
 *
 * @param baseName the title without its edition qualifier
 * @param edition  canonical edition label, "Standard Edition" when none was found
 */
public record EditionMatch(String baseName, String edition) {

    public boolean isStandard() {
        return EditionExtractor.STANDARD_EDITION.equals(edition);
    }
}
