package com.game.metadata.provider;

/**
 * The family of titles a provider can describe. Registry routing uses it to keep
 * video-game and tabletop fallback chains disjoint.
 */
public enum TitleDomain {
    VIDEO_GAME("Video game"),
    TABLETOP("Tabletop");

    private final String label;

    TitleDomain(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
