package com.game.metadata.title;

import com.game.metadata.provider.TitleDomain;

import java.util.Locale;

/**
 * Kinds of catalog titles. Each maps to the provider domain that can describe it.
 */
public enum TitleType {
    VIDEO_GAME("video_game", TitleDomain.VIDEO_GAME),
    BOARD_GAME("board_game", TitleDomain.TABLETOP),
    CARD_GAME("card_game", TitleDomain.TABLETOP),
    TABLETOP_RPG("tabletop_rpg", TitleDomain.TABLETOP),
    OTHER_PHYSICAL_GAME("other_physical_game", TitleDomain.TABLETOP);

    private final String label;
    private final TitleDomain domain;

    TitleType(String label, TitleDomain domain) {
        this.label = label;
        this.domain = domain;
    }

    public String getLabel() {
        return label;
    }

    public TitleDomain getDomain() {
        return domain;
    }

    public boolean isTabletop() {
        return domain == TitleDomain.TABLETOP;
    }

    /**
     * Parses a stored label such as {@code "board_game"}; unknown values are video games.
     */
    public static TitleType fromLabel(String label) {
        if (label != null) {
            String lower = label.trim().toLowerCase(Locale.ROOT);
            for (TitleType type : values()) {
                if (type.label.equals(lower) || type.name().equalsIgnoreCase(lower)) {
                    return type;
                }
            }
        }
        return VIDEO_GAME;
    }
}
