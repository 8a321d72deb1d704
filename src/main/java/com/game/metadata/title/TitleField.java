package com.game.metadata.title;

/**
 * Fields of a {@link GameTitle} that metadata may patch.
 */
public enum TitleField {
    DESCRIPTION("description", String.class),
    COVER_IMAGE_URL("coverImageUrl", String.class),
    OVERALL_MIN_PLAYERS("overallMinPlayers", Integer.class),
    OVERALL_MAX_PLAYERS("overallMaxPlayers", Integer.class),
    SUPPORTS_ONLINE("supportsOnline", Boolean.class),
    ONLINE_MIN_PLAYERS("onlineMinPlayers", Integer.class),
    ONLINE_MAX_PLAYERS("onlineMaxPlayers", Integer.class),
    SUPPORTS_LOCAL("supportsLocal", Boolean.class),
    LOCAL_MIN_PLAYERS("localMinPlayers", Integer.class),
    LOCAL_MAX_PLAYERS("localMaxPlayers", Integer.class),
    SUPPORTS_PHYSICAL("supportsPhysical", Boolean.class),
    PHYSICAL_MIN_PLAYERS("physicalMinPlayers", Integer.class),
    PHYSICAL_MAX_PLAYERS("physicalMaxPlayers", Integer.class);

    private final String key;
    private final Class<?> valueType;

    TitleField(String key, Class<?> valueType) {
        this.key = key;
        this.valueType = valueType;
    }

    /**
     * Property name used in persistence patches and result reporting.
     */
    public String getKey() {
        return key;
    }

    public Class<?> getValueType() {
        return valueType;
    }
}
