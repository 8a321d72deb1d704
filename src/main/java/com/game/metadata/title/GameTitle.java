package com.game.metadata.title;

import java.util.Objects;

/**
 * A catalog title as read from persistence. Player counts and support flags are
 * nullable: {@code null} means unknown.
 */
public class GameTitle {
    private final String id;
    private final String name;
    private final TitleType type;
    private final String description;
    private final String coverImageUrl;
    private final Integer overallMinPlayers;
    private final Integer overallMaxPlayers;
    private final Boolean supportsOnline;
    private final Integer onlineMinPlayers;
    private final Integer onlineMaxPlayers;
    private final Boolean supportsLocal;
    private final Integer localMinPlayers;
    private final Integer localMaxPlayers;
    private final Boolean supportsPhysical;
    private final Integer physicalMinPlayers;
    private final Integer physicalMaxPlayers;

    private GameTitle(Builder builder) {
        this.id = builder.id;
        this.name = builder.name;
        this.type = builder.type != null ? builder.type : TitleType.VIDEO_GAME;
        this.description = builder.description;
        this.coverImageUrl = builder.coverImageUrl;
        this.overallMinPlayers = builder.overallMinPlayers;
        this.overallMaxPlayers = builder.overallMaxPlayers;
        this.supportsOnline = builder.supportsOnline;
        this.onlineMinPlayers = builder.onlineMinPlayers;
        this.onlineMaxPlayers = builder.onlineMaxPlayers;
        this.supportsLocal = builder.supportsLocal;
        this.localMinPlayers = builder.localMinPlayers;
        this.localMaxPlayers = builder.localMaxPlayers;
        this.supportsPhysical = builder.supportsPhysical;
        this.physicalMinPlayers = builder.physicalMinPlayers;
        this.physicalMaxPlayers = builder.physicalMaxPlayers;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public TitleType getType() {
        return type;
    }

    public String getDescription() {
        return description;
    }

    public String getCoverImageUrl() {
        return coverImageUrl;
    }

    public Integer getOverallMinPlayers() {
        return overallMinPlayers;
    }

    public Integer getOverallMaxPlayers() {
        return overallMaxPlayers;
    }

    public Boolean getSupportsOnline() {
        return supportsOnline;
    }

    public Integer getOnlineMinPlayers() {
        return onlineMinPlayers;
    }

    public Integer getOnlineMaxPlayers() {
        return onlineMaxPlayers;
    }

    public Boolean getSupportsLocal() {
        return supportsLocal;
    }

    public Integer getLocalMinPlayers() {
        return localMinPlayers;
    }

    public Integer getLocalMaxPlayers() {
        return localMaxPlayers;
    }

    public Boolean getSupportsPhysical() {
        return supportsPhysical;
    }

    public Integer getPhysicalMinPlayers() {
        return physicalMinPlayers;
    }

    public Integer getPhysicalMaxPlayers() {
        return physicalMaxPlayers;
    }

    /**
     * Returns a copy with the patch applied. Fields absent from the patch are kept.
     */
    public GameTitle withUpdate(TitleUpdate update) {
        Builder builder = builder(this);
        update.asMap().forEach((field, value) -> {
            switch (field) {
                case DESCRIPTION -> builder.description((String) value);
                case COVER_IMAGE_URL -> builder.coverImageUrl((String) value);
                case OVERALL_MIN_PLAYERS -> builder.overallMinPlayers((Integer) value);
                case OVERALL_MAX_PLAYERS -> builder.overallMaxPlayers((Integer) value);
                case SUPPORTS_ONLINE -> builder.supportsOnline((Boolean) value);
                case ONLINE_MIN_PLAYERS -> builder.onlineMinPlayers((Integer) value);
                case ONLINE_MAX_PLAYERS -> builder.onlineMaxPlayers((Integer) value);
                case SUPPORTS_LOCAL -> builder.supportsLocal((Boolean) value);
                case LOCAL_MIN_PLAYERS -> builder.localMinPlayers((Integer) value);
                case LOCAL_MAX_PLAYERS -> builder.localMaxPlayers((Integer) value);
                case SUPPORTS_PHYSICAL -> builder.supportsPhysical((Boolean) value);
                case PHYSICAL_MIN_PLAYERS -> builder.physicalMinPlayers((Integer) value);
                case PHYSICAL_MAX_PLAYERS -> builder.physicalMaxPlayers((Integer) value);
            }
        });
        return builder.build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GameTitle that = (GameTitle) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "GameTitle{" +
                "id='" + id + '\'' +
                ", name='" + name + '\'' +
                ", type=" + type +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(GameTitle title) {
        return new Builder()
                .id(title.id)
                .name(title.name)
                .type(title.type)
                .description(title.description)
                .coverImageUrl(title.coverImageUrl)
                .overallMinPlayers(title.overallMinPlayers)
                .overallMaxPlayers(title.overallMaxPlayers)
                .supportsOnline(title.supportsOnline)
                .onlineMinPlayers(title.onlineMinPlayers)
                .onlineMaxPlayers(title.onlineMaxPlayers)
                .supportsLocal(title.supportsLocal)
                .localMinPlayers(title.localMinPlayers)
                .localMaxPlayers(title.localMaxPlayers)
                .supportsPhysical(title.supportsPhysical)
                .physicalMinPlayers(title.physicalMinPlayers)
                .physicalMaxPlayers(title.physicalMaxPlayers);
    }

    public static class Builder {
        private String id;
        private String name;
        private TitleType type;
        private String description;
        private String coverImageUrl;
        private Integer overallMinPlayers;
        private Integer overallMaxPlayers;
        private Boolean supportsOnline;
        private Integer onlineMinPlayers;
        private Integer onlineMaxPlayers;
        private Boolean supportsLocal;
        private Integer localMinPlayers;
        private Integer localMaxPlayers;
        private Boolean supportsPhysical;
        private Integer physicalMinPlayers;
        private Integer physicalMaxPlayers;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder type(TitleType type) {
            this.type = type;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder coverImageUrl(String coverImageUrl) {
            this.coverImageUrl = coverImageUrl;
            return this;
        }

        public Builder overallMinPlayers(Integer overallMinPlayers) {
            this.overallMinPlayers = overallMinPlayers;
            return this;
        }

        public Builder overallMaxPlayers(Integer overallMaxPlayers) {
            this.overallMaxPlayers = overallMaxPlayers;
            return this;
        }

        public Builder supportsOnline(Boolean supportsOnline) {
            this.supportsOnline = supportsOnline;
            return this;
        }

        public Builder onlineMinPlayers(Integer onlineMinPlayers) {
            this.onlineMinPlayers = onlineMinPlayers;
            return this;
        }

        public Builder onlineMaxPlayers(Integer onlineMaxPlayers) {
            this.onlineMaxPlayers = onlineMaxPlayers;
            return this;
        }

        public Builder supportsLocal(Boolean supportsLocal) {
            this.supportsLocal = supportsLocal;
            return this;
        }

        public Builder localMinPlayers(Integer localMinPlayers) {
            this.localMinPlayers = localMinPlayers;
            return this;
        }

        public Builder localMaxPlayers(Integer localMaxPlayers) {
            this.localMaxPlayers = localMaxPlayers;
            return this;
        }

        public Builder supportsPhysical(Boolean supportsPhysical) {
            this.supportsPhysical = supportsPhysical;
            return this;
        }

        public Builder physicalMinPlayers(Integer physicalMinPlayers) {
            this.physicalMinPlayers = physicalMinPlayers;
            return this;
        }

        public Builder physicalMaxPlayers(Integer physicalMaxPlayers) {
            this.physicalMaxPlayers = physicalMaxPlayers;
            return this;
        }

        public GameTitle build() {
            Objects.requireNonNull(id, "id is required");
            Objects.requireNonNull(name, "name is required");
            return new GameTitle(this);
        }
    }
}
