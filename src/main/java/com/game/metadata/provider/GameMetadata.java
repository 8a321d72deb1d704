package com.game.metadata.provider;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Everything one provider knows about one external title.
 * {@code externalId} and {@code name} are always present; any other field may be
 * {@code null} (scalars) or empty (lists) when the provider does not report it.
 */
public final class GameMetadata {
    private final String externalId;
    private final String name;
    private final String description;
    private final String shortDescription;
    private final String coverImageUrl;
    private final String headerImageUrl;
    private final List<String> screenshots;
    private final List<String> videos;
    private final List<String> genres;
    private final List<String> categories;
    private final List<String> developers;
    private final List<String> publishers;
    private final String releaseDate;
    private final List<String> platforms;
    private final Integer metacriticScore;
    private final String metacriticUrl;
    private final String ageRating;
    private final String storeUrl;
    private final PlayerInfo playerInfo;
    private final PriceInfo priceInfo;
    private final String rawPayload;

    private GameMetadata(Builder builder) {
        this.externalId = builder.externalId;
        this.name = builder.name;
        this.description = builder.description;
        this.shortDescription = builder.shortDescription;
        this.coverImageUrl = builder.coverImageUrl;
        this.headerImageUrl = builder.headerImageUrl;
        this.screenshots = copy(builder.screenshots);
        this.videos = copy(builder.videos);
        this.genres = copy(builder.genres);
        this.categories = copy(builder.categories);
        this.developers = copy(builder.developers);
        this.publishers = copy(builder.publishers);
        this.releaseDate = builder.releaseDate;
        this.platforms = copy(builder.platforms);
        this.metacriticScore = builder.metacriticScore;
        this.metacriticUrl = builder.metacriticUrl;
        this.ageRating = builder.ageRating;
        this.storeUrl = builder.storeUrl;
        this.playerInfo = builder.playerInfo;
        this.priceInfo = builder.priceInfo;
        this.rawPayload = builder.rawPayload;
    }

    private static List<String> copy(List<String> values) {
        return values == null ? List.of() : values.stream().filter(Objects::nonNull).collect(Collectors.toList());
    }

    public String getExternalId() {
        return externalId;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public String getShortDescription() {
        return shortDescription;
    }

    public String getCoverImageUrl() {
        return coverImageUrl;
    }

    public String getHeaderImageUrl() {
        return headerImageUrl;
    }

    public List<String> getScreenshots() {
        return screenshots;
    }

    public List<String> getVideos() {
        return videos;
    }

    public List<String> getGenres() {
        return genres;
    }

    public List<String> getCategories() {
        return categories;
    }

    public List<String> getDevelopers() {
        return developers;
    }

    public List<String> getPublishers() {
        return publishers;
    }

    public String getReleaseDate() {
        return releaseDate;
    }

    public List<String> getPlatforms() {
        return platforms;
    }

    /**
     * Review score on a 0-100 scale.
     */
    public Integer getMetacriticScore() {
        return metacriticScore;
    }

    public String getMetacriticUrl() {
        return metacriticUrl;
    }

    public String getAgeRating() {
        return ageRating;
    }

    public String getStoreUrl() {
        return storeUrl;
    }

    public PlayerInfo getPlayerInfo() {
        return playerInfo;
    }

    public PriceInfo getPriceInfo() {
        return priceInfo;
    }

    /**
     * Truncated source payload kept for diagnostics only.
     */
    public String getRawPayload() {
        return rawPayload;
    }

    public GameMetadata withPlayerInfo(PlayerInfo info) {
        return toBuilder().playerInfo(info).build();
    }

    public GameMetadata withExternalId(String id) {
        return toBuilder().externalId(id).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .externalId(externalId)
                .name(name)
                .description(description)
                .shortDescription(shortDescription)
                .coverImageUrl(coverImageUrl)
                .headerImageUrl(headerImageUrl)
                .screenshots(screenshots)
                .videos(videos)
                .genres(genres)
                .categories(categories)
                .developers(developers)
                .publishers(publishers)
                .releaseDate(releaseDate)
                .platforms(platforms)
                .metacriticScore(metacriticScore)
                .metacriticUrl(metacriticUrl)
                .ageRating(ageRating)
                .storeUrl(storeUrl)
                .playerInfo(playerInfo)
                .priceInfo(priceInfo)
                .rawPayload(rawPayload);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GameMetadata that = (GameMetadata) o;
        return externalId.equals(that.externalId) && name.equals(that.name)
                && Objects.equals(playerInfo, that.playerInfo);
    }

    @Override
    public int hashCode() {
        return Objects.hash(externalId, name, playerInfo);
    }

    @Override
    public String toString() {
        return "GameMetadata{" +
                "externalId='" + externalId + '\'' +
                ", name='" + name + '\'' +
                ", playerInfo=" + playerInfo +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String externalId;
        private String name;
        private String description;
        private String shortDescription;
        private String coverImageUrl;
        private String headerImageUrl;
        private List<String> screenshots;
        private List<String> videos;
        private List<String> genres;
        private List<String> categories;
        private List<String> developers;
        private List<String> publishers;
        private String releaseDate;
        private List<String> platforms;
        private Integer metacriticScore;
        private String metacriticUrl;
        private String ageRating;
        private String storeUrl;
        private PlayerInfo playerInfo;
        private PriceInfo priceInfo;
        private String rawPayload;

        public Builder externalId(String externalId) {
            this.externalId = externalId;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder shortDescription(String shortDescription) {
            this.shortDescription = shortDescription;
            return this;
        }

        public Builder coverImageUrl(String coverImageUrl) {
            this.coverImageUrl = coverImageUrl;
            return this;
        }

        public Builder headerImageUrl(String headerImageUrl) {
            this.headerImageUrl = headerImageUrl;
            return this;
        }

        public Builder screenshots(List<String> screenshots) {
            this.screenshots = screenshots;
            return this;
        }

        public Builder videos(List<String> videos) {
            this.videos = videos;
            return this;
        }

        public Builder genres(List<String> genres) {
            this.genres = genres;
            return this;
        }

        public Builder categories(List<String> categories) {
            this.categories = categories;
            return this;
        }

        public Builder developers(List<String> developers) {
            this.developers = developers;
            return this;
        }

        public Builder publishers(List<String> publishers) {
            this.publishers = publishers;
            return this;
        }

        public Builder releaseDate(String releaseDate) {
            this.releaseDate = releaseDate;
            return this;
        }

        public Builder platforms(List<String> platforms) {
            this.platforms = platforms;
            return this;
        }

        public Builder metacriticScore(Integer metacriticScore) {
            this.metacriticScore = metacriticScore;
            return this;
        }

        public Builder metacriticUrl(String metacriticUrl) {
            this.metacriticUrl = metacriticUrl;
            return this;
        }

        public Builder ageRating(String ageRating) {
            this.ageRating = ageRating;
            return this;
        }

        public Builder storeUrl(String storeUrl) {
            this.storeUrl = storeUrl;
            return this;
        }

        public Builder playerInfo(PlayerInfo playerInfo) {
            this.playerInfo = playerInfo;
            return this;
        }

        public Builder priceInfo(PriceInfo priceInfo) {
            this.priceInfo = priceInfo;
            return this;
        }

        public Builder rawPayload(String rawPayload) {
            this.rawPayload = rawPayload;
            return this;
        }

        public GameMetadata build() {
            Objects.requireNonNull(externalId, "externalId is required");
            Objects.requireNonNull(name, "name is required");
            if (externalId.isBlank() || name.isBlank()) {
                throw new IllegalArgumentException("externalId and name must not be blank");
            }
            return new GameMetadata(this);
        }
    }
}
