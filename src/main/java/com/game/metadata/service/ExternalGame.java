package com.game.metadata.service;

import java.util.List;
import java.util.Objects;

/**
 * A game as reported by a library connector, before or after metadata enrichment.
 * Every field except the id and name may be {@code null}, meaning the connector did not
 * supply it.
 */
public final class ExternalGame {
    private final String externalGameId;
    private final String name;
    private final Integer playtimeMinutes;
    private final String description;
    private final String releaseDate;
    private final String developer;
    private final String publisher;
    private final List<String> genres;
    private final String storeUrl;
    private final String coverImageUrl;
    private final Integer overallMinPlayers;
    private final Integer overallMaxPlayers;
    private final Boolean supportsOnline;
    private final Boolean supportsLocal;
    private final Boolean supportsPhysical;
    private final Integer onlineMaxPlayers;
    private final Integer localMaxPlayers;

    private ExternalGame(Builder builder) {
        this.externalGameId = Objects.requireNonNull(builder.externalGameId, "externalGameId is required");
        this.name = Objects.requireNonNull(builder.name, "name is required");
        this.playtimeMinutes = builder.playtimeMinutes;
        this.description = builder.description;
        this.releaseDate = builder.releaseDate;
        this.developer = builder.developer;
        this.publisher = builder.publisher;
        this.genres = builder.genres != null ? List.copyOf(builder.genres) : null;
        this.storeUrl = builder.storeUrl;
        this.coverImageUrl = builder.coverImageUrl;
        this.overallMinPlayers = builder.overallMinPlayers;
        this.overallMaxPlayers = builder.overallMaxPlayers;
        this.supportsOnline = builder.supportsOnline;
        this.supportsLocal = builder.supportsLocal;
        this.supportsPhysical = builder.supportsPhysical;
        this.onlineMaxPlayers = builder.onlineMaxPlayers;
        this.localMaxPlayers = builder.localMaxPlayers;
    }

    public String getExternalGameId() {
        return externalGameId;
    }

    public String getName() {
        return name;
    }

    public Integer getPlaytimeMinutes() {
        return playtimeMinutes;
    }

    public String getDescription() {
        return description;
    }

    public String getReleaseDate() {
        return releaseDate;
    }

    public String getDeveloper() {
        return developer;
    }

    public String getPublisher() {
        return publisher;
    }

    public List<String> getGenres() {
        return genres;
    }

    public String getStoreUrl() {
        return storeUrl;
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

    public Boolean getSupportsLocal() {
        return supportsLocal;
    }

    public Boolean getSupportsPhysical() {
        return supportsPhysical;
    }

    public Integer getOnlineMaxPlayers() {
        return onlineMaxPlayers;
    }

    public Integer getLocalMaxPlayers() {
        return localMaxPlayers;
    }

    public Builder toBuilder() {
        return new Builder()
                .externalGameId(externalGameId)
                .name(name)
                .playtimeMinutes(playtimeMinutes)
                .description(description)
                .releaseDate(releaseDate)
                .developer(developer)
                .publisher(publisher)
                .genres(genres)
                .storeUrl(storeUrl)
                .coverImageUrl(coverImageUrl)
                .overallMinPlayers(overallMinPlayers)
                .overallMaxPlayers(overallMaxPlayers)
                .supportsOnline(supportsOnline)
                .supportsLocal(supportsLocal)
                .supportsPhysical(supportsPhysical)
                .onlineMaxPlayers(onlineMaxPlayers)
                .localMaxPlayers(localMaxPlayers);
    }

    @Override
    public String toString() {
        return "ExternalGame{externalGameId='" + externalGameId + "', name='" + name + "'}";
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String externalGameId;
        private String name;
        private Integer playtimeMinutes;
        private String description;
        private String releaseDate;
        private String developer;
        private String publisher;
        private List<String> genres;
        private String storeUrl;
        private String coverImageUrl;
        private Integer overallMinPlayers;
        private Integer overallMaxPlayers;
        private Boolean supportsOnline;
        private Boolean supportsLocal;
        private Boolean supportsPhysical;
        private Integer onlineMaxPlayers;
        private Integer localMaxPlayers;

        public Builder externalGameId(String externalGameId) {
            this.externalGameId = externalGameId;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder playtimeMinutes(Integer playtimeMinutes) {
            this.playtimeMinutes = playtimeMinutes;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder releaseDate(String releaseDate) {
            this.releaseDate = releaseDate;
            return this;
        }

        public Builder developer(String developer) {
            this.developer = developer;
            return this;
        }

        public Builder publisher(String publisher) {
            this.publisher = publisher;
            return this;
        }

        public Builder genres(List<String> genres) {
            this.genres = genres;
            return this;
        }

        public Builder storeUrl(String storeUrl) {
            this.storeUrl = storeUrl;
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

        public Builder supportsLocal(Boolean supportsLocal) {
            this.supportsLocal = supportsLocal;
            return this;
        }

        public Builder supportsPhysical(Boolean supportsPhysical) {
            this.supportsPhysical = supportsPhysical;
            return this;
        }

        public Builder onlineMaxPlayers(Integer onlineMaxPlayers) {
            this.onlineMaxPlayers = onlineMaxPlayers;
            return this;
        }

        public Builder localMaxPlayers(Integer localMaxPlayers) {
            this.localMaxPlayers = localMaxPlayers;
            return this;
        }

        public ExternalGame build() {
            return new ExternalGame(this);
        }
    }
}
