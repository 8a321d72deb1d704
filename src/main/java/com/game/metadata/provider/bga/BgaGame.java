package com.game.metadata.provider.bga;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A game as returned by the Board Game Atlas search endpoint.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record BgaGame(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("description_preview") String descriptionPreview,
        @JsonProperty("description") String description,
        @JsonProperty("image_url") String imageUrl,
        @JsonProperty("thumb_url") String thumbUrl,
        @JsonProperty("min_players") Integer minPlayers,
        @JsonProperty("max_players") Integer maxPlayers,
        @JsonProperty("year_published") Integer yearPublished,
        @JsonProperty("primary_publisher") Named primaryPublisher,
        @JsonProperty("primary_designer") Named primaryDesigner,
        @JsonProperty("publishers") List<Named> publishers,
        @JsonProperty("designers") List<Named> designers,
        @JsonProperty("categories") List<Named> categories,
        @JsonProperty("mechanics") List<Named> mechanics,
        @JsonProperty("average_user_rating") Double averageUserRating) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Named(@JsonProperty("name") String name) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SearchResponse(@JsonProperty("games") List<BgaGame> games) {

        List<BgaGame> gamesOrEmpty() {
            return games == null ? List.of() : games;
        }
    }
}
