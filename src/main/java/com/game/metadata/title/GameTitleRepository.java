package com.game.metadata.title;

import java.util.Optional;

/**
 * Persistence contract for catalog titles. Each call is atomic on its own;
 * no wider transaction is implied.
 */
public interface GameTitleRepository {

    Optional<GameTitle> findById(String titleId);

    /**
     * Applies a partial update to the stored title.
     *
     * @throws IllegalArgumentException if no title has the given id
     */
    void applyUpdate(String titleId, TitleUpdate update);
}
