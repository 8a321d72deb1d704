package com.game.metadata.title;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory implementation of {@link GameTitleRepository}.
 */
public class InMemoryGameTitleRepository implements GameTitleRepository {

    private final ConcurrentMap<String, GameTitle> titles = new ConcurrentHashMap<>();

    public void save(GameTitle title) {
        if (title.getId() == null || title.getId().isBlank()) {
            throw new IllegalArgumentException("title id must not be null or blank");
        }
        titles.put(title.getId(), title);
    }

    @Override
    public Optional<GameTitle> findById(String titleId) {
        return Optional.ofNullable(titles.get(titleId));
    }

    @Override
    public void applyUpdate(String titleId, TitleUpdate update) {
        GameTitle updated = titles.computeIfPresent(titleId, (id, current) -> current.withUpdate(update));
        if (updated == null) {
            throw new IllegalArgumentException("Game title not found: " + titleId);
        }
    }
}
