package com.game.metadata.service;

import com.game.metadata.title.TitleUpdate;

import java.util.List;

/**
 * The patch computed for a title and the names of the fields it touches.
 */
public record TitleUpdateResult(TitleUpdate update, List<String> fieldsUpdated) {

    public TitleUpdateResult {
        fieldsUpdated = List.copyOf(fieldsUpdated);
    }

    public boolean isEmpty() {
        return fieldsUpdated.isEmpty();
    }
}
