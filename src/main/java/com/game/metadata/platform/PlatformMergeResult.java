package com.game.metadata.platform;

import java.util.List;

/**
 * Outcome of merging one platform into another.
 *
 * @param target        the surviving platform with its updated aliases
 * @param removedId     id of the deleted source platform
 * @param releasesMoved number of releases repointed to the target
 * @param aliasesAdded  aliases the target gained
 */
public record PlatformMergeResult(Platform target, String removedId, int releasesMoved, List<String> aliasesAdded) {

    public PlatformMergeResult {
        aliasesAdded = aliasesAdded != null ? List.copyOf(aliasesAdded) : List.of();
    }
}
