package com.game.metadata.service;

import com.game.metadata.provider.PlayerInfo;

/**
 * Player count rules shared by the metadata service and the sync pipeline.
 */
public final class PlayerCounts {

    private PlayerCounts() {
        // Utility class
    }

    /**
     * A count is usable when it is a positive number.
     */
    public static boolean isValid(Integer count) {
        return count != null && count > 0;
    }

    /**
     * Merges enrichment counts into an existing record. For every count the enrichment
     * value wins when present; otherwise the existing value is kept. Support flags are
     * always kept from the existing record.
     */
    public static PlayerInfo merge(PlayerInfo existing, PlayerInfo enrichment) {
        if (enrichment == null) {
            return existing;
        }
        if (existing == null) {
            return enrichment;
        }
        return existing.toBuilder()
                .overallMinPlayers(prefer(enrichment.getOverallMinPlayers(), existing.getOverallMinPlayers()))
                .overallMaxPlayers(prefer(enrichment.getOverallMaxPlayers(), existing.getOverallMaxPlayers()))
                .onlineMinPlayers(prefer(enrichment.getOnlineMinPlayers(), existing.getOnlineMinPlayers()))
                .onlineMaxPlayers(prefer(enrichment.getOnlineMaxPlayers(), existing.getOnlineMaxPlayers()))
                .localMinPlayers(prefer(enrichment.getLocalMinPlayers(), existing.getLocalMinPlayers()))
                .localMaxPlayers(prefer(enrichment.getLocalMaxPlayers(), existing.getLocalMaxPlayers()))
                .physicalMinPlayers(prefer(enrichment.getPhysicalMinPlayers(), existing.getPhysicalMinPlayers()))
                .physicalMaxPlayers(prefer(enrichment.getPhysicalMaxPlayers(), existing.getPhysicalMaxPlayers()))
                .build();
    }

    private static Integer prefer(Integer preferred, Integer fallback) {
        return preferred != null ? preferred : fallback;
    }
}
