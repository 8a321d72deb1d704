package com.game.metadata.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-run view of which providers should still be called. A provider is dropped for the
 * rest of the run once it rate-limits us or fails too many times in a row.
 */
public class ProviderHealthTracker {
    private static final Logger log = LoggerFactory.getLogger(ProviderHealthTracker.class);

    private final Set<String> rateLimited = ConcurrentHashMap.newKeySet();
    private final Set<String> tripped = ConcurrentHashMap.newKeySet();
    private final Map<String, Integer> consecutiveErrors = new ConcurrentHashMap<>();

    public boolean isRateLimited(String providerId) {
        return rateLimited.contains(providerId);
    }

    public boolean isUsable(String providerId) {
        return !rateLimited.contains(providerId) && !tripped.contains(providerId);
    }

    public void markRateLimited(String providerId) {
        if (rateLimited.add(providerId)) {
            log.warn("provider.health.rate_limited provider={}", providerId);
        }
    }

    public void recordSuccess(String providerId) {
        consecutiveErrors.remove(providerId);
    }

    /**
     * Counts a failure.
     *
     * @return true once {@code maxConsecutiveErrors} failures in a row have been seen
     */
    public boolean recordFailure(String providerId, int maxConsecutiveErrors) {
        int errors = consecutiveErrors.merge(providerId, 1, Integer::sum);
        if (errors >= maxConsecutiveErrors) {
            if (tripped.add(providerId)) {
                log.warn("provider.health.tripped provider={} consecutiveErrors={}", providerId, errors);
            }
            return true;
        }
        return false;
    }

    public int getConsecutiveErrors(String providerId) {
        return consecutiveErrors.getOrDefault(providerId, 0);
    }
}
