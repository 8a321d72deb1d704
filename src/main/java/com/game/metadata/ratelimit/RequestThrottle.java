package com.game.metadata.ratelimit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Enforces a minimum interval between requests to one provider.
 *
 * <p>The lock is taken before the last-request time is read and released only after the
 * request completes, so concurrent callers are serialized and two requests are never
 * issued closer together than the interval.</p>
 */
public class RequestThrottle {
    private static final Logger log = LoggerFactory.getLogger(RequestThrottle.class);

    public static final Duration DEFAULT_ACQUIRE_TIMEOUT = Duration.ofMinutes(2);

    private final String providerId;
    private final long minIntervalNanos;
    private final long acquireTimeoutMs;
    private final ReentrantLock lock = new ReentrantLock(true);

    // guarded by lock
    private long lastRequestNanos;
    private boolean issuedAny;

    public RequestThrottle(String providerId, long minIntervalMs) {
        this(providerId, minIntervalMs, DEFAULT_ACQUIRE_TIMEOUT);
    }

    public RequestThrottle(String providerId, long minIntervalMs, Duration acquireTimeout) {
        if (minIntervalMs < 0) {
            throw new IllegalArgumentException("minIntervalMs must be >= 0");
        }
        this.providerId = providerId;
        this.minIntervalNanos = TimeUnit.MILLISECONDS.toNanos(minIntervalMs);
        this.acquireTimeoutMs = acquireTimeout.toMillis();
    }

    /**
     * Runs {@code request} once the interval since the previous request has elapsed.
     *
     * @throws ThrottleAcquisitionException if the slot cannot be obtained in time
     */
    public <T> T execute(Supplier<T> request) {
        acquire();
        try {
            awaitInterval();
            lastRequestNanos = System.nanoTime();
            issuedAny = true;
            return request.get();
        } finally {
            lock.unlock();
        }
    }

    public long getMinIntervalMs() {
        return TimeUnit.NANOSECONDS.toMillis(minIntervalNanos);
    }

    private void acquire() {
        try {
            if (!lock.tryLock(acquireTimeoutMs, TimeUnit.MILLISECONDS)) {
                throw new ThrottleAcquisitionException(providerId,
                        "Request slot for '" + providerId + "' not available within " + acquireTimeoutMs + "ms");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ThrottleAcquisitionException(providerId,
                    "Interrupted while waiting for request slot of '" + providerId + "'", e);
        }
    }

    private void awaitInterval() {
        if (!issuedAny) {
            return;
        }
        long remaining = minIntervalNanos - (System.nanoTime() - lastRequestNanos);
        while (remaining > 0) {
            long waitMs = TimeUnit.NANOSECONDS.toMillis(remaining) + 1;
            log.debug("Throttling {} for {}ms", providerId, waitMs);
            try {
                Thread.sleep(waitMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ThrottleAcquisitionException(providerId,
                        "Interrupted while throttling '" + providerId + "'", e);
            }
            remaining = minIntervalNanos - (System.nanoTime() - lastRequestNanos);
        }
    }
}
