package com.scorpius.ratelimit;

import com.scorpius.exception.RateLimitExceededException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Fixed-window counters keyed by an arbitrary string.
 *
 * <p>The first call for a key opens a window of the given length. Calls are allowed while
 * the count is below the limit; once the limit is reached every call is rejected until the
 * window expires, after which the next call opens a fresh window and counts as 1. The
 * instant {@code resetAt} itself still belongs to the old window.
 *
 * <p>Counters live in memory only. Several processes sharing one budget each count
 * separately, so the effective limit is per process.
 */
@Component
public class RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    private final Clock clock;
    private final Map<String, Counter> counters = new ConcurrentHashMap<>();

    public RateLimiter(Clock clock) {
        this.clock = clock;
    }

    public boolean isAllowed(String key, int limit, Duration window) {
        return isAllowed(key, limit, window, clock.instant());
    }

    /**
     * Counts one call against {@code key}.
     *
     * @throws RateLimitExceededException when the window's limit is already reached
     */
    public void acquire(String key, int limit, Duration window) {
        if (!isAllowed(key, limit, window)) {
            throw new RateLimitExceededException(key, limit);
        }
    }

    /**
     * Testable version that accepts an explicit current time.
     */
    public boolean isAllowed(String key, int limit, Duration window, Instant now) {
        AtomicBoolean allowed = new AtomicBoolean();
        counters.compute(key, (k, counter) -> {
            if (counter == null || now.isAfter(counter.resetAt)) {
                allowed.set(limit > 0);
                return new Counter(limit > 0 ? 1 : 0, now.plus(window));
            }
            if (counter.count < limit) {
                allowed.set(true);
                return new Counter(counter.count + 1, counter.resetAt);
            }
            return counter;
        });
        if (!allowed.get()) {
            log.debug("Rate limit reached for {} ({} per {})", key, limit, window);
        }
        return allowed.get();
    }

    public void reset(String key) {
        counters.remove(key);
    }

    /**
     * Drops counters whose window has elapsed. Expired counters are already ignored by
     * {@link #isAllowed}; this only bounds memory.
     */
    @Scheduled(fixedDelayString = "${scorpius.rate-limit.eviction-interval:PT10M}")
    public void evictExpired() {
        evictExpired(clock.instant());
    }

    public int evictExpired(Instant now) {
        int before = counters.size();
        counters.entrySet().removeIf(entry -> now.isAfter(entry.getValue().resetAt));
        int evicted = before - counters.size();
        if (evicted > 0) {
            log.debug("Evicted {} expired rate-limit counters", evicted);
        }
        return evicted;
    }

    /** Visible for testing. */
    public int size() {
        return counters.size();
    }

    /** Visible for testing: current count in the open window, 0 when none. */
    public int getCount(String key) {
        Counter counter = counters.get(key);
        return counter != null ? counter.count : 0;
    }

    private record Counter(int count, Instant resetAt) {}
}
