package com.scorpius.unit.ratelimit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scorpius.exception.ErrorCode;
import com.scorpius.exception.RateLimitExceededException;
import com.scorpius.ratelimit.RateLimiter;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for RateLimiter covering the fixed window, key isolation, reset and eviction.
 */
class RateLimiterTest {

    private static final Instant T0 = Instant.parse("2026-03-02T10:00:00Z");
    private static final Duration HOUR = Duration.ofHours(1);

    private RateLimiter rateLimiter;

    @BeforeEach
    void setUp() {
        rateLimiter = new RateLimiter(Clock.fixed(T0, ZoneOffset.UTC));
    }

    @Nested
    @DisplayName("Fixed window")
    class FixedWindow {

        @Test
        @DisplayName("Allows up to the limit, then rejects until the window expires")
        void allowsUpToLimit() {
            assertThat(rateLimiter.isAllowed("k", 3, HOUR, T0)).isTrue();
            assertThat(rateLimiter.isAllowed("k", 3, HOUR, T0.plusSeconds(1))).isTrue();
            assertThat(rateLimiter.isAllowed("k", 3, HOUR, T0.plusSeconds(2))).isTrue();
            assertThat(rateLimiter.isAllowed("k", 3, HOUR, T0.plusSeconds(3))).isFalse();

            assertThat(rateLimiter.isAllowed("k", 3, HOUR, T0.plus(HOUR).plusSeconds(1))).isTrue();
            assertThat(rateLimiter.getCount("k")).isEqualTo(1);
        }

        @Test
        @DisplayName("Rejected calls do not extend the window")
        void rejectedCallsDoNotExtendWindow() {
            rateLimiter.isAllowed("k", 1, HOUR, T0);
            assertThat(rateLimiter.isAllowed("k", 1, HOUR, T0.plus(Duration.ofMinutes(59)))).isFalse();

            assertThat(rateLimiter.isAllowed("k", 1, HOUR, T0.plus(HOUR).plusMillis(1))).isTrue();
        }

        @Test
        @DisplayName("Window boundary is inclusive: a call at exactly resetAt still counts against the old window")
        void boundaryBelongsToOldWindow() {
            rateLimiter.isAllowed("k", 1, HOUR, T0);

            assertThat(rateLimiter.isAllowed("k", 1, HOUR, T0.plus(HOUR))).isFalse();
            assertThat(rateLimiter.isAllowed("k", 1, HOUR, T0.plus(HOUR).plusMillis(1))).isTrue();
        }

        @Test
        @DisplayName("A limit of zero rejects every call")
        void zeroLimitRejects() {
            assertThat(rateLimiter.isAllowed("k", 0, HOUR, T0)).isFalse();
            assertThat(rateLimiter.isAllowed("k", 0, HOUR, T0.plusSeconds(1))).isFalse();
        }

        @Test
        @DisplayName("The clock-based overload uses the injected clock")
        void usesInjectedClock() {
            assertThat(rateLimiter.isAllowed("k", 1, HOUR)).isTrue();
            assertThat(rateLimiter.isAllowed("k", 1, HOUR)).isFalse();
        }
    }

    @Test
    void acquire_limitReached_throwsWithKeyAndLimit() {
        rateLimiter.acquire("slack_global_hour", 1, HOUR);

        assertThatThrownBy(() -> rateLimiter.acquire("slack_global_hour", 1, HOUR))
                .isInstanceOf(RateLimitExceededException.class)
                .hasMessageContaining("slack_global_hour")
                .satisfies(e -> {
                    RateLimitExceededException ex = (RateLimitExceededException) e;
                    assertThat(ex.getErrorCode()).isEqualTo(ErrorCode.RATE_LIMIT_EXCEEDED);
                    assertThat(ex.getDetails()).containsEntry("limit", 1);
                });
    }

    @Test
    void keys_areIndependent() {
        assertThat(rateLimiter.isAllowed("slack_global_hour", 1, HOUR, T0)).isTrue();
        assertThat(rateLimiter.isAllowed("slack_global_hour", 1, HOUR, T0)).isFalse();

        assertThat(rateLimiter.isAllowed("telegram_global_hour", 1, HOUR, T0)).isTrue();
    }

    @Test
    void reset_clearsCounter() {
        rateLimiter.isAllowed("k", 1, HOUR, T0);
        rateLimiter.reset("k");

        assertThat(rateLimiter.getCount("k")).isZero();
        assertThat(rateLimiter.isAllowed("k", 1, HOUR, T0)).isTrue();
    }

    @Test
    void evictExpired_removesOnlyElapsedWindows() {
        rateLimiter.isAllowed("short", 5, Duration.ofMinutes(1), T0);
        rateLimiter.isAllowed("long", 5, Duration.ofDays(1), T0);

        int evicted = rateLimiter.evictExpired(T0.plus(Duration.ofMinutes(2)));

        assertThat(evicted).isEqualTo(1);
        assertThat(rateLimiter.size()).isEqualTo(1);
        assertThat(rateLimiter.getCount("long")).isEqualTo(1);
    }
}
