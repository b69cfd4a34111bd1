package com.scorpius.unit.notification;

import static org.assertj.core.api.Assertions.assertThat;

import com.scorpius.domain.enums.NotificationPriority;
import com.scorpius.domain.enums.NotificationType;
import com.scorpius.domain.model.NotificationFilters;
import com.scorpius.domain.model.NotificationPayload;
import com.scorpius.domain.model.NotificationPreferences;
import com.scorpius.domain.model.QuietHours;
import com.scorpius.notification.NotificationFilter;
import com.scorpius.notification.NotificationFilter.DropReason;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for NotificationFilter: quiet hours (including the midnight wrap and the
 * CRITICAL bypass), minimum priority, keyword allow and deny lists, expiry.
 */
class NotificationFilterTest {

    private NotificationFilter filter;
    private NotificationPreferences defaults;

    @BeforeEach
    void setUp() {
        filter = new NotificationFilter();
        defaults = NotificationPreferences.createDefault();
    }

    private static NotificationPayload payload(NotificationPriority priority, String message) {
        return NotificationPayload.builder()
                .type(NotificationType.SCAN_COMPLETED)
                .title("Scan")
                .message(message)
                .priority(priority)
                .build();
    }

    private static QuietHours quiet(int startHour, int endHour, ZoneId zone) {
        return QuietHours.builder()
                .enabled(true)
                .start(LocalTime.of(startHour, 0))
                .end(LocalTime.of(endHour, 0))
                .timezone(zone)
                .build();
    }

    @Nested
    @DisplayName("Quiet hours")
    class QuietHoursWindow {

        @Test
        @DisplayName("Window wrapping midnight covers late evening and early morning")
        void wrapsMidnight() {
            QuietHours window = quiet(22, 8, ZoneOffset.UTC);

            assertThat(filter.isQuietHour(window, Instant.parse("2026-03-02T23:00:00Z"))).isTrue();
            assertThat(filter.isQuietHour(window, Instant.parse("2026-03-02T03:00:00Z"))).isTrue();
            assertThat(filter.isQuietHour(window, Instant.parse("2026-03-02T12:00:00Z"))).isFalse();
        }

        @Test
        @DisplayName("Start is inclusive, end is exclusive")
        void halfOpen() {
            QuietHours window = quiet(22, 8, ZoneOffset.UTC);

            assertThat(filter.isQuietHour(window, Instant.parse("2026-03-02T22:00:00Z"))).isTrue();
            assertThat(filter.isQuietHour(window, Instant.parse("2026-03-02T08:00:00Z"))).isFalse();
        }

        @Test
        @DisplayName("Same-day window")
        void sameDay() {
            QuietHours window = quiet(9, 17, ZoneOffset.UTC);

            assertThat(filter.isQuietHour(window, Instant.parse("2026-03-02T10:00:00Z"))).isTrue();
            assertThat(filter.isQuietHour(window, Instant.parse("2026-03-02T18:00:00Z"))).isFalse();
        }

        @Test
        @DisplayName("Local time is taken in the configured zone")
        void usesTimezone() {
            QuietHours window = quiet(22, 8, ZoneId.of("Asia/Tokyo"));

            // 14:00 UTC is 23:00 in Tokyo
            assertThat(filter.isQuietHour(window, Instant.parse("2026-03-02T14:00:00Z"))).isTrue();
        }

        @Test
        @DisplayName("Disabled quiet hours never match")
        void disabled() {
            QuietHours window = quiet(22, 8, ZoneOffset.UTC).toBuilder().enabled(false).build();

            assertThat(filter.isQuietHour(window, Instant.parse("2026-03-02T23:00:00Z"))).isFalse();
        }

        @Test
        @DisplayName("Only CRITICAL passes during quiet hours")
        void criticalBypass() {
            NotificationPreferences prefs = defaults.toBuilder().quietHours(quiet(22, 8, ZoneOffset.UTC)).build();
            Instant lateEvening = Instant.parse("2026-03-02T23:00:00Z");

            assertThat(filter.evaluate(payload(NotificationPriority.HIGH, "m"), prefs, lateEvening))
                    .contains(DropReason.QUIET_HOURS);
            assertThat(filter.evaluate(payload(NotificationPriority.CRITICAL, "m"), prefs, lateEvening)).isEmpty();
        }
    }

    @Test
    void evaluate_defaults_admitsEverything() {
        assertThat(filter.evaluate(payload(NotificationPriority.LOW, "anything"), defaults, Instant.now())).isEmpty();
    }

    @Test
    void evaluate_belowMinPriority_dropped() {
        NotificationPreferences prefs = defaults.toBuilder()
                .filters(NotificationFilters.builder().minPriority(NotificationPriority.NORMAL).build())
                .build();

        assertThat(filter.evaluate(payload(NotificationPriority.LOW, "m"), prefs, Instant.now()))
                .contains(DropReason.PRIORITY);
        assertThat(filter.evaluate(payload(NotificationPriority.NORMAL, "m"), prefs, Instant.now())).isEmpty();
    }

    @Test
    void evaluate_keywordAllowList_requiresMatch() {
        NotificationPreferences prefs = defaults.toBuilder()
                .filters(NotificationFilters.builder().keyword("Critical").keyword("reentrancy").build())
                .build();

        assertThat(filter.evaluate(payload(NotificationPriority.HIGH, "REENTRANCY in withdraw"), prefs, Instant.now()))
                .isEmpty();
        assertThat(filter.evaluate(payload(NotificationPriority.HIGH, "gas report"), prefs, Instant.now()))
                .contains(DropReason.KEYWORD);
    }

    @Test
    void evaluate_excludeKeywordWinsOverAllowList() {
        NotificationPreferences prefs = defaults.toBuilder()
                .filters(NotificationFilters.builder().keyword("scan").excludeKeyword("testnet").build())
                .build();

        assertThat(filter.evaluate(payload(NotificationPriority.HIGH, "scan finished on Testnet"), prefs, Instant.now()))
                .contains(DropReason.KEYWORD);
    }

    @Test
    void evaluate_expiredPayload_dropped() {
        Instant now = Instant.parse("2026-03-02T12:00:00Z");
        NotificationPayload expired = payload(NotificationPriority.HIGH, "m").toBuilder()
                .expiresAt(now.minusSeconds(1))
                .build();

        assertThat(filter.evaluate(expired, defaults, now)).contains(DropReason.EXPIRED);
    }

    @Test
    void dropReason_tag_isLowerCase() {
        assertThat(DropReason.QUIET_HOURS.tag()).isEqualTo("quiet_hours");
    }
}
