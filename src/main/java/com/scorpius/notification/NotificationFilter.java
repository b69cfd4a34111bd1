package com.scorpius.notification;

import com.scorpius.domain.enums.NotificationPriority;
import com.scorpius.domain.model.NotificationFilters;
import com.scorpius.domain.model.NotificationPayload;
import com.scorpius.domain.model.NotificationPreferences;
import com.scorpius.domain.model.QuietHours;
import java.time.Instant;
import java.time.LocalTime;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Admission checks applied before a payload is queued, in order: quiet hours, minimum
 * priority, keyword filters, expiry.
 */
@Component
public class NotificationFilter {

    public enum DropReason {
        QUIET_HOURS,
        PRIORITY,
        KEYWORD,
        EXPIRED;

        public String tag() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    /**
     * @return the reason the payload must be dropped, or empty when it may be delivered
     */
    public Optional<DropReason> evaluate(NotificationPayload payload, NotificationPreferences preferences, Instant now) {
        if (isQuietHour(preferences.getQuietHours(), now) && payload.getPriority() != NotificationPriority.CRITICAL) {
            return Optional.of(DropReason.QUIET_HOURS);
        }
        NotificationFilters filters = preferences.getFilters();
        if (filters != null && !meetsPriorityFilter(payload.getPriority(), filters.getMinPriority())) {
            return Optional.of(DropReason.PRIORITY);
        }
        if (filters != null && !meetsKeywordFilter(payload.getMessage(), filters)) {
            return Optional.of(DropReason.KEYWORD);
        }
        if (payload.isExpired(now)) {
            return Optional.of(DropReason.EXPIRED);
        }
        return Optional.empty();
    }

    public boolean isQuietHour(QuietHours quietHours, Instant now) {
        if (quietHours == null || !quietHours.isEnabled()) {
            return false;
        }
        LocalTime local = now.atZone(quietHours.getTimezone()).toLocalTime();
        return quietHours.contains(local);
    }

    boolean meetsPriorityFilter(NotificationPriority priority, NotificationPriority minPriority) {
        return minPriority == null || priority.isAtLeast(minPriority);
    }

    boolean meetsKeywordFilter(String message, NotificationFilters filters) {
        String lowerMessage = message != null ? message.toLowerCase(Locale.ROOT) : "";
        if (containsAny(lowerMessage, filters.getExcludeKeywords())) {
            return false;
        }
        List<String> keywords = filters.getKeywords();
        return keywords == null || keywords.isEmpty() || containsAny(lowerMessage, keywords);
    }

    private static boolean containsAny(String lowerMessage, List<String> keywords) {
        if (keywords == null) {
            return false;
        }
        for (String keyword : keywords) {
            if (!keyword.isEmpty() && lowerMessage.contains(keyword.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }
}
