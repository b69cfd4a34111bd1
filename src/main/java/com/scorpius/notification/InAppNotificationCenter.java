package com.scorpius.notification;

import com.scorpius.domain.model.InAppNotification;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Bounded, newest-first history of in-app notifications with read tracking. Oldest entries
 * are evicted once {@code scorpius.notifications.in-app.history-size} is exceeded.
 */
@Component
public class InAppNotificationCenter {

    private final int historySize;
    private final Deque<InAppNotification> recent = new ArrayDeque<>();
    private final Set<String> unread = new HashSet<>();

    public InAppNotificationCenter(NotificationProperties notificationProperties) {
        this.historySize = Math.max(1, notificationProperties.getInApp().getHistorySize());
    }

    /**
     * Adds a notification as unread. A redelivered id replaces its earlier entry and keeps
     * its read state.
     */
    public synchronized void record(InAppNotification notification) {
        boolean redelivered = recent.removeIf(existing -> Objects.equals(existing.getId(), notification.getId()));
        recent.addFirst(notification);
        if (!redelivered) {
            unread.add(notification.getId());
        }
        while (recent.size() > historySize) {
            InAppNotification evicted = recent.removeLast();
            unread.remove(evicted.getId());
        }
    }

    public synchronized List<InAppNotification> getRecent() {
        return new ArrayList<>(recent);
    }

    public synchronized int getUnreadCount() {
        return unread.size();
    }

    public synchronized boolean isUnread(String id) {
        return unread.contains(id);
    }

    public synchronized boolean markRead(String id) {
        return unread.remove(id);
    }

    public synchronized void markAllRead() {
        unread.clear();
    }

    public synchronized void clear() {
        recent.clear();
        unread.clear();
    }
}
