package com.scorpius.notification;

import com.scorpius.domain.model.NotificationPreferences;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Holds the process-wide {@link NotificationPreferences} snapshot. Updates replace the whole
 * snapshot atomically; readers never see a half-applied change.
 */
@Component
public class NotificationPreferencesStore {

    private static final Logger log = LoggerFactory.getLogger(NotificationPreferencesStore.class);

    private final AtomicReference<NotificationPreferences> current;

    @Autowired
    public NotificationPreferencesStore(NotificationProperties notificationProperties) {
        this(notificationProperties.toPreferences());
    }

    public NotificationPreferencesStore(NotificationPreferences initial) {
        this.current = new AtomicReference<>(Objects.requireNonNull(initial));
    }

    public NotificationPreferences get() {
        return current.get();
    }

    public NotificationPreferences update(UnaryOperator<NotificationPreferences> change) {
        NotificationPreferences updated = current.updateAndGet(prefs -> Objects.requireNonNull(change.apply(prefs)));
        log.info("Notification preferences updated");
        return updated;
    }

    public void replace(NotificationPreferences preferences) {
        current.set(Objects.requireNonNull(preferences));
        log.info("Notification preferences replaced");
    }
}
