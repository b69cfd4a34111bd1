package com.scorpius.notification;

import com.scorpius.domain.model.InAppNotification;
import org.springframework.context.ApplicationEvent;

/**
 * Published for every notification delivered on the in-app channel. The UI bridge listens
 * and shows a toast.
 */
public class InAppNotificationEvent extends ApplicationEvent {

    private final InAppNotification notification;

    public InAppNotificationEvent(Object source, InAppNotification notification) {
        super(source);
        this.notification = notification;
    }

    public InAppNotification getNotification() {
        return notification;
    }
}
