package com.scorpius.notification.channel;

import com.scorpius.domain.enums.NotificationChannel;
import com.scorpius.domain.model.ChannelConfig;
import com.scorpius.domain.model.RenderedNotification;

/**
 * Delivers a rendered notification to one external channel.
 *
 * <p>Implementations report failure by returning false and never throw. A config missing the
 * credentials the channel needs yields false without any network I/O.
 */
public interface ChannelSender {

    NotificationChannel channel();

    boolean send(ChannelConfig config, RenderedNotification notification);
}
