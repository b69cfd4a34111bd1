package com.scorpius.exception;

import com.scorpius.domain.enums.NotificationChannel;
import java.util.Map;

/**
 * Raised inside a channel adapter when a provider call fails. Adapters catch it and
 * report {@code false}; it never leaves the adapter boundary.
 */
public class ChannelDeliveryException extends BaseException {

    public ChannelDeliveryException(NotificationChannel channel, String message) {
        super(ErrorCode.CHANNEL_DELIVERY_FAILED, message, Map.of("channel", channel.name()));
    }

    public ChannelDeliveryException(NotificationChannel channel, String message, Throwable cause) {
        super(ErrorCode.CHANNEL_DELIVERY_FAILED, message, Map.of("channel", channel.name()), cause);
    }
}
