package com.scorpius.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Configuration of one delivery channel.
 *
 * <p>Which credential fields are required depends on the channel: Slack, Discord and
 * the generic webhook need {@code webhook}; Telegram needs {@code token} and
 * {@code chatId}; email needs {@code email}; SMS uses {@code webhook} as the gateway URL,
 * {@code token} as the API key and {@code chatId} as the phone number; push uses
 * {@code webhook} and {@code token}.
 */
@Value
@Builder(toBuilder = true)
public class ChannelConfig {

    boolean enabled;
    String webhook;
    String token;
    String chatId;
    String email;

    /** Overrides the default template for this channel when set. */
    String template;

    /** Null means unlimited. */
    RateLimit rateLimit;

    public static ChannelConfig disabled() {
        return ChannelConfig.builder().enabled(false).build();
    }

    public static ChannelConfig enabledDefault() {
        return ChannelConfig.builder().enabled(true).build();
    }
}
