package com.scorpius.notification;

import com.scorpius.domain.enums.NotificationChannel;
import com.scorpius.domain.enums.NotificationType;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Built-in message templates per notification type and channel.
 *
 * <p>Email templates are HTML, Slack uses mrkdwn and Telegram uses Markdown. Types or
 * channels without an entry fall back to the raw payload message.
 */
public final class NotificationTemplates {

    private static final Map<NotificationType, String> TITLES = new EnumMap<>(NotificationType.class);
    private static final Map<NotificationType, Map<NotificationChannel, String>> BODIES =
            new EnumMap<>(NotificationType.class);

    static {
        TITLES.put(NotificationType.VULNERABILITY_FOUND, "🚨 Vulnerability Detected");
        register(
                NotificationType.VULNERABILITY_FOUND,
                "<h2>Security Vulnerability Found</h2>\n"
                        + "<p>A vulnerability has been detected in your smart contract scan.</p>\n"
                        + "<p><strong>Severity:</strong> {{severity}}</p>\n"
                        + "<p><strong>Contract:</strong> {{contractAddress}}</p>\n"
                        + "<p><strong>Description:</strong> {{description}}</p>\n"
                        + "<a href=\"{{dashboardUrl}}\">View Details</a>",
                "🚨 *Vulnerability Detected*\n\n*Severity:* {{severity}}\n*Contract:* {{contractAddress}}\n"
                        + "*Description:* {{description}}\n\n<{{dashboardUrl}}|View Details>",
                "🚨 *Vulnerability Detected*\n\n*Severity:* {{severity}}\n*Contract:* `{{contractAddress}}`\n"
                        + "*Description:* {{description}}\n\n[View Details]({{dashboardUrl}})");

        TITLES.put(NotificationType.SCAN_COMPLETED, "✅ Scan Completed");
        register(
                NotificationType.SCAN_COMPLETED,
                "<h2>Scan Completed Successfully</h2>\n"
                        + "<p>Your smart contract scan has been completed.</p>\n"
                        + "<p><strong>Scan ID:</strong> {{scanId}}</p>\n"
                        + "<p><strong>Duration:</strong> {{duration}}</p>\n"
                        + "<p><strong>Issues Found:</strong> {{issuesCount}}</p>\n"
                        + "<a href=\"{{dashboardUrl}}\">View Results</a>",
                "✅ *Scan Completed*\n\n*Scan ID:* {{scanId}}\n*Duration:* {{duration}}\n"
                        + "*Issues Found:* {{issuesCount}}\n\n<{{dashboardUrl}}|View Results>",
                "✅ *Scan Completed*\n\n*Scan ID:* `{{scanId}}`\n*Duration:* {{duration}}\n"
                        + "*Issues Found:* {{issuesCount}}\n\n[View Results]({{dashboardUrl}})");

        TITLES.put(NotificationType.MEV_OPPORTUNITY, "💰 MEV Opportunity");
        register(
                NotificationType.MEV_OPPORTUNITY,
                "<h2>MEV Opportunity Detected</h2>\n"
                        + "<p>A potential MEV opportunity has been identified.</p>\n"
                        + "<p><strong>Type:</strong> {{mevType}}</p>\n"
                        + "<p><strong>Estimated Profit:</strong> {{estimatedProfit}} ETH</p>\n"
                        + "<p><strong>Transaction:</strong> {{transactionHash}}</p>\n"
                        + "<a href=\"{{dashboardUrl}}\">View Details</a>",
                "💰 *MEV Opportunity*\n\n*Type:* {{mevType}}\n*Estimated Profit:* {{estimatedProfit}} ETH\n"
                        + "*Transaction:* {{transactionHash}}\n\n<{{dashboardUrl}}|View Details>",
                "💰 *MEV Opportunity*\n\n*Type:* {{mevType}}\n*Estimated Profit:* {{estimatedProfit}} ETH\n"
                        + "*Transaction:* `{{transactionHash}}`\n\n[View Details]({{dashboardUrl}})");

        TITLES.put(NotificationType.SYSTEM_ALERT, "⚠️ System Alert");
        register(
                NotificationType.SYSTEM_ALERT,
                "<h2>System Alert</h2>\n"
                        + "<p>A system alert has been triggered.</p>\n"
                        + "<p><strong>Alert Type:</strong> {{alertType}}</p>\n"
                        + "<p><strong>Description:</strong> {{description}}</p>\n"
                        + "<p><strong>Time:</strong> {{timestamp}}</p>",
                "⚠️ *System Alert*\n\n*Type:* {{alertType}}\n*Description:* {{description}}\n"
                        + "*Time:* {{timestamp}}",
                "⚠️ *System Alert*\n\n*Type:* {{alertType}}\n*Description:* {{description}}\n"
                        + "*Time:* {{timestamp}}");
    }

    private NotificationTemplates() {}

    public static Optional<String> body(NotificationType type, NotificationChannel channel) {
        Map<NotificationChannel, String> byChannel = BODIES.get(type);
        return Optional.ofNullable(byChannel != null ? byChannel.get(channel) : null);
    }

    public static Optional<String> title(NotificationType type) {
        return Optional.ofNullable(TITLES.get(type));
    }

    private static void register(NotificationType type, String email, String slack, String telegram) {
        Map<NotificationChannel, String> byChannel = new EnumMap<>(NotificationChannel.class);
        byChannel.put(NotificationChannel.EMAIL, email);
        byChannel.put(NotificationChannel.SLACK, slack);
        byChannel.put(NotificationChannel.TELEGRAM, telegram);
        BODIES.put(type, byChannel);
    }
}
