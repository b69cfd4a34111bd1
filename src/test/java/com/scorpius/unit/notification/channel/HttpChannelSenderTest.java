package com.scorpius.unit.notification.channel;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.headerDoesNotExist;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.scorpius.domain.enums.NotificationChannel;
import com.scorpius.domain.enums.NotificationPriority;
import com.scorpius.domain.enums.NotificationType;
import com.scorpius.domain.model.ChannelConfig;
import com.scorpius.domain.model.NotificationPayload;
import com.scorpius.domain.model.RenderedNotification;
import com.scorpius.notification.channel.DiscordChannelSender;
import com.scorpius.notification.channel.PushChannelSender;
import com.scorpius.notification.channel.SlackChannelSender;
import com.scorpius.notification.channel.SmsChannelSender;
import com.scorpius.notification.channel.TelegramChannelSender;
import com.scorpius.notification.channel.WebhookChannelSender;
import java.io.IOException;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

/**
 * Unit tests for the HTTP channel senders: request URL and body shape per channel, missing
 * credentials short-circuiting without I/O, and failures mapped to {@code false}.
 */
@ExtendWith(OutputCaptureExtension.class)
class HttpChannelSenderTest {

    private static final Instant TS = Instant.parse("2026-03-02T10:00:00Z");

    private MockRestServiceServer server;
    private RestClient restClient;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        restClient = builder.build();
    }

    private static RenderedNotification rendered(NotificationChannel channel, String body) {
        NotificationPayload payload = NotificationPayload.builder()
                .id("n-1")
                .type(NotificationType.VULNERABILITY_FOUND)
                .title("Reentrancy")
                .message("Reentrancy in withdraw()")
                .priority(NotificationPriority.HIGH)
                .timestamp(TS)
                .dataEntry("severity", "high")
                .build();
        return RenderedNotification.builder()
                .channel(channel)
                .title("Reentrancy")
                .body(body)
                .templated(true)
                .payload(payload)
                .build();
    }

    private static ChannelConfig webhook(String url) {
        return ChannelConfig.builder().enabled(true).webhook(url).build();
    }

    @Nested
    @DisplayName("Slack")
    class Slack {

        @Test
        @DisplayName("Posts title and a priority-colored attachment")
        void postsAttachment() {
            server.expect(requestTo("https://hooks.slack.test/T/B/x"))
                    .andExpect(method(HttpMethod.POST))
                    .andExpect(jsonPath("$.text").value("Reentrancy"))
                    .andExpect(jsonPath("$.attachments[0].color").value("#ea580c"))
                    .andExpect(jsonPath("$.attachments[0].text").value("*Severity:* high"))
                    .andExpect(jsonPath("$.attachments[0].ts").value(TS.getEpochSecond()))
                    .andRespond(withSuccess());

            boolean sent = new SlackChannelSender(restClient)
                    .send(webhook("https://hooks.slack.test/T/B/x"), rendered(NotificationChannel.SLACK, "*Severity:* high"));

            assertThat(sent).isTrue();
            server.verify();
        }

        @Test
        @DisplayName("Missing webhook returns false without I/O")
        void missingWebhook() {
            boolean sent = new SlackChannelSender(restClient)
                    .send(ChannelConfig.enabledDefault(), rendered(NotificationChannel.SLACK, "b"));

            assertThat(sent).isFalse();
            server.verify();
        }

        @Test
        @DisplayName("Non-2xx response returns false")
        void serverError() {
            server.expect(requestTo("https://hooks.slack.test/T/B/x")).andRespond(withServerError());

            assertThat(new SlackChannelSender(restClient)
                            .send(webhook("https://hooks.slack.test/T/B/x"), rendered(NotificationChannel.SLACK, "b")))
                    .isFalse();
        }

        @Test
        @DisplayName("Transport failure returns false")
        void networkError() {
            server.expect(requestTo("https://hooks.slack.test/T/B/x")).andRespond(withException(new IOException("reset")));

            assertThat(new SlackChannelSender(restClient)
                            .send(webhook("https://hooks.slack.test/T/B/x"), rendered(NotificationChannel.SLACK, "b")))
                    .isFalse();
        }
    }

    @Nested
    @DisplayName("Telegram")
    class Telegram {

        @Test
        @DisplayName("Posts Markdown to the bot API of the configured token")
        void postsMarkdown() {
            server.expect(requestTo("https://api.telegram.org/botbot-token/sendMessage"))
                    .andExpect(jsonPath("$.chat_id").value("42"))
                    .andExpect(jsonPath("$.text").value("*Vulnerability*"))
                    .andExpect(jsonPath("$.parse_mode").value("Markdown"))
                    .andExpect(jsonPath("$.disable_web_page_preview").value(false))
                    .andRespond(withSuccess());

            ChannelConfig config = ChannelConfig.builder().enabled(true).token("bot-token").chatId("42").build();

            assertThat(new TelegramChannelSender(restClient)
                            .send(config, rendered(NotificationChannel.TELEGRAM, "*Vulnerability*")))
                    .isTrue();
            server.verify();
        }

        @Test
        @DisplayName("Token without chat id returns false without I/O")
        void missingChatId() {
            ChannelConfig config = ChannelConfig.builder().enabled(true).token("bot-token").build();

            assertThat(new TelegramChannelSender(restClient).send(config, rendered(NotificationChannel.TELEGRAM, "b")))
                    .isFalse();
            server.verify();
        }

        @Test
        @DisplayName("Rejected token returns false")
        void unauthorized() {
            server.expect(requestTo("https://api.telegram.org/botbad/sendMessage"))
                    .andRespond(withStatus(HttpStatus.UNAUTHORIZED));
            ChannelConfig config = ChannelConfig.builder().enabled(true).token("bad").chatId("42").build();

            assertThat(new TelegramChannelSender(restClient).send(config, rendered(NotificationChannel.TELEGRAM, "b")))
                    .isFalse();
        }
    }

    @Test
    void telegram_networkFailure_logsWithoutBotToken(CapturedOutput output) {
        server.expect(requestTo("https://api.telegram.org/botSECRET123/sendMessage"))
                .andRespond(withException(new IOException("Connection reset")));
        ChannelConfig config = ChannelConfig.builder().enabled(true).token("SECRET123").chatId("42").build();

        assertThat(new TelegramChannelSender(restClient).send(config, rendered(NotificationChannel.TELEGRAM, "b")))
                .isFalse();

        assertThat(output).contains("telegram notification failed: request failed (IOException)");
        assertThat(output).doesNotContain("SECRET123");
    }

    @Test
    void discord_postsEmbedWithDataFields() {
        server.expect(requestTo("https://discord.test/api/webhooks/1/x"))
                .andExpect(jsonPath("$.embeds[0].title").value("Reentrancy"))
                .andExpect(jsonPath("$.embeds[0].description").value("Reentrancy in withdraw()"))
                .andExpect(jsonPath("$.embeds[0].color").value(0xea580c))
                .andExpect(jsonPath("$.embeds[0].timestamp").value("2026-03-02T10:00:00Z"))
                .andExpect(jsonPath("$.embeds[0].fields[0].name").value("severity"))
                .andExpect(jsonPath("$.embeds[0].fields[0].value").value("high"))
                .andExpect(jsonPath("$.embeds[0].fields[0].inline").value(true))
                .andRespond(withStatus(HttpStatus.NO_CONTENT));

        assertThat(new DiscordChannelSender(restClient)
                        .send(webhook("https://discord.test/api/webhooks/1/x"), rendered(NotificationChannel.DISCORD, "b")))
                .isTrue();
        server.verify();
    }

    @Test
    void webhook_forwardsPayloadAsJson() {
        server.expect(requestTo("https://hooks.test/in"))
                .andExpect(jsonPath("$.id").value("n-1"))
                .andExpect(jsonPath("$.type").value("vulnerability_found"))
                .andExpect(jsonPath("$.priority").value("high"))
                .andExpect(jsonPath("$.data.severity").value("high"))
                .andRespond(withSuccess());

        assertThat(new WebhookChannelSender(restClient)
                        .send(webhook("https://hooks.test/in"), rendered(NotificationChannel.WEBHOOK, "b")))
                .isTrue();
        server.verify();
    }

    @Test
    void sms_postsToGatewayWithApiKey() {
        server.expect(requestTo("https://sms.test/send"))
                .andExpect(header("Authorization", "Bearer sms-key"))
                .andExpect(jsonPath("$.to").value("+15550100"))
                .andExpect(jsonPath("$.message").value("Reentrancy\nReentrancy in withdraw()"))
                .andRespond(withSuccess());
        ChannelConfig config = ChannelConfig.builder()
                .enabled(true)
                .webhook("https://sms.test/send")
                .token("sms-key")
                .chatId("+15550100")
                .build();

        assertThat(new SmsChannelSender(restClient).send(config, rendered(NotificationChannel.SMS, "b"))).isTrue();
        server.verify();
    }

    @Test
    void sms_missingPhoneNumber_noIo() {
        assertThat(new SmsChannelSender(restClient)
                        .send(webhook("https://sms.test/send"), rendered(NotificationChannel.SMS, "b")))
                .isFalse();
        server.verify();
    }

    @Test
    void push_postsPayloadWithoutTokenWhenAbsent() {
        server.expect(requestTo("https://push.test/notify"))
                .andExpect(headerDoesNotExist("Authorization"))
                .andExpect(jsonPath("$.title").value("Reentrancy"))
                .andExpect(jsonPath("$.body").value("Reentrancy in withdraw()"))
                .andExpect(jsonPath("$.priority").value("high"))
                .andExpect(jsonPath("$.tag").value("n-1"))
                .andRespond(withSuccess());

        assertThat(new PushChannelSender(restClient)
                        .send(webhook("https://push.test/notify"), rendered(NotificationChannel.PUSH, "b")))
                .isTrue();
        server.verify();
    }
}
