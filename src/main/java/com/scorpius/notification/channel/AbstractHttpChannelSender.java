package com.scorpius.notification.channel;

import com.scorpius.domain.model.ChannelConfig;
import com.scorpius.domain.model.RenderedNotification;
import com.scorpius.exception.ChannelDeliveryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Base for channels that deliver with one JSON POST. Subclasses validate the config,
 * build the body and pick the URL; this class performs the call and maps any failure to
 * {@code false}.
 */
public abstract class AbstractHttpChannelSender implements ChannelSender {

    protected final Logger log = LoggerFactory.getLogger(getClass());

    private final RestClient restClient;

    protected AbstractHttpChannelSender(RestClient restClient) {
        this.restClient = restClient;
    }

    @Override
    public boolean send(ChannelConfig config, RenderedNotification notification) {
        if (config == null || !hasRequiredConfig(config)) {
            log.debug("{} channel not configured, skipping {}", channel().getValue(), notification.getPayload().getId());
            return false;
        }
        try {
            post(url(config), bearerToken(config), body(config, notification));
            log.debug("{} notification sent: {}", channel().getValue(), notification.getTitle());
            return true;
        } catch (ChannelDeliveryException e) {
            log.error("{} notification failed: {}", channel().getValue(), e.getMessage());
            return false;
        } catch (RuntimeException e) {
            log.error("Failed to send {} notification: {}", channel().getValue(), e.getClass().getSimpleName());
            return false;
        }
    }

    protected abstract boolean hasRequiredConfig(ChannelConfig config);

    protected abstract String url(ChannelConfig config);

    protected abstract Object body(ChannelConfig config, RenderedNotification notification);

    /** Bearer credential for the call, none by default. */
    protected String bearerToken(ChannelConfig config) {
        return null;
    }

    private void post(String url, String bearerToken, Object body) {
        ResponseEntity<Void> response;
        try {
            response = restClient
                    .post()
                    .uri(url)
                    .contentType(MediaType.APPLICATION_JSON)
                    .headers(headers -> {
                        if (bearerToken != null) {
                            headers.setBearerAuth(bearerToken);
                        }
                    })
                    .body(body)
                    .retrieve()
                    .toBodilessEntity();
        } catch (RestClientResponseException e) {
            throw new ChannelDeliveryException(channel(), "HTTP " + e.getStatusCode().value(), e);
        } catch (RestClientException e) {
            // message embeds the request URL; webhook and bot URLs carry credentials
            Throwable cause = NestedExceptionUtils.getMostSpecificCause(e);
            throw new ChannelDeliveryException(channel(), "request failed (" + cause.getClass().getSimpleName() + ")", e);
        }
        if (!response.getStatusCode().is2xxSuccessful()) {
            throw new ChannelDeliveryException(channel(), "HTTP " + response.getStatusCode().value());
        }
    }

    protected static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
