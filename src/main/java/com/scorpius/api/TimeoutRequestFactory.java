package com.scorpius.api;

import java.time.Duration;
import org.springframework.http.client.ClientHttpRequestFactory;

/**
 * Creates the HTTP request factory for a given read timeout. The timeout aborts the
 * in-flight call; the pipeline keeps one factory per distinct timeout.
 */
@FunctionalInterface
public interface TimeoutRequestFactory {

    ClientHttpRequestFactory forTimeout(Duration readTimeout);
}
