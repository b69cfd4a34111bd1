package com.scorpius.api;

import java.time.Duration;
import java.util.Map;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.springframework.http.HttpMethod;

/**
 * Per-call options of {@link RequestPipeline#request}. Null {@code timeout} and
 * {@code retries} fall back to {@code scorpius.api.timeout} and {@code scorpius.api.retries}.
 */
@Value
@Builder
public class RequestOptions {

    @Builder.Default
    HttpMethod method = HttpMethod.GET;

    @Singular
    Map<String, String> headers;

    /** Serialized as JSON when present. */
    Object body;

    Duration timeout;

    Integer retries;

    public static RequestOptions of(HttpMethod method) {
        return RequestOptions.builder().method(method).build();
    }

    public static RequestOptions of(HttpMethod method, Object body) {
        return RequestOptions.builder().method(method).body(body).build();
    }
}
