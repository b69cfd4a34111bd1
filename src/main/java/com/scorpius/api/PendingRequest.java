package com.scorpius.api;

import java.net.URI;
import java.time.Duration;
import java.util.Map;
import lombok.Value;
import org.springframework.http.HttpMethod;

/**
 * One resolved {@code request()} call: absolute URL plus effective timeout and retry budget.
 * Lives only for the duration of the call.
 */
@Value
class PendingRequest {

    String endpoint;
    URI url;
    HttpMethod method;
    Map<String, String> headers;
    Object body;
    int retries;
    Duration timeout;
}
