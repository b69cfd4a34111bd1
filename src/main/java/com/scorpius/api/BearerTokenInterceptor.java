package com.scorpius.api;

import com.scorpius.auth.AuthCoordinator;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpRequest;
import org.springframework.http.client.ClientHttpRequestExecution;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.stereotype.Component;

/**
 * Adds {@code Authorization: Bearer <token>} from {@link AuthCoordinator#ensureValidToken()}.
 * An expiring token is refreshed before the request leaves. Anonymous requests and requests
 * that already carry an Authorization header pass through unchanged.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class BearerTokenInterceptor implements ClientHttpRequestInterceptor {

    private static final Logger log = LoggerFactory.getLogger(BearerTokenInterceptor.class);

    private final AuthCoordinator authCoordinator;

    public BearerTokenInterceptor(AuthCoordinator authCoordinator) {
        this.authCoordinator = authCoordinator;
    }

    @Override
    public ClientHttpResponse intercept(HttpRequest request, byte[] body, ClientHttpRequestExecution execution)
            throws IOException {
        if (!request.getHeaders().containsKey(HttpHeaders.AUTHORIZATION)) {
            String token = authCoordinator.ensureValidToken();
            if (token != null) {
                request.getHeaders().setBearerAuth(token);
            } else {
                log.debug("No access token, sending {} {} anonymously", request.getMethod(), request.getURI());
            }
        }
        return execution.execute(request, body);
    }
}
