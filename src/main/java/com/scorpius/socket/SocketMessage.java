package com.scorpius.socket;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Envelope of every frame on the backend socket, in both directions: {@code {type, payload}}
 * with an optional timestamp and id.
 *
 * <p>Reserved inbound types are {@code live_update}, {@code auth_required} and
 * {@code error}; every other type is forwarded to its subscribers unchanged.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class SocketMessage {

    public static final String LIVE_UPDATE = "live_update";
    public static final String AUTH_REQUIRED = "auth_required";
    public static final String ERROR = "error";

    private String type;

    private JsonNode payload;

    private String timestamp;

    private String id;

    public static SocketMessage of(String type, JsonNode payload) {
        return SocketMessage.builder().type(type).payload(payload).build();
    }
}
