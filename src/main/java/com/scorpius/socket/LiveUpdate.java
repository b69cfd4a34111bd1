package com.scorpius.socket;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Payload of a {@code live_update} frame. Subscribers of {@link #type} receive {@link #data};
 * subscribers of {@code live_update} receive the whole update.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class LiveUpdate {

    private String type;
    private JsonNode data;
    private String timestamp;
}
