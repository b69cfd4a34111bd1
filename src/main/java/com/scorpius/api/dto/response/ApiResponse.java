package com.scorpius.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import lombok.Getter;

/**
 * Uniform result of {@link com.scorpius.api.RequestPipeline} calls.
 *
 * <p>Backends that wrap results as {@code {success, data, message, timestamp}} are unwrapped
 * into this shape; plain JSON bodies become {@code data} with {@code success = true}.
 */
@Getter
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {

    private final boolean success;
    private final T data;
    private final String message;
    private final Instant timestamp;
    private final int status;

    private ApiResponse(boolean success, T data, String message, Instant timestamp, int status) {
        this.success = success;
        this.data = data;
        this.message = message;
        this.timestamp = timestamp != null ? timestamp : Instant.now();
        this.status = status;
    }

    public static <T> ApiResponse<T> of(T data) {
        return new ApiResponse<>(true, data, null, null, 200);
    }

    public static <T> ApiResponse<T> of(boolean success, T data, String message, Instant timestamp, int status) {
        return new ApiResponse<>(success, data, message, timestamp, status);
    }
}
