package com.opentoclose.client.exception.apiclient;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Getter;

import java.io.Serial;

/**
 * Exception indicating that too many requests were made (HTTP 429).
 *
 * <p>The client never waits or retries on its own; {@link #getRetryAfter()} exposes the
 * server's {@code Retry-After} hint in seconds so the caller can decide.
 */
@Getter
public class RateLimitException extends OpenToCloseApiException {

    @Serial
    private static final long serialVersionUID = 2824037461213174468L;

    private final Integer retryAfter;

    /**
     * Constructs a new RateLimitException.
     *
     * @param message      A descriptive message about the exception.
     * @param statusCode   The HTTP status code.
     * @param responseData The decoded response body.
     * @param method       The HTTP method of the failing call.
     * @param endpoint     The endpoint of the failing call.
     * @param retryAfter   Seconds to wait before retrying, or {@code null} if the server gave no hint.
     */
    public RateLimitException(String message, Integer statusCode, JsonNode responseData, String method,
                              String endpoint, Integer retryAfter) {
        super(message, statusCode, responseData, method, endpoint);
        this.retryAfter = retryAfter;
    }
}
