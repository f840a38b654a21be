package com.opentoclose.client.exception.apiclient;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.Serial;

/**
 * Base class for every error raised by the Open To Close client.
 *
 * <p>Catching this type catches the whole taxonomy. It is also thrown directly for HTTP status
 * codes that have no dedicated subtype. Each instance carries the HTTP status code (absent when no
 * response was received or the request was rejected locally), the decoded response payload, and
 * the method and endpoint of the failing call.
 *
 * <p>Every instance logs itself when constructed so that failures are visible even when a caller
 * swallows them.
 */
@Slf4j
@Getter
public class OpenToCloseApiException extends RuntimeException {

    @Serial
    private static final long serialVersionUID = 1098088204851906559L;

    private final Integer statusCode;
    private final transient JsonNode responseData;
    private final String method;
    private final String endpoint;

    /**
     * Constructs an exception for a failure detected before any request was sent.
     *
     * @param message A descriptive message about the exception.
     */
    public OpenToCloseApiException(String message) {
        this(message, null, null, null, null, null);
    }

    /**
     * Constructs an exception for a failed API call.
     *
     * @param message      A descriptive message about the exception.
     * @param statusCode   The HTTP status code, or {@code null} if no response was received.
     * @param responseData The decoded response body, if any.
     * @param method       The HTTP method of the failing call.
     * @param endpoint     The endpoint of the failing call.
     */
    public OpenToCloseApiException(String message, Integer statusCode, JsonNode responseData, String method,
                                   String endpoint) {
        this(message, statusCode, responseData, method, endpoint, null);
    }

    /**
     * Constructs an exception for a failed API call with an underlying cause.
     *
     * @param message      A descriptive message about the exception.
     * @param statusCode   The HTTP status code, or {@code null} if no response was received.
     * @param responseData The decoded response body, if any.
     * @param method       The HTTP method of the failing call.
     * @param endpoint     The endpoint of the failing call.
     * @param cause        The underlying cause, if any.
     */
    public OpenToCloseApiException(String message, Integer statusCode, JsonNode responseData, String method,
                                   String endpoint, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.responseData = responseData;
        this.method = method;
        this.endpoint = endpoint;
        logFailure();
    }

    private void logFailure() {
        if (statusCode == null && endpoint == null) {
            log.warn("{} raised before any request was sent: {}", getClass().getSimpleName(), getMessage());
            return;
        }
        log.error("{} for {} {} (status: {}): {}. Response payload: {}", getClass().getSimpleName(), method,
                  endpoint, statusCode, getMessage(), responseData);
    }
}
