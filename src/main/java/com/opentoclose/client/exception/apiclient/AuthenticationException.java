package com.opentoclose.client.exception.apiclient;

import com.fasterxml.jackson.databind.JsonNode;

import java.io.Serial;

/**
 * Exception indicating that the credential was missing or rejected (HTTP 401).
 *
 * <p>Also raised when no API token can be resolved while constructing a client, and when the API
 * serves an HTML login page instead of JSON.
 */
public class AuthenticationException extends OpenToCloseApiException {

    @Serial
    private static final long serialVersionUID = -4510274804115958621L;

    /**
     * Constructs a new AuthenticationException for a credential problem detected locally.
     *
     * @param message A descriptive message about the exception.
     */
    public AuthenticationException(String message) {
        super(message);
    }

    /**
     * Constructs a new AuthenticationException for a failed API call.
     *
     * @param message      A descriptive message about the exception.
     * @param statusCode   The HTTP status code.
     * @param responseData The decoded response body.
     * @param method       The HTTP method of the failing call.
     * @param endpoint     The endpoint of the failing call.
     */
    public AuthenticationException(String message, Integer statusCode, JsonNode responseData, String method,
                                   String endpoint) {
        super(message, statusCode, responseData, method, endpoint);
    }
}
