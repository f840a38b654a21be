package com.opentoclose.client.exception.apiclient;

import com.fasterxml.jackson.databind.JsonNode;

import java.io.Serial;

/**
 * Exception indicating that a resource was not found (HTTP 404).
 *
 * <p>This exception is thrown when the API cannot find the requested resource id.
 */
public class NotFoundException extends OpenToCloseApiException {

    @Serial
    private static final long serialVersionUID = 4667162519612026425L;

    /**
     * Constructs a new NotFoundException.
     *
     * @param message      A descriptive message about the exception.
     * @param statusCode   The HTTP status code.
     * @param responseData The decoded response body.
     * @param method       The HTTP method of the failing call.
     * @param endpoint     The endpoint of the failing call.
     */
    public NotFoundException(String message, Integer statusCode, JsonNode responseData, String method,
                             String endpoint) {
        super(message, statusCode, responseData, method, endpoint);
    }
}
