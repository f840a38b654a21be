package com.opentoclose.client.exception.apiclient;

import com.fasterxml.jackson.databind.JsonNode;

import java.io.Serial;

/**
 * Exception indicating a provider-side failure (HTTP 500-599).
 */
public class ServerException extends OpenToCloseApiException {

    @Serial
    private static final long serialVersionUID = 7357721449449770205L;

    public ServerException(String message, Integer statusCode, JsonNode responseData, String method,
                           String endpoint) {
        super(message, statusCode, responseData, method, endpoint);
    }
}
