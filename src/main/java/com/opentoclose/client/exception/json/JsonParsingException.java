package com.opentoclose.client.exception.json;

import java.io.Serial;

/**
 * Thrown when a response body cannot be decoded as JSON.
 */
public class JsonParsingException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 2488092323972527434L;

    public JsonParsingException(String message, Throwable cause) {
        super(message, cause);
    }
}
