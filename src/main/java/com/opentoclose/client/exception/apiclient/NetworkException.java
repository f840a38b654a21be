package com.opentoclose.client.exception.apiclient;

import java.io.Serial;

/**
 * Exception indicating that no response was received at all.
 *
 * <p>This exception is thrown on DNS failures, refused connections and timeouts. It carries no
 * status code and wraps the underlying transport error.
 */
public class NetworkException extends OpenToCloseApiException {

    @Serial
    private static final long serialVersionUID = 8116978127460555334L;

    /**
     * Constructs a new NetworkException.
     *
     * @param message  A descriptive message about the exception.
     * @param method   The HTTP method of the failing call.
     * @param endpoint The endpoint of the failing call.
     * @param cause    The underlying transport error.
     */
    public NetworkException(String message, String method, String endpoint, Throwable cause) {
        super(message, null, null, method, endpoint, cause);
    }
}
