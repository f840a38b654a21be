package com.opentoclose.client.exception.apiclient;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Getter;

import java.io.Serial;

/**
 * Exception indicating that a request was malformed.
 *
 * <p>Raised either locally, before any network call, when caller input fails validation, or when
 * the API answers HTTP 400. The two cases are distinguished only by {@link #getStatusCode()}, which
 * is {@code null} for local failures. Server-reported failures may carry per-field errors taken from
 * the response body.
 */
@Getter
public class ValidationException extends OpenToCloseApiException {

    @Serial
    private static final long serialVersionUID = -5002295663802925528L;

    private final transient JsonNode fieldErrors;

    /**
     * Constructs a new ValidationException for input rejected locally.
     *
     * @param message A descriptive message naming the field, the constraint and the actual value.
     */
    public ValidationException(String message) {
        super(message);
        this.fieldErrors = null;
    }

    /**
     * Constructs a new ValidationException for input rejected locally because a lookup it depends
     * on failed.
     *
     * @param message A descriptive message about the exception.
     * @param cause   The failure that prevented the input from being completed.
     */
    public ValidationException(String message, Throwable cause) {
        super(message, null, null, null, null, cause);
        this.fieldErrors = null;
    }

    /**
     * Constructs a new ValidationException for an HTTP 400 response.
     *
     * @param message      A descriptive message about the exception.
     * @param statusCode   The HTTP status code.
     * @param responseData The decoded response body.
     * @param method       The HTTP method of the failing call.
     * @param endpoint     The endpoint of the failing call.
     * @param fieldErrors  Field-level errors reported by the API, if any.
     */
    public ValidationException(String message, Integer statusCode, JsonNode responseData, String method,
                               String endpoint, JsonNode fieldErrors) {
        super(message, statusCode, responseData, method, endpoint);
        this.fieldErrors = fieldErrors;
    }
}
