package com.opentoclose.client.common.apiclient.model;

import lombok.Builder;
import lombok.Getter;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.lang.Nullable;

import java.time.Instant;

/**
 * Represents the raw response of an API call before it is decoded.
 */
@Builder
@Getter
public class ApiResponse {

    /**
     * The response body as text.
     *
     * <p>Empty when the response had no body, and never read for HTTP 204.
     */
    @Builder.Default
    private final String body = "";

    /**
     * The media type of the response, if the server declared one.
     */
    @Nullable
    private final MediaType contentType;

    /**
     * The HTTP headers from the response.
     */
    @Nullable
    private final HttpHeaders headers;

    /**
     * The HTTP status code of the response.
     */
    private final int statusCode;

    /**
     * The timestamp when the response was received.
     */
    private final Instant timestamp;

    /**
     * Returns whether the server declared an HTML body.
     *
     * @return {@code true} if the content type is compatible with {@code text/html}.
     */
    public boolean isHtml() {
        return contentType != null && MediaType.TEXT_HTML.isCompatibleWith(contentType);
    }
}
