package com.opentoclose.client.common.apiclient.model;

import lombok.Builder;
import lombok.Data;
import org.springframework.http.HttpMethod;
import org.springframework.lang.Nullable;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Describes one request to the Open To Close API.
 *
 * <p>A descriptor is built per call and discarded afterwards. At most one body flavour is used:
 * files switch the request to multipart (with {@link #formData} sent as plain parts), form data
 * alone is sent URL-encoded, otherwise {@link #jsonBody} is sent as JSON.
 */
@Builder
@Data
public class ApiRequest {

    /**
     * The HTTP method for the API request (GET, POST, PUT, PATCH or DELETE).
     */
    private final HttpMethod method;

    /**
     * The endpoint path, relative to the client's base URL.
     */
    private final String endpoint;

    /**
     * Query parameters to be included in the API request.
     *
     * <p>Always mutable so that authentication can add to it. Collection values expand to repeated
     * parameters.
     */
    @Builder.Default
    private final Map<String, Object> queryParams = new LinkedHashMap<>();

    /**
     * Optional JSON body, either an object or an array.
     */
    @Nullable
    private final Object jsonBody;

    /**
     * Optional form fields, passed through unchanged.
     */
    @Nullable
    private final Map<String, Object> formData;

    /**
     * Optional file parts keyed by form field name, passed through unchanged.
     */
    @Nullable
    private final Map<String, Object> files;

    /**
     * Describes this request without its query string, so that the API token never reaches the
     * logs.
     *
     * @return the method and endpoint.
     */
    public String describe() {
        return method + " " + endpoint;
    }
}
