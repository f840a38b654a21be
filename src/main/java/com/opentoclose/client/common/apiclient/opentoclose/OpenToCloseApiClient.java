package com.opentoclose.client.common.apiclient.opentoclose;

import com.fasterxml.jackson.databind.JsonNode;
import com.opentoclose.client.common.apiclient.ApiClient;
import com.opentoclose.client.common.apiclient.authentication.Authentication;
import com.opentoclose.client.common.apiclient.model.ApiRequest;
import com.opentoclose.client.common.apiclient.model.ApiResponse;
import com.opentoclose.client.common.apiclient.model.HeaderConfig;
import com.opentoclose.client.common.json.JsonParser;
import com.opentoclose.client.exception.apiclient.AuthenticationException;
import com.opentoclose.client.exception.apiclient.ServerException;
import com.opentoclose.client.exception.json.JsonParsingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.http.codec.ClientCodecConfigurer;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Transport client for the Open To Close REST API.
 *
 * <p>Turns a method, endpoint and payload into one HTTP call, authenticated with the
 * {@code api_token} query parameter, and decodes the body. Successful bodies that are empty or not
 * JSON decode to an empty object; HTTP 204 decodes to an empty object without reading the body.
 */
@Slf4j
public class OpenToCloseApiClient extends ApiClient {

    public static final String DEFAULT_BASE_URL = "https://api.opentoclose.com/v1";
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);
    public static final String DEFAULT_USER_AGENT = "open-to-close-java-client/1.0.0";
    /**
     * No limit on the size of a buffered response body.
     */
    public static final int DEFAULT_MAX_IN_MEMORY_SIZE = -1;

    /**
     * Constructs a new OpenToCloseApiClient.
     *
     * @param webClient      The WebClient for making HTTP requests.
     * @param authentication The token authentication applied to every request.
     * @param headerConfig   The headers sent with every request.
     * @param jsonParser     The JSON parser for decoding responses.
     * @param baseUrl        The API base URL, used verbatim.
     * @param timeout        The per-request timeout.
     */
    public OpenToCloseApiClient(WebClient webClient, Authentication authentication, HeaderConfig headerConfig,
                                JsonParser jsonParser, String baseUrl, Duration timeout) {
        super(webClient, authentication, headerConfig, jsonParser, baseUrl, timeout);
        log.info("Initialized Open To Close API client with base URL: {} and timeout: {}", baseUrl, timeout);
    }

    /**
     * Codec settings for the WebClient behind this client. Response bodies are buffered whole and
     * must fit within the limit.
     *
     * @param maxInMemorySize the buffer limit in bytes, {@code -1} for no limit.
     *
     * @return the codec customizer to pass to {@link WebClient.Builder#codecs}.
     */
    public static Consumer<ClientCodecConfigurer> codecs(int maxInMemorySize) {
        return configurer -> configurer.defaultCodecs().maxInMemorySize(maxInMemorySize);
    }

    public JsonNode get(String endpoint, Map<String, ?> queryParams) {
        return execute(HttpMethod.GET, endpoint, queryParams, null);
    }

    public JsonNode post(String endpoint, Object jsonBody) {
        return execute(HttpMethod.POST, endpoint, null, jsonBody);
    }

    public JsonNode put(String endpoint, Object jsonBody) {
        return execute(HttpMethod.PUT, endpoint, null, jsonBody);
    }

    public JsonNode patch(String endpoint, Object jsonBody) {
        return execute(HttpMethod.PATCH, endpoint, null, jsonBody);
    }

    public JsonNode delete(String endpoint) {
        return execute(HttpMethod.DELETE, endpoint, null, null);
    }

    /**
     * Executes one request with an optional JSON body.
     *
     * @see #execute(HttpMethod, String, Map, Object, Map, Map)
     */
    public JsonNode execute(HttpMethod method, String endpoint, Map<String, ?> queryParams, Object jsonBody) {
        return execute(method, endpoint, queryParams, jsonBody, null, null);
    }

    /**
     * Executes one request and decodes its body.
     *
     * @param method      The HTTP method.
     * @param endpoint    The endpoint path; one leading slash is stripped.
     * @param queryParams Optional query parameters. The API token is added to a copy.
     * @param jsonBody    Optional JSON body, an object or an array.
     * @param formData    Optional form fields, passed through unchanged.
     * @param files       Optional file parts, passed through unchanged. Forces a multipart body.
     *
     * @return the decoded body, an empty object when there is none.
     */
    public JsonNode execute(HttpMethod method, String endpoint, Map<String, ?> queryParams, Object jsonBody,
                            Map<String, Object> formData, Map<String, Object> files) {
        Map<String, Object> query = new LinkedHashMap<>();
        if (queryParams != null) {
            query.putAll(queryParams);
        }
        ApiRequest apiRequest = ApiRequest.builder().method(method).endpoint(endpoint).queryParams(query)
                                          .jsonBody(jsonBody).formData(formData).files(files).build();
        return decode(call(apiRequest), apiRequest);
    }

    /**
     * Decodes a successful response. An HTML body on a success status means the API served a web
     * page instead of JSON: an error page raises {@link ServerException}, anything else is taken
     * for a login page and raises {@link AuthenticationException}.
     *
     * @param apiResponse The successful response.
     * @param apiRequest  The request that produced it.
     *
     * @return the decoded body.
     */
    private JsonNode decode(ApiResponse apiResponse, ApiRequest apiRequest) {
        if (apiResponse.getStatusCode() == 204) {
            return emptyObject();
        }

        if (apiResponse.isHtml()) {
            rejectHtml(apiResponse, apiRequest);
        }

        String body = apiResponse.getBody();
        if (body.isBlank()) {
            return emptyObject();
        }
        try {
            return jsonParser.parseTree(body);
        } catch (JsonParsingException e) {
            log.warn("Successful response for {} is not JSON, treating it as an empty object", apiRequest.describe());
            return emptyObject();
        }
    }

    private void rejectHtml(ApiResponse apiResponse, ApiRequest apiRequest) {
        String method = apiRequest.getMethod().name();
        String endpoint = apiRequest.getEndpoint();
        String page = apiResponse.getBody().toLowerCase(Locale.ROOT);
        String contentType = String.valueOf(apiResponse.getContentType());

        if (page.contains("error occurred") || page.contains("internal server error")) {
            throw new ServerException("Server returned HTML error page for " + method + " " + endpoint
                                      + ". The endpoint may not be available or implemented.",
                                      apiResponse.getStatusCode(),
                                      jsonParser.toTree(htmlDetails("Server error returned as HTML", contentType)),
                                      method, endpoint);
        }
        throw new AuthenticationException("Received HTML login page instead of JSON for " + method + " " + endpoint
                                          + ". Check authentication or endpoint availability.",
                                          apiResponse.getStatusCode(),
                                          jsonParser.toTree(htmlDetails("Authentication required", contentType)),
                                          method, endpoint);
    }

    private static Map<String, Object> htmlDetails(String message, String contentType) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("message", message);
        details.put("content_type", contentType);
        return details;
    }

    private JsonNode emptyObject() {
        return jsonParser.toTree(Map.of());
    }
}
