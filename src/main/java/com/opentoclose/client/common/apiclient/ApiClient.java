package com.opentoclose.client.common.apiclient;

import com.fasterxml.jackson.databind.JsonNode;
import com.opentoclose.client.common.apiclient.authentication.Authentication;
import com.opentoclose.client.common.apiclient.model.ApiRequest;
import com.opentoclose.client.common.apiclient.model.ApiResponse;
import com.opentoclose.client.common.apiclient.model.HeaderConfig;
import com.opentoclose.client.common.json.JsonParser;
import com.opentoclose.client.exception.apiclient.AuthenticationException;
import com.opentoclose.client.exception.apiclient.NetworkException;
import com.opentoclose.client.exception.apiclient.NotFoundException;
import com.opentoclose.client.exception.apiclient.OpenToCloseApiException;
import com.opentoclose.client.exception.apiclient.RateLimitException;
import com.opentoclose.client.exception.apiclient.ServerException;
import com.opentoclose.client.exception.apiclient.ValidationException;
import com.opentoclose.client.exception.json.JsonParsingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.lang.NonNull;
import org.springframework.util.CollectionUtils;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeoutException;

/**
 * Abstract base class for API clients, providing common functionality for making API calls,
 * handling responses, and mapping failures onto the client's exception taxonomy. Subclasses
 * decide how successful bodies are decoded.
 *
 * <p>Exactly one HTTP request is sent per {@link #call(ApiRequest)}. Nothing is retried, cached or
 * batched. Instances hold only immutable state and are safe to share between threads.
 */
@Slf4j
public abstract class ApiClient {

    protected final WebClient webClient;
    protected final Authentication authentication;
    protected final HeaderConfig headerConfig;
    protected final JsonParser jsonParser;
    protected final String baseUrl;
    protected final Duration timeout;

    protected ApiClient(WebClient webClient, Authentication authentication, HeaderConfig headerConfig,
                        JsonParser jsonParser, String baseUrl, Duration timeout) {
        this.webClient = Objects.requireNonNull(webClient, "webClient must not be null");
        this.authentication = Objects.requireNonNull(authentication, "authentication must not be null");
        this.headerConfig = headerConfig;
        this.jsonParser = Objects.requireNonNull(jsonParser, "jsonParser must not be null");
        this.baseUrl = validateBaseUrl(baseUrl);
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
    }

    /**
     * Executes an API call based on the provided {@link ApiRequest}. This method applies
     * authentication and headers, sends the request and maps failures.
     *
     * @param apiRequest The API request to execute. Must not be null.
     *
     * @return The raw API response, always with a 2xx status code.
     *
     * @throws NetworkException        If no response was received.
     * @throws OpenToCloseApiException If the API answered with an error status.
     */
    protected ApiResponse call(@NonNull ApiRequest apiRequest) {
        Objects.requireNonNull(apiRequest, "apiRequest must not be null");
        validateEndpoint(apiRequest.getEndpoint());
        log.info("Calling API with method: {} and endpoint: {}", apiRequest.getMethod(), apiRequest.getEndpoint());

        authentication.applyAuthentication(apiRequest);
        URI uri = buildUri(apiRequest);
        log.debug("Request has json body: {}, form data: {}, files: {}, query parameters: {}",
                  apiRequest.getJsonBody() != null, apiRequest.getFormData() != null, apiRequest.getFiles() != null,
                  apiRequest.getQueryParams().size());

        ApiResponse apiResponse;
        try {
            WebClient.RequestBodySpec requestBodySpec = webClient.method(apiRequest.getMethod()).uri(uri);
            configureHeaders(requestBodySpec);
            configureBody(apiRequest, requestBodySpec);
            apiResponse = requestBodySpec.exchangeToMono(this::readResponse).timeout(timeout).block();
        } catch (OpenToCloseApiException e) {
            throw e;
        } catch (Exception e) {
            throw mapException(e, apiRequest);
        }

        if (apiResponse == null) {
            throw new OpenToCloseApiException("No response received for " + apiRequest.describe(), null, null,
                                              apiRequest.getMethod().name(), apiRequest.getEndpoint());
        }
        log.debug("Received status {} for {}", apiResponse.getStatusCode(), apiRequest.describe());

        if (apiResponse.getStatusCode() >= 200 && apiResponse.getStatusCode() < 300) {
            return apiResponse;
        }
        throw createException(apiResponse, apiRequest);
    }

    /**
     * Maps a transport-level failure to a {@link NetworkException}. Anything that is not a transport
     * failure becomes a generic {@link OpenToCloseApiException}.
     *
     * @param error      The error raised while sending the request.
     * @param apiRequest The request that failed.
     *
     * @return the exception to throw.
     */
    private OpenToCloseApiException mapException(Throwable error, ApiRequest apiRequest) {
        Throwable cause = Exceptions.unwrap(error);
        String method = apiRequest.getMethod().name();
        String endpoint = apiRequest.getEndpoint();
        log.warn("Mapping exception for {}: {}", apiRequest.describe(), cause.toString());

        if (cause instanceof TimeoutException) {
            return new NetworkException("Request timed out for " + method + " " + endpoint + " after " + timeout,
                                        method, endpoint, cause);
        }
        if (cause instanceof WebClientRequestException || cause instanceof IOException) {
            return new NetworkException("Network error for " + method + " " + endpoint + ": " + cause.getMessage(),
                                        method, endpoint, cause);
        }
        return new OpenToCloseApiException("Unexpected error for " + method + " " + endpoint + ": " + cause.getMessage(),
                                           null, null, method, endpoint, cause);
    }

    /**
     * Builds the target URI. One leading slash is stripped from the endpoint before it is joined to
     * the base URL; the base URL itself is used verbatim. Query values are expanded as URI
     * variables so that they are strictly encoded.
     *
     * @param apiRequest The API request containing the endpoint and query parameters.
     *
     * @return the absolute URI.
     */
    private URI buildUri(ApiRequest apiRequest) {
        String endpoint = apiRequest.getEndpoint();
        String relative = endpoint.startsWith("/") ? endpoint.substring(1) : endpoint;
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(baseUrl + "/" + relative);

        Map<String, Object> variables = new HashMap<>();
        int index = 0;
        for (Map.Entry<String, Object> param : apiRequest.getQueryParams().entrySet()) {
            Collection<?> values = param.getValue() instanceof Collection<?> collection
                    ? collection
                    : Collections.singletonList(param.getValue());
            for (Object value : values) {
                if (value == null) {
                    continue;
                }
                String variable = "q" + index++;
                builder.queryParam(param.getKey(), "{" + variable + "}");
                variables.put(variable, value);
            }
        }
        return builder.encode().buildAndExpand(variables).toUri();
    }

    /**
     * Applies the headers from {@link HeaderConfig} to the request.
     *
     * @param requestBodySpec The request body specification to configure.
     */
    private void configureHeaders(WebClient.RequestBodySpec requestBodySpec) {
        if (headerConfig == null || headerConfig.getHeaders() == null) {
            return;
        }
        headerConfig.getHeaders().forEach(header -> requestBodySpec.header(header.getName(), header.getValue()));
    }

    /**
     * Configures the request body. Files switch the request to multipart with the form fields as
     * plain parts; form fields alone are sent URL-encoded; otherwise the JSON body, if any, is sent.
     *
     * @param apiRequest      The API request containing the body.
     * @param requestBodySpec The request body specification to configure.
     */
    private void configureBody(ApiRequest apiRequest, WebClient.RequestBodySpec requestBodySpec) {
        if (!CollectionUtils.isEmpty(apiRequest.getFiles())) {
            MultipartBodyBuilder multipart = new MultipartBodyBuilder();
            if (apiRequest.getFormData() != null) {
                apiRequest.getFormData().forEach((name, value) -> multipart.part(name, String.valueOf(value)));
            }
            apiRequest.getFiles().forEach(multipart::part);
            log.trace("Sending multipart body with {} file part(s)", apiRequest.getFiles().size());
            requestBodySpec.body(BodyInserters.fromMultipartData(multipart.build()));
            return;
        }

        if (apiRequest.getFormData() != null) {
            MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
            apiRequest.getFormData().forEach((name, value) -> form.add(name, String.valueOf(value)));
            log.trace("Sending form body with fields {}", form.keySet());
            requestBodySpec.body(BodyInserters.fromFormData(form));
            return;
        }

        if (apiRequest.getJsonBody() != null) {
            requestBodySpec.contentType(MediaType.APPLICATION_JSON);
            requestBodySpec.bodyValue(apiRequest.getJsonBody());
        }
    }

    /**
     * Reads the {@link ClientResponse} into an {@link ApiResponse}. A 204 body is released unread.
     *
     * @param response The client response.
     *
     * @return A {@link Mono} emitting the {@link ApiResponse}.
     */
    private Mono<ApiResponse> readResponse(ClientResponse response) {
        Instant timestamp = Instant.now();
        HttpHeaders headers = response.headers().asHttpHeaders();
        int statusCode = response.statusCode().value();

        if (statusCode == HttpStatus.NO_CONTENT.value()) {
            return response.releaseBody().then(Mono.just(ApiResponse.builder().statusCode(statusCode)
                                                                     .headers(headers)
                                                                     .contentType(headers.getContentType())
                                                                     .timestamp(timestamp).build()));
        }

        return response.bodyToMono(String.class).defaultIfEmpty("")
                       .map(body -> ApiResponse.builder().statusCode(statusCode).body(body).headers(headers)
                                               .contentType(headers.getContentType()).timestamp(timestamp)
                                               .build());
    }

    /**
     * Creates the exception matching the status code of an error response. The body's
     * {@code message} field is used when the body is JSON; a body that is not JSON becomes the
     * exception message verbatim.
     *
     * @param apiResponse The error response.
     * @param apiRequest  The request that produced it.
     *
     * @return An {@link OpenToCloseApiException} representing the error.
     */
    private OpenToCloseApiException createException(ApiResponse apiResponse, ApiRequest apiRequest) {
        int statusCode = apiResponse.getStatusCode();
        String body = apiResponse.getBody();
        String method = apiRequest.getMethod().name();
        String endpoint = apiRequest.getEndpoint();
        log.debug("Creating exception for status code: {}, body: {}", statusCode, body);

        JsonNode responseData = null;
        boolean rawText = false;
        if (!body.isBlank()) {
            try {
                responseData = jsonParser.parseTree(body);
            } catch (JsonParsingException e) {
                log.warn("Error body for {} is not JSON, using raw text", apiRequest.describe());
                rawText = true;
            }
        }
        if (responseData == null) {
            Map<String, Object> fallback = new LinkedHashMap<>();
            if (rawText) {
                fallback.put("message", body);
                fallback.put("raw_content", body);
            }
            responseData = jsonParser.toTree(fallback);
        }

        String detail = responseData.isObject() && responseData.hasNonNull("message")
                ? responseData.get("message").asText()
                : null;
        ErrorMessage message = new ErrorMessage(rawText ? body : null, method, endpoint, detail);

        if (statusCode == 400) {
            JsonNode fieldErrors = null;
            if (responseData.isObject()) {
                fieldErrors = responseData.hasNonNull("errors") ? responseData.get("errors")
                        : responseData.get("field_errors");
            }
            return new ValidationException(message.format("Bad request to", "Invalid request"), statusCode,
                                           responseData, method, endpoint, fieldErrors);
        }
        if (statusCode == 401) {
            return new AuthenticationException(message.format("Authentication failed for", "Invalid credentials"),
                                               statusCode, responseData, method, endpoint);
        }
        if (statusCode == 404) {
            return new NotFoundException(message.format("Resource not found for", "Not found"), statusCode,
                                         responseData, method, endpoint);
        }
        if (statusCode == 429) {
            return new RateLimitException(message.format("Rate limit exceeded for", "Too many requests"), statusCode,
                                          responseData, method, endpoint, retryAfter(apiResponse));
        }
        if (statusCode >= 500 && statusCode < 600) {
            return new ServerException(message.format("Server error for", "Internal server error"), statusCode,
                                       responseData, method, endpoint);
        }
        return new OpenToCloseApiException(message.format("Unexpected error for", "Unknown error"), statusCode,
                                           responseData, method, endpoint);
    }

    private static Integer retryAfter(ApiResponse apiResponse) {
        if (apiResponse.getHeaders() == null) {
            return null;
        }
        String value = apiResponse.getHeaders().getFirst(HttpHeaders.RETRY_AFTER);
        if (value == null) {
            return null;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            log.debug("Ignoring non-numeric Retry-After header '{}'", value);
            return null;
        }
    }

    private static void validateEndpoint(String endpoint) {
        if (endpoint == null || endpoint.isBlank()) {
            throw new ValidationException("Endpoint cannot be empty");
        }
    }

    private static String validateBaseUrl(String baseUrl) {
        if (baseUrl == null || !(baseUrl.startsWith("http://") || baseUrl.startsWith("https://"))) {
            throw new ValidationException("Invalid base URL: " + baseUrl + ". Must be a valid HTTP/HTTPS URL.");
        }
        return baseUrl;
    }

    private record ErrorMessage(String verbatim, String method, String endpoint, String detail) {

        String format(String prefix, String defaultDetail) {
            if (verbatim != null) {
                return verbatim;
            }
            return prefix + " " + method + " " + endpoint + ": " + (detail != null ? detail : defaultDetail);
        }
    }
}
