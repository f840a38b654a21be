package com.opentoclose.client.common.apiclient.authentication.impl;

import com.opentoclose.client.common.apiclient.authentication.Authentication;
import com.opentoclose.client.common.apiclient.model.ApiRequest;
import com.opentoclose.client.exception.apiclient.AuthenticationException;
import lombok.extern.slf4j.Slf4j;

import java.util.function.Function;

/**
 * An implementation of {@link Authentication} that sends the API token as a query parameter.
 *
 * <p>Open To Close reads the token from the {@code api_token} query parameter on every verb,
 * including POST, PUT and DELETE, rather than from an {@code Authorization} header.
 */
@Slf4j
public record QueryTokenAuthentication(String parameterName, String apiToken) implements Authentication {

    public static final String DEFAULT_PARAMETER_NAME = "api_token";
    public static final String API_KEY_ENVIRONMENT_VARIABLE = "OPEN_TO_CLOSE_API_KEY";

    public QueryTokenAuthentication {
        if (apiToken == null || apiToken.isBlank()) {
            throw new AuthenticationException("API key is required. Set the " + API_KEY_ENVIRONMENT_VARIABLE
                                              + " environment variable or pass an API key explicitly.");
        }
    }

    /**
     * Resolves the token from an explicit value, falling back to the
     * {@value #API_KEY_ENVIRONMENT_VARIABLE} variable of the supplied environment.
     *
     * @param explicitToken the token passed by the caller, may be {@code null}.
     * @param environment   lookup for environment variables, typically {@code System::getenv}.
     *
     * @return the authentication for the resolved token.
     *
     * @throws AuthenticationException if neither source yields a non-blank token.
     */
    public static QueryTokenAuthentication resolve(String explicitToken, Function<String, String> environment) {
        if (explicitToken != null && !explicitToken.isBlank()) {
            log.debug("Using explicitly configured API key");
            return new QueryTokenAuthentication(DEFAULT_PARAMETER_NAME, explicitToken);
        }
        String fromEnvironment = environment == null ? null : environment.apply(API_KEY_ENVIRONMENT_VARIABLE);
        log.debug("No explicit API key, environment variable {} is {}", API_KEY_ENVIRONMENT_VARIABLE,
                  fromEnvironment == null || fromEnvironment.isBlank() ? "not set" : "set");
        return new QueryTokenAuthentication(DEFAULT_PARAMETER_NAME, fromEnvironment);
    }

    @Override
    public void applyAuthentication(ApiRequest request) {
        request.getQueryParams().put(parameterName, apiToken);
        log.trace("Applied API token as query parameter '{}'", parameterName);
    }

    @Override
    public String toString() {
        return "QueryTokenAuthentication[parameterName=" + parameterName + "]";
    }
}
