package com.opentoclose.client.common.apiclient.authentication;

import com.opentoclose.client.common.apiclient.model.ApiRequest;

/**
 * Defines the contract for applying authentication to an API request.
 *
 * <p>This interface allows different authentication schemes to be applied to API requests in a
 * consistent manner.
 */
public interface Authentication {

    /**
     * Applies the authentication to the provided request.
     *
     * @param request The request about to be sent. Implementations add to its query parameters or
     *                headers.
     */
    void applyAuthentication(ApiRequest request);
}
