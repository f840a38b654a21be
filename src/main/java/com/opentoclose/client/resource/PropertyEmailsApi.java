package com.opentoclose.client.resource;

import com.opentoclose.client.common.apiclient.opentoclose.OpenToCloseApiClient;
import com.opentoclose.client.common.response.ResponseNormalizer;
import com.opentoclose.client.service.validation.ResourceRules;

/**
 * Emails logged against a property, filterable by {@code status}.
 */
public class PropertyEmailsApi extends PropertySubResourceApi {

    public PropertyEmailsApi(OpenToCloseApiClient apiClient, ResponseNormalizer normalizer) {
        super(apiClient, normalizer, "emails", "email", ResourceRules.PROPERTY_EMAILS, ResourceRules.EMAILS_LIST);
    }
}
