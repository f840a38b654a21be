package com.opentoclose.client.resource;

import com.opentoclose.client.common.apiclient.opentoclose.OpenToCloseApiClient;
import com.opentoclose.client.common.response.ResponseNormalizer;
import com.opentoclose.client.service.validation.ResourceRules;

/**
 * Documents attached to a property, filterable by {@code type}.
 */
public class PropertyDocumentsApi extends PropertySubResourceApi {

    public PropertyDocumentsApi(OpenToCloseApiClient apiClient, ResponseNormalizer normalizer) {
        super(apiClient, normalizer, "documents", "document", ResourceRules.PROPERTY_DOCUMENTS, ResourceRules.DOCUMENTS_LIST);
    }
}
