package com.opentoclose.client.resource;

import com.opentoclose.client.common.apiclient.opentoclose.OpenToCloseApiClient;
import com.opentoclose.client.common.response.ResponseNormalizer;
import com.opentoclose.client.service.validation.ResourceRules;

/**
 * Notes on a property, filterable by {@code author}.
 */
public class PropertyNotesApi extends PropertySubResourceApi {

    public PropertyNotesApi(OpenToCloseApiClient apiClient, ResponseNormalizer normalizer) {
        super(apiClient, normalizer, "notes", "note", ResourceRules.PROPERTY_NOTES, ResourceRules.NOTES_LIST);
    }
}
