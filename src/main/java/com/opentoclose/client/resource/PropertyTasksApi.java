package com.opentoclose.client.resource;

import com.opentoclose.client.common.apiclient.opentoclose.OpenToCloseApiClient;
import com.opentoclose.client.common.response.ResponseNormalizer;
import com.opentoclose.client.service.validation.ResourceRules;

/**
 * Tasks of a property, filterable by {@code status}.
 */
public class PropertyTasksApi extends PropertySubResourceApi {

    public PropertyTasksApi(OpenToCloseApiClient apiClient, ResponseNormalizer normalizer) {
        super(apiClient, normalizer, "tasks", "task", ResourceRules.PROPERTY_TASKS, ResourceRules.TASKS_LIST);
    }
}
