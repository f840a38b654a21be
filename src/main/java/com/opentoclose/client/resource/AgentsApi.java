package com.opentoclose.client.resource;

import com.opentoclose.client.common.apiclient.opentoclose.OpenToCloseApiClient;
import com.opentoclose.client.common.response.ResponseNormalizer;
import com.opentoclose.client.service.validation.ResourceRules;

/**
 * Agents: {@code /agents}. Create needs at least one of email, phone, name, first_name or last_name.
 */
public class AgentsApi extends ResourceApi {

    public AgentsApi(OpenToCloseApiClient apiClient, ResponseNormalizer normalizer) {
        super(apiClient, normalizer, "/agents", "agent", ResourceRules.AGENTS, ResourceRules.STANDARD_LIST);
    }
}
