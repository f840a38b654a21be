package com.opentoclose.client.resource;

import com.opentoclose.client.common.apiclient.opentoclose.OpenToCloseApiClient;
import com.opentoclose.client.common.response.ResponseNormalizer;
import com.opentoclose.client.service.validation.ResourceRules;

public class TeamsApi extends ResourceApi {

    public TeamsApi(OpenToCloseApiClient apiClient, ResponseNormalizer normalizer) {
        super(apiClient, normalizer, "/teams", "team", ResourceRules.TEAMS, ResourceRules.STANDARD_LIST);
    }
}
