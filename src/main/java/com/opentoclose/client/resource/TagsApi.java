package com.opentoclose.client.resource;

import com.opentoclose.client.common.apiclient.opentoclose.OpenToCloseApiClient;
import com.opentoclose.client.common.response.ResponseNormalizer;
import com.opentoclose.client.service.validation.ResourceRules;

/**
 * Tags: {@code /tags}, filterable by {@code category}.
 */
public class TagsApi extends ResourceApi {

    public TagsApi(OpenToCloseApiClient apiClient, ResponseNormalizer normalizer) {
        super(apiClient, normalizer, "/tags", "tag", ResourceRules.TAGS, ResourceRules.TAGS_LIST);
    }
}
