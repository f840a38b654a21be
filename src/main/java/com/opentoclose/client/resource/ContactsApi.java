package com.opentoclose.client.resource;

import com.opentoclose.client.common.apiclient.opentoclose.OpenToCloseApiClient;
import com.opentoclose.client.common.response.ResponseNormalizer;
import com.opentoclose.client.service.validation.ResourceRules;

/**
 * Contacts: {@code /contacts}.
 *
 * <p>The API takes separate {@code first_name} and {@code last_name} fields; a combined
 * {@code name} is rejected on create.
 */
public class ContactsApi extends ResourceApi {

    public ContactsApi(OpenToCloseApiClient apiClient, ResponseNormalizer normalizer) {
        super(apiClient, normalizer, "/contacts", "contact", ResourceRules.CONTACTS, ResourceRules.STANDARD_LIST);
    }
}
