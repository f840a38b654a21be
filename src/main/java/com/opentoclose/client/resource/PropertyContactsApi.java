package com.opentoclose.client.resource;

import com.opentoclose.client.common.apiclient.opentoclose.OpenToCloseApiClient;
import com.opentoclose.client.common.response.ResponseNormalizer;
import com.opentoclose.client.exception.apiclient.ValidationException;
import com.opentoclose.client.service.validation.ResourceRules;

import java.util.Map;

/**
 * Contacts linked to a property.
 *
 * <p>Links can be listed, created and retrieved. The API answers 405 to updates and deletes, so
 * both are rejected before any request is sent.
 */
public class PropertyContactsApi extends PropertySubResourceApi {

    public PropertyContactsApi(OpenToCloseApiClient apiClient, ResponseNormalizer normalizer) {
        super(apiClient, normalizer, "contacts", "contact", ResourceRules.PROPERTY_CONTACTS,
              ResourceRules.STANDARD_LIST);
    }

    /**
     * Not supported by the API.
     *
     * @throws ValidationException always.
     */
    @Override
    public Map<String, Object> update(long propertyId, long id, Map<String, ?> data) {
        throw new ValidationException("Update operations are not supported by the property contacts API. "
                                      + "The API returns 405 Method Not Allowed for PUT requests. "
                                      + "To modify a contact association, delete it and create a new one.");
    }

    /**
     * Not supported by the API.
     *
     * @throws ValidationException always.
     */
    @Override
    public Map<String, Object> delete(long propertyId, long id) {
        throw new ValidationException("Delete operations are not supported by the property contacts API. "
                                      + "The API returns 405 Method Not Allowed for DELETE requests.");
    }
}
