package com.opentoclose.client.resource;

import com.opentoclose.client.common.apiclient.opentoclose.OpenToCloseApiClient;
import com.opentoclose.client.common.response.ResponseNormalizer;
import com.opentoclose.client.service.validation.ListParamsValidator;
import com.opentoclose.client.service.validation.Operation;
import com.opentoclose.client.service.validation.ResourceIds;
import com.opentoclose.client.service.validation.ResourceValidator;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;

/**
 * Base facade of a collection nested under one property, such as
 * {@code /properties/{propertyId}/notes}. Every operation takes the property id first.
 */
@Slf4j
public abstract class PropertySubResourceApi {

    protected final OpenToCloseApiClient apiClient;
    protected final ResponseNormalizer normalizer;

    private final String segment;
    private final String resourceType;
    private final ResourceValidator validator;
    private final ListParamsValidator listValidator;

    protected PropertySubResourceApi(OpenToCloseApiClient apiClient, ResponseNormalizer normalizer, String segment,
                                     String resourceType, ResourceValidator validator,
                                     ListParamsValidator listValidator) {
        this.apiClient = apiClient;
        this.normalizer = normalizer;
        this.segment = segment;
        this.resourceType = resourceType;
        this.validator = validator;
        this.listValidator = listValidator;
    }

    public List<Map<String, Object>> list(long propertyId, Map<String, ?> params) {
        String path = collectionPath(propertyId);
        Map<String, Object> query = listValidator.validate(params);
        List<Map<String, Object>> records = normalizer.normalizeList(apiClient.get(path, query));
        log.debug("Listed {} {} records of property {}", records.size(), resourceType, propertyId);
        return records;
    }

    public List<Map<String, Object>> list(long propertyId) {
        return list(propertyId, null);
    }

    public Map<String, Object> create(long propertyId, Map<String, ?> data) {
        String path = collectionPath(propertyId);
        Map<String, Object> payload = validator.validate(data, Operation.CREATE);
        Map<String, Object> created = normalizer.normalizeRecord(apiClient.post(path, payload));
        log.info("Created {} {} on property {}", resourceType, created.get("id"), propertyId);
        return created;
    }

    public Map<String, Object> retrieve(long propertyId, long id) {
        return normalizer.normalizeRecord(apiClient.get(recordPath(propertyId, id), null));
    }

    public Map<String, Object> update(long propertyId, long id, Map<String, ?> data) {
        String path = recordPath(propertyId, id);
        Map<String, Object> payload = validator.validate(data, Operation.UPDATE);
        Map<String, Object> updated = normalizer.normalizeRecord(apiClient.put(path, payload));
        log.info("Updated {} {} on property {}", resourceType, id, propertyId);
        return updated;
    }

    public Map<String, Object> delete(long propertyId, long id) {
        Map<String, Object> result = normalizer.asMap(apiClient.delete(recordPath(propertyId, id)));
        log.info("Deleted {} {} from property {}", resourceType, id, propertyId);
        return result;
    }

    protected String collectionPath(long propertyId) {
        return "/properties/" + ResourceIds.validate(propertyId, "property") + "/" + segment;
    }

    protected String recordPath(long propertyId, long id) {
        return collectionPath(propertyId) + "/" + ResourceIds.validate(id, resourceType);
    }
}
