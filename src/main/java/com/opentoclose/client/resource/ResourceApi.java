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
 * Base facade of a top-level Open To Close collection such as {@code /contacts}.
 *
 * <p>Each operation validates its input, performs exactly one request and normalizes the response.
 * Failures surface as exceptions of the client's taxonomy and are never retried.
 */
@Slf4j
public abstract class ResourceApi {

    protected final OpenToCloseApiClient apiClient;
    protected final ResponseNormalizer normalizer;

    private final String basePath;
    private final String resourceType;
    private final ResourceValidator validator;
    private final ListParamsValidator listValidator;

    protected ResourceApi(OpenToCloseApiClient apiClient, ResponseNormalizer normalizer, String basePath,
                          String resourceType, ResourceValidator validator, ListParamsValidator listValidator) {
        this.apiClient = apiClient;
        this.normalizer = normalizer;
        this.basePath = basePath;
        this.resourceType = resourceType;
        this.validator = validator;
        this.listValidator = listValidator;
    }

    /**
     * Lists the collection.
     *
     * @param params optional query parameters such as {@code limit} and {@code offset}.
     *
     * @return the records, possibly empty.
     */
    public List<Map<String, Object>> list(Map<String, ?> params) {
        Map<String, Object> query = listValidator.validate(params);
        List<Map<String, Object>> records = normalizer.normalizeList(apiClient.get(basePath, query));
        log.debug("Listed {} {} records", records.size(), resourceType);
        return records;
    }

    public List<Map<String, Object>> list() {
        return list(null);
    }

    /**
     * Creates a record.
     *
     * @param data the record's fields.
     *
     * @return the created record.
     */
    public Map<String, Object> create(Map<String, ?> data) {
        Map<String, Object> payload = validator.validate(data, Operation.CREATE);
        Map<String, Object> created = normalizer.normalizeRecord(apiClient.post(basePath, payload));
        log.info("Created {} {}", resourceType, created.get("id"));
        return created;
    }

    public Map<String, Object> retrieve(long id) {
        return normalizer.normalizeRecord(apiClient.get(recordPath(id), null));
    }

    /**
     * Updates a record.
     *
     * @param id   the record id.
     * @param data the fields to change.
     *
     * @return the updated record.
     */
    public Map<String, Object> update(long id, Map<String, ?> data) {
        String path = recordPath(id);
        Map<String, Object> payload = validator.validate(data, Operation.UPDATE);
        Map<String, Object> updated = normalizer.normalizeRecord(apiClient.put(path, payload));
        log.info("Updated {} {}", resourceType, id);
        return updated;
    }

    /**
     * Deletes a record.
     *
     * @param id the record id.
     *
     * @return the API's response body, usually a status message; empty for HTTP 204.
     */
    public Map<String, Object> delete(long id) {
        Map<String, Object> result = normalizer.asMap(apiClient.delete(recordPath(id)));
        log.info("Deleted {} {}", resourceType, id);
        return result;
    }

    protected String recordPath(long id) {
        return basePath + "/" + ResourceIds.validate(id, resourceType);
    }
}
