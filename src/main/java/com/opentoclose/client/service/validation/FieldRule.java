package com.opentoclose.client.service.validation;

import java.util.Map;

/**
 * One check applied to a resource payload.
 */
@FunctionalInterface
public interface FieldRule {

    /**
     * Checks the payload.
     *
     * @param resourceLabel the resource name used in messages, e.g. {@code "Contact"}.
     * @param data          the payload, never empty.
     * @param operation     the operation being validated.
     *
     * @throws com.opentoclose.client.exception.apiclient.ValidationException on violation.
     */
    void check(String resourceLabel, Map<String, Object> data, Operation operation);
}
