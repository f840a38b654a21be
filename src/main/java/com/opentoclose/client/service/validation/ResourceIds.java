package com.opentoclose.client.service.validation;

import com.opentoclose.client.exception.apiclient.ValidationException;

/**
 * Validates resource ids before they are placed in an endpoint path.
 */
public final class ResourceIds {

    private ResourceIds() {
    }

    /**
     * Validates that an id is a positive integer. Numeric strings are accepted.
     *
     * @param resourceId   the id supplied by the caller.
     * @param resourceType the resource name used in error messages, e.g. {@code "contact"}.
     *
     * @return the id as a {@code long}.
     *
     * @throws ValidationException if the id is missing, not an integer, or not positive.
     */
    public static long validate(Object resourceId, String resourceType) {
        if (resourceId == null) {
            throw new ValidationException(resourceType + " ID cannot be null");
        }
        long id = Values.parseLong(resourceId).orElseThrow(
                () -> new ValidationException(resourceType + " ID must be a valid integer, got "
                                              + Values.describe(resourceId)));
        if (id <= 0) {
            throw new ValidationException(resourceType + " ID must be a positive integer, got " + id);
        }
        return id;
    }
}
