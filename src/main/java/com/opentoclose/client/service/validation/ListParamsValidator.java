package com.opentoclose.client.service.validation;

import com.opentoclose.client.exception.apiclient.ValidationException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Validates the query parameters of collection listing calls.
 *
 * <p>{@code limit} must be a positive integer and {@code offset} a non-negative one; both are
 * coerced from numeric strings. A limit above {@value #LARGE_LIMIT} is accepted with a warning.
 * Resources may declare extra filters that must be non-blank strings or real booleans. Every other
 * key is passed through unchanged.
 */
@Slf4j
public final class ListParamsValidator {

    public static final int LARGE_LIMIT = 1000;

    private final List<String> stringFilters;
    private final List<String> booleanFilters;

    private ListParamsValidator(List<String> stringFilters, List<String> booleanFilters) {
        this.stringFilters = List.copyOf(stringFilters);
        this.booleanFilters = List.copyOf(booleanFilters);
    }

    public static ListParamsValidator standard() {
        return new ListParamsValidator(List.of(), List.of());
    }

    public static ListParamsValidator withStringFilters(String... filters) {
        return new ListParamsValidator(List.of(filters), List.of());
    }

    /**
     * Returns a copy of this validator that also requires the given filters to be
     * {@link Boolean} values.
     */
    public ListParamsValidator andBooleanFilters(String... filters) {
        List<String> combined = new ArrayList<>(booleanFilters);
        combined.addAll(List.of(filters));
        return new ListParamsValidator(stringFilters, combined);
    }

    /**
     * Validates listing parameters.
     *
     * @param params the caller's parameters, may be {@code null}.
     *
     * @return a new map with coerced {@code limit} and {@code offset} values; the input is not
     *         modified.
     *
     * @throws ValidationException if the parameters are not a map or a value is out of range.
     */
    public Map<String, Object> validate(Object params) {
        if (params == null) {
            return new LinkedHashMap<>();
        }
        if (!(params instanceof Map<?, ?> map)) {
            throw new ValidationException("List parameters must be a map, got " + Values.typeName(params));
        }

        Map<String, Object> validated = new LinkedHashMap<>();
        map.forEach((key, value) -> validated.put(String.valueOf(key), value));

        if (validated.containsKey("limit")) {
            int limit = Values.toInt(validated.get("limit"), "limit");
            if (limit <= 0) {
                throw new ValidationException("limit must be a positive integer, got " + limit);
            }
            if (limit > LARGE_LIMIT) {
                log.warn("Large limit value: {}. Consider using pagination.", limit);
            }
            validated.put("limit", limit);
        }

        if (validated.containsKey("offset")) {
            int offset = Values.toInt(validated.get("offset"), "offset");
            if (offset < 0) {
                throw new ValidationException("offset must be non-negative, got " + offset);
            }
            validated.put("offset", offset);
        }

        for (String filter : stringFilters) {
            if (validated.containsKey(filter) && !Values.isNonBlankString(validated.get(filter))) {
                throw new ValidationException(filter + " filter must be a non-empty string, got "
                                              + Values.describe(validated.get(filter)));
            }
        }

        for (String filter : booleanFilters) {
            if (validated.containsKey(filter) && !(validated.get(filter) instanceof Boolean)) {
                throw new ValidationException(filter + " filter must be a boolean, got "
                                              + Values.describe(validated.get(filter)));
            }
        }

        log.debug("List parameters validated: {}", validated.keySet());
        return validated;
    }
}
