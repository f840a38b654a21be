package com.opentoclose.client.common.response;

import com.fasterxml.jackson.databind.JsonNode;
import com.opentoclose.client.common.json.JsonParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collapses the envelope shapes of Open To Close responses into one canonical shape per call type.
 *
 * <p>Normalization never fails: an unexpected shape degrades to no records or an empty record.
 * Callers that must tell a genuine empty result from an unexpected shape have to rely on the HTTP
 * status.
 */
@Slf4j
@RequiredArgsConstructor
public class ResponseNormalizer {

    private final JsonParser jsonParser;

    /**
     * Extracts the records of a list response.
     *
     * @param body the decoded body.
     *
     * @return the records of a bare array or of a {@code data} array, otherwise an empty list.
     */
    public List<Map<String, Object>> normalizeList(JsonNode body) {
        EnvelopeShape shape = EnvelopeShape.of(body);
        JsonNode records = switch (shape) {
            case RECORD_LIST -> body;
            case RECORD, DATA_WRAPPER -> body.path("data").isArray() ? body.get("data") : null;
            default -> null;
        };
        if (records == null) {
            log.warn("Expected a list response but got shape {}, returning no records", shape);
            return new ArrayList<>();
        }

        List<Map<String, Object>> result = new ArrayList<>(records.size());
        for (JsonNode record : records) {
            if (record.isObject()) {
                result.add(jsonParser.toMap(record));
            } else {
                log.debug("Skipping non-object list element of type {}", record.getNodeType());
            }
        }
        return result;
    }

    /**
     * Extracts the record of a single-resource response.
     *
     * @param body the decoded body.
     *
     * @return the body itself if it carries an {@code id}, the {@code data} object if wrapped,
     *         otherwise an empty map.
     */
    public Map<String, Object> normalizeRecord(JsonNode body) {
        EnvelopeShape shape = EnvelopeShape.of(body);
        JsonNode record = switch (shape) {
            case RECORD -> body;
            case DATA_WRAPPER -> body.get("data").isObject() ? body.get("data") : null;
            default -> null;
        };
        if (record == null) {
            log.debug("No record found in response of shape {}", shape);
            return new LinkedHashMap<>();
        }
        return jsonParser.toMap(record);
    }

    /**
     * Returns an object body as-is, without unwrapping. Used for delete responses, whose body is a
     * status message rather than a record.
     *
     * @param body the decoded body.
     *
     * @return the body as a map, or an empty map if it is not an object.
     */
    public Map<String, Object> asMap(JsonNode body) {
        if (body == null || !body.isObject()) {
            return new LinkedHashMap<>();
        }
        return jsonParser.toMap(body);
    }
}
