package com.opentoclose.client.common.response;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * The shapes an Open To Close response body can take.
 */
public enum EnvelopeShape {

    /**
     * A bare JSON array of records.
     */
    RECORD_LIST,

    /**
     * A bare record: a JSON object carrying an {@code id} key.
     */
    RECORD,

    /**
     * A JSON object wrapping the payload under a {@code data} key.
     */
    DATA_WRAPPER,

    /**
     * Anything else, including a missing body.
     */
    UNRECOGNIZED;

    /**
     * Classifies a decoded body. An object with both {@code id} and {@code data} keys is a record.
     *
     * @param body the decoded body, may be {@code null}.
     *
     * @return the shape of the body.
     */
    public static EnvelopeShape of(JsonNode body) {
        if (body == null) {
            return UNRECOGNIZED;
        }
        if (body.isArray()) {
            return RECORD_LIST;
        }
        if (body.isObject() && body.has("id")) {
            return RECORD;
        }
        if (body.isObject() && body.has("data")) {
            return DATA_WRAPPER;
        }
        return UNRECOGNIZED;
    }
}
