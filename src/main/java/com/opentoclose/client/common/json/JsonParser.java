package com.opentoclose.client.common.json;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * Defines the contract for decoding API payloads.
 *
 * <p>Implementations handle the details of JSON parsing using a specific JSON library (e.g.,
 * Jackson). Responses are decoded to a tree first because their envelope shape is only known after
 * inspection.
 */
public interface JsonParser {

    /**
     * Parses JSON text into a tree.
     *
     * @param json The JSON data as a string.
     *
     * @return The parsed tree, never {@code null}.
     *
     * @throws com.opentoclose.client.exception.json.JsonParsingException if the text is not valid
     *                                                                    JSON.
     */
    JsonNode parseTree(String json);

    /**
     * Converts a JSON object node into an insertion-ordered map of plain Java values.
     *
     * @param node The object node to convert.
     *
     * @return The converted map.
     *
     * @throws com.opentoclose.client.exception.json.JsonParsingException if the node cannot be
     *                                                                    converted.
     */
    Map<String, Object> toMap(JsonNode node);

    /**
     * Converts plain Java values into a tree, for logging and error payloads.
     *
     * @param value The value to convert.
     *
     * @return The tree representation of the value.
     */
    JsonNode toTree(Object value);
}
