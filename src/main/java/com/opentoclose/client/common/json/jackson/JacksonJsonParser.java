package com.opentoclose.client.common.json.jackson;


import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.opentoclose.client.common.json.JsonParser;
import com.opentoclose.client.exception.json.JsonParsingException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Implementation of the {@link JsonParser} interface using the Jackson library.
 *
 * <p>It leverages the {@link ObjectMapper} from the Jackson library to perform the JSON parsing.
 */
@RequiredArgsConstructor
@Slf4j
public class JacksonJsonParser implements JsonParser {

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    /**
     * Parses JSON text into a Jackson tree.
     *
     * @param json The JSON data as a string.
     *
     * @return The parsed tree.
     *
     * @throws JsonParsingException if the text is not valid JSON or is empty.
     */
    @Override
    public JsonNode parseTree(String json) {
        log.trace("Parsing JSON text of length {}", json == null ? 0 : json.length());
        if (json == null || json.isBlank()) {
            throw new JsonParsingException("Cannot parse an empty JSON document", null);
        }
        try {
            JsonNode node = objectMapper.readTree(json);
            if (node == null || node instanceof MissingNode) {
                throw new JsonParsingException("JSON document has no content", null);
            }
            return node;
        } catch (JsonProcessingException e) {
            log.debug("Text is not valid JSON: {}", e.getOriginalMessage());
            throw new JsonParsingException("Error parsing JSON string", e);
        }
    }

    @Override
    public Map<String, Object> toMap(JsonNode node) {
        try {
            return objectMapper.convertValue(node, MAP_TYPE);
        } catch (IllegalArgumentException e) {
            log.error("Error converting JSON node to map", e);
            throw new JsonParsingException("Error converting JSON node to map", e);
        }
    }

    @Override
    public JsonNode toTree(Object value) {
        return objectMapper.valueToTree(value);
    }
}
