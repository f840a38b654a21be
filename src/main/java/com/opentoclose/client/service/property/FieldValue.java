package com.opentoclose.client.service.property;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One {@code {id, key, value}} entry of a property's wire-format {@code fields} array.
 */
public record FieldValue(long id, String key, Object value) {

    public Map<String, Object> toWire() {
        Map<String, Object> wire = new LinkedHashMap<>();
        wire.put("id", id);
        wire.put("key", key);
        wire.put("value", value);
        return wire;
    }
}
