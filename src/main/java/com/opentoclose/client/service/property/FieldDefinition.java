package com.opentoclose.client.service.property;

import com.opentoclose.client.exception.apiclient.ValidationException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * One entry of the property field mapping table.
 *
 * @param id      the provider's numeric field id.
 * @param key     the provider's field key.
 * @param options option label to option id, empty for free-value fields. Labels keep their
 *                declared spelling; lookup ignores case.
 */
public record FieldDefinition(long id, String key, Map<String, Long> options) {

    public FieldDefinition {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Field key must not be blank");
        }
        options = options == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(options));
    }

    public static FieldDefinition value(long id, String key) {
        return new FieldDefinition(id, key, Map.of());
    }

    public static FieldDefinition choice(long id, String key, Map<String, Long> options) {
        return new FieldDefinition(id, key, options);
    }

    public boolean isChoice() {
        return !options.isEmpty();
    }

    /**
     * Resolves an option label to its id, ignoring case and surrounding whitespace.
     *
     * @param humanName the human field name used in the error message.
     * @param label     the caller's label.
     *
     * @return the option id.
     *
     * @throws ValidationException if no option matches; the message lists the valid choices.
     */
    public long resolveOption(String humanName, Object label) {
        if (label instanceof String text) {
            String wanted = text.trim().toLowerCase(Locale.ROOT);
            for (Map.Entry<String, Long> option : options.entrySet()) {
                if (option.getKey().toLowerCase(Locale.ROOT).equals(wanted)) {
                    return option.getValue();
                }
            }
        }
        throw new ValidationException("Invalid " + humanName + " '" + label + "'. Valid choices: "
                                      + String.join(", ", options.keySet()));
    }
}
