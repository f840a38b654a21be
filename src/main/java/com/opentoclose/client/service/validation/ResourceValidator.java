package com.opentoclose.client.service.validation;

import com.opentoclose.client.exception.apiclient.ValidationException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Validates a create or update payload for one resource type before any request is sent.
 *
 * <p>The payload must be a non-empty map. Rules are evaluated in the order they were added and the
 * first violation is raised as a {@link ValidationException} naming the field, the constraint and
 * the value received. Fields a rule does not mention are not checked.
 */
@Slf4j
public final class ResourceValidator {

    private final String resourceLabel;
    private final List<FieldRule> rules;

    private ResourceValidator(String resourceLabel, List<FieldRule> rules) {
        this.resourceLabel = resourceLabel;
        this.rules = List.copyOf(rules);
    }

    public static Builder forResource(String resourceLabel) {
        return new Builder(resourceLabel);
    }

    /**
     * Validates a payload.
     *
     * @param data      the caller's payload.
     * @param operation the operation it is sent with.
     *
     * @return a copy of the payload with string keys, values unchanged.
     *
     * @throws ValidationException if the payload is not a non-empty map or a rule is violated.
     */
    public Map<String, Object> validate(Object data, Operation operation) {
        if (!(data instanceof Map<?, ?> map)) {
            throw new ValidationException(resourceLabel + " data for " + operation.label()
                                          + " must be a map, got " + Values.typeName(data));
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        map.forEach((key, value) -> payload.put(String.valueOf(key), value));
        if (payload.isEmpty()) {
            throw new ValidationException(resourceLabel + " data for " + operation.label() + " cannot be empty");
        }
        for (FieldRule rule : rules) {
            rule.check(resourceLabel, payload, operation);
        }
        log.debug("{} data validated for {} operation", resourceLabel, operation.label());
        return payload;
    }

    /**
     * Fluent builder of the rule list.
     */
    public static final class Builder {

        private final String resourceLabel;
        private final List<FieldRule> rules = new ArrayList<>();

        private Builder(String resourceLabel) {
            this.resourceLabel = resourceLabel;
        }

        /**
         * On create, at least one of the fields must be present.
         */
        public Builder requireAnyOnCreate(String... fields) {
            rules.add((label, data, operation) -> {
                if (operation == Operation.CREATE && Arrays.stream(fields).noneMatch(data::containsKey)) {
                    throw new ValidationException(label + " data for " + operation.label()
                                                  + " must include at least one of: " + String.join(", ", fields));
                }
            });
            return this;
        }

        /**
         * On create, every field must be present.
         */
        public Builder requireAllOnCreate(String... fields) {
            rules.add((label, data, operation) -> {
                if (operation != Operation.CREATE) {
                    return;
                }
                List<String> missing = Arrays.stream(fields).filter(field -> !data.containsKey(field)).toList();
                if (!missing.isEmpty()) {
                    throw new ValidationException(label + " data for " + operation.label()
                                                  + " missing required fields: " + String.join(", ", missing));
                }
            });
            return this;
        }

        /**
         * On create, the field is rejected with the given message.
         */
        public Builder rejectOnCreate(String field, String message) {
            rules.add((label, data, operation) -> {
                if (operation == Operation.CREATE && data.containsKey(field)) {
                    throw new ValidationException(message);
                }
            });
            return this;
        }

        public Builder nonBlankString(String... fields) {
            for (String field : fields) {
                rules.add(present(field, Values::isNonBlankString,
                                  field + " must be a non-empty string, got "));
            }
            return this;
        }

        public Builder string(String... fields) {
            for (String field : fields) {
                rules.add(present(field, value -> value instanceof String, field + " must be a string, got "));
            }
            return this;
        }

        public Builder email(String... fields) {
            for (String field : fields) {
                rules.add(present(field, value -> value instanceof String text && text.contains("@"),
                                  "Invalid email format for " + field + ": expected a string containing '@', got "));
            }
            return this;
        }

        /**
         * The field must be a hex color code, {@code #RGB} or {@code #RRGGBB}.
         */
        public Builder hexColor(String field) {
            rules.add((label, data, operation) -> {
                if (!data.containsKey(field)) {
                    return;
                }
                Object value = data.get(field);
                if (!Values.isNonBlankString(value)) {
                    throw new ValidationException(field + " must be a non-empty string, got " + Values.describe(value));
                }
                String color = (String) value;
                if (!color.startsWith("#") || (color.length() != 4 && color.length() != 7)) {
                    throw new ValidationException(field + " must be a valid hex color code (e.g., #FF0000), got "
                                                  + Values.describe(value));
                }
            });
            return this;
        }

        /**
         * The field must be an actual {@link Boolean}; strings such as {@code "true"} are rejected.
         */
        public Builder bool(String... fields) {
            for (String field : fields) {
                rules.add(present(field, value -> value instanceof Boolean, field + " must be a boolean, got "));
            }
            return this;
        }

        public Builder httpUrl(String field) {
            rules.add((label, data, operation) -> {
                if (!data.containsKey(field)) {
                    return;
                }
                Object value = data.get(field);
                if (!Values.isNonBlankString(value)) {
                    throw new ValidationException(field + " must be a non-empty string, got " + Values.describe(value));
                }
                String url = (String) value;
                if (!url.startsWith("http://") && !url.startsWith("https://")) {
                    throw new ValidationException(field + " must be a valid HTTP/HTTPS URL, got " + Values.describe(value));
                }
            });
            return this;
        }

        public Builder nonNegativeInteger(String field) {
            rules.add((label, data, operation) -> {
                if (data.containsKey(field)) {
                    long value = Values.toLong(data.get(field), field);
                    if (value < 0) {
                        throw new ValidationException(field + " must be non-negative, got " + value);
                    }
                }
            });
            return this;
        }

        public Builder positiveInteger(String field) {
            rules.add((label, data, operation) -> {
                if (data.containsKey(field)) {
                    long value = Values.toLong(data.get(field), field);
                    if (value <= 0) {
                        throw new ValidationException(field + " must be a positive integer, got " + value);
                    }
                }
            });
            return this;
        }

        /**
         * The field must be a list whose every element is a non-blank string.
         */
        public Builder stringList(String field) {
            rules.add(listOf(field, Values::isNonBlankString, "must be a non-empty string"));
            return this;
        }

        /**
         * The field must be a list whose every element is a string containing {@code @}.
         */
        public Builder emailList(String field) {
            rules.add(listOf(field, value -> value instanceof String text && text.contains("@"),
                             "must be a valid email address"));
            return this;
        }

        /**
         * Fields the API ignores: accepted, with a warning.
         */
        public Builder ignoredByApi(String... fields) {
            Set<String> ignored = Arrays.stream(fields).collect(Collectors.toUnmodifiableSet());
            rules.add((label, data, operation) -> data.keySet().stream().filter(ignored::contains).forEach(
                    field -> log.warn("Field '{}' is not supported by the {} API and will be ignored", field, label)));
            return this;
        }

        public ResourceValidator build() {
            return new ResourceValidator(resourceLabel, rules);
        }

        private static FieldRule listOf(String field, Predicate<Object> validElement, String constraint) {
            return (label, data, operation) -> {
                if (!data.containsKey(field)) {
                    return;
                }
                if (!(data.get(field) instanceof List<?> elements)) {
                    throw new ValidationException(field + " must be a list, got " + Values.describe(data.get(field)));
                }
                for (int i = 0; i < elements.size(); i++) {
                    if (!validElement.test(elements.get(i))) {
                        throw new ValidationException(field + "[" + i + "] " + constraint + ", got "
                                                      + Values.describe(elements.get(i)));
                    }
                }
            };
        }

        private static FieldRule present(String field, Predicate<Object> valid, String message) {
            return (label, data, operation) -> {
                if (data.containsKey(field) && !valid.test(data.get(field))) {
                    throw new ValidationException(message + Values.describe(data.get(field)));
                }
            };
        }
    }
}
