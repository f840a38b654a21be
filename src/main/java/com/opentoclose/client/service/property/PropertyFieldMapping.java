package com.opentoclose.client.service.property;

import com.opentoclose.client.exception.apiclient.ValidationException;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable table from human property field names to the provider's field definitions.
 *
 * <p>Field and option ids differ between Open To Close accounts. {@link #defaults()} holds the
 * built-in table; {@link #withOverrides(Map)} derives a per-environment copy, typically from
 * {@code app.open-to-close.property-fields}.
 */
@Slf4j
public final class PropertyFieldMapping {

    public static final String TITLE = "title";
    public static final String CLIENT_TYPE = "client_type";
    public static final String STATUS = "status";
    public static final String PURCHASE_AMOUNT = "purchase_amount";

    private static final PropertyFieldMapping DEFAULTS = new PropertyFieldMapping(defaultTable());

    private final Map<String, FieldDefinition> fields;

    private PropertyFieldMapping(Map<String, FieldDefinition> fields) {
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static PropertyFieldMapping defaults() {
        return DEFAULTS;
    }

    /**
     * Returns a copy of this table with some entries replaced.
     *
     * @param overrides human field name to replacement definition. Only the four known names are
     *                  accepted.
     *
     * @return the new table, or this one when there is nothing to override.
     *
     * @throws ValidationException if an override names an unknown field.
     */
    public PropertyFieldMapping withOverrides(Map<String, FieldDefinition> overrides) {
        if (overrides == null || overrides.isEmpty()) {
            return this;
        }
        Map<String, FieldDefinition> merged = new LinkedHashMap<>(fields);
        overrides.forEach((name, definition) -> {
            if (!fields.containsKey(name)) {
                throw new ValidationException("Unknown property field '" + name + "'. Known fields: "
                                              + String.join(", ", fields.keySet()));
            }
            log.info("Overriding property field '{}' with id {} and key '{}'", name, definition.id(),
                     definition.key());
            merged.put(name, definition);
        });
        return new PropertyFieldMapping(merged);
    }

    public Optional<FieldDefinition> find(String humanName) {
        return Optional.ofNullable(fields.get(humanName));
    }

    public FieldDefinition get(String humanName) {
        return find(humanName).orElseThrow(
                () -> new IllegalStateException("No mapping for property field '" + humanName + "'"));
    }

    private static Map<String, FieldDefinition> defaultTable() {
        Map<String, Long> clientTypes = new LinkedHashMap<>();
        clientTypes.put("Buyer", 797212L);
        clientTypes.put("Seller", 797213L);
        clientTypes.put("Dual", 797214L);

        Map<String, Long> statuses = new LinkedHashMap<>();
        statuses.put("Pre-MLS", 797635L);
        statuses.put("Active", 797636L);
        statuses.put("Under Contract", 797637L);
        statuses.put("Pending", 797638L);
        statuses.put("Closed", 797639L);
        statuses.put("Withdrawn", 797640L);
        statuses.put("Cancelled", 797641L);

        Map<String, FieldDefinition> table = new LinkedHashMap<>();
        table.put(TITLE, FieldDefinition.value(922675L, "contract_title"));
        table.put(CLIENT_TYPE, FieldDefinition.choice(922663L, "contract_client_type", clientTypes));
        table.put(STATUS, FieldDefinition.choice(922662L, "contract_status", statuses));
        table.put(PURCHASE_AMOUNT, FieldDefinition.value(922664L, "contract_purchase_amount"));
        return table;
    }
}
