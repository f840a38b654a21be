package com.opentoclose.client.service.property;

import com.opentoclose.client.exception.apiclient.ValidationException;
import com.opentoclose.client.service.validation.ResourceIds;
import com.opentoclose.client.service.validation.Values;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Translates property input into the wire format the properties endpoint expects:
 * {@code {team_member_id, time_zone_id, fields: [{id, key, value}, ...]}}.
 *
 * <p>Accepted input:
 * <ul>
 *     <li>a bare string, taken as the title of a Buyer property with status Active;</li>
 *     <li>a map of human keys: {@code title} (required), {@code client_type}, {@code status},
 *     {@code purchase_amount}, {@code team_member_id} and {@code time_zone_id};</li>
 *     <li>a map already in wire format, recognised by having both {@code fields} and
 *     {@code team_member_id}, which is checked structurally and passed through.</li>
 * </ul>
 * A field triple is only emitted for a human key the caller supplied.
 */
@Slf4j
@RequiredArgsConstructor
public class PropertyFieldTranslator {

    public static final long DEFAULT_TIME_ZONE_ID = 1L;
    static final String DEFAULT_CLIENT_TYPE = "Buyer";
    static final String DEFAULT_STATUS = "Active";

    private static final String TEAM_MEMBER_ID = "team_member_id";
    private static final String TIME_ZONE_ID = "time_zone_id";
    private static final String FIELDS = "fields";
    private static final Set<String> RECOGNISED_KEYS = Set.of(PropertyFieldMapping.TITLE,
                                                              PropertyFieldMapping.CLIENT_TYPE,
                                                              PropertyFieldMapping.STATUS,
                                                              PropertyFieldMapping.PURCHASE_AMOUNT,
                                                              TEAM_MEMBER_ID, TIME_ZONE_ID);

    private final PropertyFieldMapping mapping;
    private final TeamMemberResolver teamMemberResolver;

    /**
     * Translates property input.
     *
     * @param propertyData a title string or a map, see the class description.
     *
     * @return the wire payload.
     *
     * @throws ValidationException if the input is invalid or no team member can be resolved.
     */
    public Map<String, Object> translate(Object propertyData) {
        if (propertyData instanceof String title) {
            Map<String, Object> human = new LinkedHashMap<>();
            human.put(PropertyFieldMapping.TITLE, title);
            human.put(PropertyFieldMapping.CLIENT_TYPE, DEFAULT_CLIENT_TYPE);
            human.put(PropertyFieldMapping.STATUS, DEFAULT_STATUS);
            return translateHuman(human);
        }
        if (propertyData instanceof Map<?, ?> map) {
            Map<String, Object> data = new LinkedHashMap<>();
            map.forEach((key, value) -> data.put(String.valueOf(key), value));
            if (data.containsKey(FIELDS) && data.containsKey(TEAM_MEMBER_ID)) {
                return checkWireFormat(data);
            }
            return translateHuman(data);
        }
        throw new ValidationException("Property data must be a title string or a map, got "
                                      + Values.typeName(propertyData));
    }

    private Map<String, Object> translateHuman(Map<String, Object> data) {
        Object title = data.get(PropertyFieldMapping.TITLE);
        if (!Values.isNonBlankString(title)) {
            throw new ValidationException("Property title is required and must be a non-empty string, got "
                                          + Values.describe(title));
        }

        List<FieldValue> fields = new ArrayList<>();
        FieldDefinition titleField = mapping.get(PropertyFieldMapping.TITLE);
        fields.add(new FieldValue(titleField.id(), titleField.key(), ((String) title).trim()));

        for (String choice : List.of(PropertyFieldMapping.CLIENT_TYPE, PropertyFieldMapping.STATUS)) {
            if (data.get(choice) != null) {
                FieldDefinition definition = mapping.get(choice);
                long optionId = definition.resolveOption(choice, data.get(choice));
                fields.add(new FieldValue(definition.id(), definition.key(), optionId));
            }
        }

        if (data.get(PropertyFieldMapping.PURCHASE_AMOUNT) != null) {
            BigDecimal amount = Values.toDecimal(data.get(PropertyFieldMapping.PURCHASE_AMOUNT),
                                                 PropertyFieldMapping.PURCHASE_AMOUNT);
            if (amount.signum() < 0) {
                throw new ValidationException("purchase_amount must be non-negative, got " + amount);
            }
            FieldDefinition definition = mapping.get(PropertyFieldMapping.PURCHASE_AMOUNT);
            fields.add(new FieldValue(definition.id(), definition.key(), amount));
        }

        data.keySet().stream().filter(key -> !RECOGNISED_KEYS.contains(key)).forEach(
                key -> log.warn("Property field '{}' has no mapping and will be ignored", key));

        long timeZoneId = data.get(TIME_ZONE_ID) == null
                ? DEFAULT_TIME_ZONE_ID
                : ResourceIds.validate(data.get(TIME_ZONE_ID), "time_zone");
        long teamMemberId = teamMemberResolver.resolve(data.get(TEAM_MEMBER_ID));

        Map<String, Object> wire = new LinkedHashMap<>();
        wire.put(TEAM_MEMBER_ID, teamMemberId);
        wire.put(TIME_ZONE_ID, timeZoneId);
        wire.put(FIELDS, fields.stream().map(FieldValue::toWire).toList());
        log.debug("Translated property '{}' into {} fields for team member {}", title, fields.size(), teamMemberId);
        return wire;
    }

    private Map<String, Object> checkWireFormat(Map<String, Object> data) {
        ResourceIds.validate(data.get(TEAM_MEMBER_ID), "team_member");
        if (!(data.get(FIELDS) instanceof List<?> fields)) {
            throw new ValidationException("fields must be a list, got " + Values.describe(data.get(FIELDS)));
        }
        for (Object field : fields) {
            if (!(field instanceof Map<?, ?> entry) || entry.get("id") == null) {
                throw new ValidationException("Each entry of fields must be a map with an id, got "
                                              + Values.describe(field));
            }
        }
        log.debug("Property data is already in wire format, passing it through");
        return data;
    }
}
