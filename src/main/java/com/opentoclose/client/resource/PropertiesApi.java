package com.opentoclose.client.resource;

import com.opentoclose.client.common.apiclient.opentoclose.OpenToCloseApiClient;
import com.opentoclose.client.common.response.ResponseNormalizer;
import com.opentoclose.client.service.property.PropertyFieldTranslator;
import com.opentoclose.client.service.validation.ResourceRules;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * Properties: {@code /properties}.
 *
 * <p>Create goes through {@link PropertyFieldTranslator}, which turns human-readable input into the
 * provider's field-id format. The other operations send the caller's keys as they are.
 */
@Slf4j
public class PropertiesApi extends ResourceApi {

    private static final String PROPERTIES_ENDPOINT = "/properties";

    private final PropertyFieldTranslator translator;

    public PropertiesApi(OpenToCloseApiClient apiClient, ResponseNormalizer normalizer,
                         PropertyFieldTranslator translator) {
        super(apiClient, normalizer, PROPERTIES_ENDPOINT, "property", ResourceRules.PROPERTIES,
              ResourceRules.STANDARD_LIST);
        this.translator = translator;
    }

    /**
     * Creates a property from human-readable fields or from a payload already in wire format.
     *
     * @param data {@code title} (required), {@code client_type}, {@code status},
     *             {@code purchase_amount}, {@code team_member_id} and {@code time_zone_id}.
     *
     * @return the created property.
     */
    @Override
    public Map<String, Object> create(Map<String, ?> data) {
        return send(translator.translate(data));
    }

    /**
     * Creates a Buyer property with status Active.
     *
     * @param title the property title.
     *
     * @return the created property.
     */
    public Map<String, Object> create(String title) {
        return send(translator.translate(title));
    }

    private Map<String, Object> send(Map<String, Object> payload) {
        Map<String, Object> created = normalizer.normalizeRecord(apiClient.post(PROPERTIES_ENDPOINT, payload));
        log.info("Created property {}", created.get("id"));
        return created;
    }
}
