package com.opentoclose.client.config;

import com.opentoclose.client.common.apiclient.opentoclose.OpenToCloseApiClient;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Binds application properties under the "app.open-to-close" prefix.
 */
@Data
@ConfigurationProperties(prefix = "app.open-to-close")
public class OpenToCloseProperties {

    /**
     * API token. When unset, the OPEN_TO_CLOSE_API_KEY environment variable is used.
     */
    private String apiKey;

    private String baseUrl = OpenToCloseApiClient.DEFAULT_BASE_URL;

    private Duration timeout = OpenToCloseApiClient.DEFAULT_TIMEOUT;

    private String userAgent = OpenToCloseApiClient.DEFAULT_USER_AGENT;

    /**
     * Largest response body buffered in memory, in bytes. -1 means no limit.
     */
    private int maxInMemorySize = OpenToCloseApiClient.DEFAULT_MAX_IN_MEMORY_SIZE;

    /**
     * Per-account overrides of the property field table, keyed by human field name
     * (title, client_type, status, purchase_amount).
     */
    private Map<String, PropertyField> propertyFields = new LinkedHashMap<>();

    @Data
    public static class PropertyField {
        private Long id;
        private String key;
        private Map<String, Long> options = new LinkedHashMap<>();
    }
}
