package com.opentoclose.client.common.apiclient.opentoclose.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.opentoclose.client.common.apiclient.authentication.Authentication;
import com.opentoclose.client.common.apiclient.authentication.impl.QueryTokenAuthentication;
import com.opentoclose.client.common.apiclient.model.HeaderConfig;
import com.opentoclose.client.common.apiclient.opentoclose.OpenToCloseApiClient;
import com.opentoclose.client.common.json.JsonParser;
import com.opentoclose.client.common.json.jackson.JacksonJsonParser;
import com.opentoclose.client.common.response.ResponseNormalizer;
import com.opentoclose.client.config.OpenToCloseProperties;
import com.opentoclose.client.resource.OpenToCloseApi;
import com.opentoclose.client.service.property.FieldDefinition;
import com.opentoclose.client.service.property.PropertyFieldMapping;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configures the beans of the Open To Close client, from the {@link WebClient} and
 * {@link Authentication} up to the {@link OpenToCloseApi} facade root.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(OpenToCloseProperties.class)
public class OpenToCloseClientConfiguration {

    /**
     * Creates the {@link WebClient} used for the Open To Close API. The base URL is applied by the
     * transport client, not here.
     *
     * @param builder    the application's WebClient builder, if one is available.
     * @param properties the bound client properties.
     *
     * @return A {@link WebClient} bean named "openToCloseWebClient".
     */
    @Bean("openToCloseWebClient")
    public WebClient openToCloseWebClient(ObjectProvider<WebClient.Builder> builder, OpenToCloseProperties properties) {
        log.info("Initializing Open To Close WebClient with max in-memory size: {}", properties.getMaxInMemorySize());
        return builder.getIfAvailable(WebClient::builder)
                      .codecs(OpenToCloseApiClient.codecs(properties.getMaxInMemorySize()))
                      .build();
    }

    /**
     * Creates the token authentication, from the configured key or the environment.
     *
     * @param properties the bound client properties.
     *
     * @return A {@link QueryTokenAuthentication} bean named "openToCloseAuthentication".
     */
    @Bean("openToCloseAuthentication")
    public Authentication openToCloseAuthentication(OpenToCloseProperties properties) {
        Authentication authentication = QueryTokenAuthentication.resolve(properties.getApiKey(), System::getenv);
        log.info("Initialized Open To Close authentication: {}", authentication);
        return authentication;
    }

    @Bean("openToCloseHeader")
    public HeaderConfig openToCloseHeader(OpenToCloseProperties properties) {
        return new HeaderConfig()
                .add(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .add(HttpHeaders.USER_AGENT, properties.getUserAgent());
    }

    @Bean("openToCloseJsonParser")
    public JsonParser openToCloseJsonParser(ObjectProvider<ObjectMapper> objectMapper) {
        return new JacksonJsonParser(objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    public OpenToCloseApiClient openToCloseApiClient(@Qualifier("openToCloseWebClient") WebClient webClient,
                                                     @Qualifier("openToCloseAuthentication") Authentication authentication,
                                                     @Qualifier("openToCloseHeader") HeaderConfig headerConfig,
                                                     @Qualifier("openToCloseJsonParser") JsonParser jsonParser,
                                                     OpenToCloseProperties properties) {
        return new OpenToCloseApiClient(webClient, authentication, headerConfig, jsonParser,
                                        properties.getBaseUrl(), properties.getTimeout());
    }

    @Bean
    public ResponseNormalizer openToCloseResponseNormalizer(@Qualifier("openToCloseJsonParser") JsonParser jsonParser) {
        return new ResponseNormalizer(jsonParser);
    }

    /**
     * Builds the property field table, applying the configured overrides to the defaults. Unset
     * parts of an override keep their default value.
     *
     * @param properties the bound client properties.
     *
     * @return the field table.
     */
    @Bean
    public PropertyFieldMapping propertyFieldMapping(OpenToCloseProperties properties) {
        PropertyFieldMapping defaults = PropertyFieldMapping.defaults();
        Map<String, FieldDefinition> overrides = new LinkedHashMap<>();
        properties.getPropertyFields().forEach((name, field) -> {
            FieldDefinition base = defaults.find(name).orElse(null);
            long id = field.getId() != null ? field.getId() : base == null ? 0L : base.id();
            String key = field.getKey() != null ? field.getKey() : base == null ? name : base.key();
            Map<String, Long> options = field.getOptions().isEmpty() && base != null
                    ? base.options()
                    : field.getOptions();
            overrides.put(name, new FieldDefinition(id, key, options));
        });
        return defaults.withOverrides(overrides);
    }

    @Bean
    public OpenToCloseApi openToCloseApi(OpenToCloseApiClient apiClient, ResponseNormalizer normalizer,
                                         PropertyFieldMapping propertyFieldMapping) {
        return new OpenToCloseApi(apiClient, normalizer, propertyFieldMapping);
    }
}
