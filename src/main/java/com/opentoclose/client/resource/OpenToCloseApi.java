package com.opentoclose.client.resource;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.opentoclose.client.common.apiclient.authentication.impl.QueryTokenAuthentication;
import com.opentoclose.client.common.apiclient.model.HeaderConfig;
import com.opentoclose.client.common.apiclient.opentoclose.OpenToCloseApiClient;
import com.opentoclose.client.common.json.JsonParser;
import com.opentoclose.client.common.json.jackson.JacksonJsonParser;
import com.opentoclose.client.common.response.ResponseNormalizer;
import com.opentoclose.client.service.property.PropertyFieldMapping;
import com.opentoclose.client.service.property.PropertyFieldTranslator;
import com.opentoclose.client.service.property.TeamMemberResolver;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Entry point of the Open To Close client: one facade per resource, all sharing one transport.
 *
 * <p>Spring applications get an instance from the client configuration; other callers use
 * {@link #create(String, String)} or {@link #fromEnvironment(String)}.
 */
@Getter
@Accessors(fluent = true)
public class OpenToCloseApi {

    private final AgentsApi agents;
    private final ContactsApi contacts;
    private final PropertiesApi properties;
    private final PropertyContactsApi propertyContacts;
    private final PropertyDocumentsApi propertyDocuments;
    private final PropertyEmailsApi propertyEmails;
    private final PropertyNotesApi propertyNotes;
    private final PropertyTasksApi propertyTasks;
    private final TagsApi tags;
    private final TeamsApi teams;
    private final UsersApi users;

    public OpenToCloseApi(OpenToCloseApiClient apiClient, ResponseNormalizer normalizer,
                          PropertyFieldMapping fieldMapping) {
        TeamMemberResolver teamMemberResolver = new TeamMemberResolver(apiClient, normalizer);
        this.agents = new AgentsApi(apiClient, normalizer);
        this.contacts = new ContactsApi(apiClient, normalizer);
        this.properties = new PropertiesApi(apiClient, normalizer,
                                            new PropertyFieldTranslator(fieldMapping, teamMemberResolver));
        this.propertyContacts = new PropertyContactsApi(apiClient, normalizer);
        this.propertyDocuments = new PropertyDocumentsApi(apiClient, normalizer);
        this.propertyEmails = new PropertyEmailsApi(apiClient, normalizer);
        this.propertyNotes = new PropertyNotesApi(apiClient, normalizer);
        this.propertyTasks = new PropertyTasksApi(apiClient, normalizer);
        this.tags = new TagsApi(apiClient, normalizer);
        this.teams = new TeamsApi(apiClient, normalizer);
        this.users = new UsersApi(apiClient, normalizer);
    }

    /**
     * Builds a client with an explicit token, falling back to the {@code OPEN_TO_CLOSE_API_KEY}
     * environment variable when the token is {@code null}.
     *
     * @param apiKey  the API token, may be {@code null}.
     * @param baseUrl the base URL, or {@code null} for the production API.
     *
     * @return the client.
     *
     * @throws com.opentoclose.client.exception.apiclient.AuthenticationException if no token is found.
     */
    public static OpenToCloseApi create(String apiKey, String baseUrl) {
        JsonParser jsonParser = new JacksonJsonParser(new ObjectMapper());
        HeaderConfig headers = new HeaderConfig()
                .add(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .add(HttpHeaders.USER_AGENT, OpenToCloseApiClient.DEFAULT_USER_AGENT);
        OpenToCloseApiClient apiClient = new OpenToCloseApiClient(
                WebClient.builder()
                         .codecs(OpenToCloseApiClient.codecs(OpenToCloseApiClient.DEFAULT_MAX_IN_MEMORY_SIZE))
                         .build(),
                QueryTokenAuthentication.resolve(apiKey, System::getenv),
                headers,
                jsonParser,
                baseUrl == null ? OpenToCloseApiClient.DEFAULT_BASE_URL : baseUrl,
                OpenToCloseApiClient.DEFAULT_TIMEOUT);
        return new OpenToCloseApi(apiClient, new ResponseNormalizer(jsonParser), PropertyFieldMapping.defaults());
    }

    public static OpenToCloseApi fromEnvironment(String baseUrl) {
        return create(null, baseUrl);
    }
}
