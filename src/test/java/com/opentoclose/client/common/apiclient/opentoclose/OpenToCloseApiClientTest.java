package com.opentoclose.client.common.apiclient.opentoclose;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.opentoclose.client.common.apiclient.StubExchange;
import com.opentoclose.client.common.apiclient.authentication.impl.QueryTokenAuthentication;
import com.opentoclose.client.common.apiclient.model.HeaderConfig;
import com.opentoclose.client.common.json.jackson.JacksonJsonParser;
import com.opentoclose.client.exception.apiclient.AuthenticationException;
import com.opentoclose.client.exception.apiclient.NetworkException;
import com.opentoclose.client.exception.apiclient.NotFoundException;
import com.opentoclose.client.exception.apiclient.OpenToCloseApiException;
import com.opentoclose.client.exception.apiclient.RateLimitException;
import com.opentoclose.client.exception.apiclient.ServerException;
import com.opentoclose.client.exception.apiclient.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("OpenToCloseApiClient Tests")
class OpenToCloseApiClientTest {

    private static final String BASE_URL = "https://api.example.com/v1";

    private OpenToCloseApiClient client(StubExchange exchange) {
        return new OpenToCloseApiClient(exchange.webClient(),
                                        new QueryTokenAuthentication(QueryTokenAuthentication.DEFAULT_PARAMETER_NAME, "k"),
                                        new HeaderConfig().add(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE),
                                        new JacksonJsonParser(new ObjectMapper()), BASE_URL, Duration.ofSeconds(5));
    }

    @Nested
    @DisplayName("Request building")
    class RequestBuilding {

        @ParameterizedTest
        @EnumSource(value = Verb.class)
        @DisplayName("Should send the API token as a query parameter on every verb")
        void shouldSendTokenOnEveryVerb(Verb verb) {
            StubExchange exchange = StubExchange.respondingWith(200, "{\"id\":1}");

            verb.invoke(client(exchange));

            ClientRequest request = exchange.lastRequest();
            assertThat(request.method()).isEqualTo(verb.method);
            assertThat(request.url().getQuery()).isEqualTo("api_token=k");
            assertThat(request.headers().containsKey("Authorization")).isFalse();
        }

        @Test
        @DisplayName("Should strip one leading slash and join the endpoint to the base URL")
        void shouldJoinEndpointToBaseUrl() {
            StubExchange exchange = StubExchange.respondingWith(200, "[]");

            client(exchange).get("/contacts", null);
            client(exchange).get("contacts/5", null);

            assertThat(exchange.requests().get(0).url().getPath()).isEqualTo("/v1/contacts");
            assertThat(exchange.requests().get(1).url().getPath()).isEqualTo("/v1/contacts/5");
        }

        @Test
        @DisplayName("Should keep caller query parameters alongside the token")
        void shouldKeepQueryParameters() {
            StubExchange exchange = StubExchange.respondingWith(200, "[]");

            client(exchange).get("/tags", Map.of("category", "a b"));

            assertThat(exchange.lastRequest().url().getRawQuery()).isEqualTo("category=a%20b&api_token=k");
        }

        @Test
        @DisplayName("Should send a JSON body")
        void shouldSendJsonBody() {
            StubExchange exchange = StubExchange.respondingWith(201, "{\"id\":3}");

            client(exchange).post("/contacts", Map.of("email", "a@b.com"));

            assertThat(exchange.lastBody()).isEqualTo("{\"email\":\"a@b.com\"}");
            assertThat(exchange.lastRequest().url().getQuery()).isEqualTo("api_token=k");
        }

        @Test
        @DisplayName("Should send form fields URL-encoded with the token still in the query")
        void shouldSendFormData() {
            StubExchange exchange = StubExchange.respondingWith(200, "{\"id\":4}");
            Map<String, Object> form = new LinkedHashMap<>();
            form.put("name", "Deed");
            form.put("type", "legal");

            client(exchange).execute(HttpMethod.POST, "/properties/1/documents", null, null, form, null);

            assertThat(exchange.lastBody()).isEqualTo("name=Deed&type=legal");
            assertThat(exchange.lastRequest().url().getQuery()).isEqualTo("api_token=k");
        }

        @Test
        @DisplayName("Should send form fields and files as multipart parts")
        void shouldSendMultipart() {
            StubExchange exchange = StubExchange.respondingWith(200, "{\"id\":5}");
            ByteArrayResource file = new ByteArrayResource("%PDF-1.4 deed".getBytes(StandardCharsets.UTF_8)) {
                @Override
                public String getFilename() {
                    return "deed.pdf";
                }
            };

            client(exchange).execute(HttpMethod.POST, "/properties/1/documents", null, null,
                                     Map.<String, Object>of("name", "Deed"), Map.<String, Object>of("file", file));

            assertThat(exchange.lastBody())
                    .contains("name=\"name\"", "Deed")
                    .contains("name=\"file\"; filename=\"deed.pdf\"", "%PDF-1.4 deed");
            assertThat(exchange.lastRequest().url().getQuery()).isEqualTo("api_token=k");
        }

        @Test
        @DisplayName("Should send configured headers")
        void shouldSendConfiguredHeaders() {
            StubExchange exchange = StubExchange.respondingWith(200, "{}");

            client(exchange).get("/users", null);

            assertThat(exchange.lastRequest().headers().getFirst(HttpHeaders.ACCEPT))
                    .isEqualTo(MediaType.APPLICATION_JSON_VALUE);
        }

        @Test
        @DisplayName("Should reject a blank endpoint before sending anything")
        void shouldRejectBlankEndpoint() {
            StubExchange exchange = StubExchange.respondingWith(200, "{}");

            assertThatThrownBy(() -> client(exchange).get(" ", null)).isInstanceOf(ValidationException.class);
            assertThat(exchange.requests()).isEmpty();
        }

        @Test
        @DisplayName("Should reject a base URL that is not HTTP")
        void shouldRejectInvalidBaseUrl() {
            StubExchange exchange = new StubExchange();

            assertThatThrownBy(() -> new OpenToCloseApiClient(exchange.webClient(),
                    new QueryTokenAuthentication("api_token", "k"), new HeaderConfig(),
                    new JacksonJsonParser(new ObjectMapper()), "ftp://example.com", Duration.ofSeconds(5)))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("ftp://example.com");
        }
    }

    @Nested
    @DisplayName("Successful responses")
    class SuccessfulResponses {

        @ParameterizedTest
        @EnumSource(value = Verb.class)
        @DisplayName("Should return an empty object for 204 on every verb")
        void shouldReturnEmptyObjectForNoContent(Verb verb) {
            StubExchange exchange = new StubExchange().respond(204, null, null);

            JsonNode result = verb.invoke(client(exchange));

            assertThat(result.isObject()).isTrue();
            assertThat(result.size()).isZero();
        }

        @Test
        @DisplayName("Should decode a JSON body")
        void shouldDecodeJson() {
            StubExchange exchange = StubExchange.respondingWith(200, "{\"id\":7,\"email\":\"a@b.com\"}");

            JsonNode result = client(exchange).get("/contacts/7", null);

            assertThat(result.get("email").asText()).isEqualTo("a@b.com");
        }

        @Test
        @DisplayName("Should decode a list response larger than the default codec buffer")
        void shouldDecodeLargeBody() {
            StringBuilder body = new StringBuilder("{\"data\":[");
            for (int i = 1; i <= 1000; i++) {
                if (i > 1) {
                    body.append(',');
                }
                body.append("{\"id\":").append(i).append(",\"notes\":\"").append("x".repeat(300)).append("\"}");
            }
            body.append("]}");
            assertThat(body.length()).isGreaterThan(256 * 1024);
            StubExchange exchange = StubExchange.respondingWith(200, body.toString())
                    .withCodecs(OpenToCloseApiClient.codecs(OpenToCloseApiClient.DEFAULT_MAX_IN_MEMORY_SIZE));

            JsonNode result = client(exchange).get("/properties", Map.of("limit", 1000));

            assertThat(result.get("data").size()).isEqualTo(1000);
        }

        @Test
        @DisplayName("Should treat an unparsable body as an empty object")
        void shouldTreatUnparsableBodyAsEmpty() {
            StubExchange exchange = new StubExchange().respond(200, MediaType.TEXT_PLAIN_VALUE, "OK, done");

            JsonNode result = client(exchange).post("/contacts", Map.of("email", "a@b.com"));

            assertThat(result.isObject()).isTrue();
            assertThat(result.size()).isZero();
        }

        @Test
        @DisplayName("Should treat an empty body as an empty object")
        void shouldTreatEmptyBodyAsEmpty() {
            StubExchange exchange = StubExchange.respondingWith(200, null);

            assertThat(client(exchange).delete("/contacts/1").size()).isZero();
        }

        @Test
        @DisplayName("Should raise AuthenticationException for an HTML login page")
        void shouldRejectHtmlLoginPage() {
            StubExchange exchange = new StubExchange()
                    .respond(200, MediaType.TEXT_HTML_VALUE, "<html><body>Please sign in</body></html>");

            assertThatThrownBy(() -> client(exchange).get("/properties", null))
                    .isInstanceOf(AuthenticationException.class)
                    .hasMessageContaining("HTML login page")
                    .extracting("statusCode").isEqualTo(200);
        }

        @Test
        @DisplayName("Should raise ServerException for an HTML error page")
        void shouldRejectHtmlErrorPage() {
            StubExchange exchange = new StubExchange()
                    .respond(200, MediaType.TEXT_HTML_VALUE, "<html><h1>An error occurred</h1></html>");

            assertThatThrownBy(() -> client(exchange).get("/properties", null))
                    .isInstanceOf(ServerException.class);
        }
    }

    @Nested
    @DisplayName("Error responses")
    class ErrorResponses {

        @Test
        @DisplayName("Should raise RateLimitException with the API message and Retry-After")
        void shouldMapRateLimit() {
            HttpHeaders headers = new HttpHeaders();
            headers.add(HttpHeaders.RETRY_AFTER, "30");
            StubExchange exchange = new StubExchange()
                    .respond(429, MediaType.APPLICATION_JSON_VALUE, "{\"message\":\"slow down\"}", headers);

            assertThatThrownBy(() -> client(exchange).get("/contacts", null))
                    .isInstanceOfSatisfying(RateLimitException.class, e -> {
                        assertThat(e.getMessage()).contains("slow down");
                        assertThat(e.getStatusCode()).isEqualTo(429);
                        assertThat(e.getRetryAfter()).isEqualTo(30);
                        assertThat(e.getMethod()).isEqualTo("GET");
                        assertThat(e.getEndpoint()).isEqualTo("/contacts");
                    });
        }

        @Test
        @DisplayName("Should raise ValidationException with field errors for 400")
        void shouldMapBadRequest() {
            StubExchange exchange = StubExchange.respondingWith(400,
                    "{\"message\":\"Invalid data\",\"errors\":{\"email\":[\"is invalid\"]}}");

            assertThatThrownBy(() -> client(exchange).post("/contacts", Map.of("email", "x@y")))
                    .isInstanceOfSatisfying(ValidationException.class, e -> {
                        assertThat(e.getMessage()).isEqualTo("Bad request to POST /contacts: Invalid data");
                        assertThat(e.getFieldErrors().get("email").get(0).asText()).isEqualTo("is invalid");
                    });
        }

        @Test
        @DisplayName("Should map 401, 404 and 5xx to their exception types")
        void shouldMapStatusCodes() {
            assertThatThrownBy(() -> client(StubExchange.respondingWith(401, "{}")).get("/users", null))
                    .isInstanceOf(AuthenticationException.class)
                    .hasMessage("Authentication failed for GET /users: Invalid credentials");
            assertThatThrownBy(() -> client(StubExchange.respondingWith(404, "{\"message\":\"gone\"}")).get("/users/9", null))
                    .isInstanceOf(NotFoundException.class)
                    .hasMessage("Resource not found for GET /users/9: gone");
            assertThatThrownBy(() -> client(StubExchange.respondingWith(503, "")).get("/users", null))
                    .isInstanceOf(ServerException.class)
                    .extracting("statusCode").isEqualTo(503);
        }

        @Test
        @DisplayName("Should raise the generic exception for an unmapped status")
        void shouldMapUnknownStatusToGeneric() {
            assertThatThrownBy(() -> client(StubExchange.respondingWith(405, "{}")).delete("/properties/1/contacts/2"))
                    .isExactlyInstanceOf(OpenToCloseApiException.class)
                    .hasMessageStartingWith("Unexpected error for DELETE");
        }

        @Test
        @DisplayName("Should use a non-JSON error body verbatim")
        void shouldUseRawErrorBody() {
            StubExchange exchange = new StubExchange().respond(500, MediaType.TEXT_PLAIN_VALUE, "upstream exploded");

            assertThatThrownBy(() -> client(exchange).get("/teams", null))
                    .isInstanceOfSatisfying(ServerException.class, e -> {
                        assertThat(e.getMessage()).isEqualTo("upstream exploded");
                        assertThat(e.getResponseData().get("raw_content").asText()).isEqualTo("upstream exploded");
                    });
        }

        @Test
        @DisplayName("Should raise NetworkException when no response is received")
        void shouldMapNetworkFailure() {
            StubExchange exchange = new StubExchange().fail(new IOException("Connection refused"));

            assertThatThrownBy(() -> client(exchange).get("/agents", null))
                    .isInstanceOf(NetworkException.class)
                    .hasRootCauseInstanceOf(IOException.class)
                    .extracting("statusCode").isNull();
        }
    }

    enum Verb {
        GET(HttpMethod.GET), POST(HttpMethod.POST), PUT(HttpMethod.PUT), PATCH(HttpMethod.PATCH),
        DELETE(HttpMethod.DELETE);

        private final HttpMethod method;

        Verb(HttpMethod method) {
            this.method = method;
        }

        JsonNode invoke(OpenToCloseApiClient client) {
            return switch (this) {
                case GET -> client.get("/contacts", null);
                case POST -> client.post("/contacts", Map.of("email", "a@b.com"));
                case PUT -> client.put("/contacts/1", Map.of("phone", "555"));
                case PATCH -> client.patch("/contacts/1", List.of(Map.of("phone", "555")));
                case DELETE -> client.delete("/contacts/1");
            };
        }
    }
}
