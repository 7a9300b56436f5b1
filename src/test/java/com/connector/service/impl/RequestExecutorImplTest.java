package com.connector.service.impl;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.connector.exception.ProviderException;
import com.connector.exception.RateLimitException;
import com.connector.exception.RequestException;
import com.connector.exception.ValidationException;
import com.connector.expression.Scope;
import com.connector.model.CallDefinition;
import com.connector.model.IntegrationDefinition;
import com.connector.model.RawResponse;
import com.connector.model.ResultItem;
import com.connector.support.Fixtures;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import static com.connector.support.Fixtures.json;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RequestExecutorImplTest {

    public static MockWebServer mockWebServer;

    private RequestExecutorImpl requestExecutor;
    private IntegrationDefinition integration;
    private Scope scope;

    @BeforeAll
    static void setUpAll() throws IOException {
        mockWebServer = new MockWebServer();
        mockWebServer.start();
    }

    @AfterAll
    static void tearDownAll() throws IOException {
        mockWebServer.shutdown();
    }

    @BeforeEach
    void setUp() {
        requestExecutor = Fixtures.requestExecutor(Fixtures.evaluator(), Fixtures.fixedClock());
        integration = Fixtures.integration("requests.json", mockWebServer.url("/api").toString());
        scope = Scope.of(integration.appContext())
                .with(Scope.PARAMETERS, json("{\"id\": 42}"))
                .with(Scope.CONNECTION, json("{\"apiKey\": \"secret-key\"}"));
    }

    private CallDefinition call(String moduleId) {
        return integration.requireModule(moduleId).getCalls().get(0);
    }

    @Test
    void execute_shouldMergeBaseAndCallSettingsIntoTheRequest() throws Exception {
        // --- Arrange ---
        mockWebServer.enqueue(new MockResponse()
                .setBody("{\"id\": 42, \"name\": \"ada\"}")
                .addHeader("Content-Type", "application/json"));

        // --- Act ---
        RawResponse response = requestExecutor.execute(call("getContact"), integration, scope);

        // --- Assert ---
        RecordedRequest recordedRequest = mockWebServer.takeRequest();
        assertThat(recordedRequest.getMethod()).isEqualTo("GET");
        assertThat(recordedRequest.getRequestUrl().encodedPath()).isEqualTo("/api/contacts/42");
        assertThat(recordedRequest.getRequestUrl().queryParameter("api_version")).isEqualTo("2024-01");
        assertThat(recordedRequest.getRequestUrl().queryParameterValues("tags")).containsExactly("a", "b");
        assertThat(recordedRequest.getRequestUrl().queryParameterNames()).doesNotContain("fields", "empty");
        assertThat(recordedRequest.getHeader("Authorization")).isEqualTo("Bearer secret-key");
        assertThat(recordedRequest.getHeaders().values("X-Client")).containsExactly("override");

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.headers().get("content-type").asText()).startsWith("application/json");
    }

    @Test
    void execute_shouldKeepSanitizedQueryParametersOutOfTheExchangeLog() {
        // --- Arrange ---
        mockWebServer.enqueue(new MockResponse().setBody("{}").addHeader("Content-Type", "application/json"));
        Logger logger = (Logger) LoggerFactory.getLogger(RequestExecutorImpl.class);
        Level previousLevel = logger.getLevel();
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        logger.setLevel(Level.DEBUG);

        // --- Act ---
        try {
            requestExecutor.execute(call("searchByKey"), integration, scope);
        } finally {
            logger.detachAppender(appender);
            logger.setLevel(previousLevel);
        }

        // --- Assert ---
        assertThat(appender.list).extracting(ILoggingEvent::getFormattedMessage)
                .anySatisfy(message -> assertThat(message)
                        .startsWith("HTTP exchange for 'requests'")
                        .contains("\"q\":\"ada\"")
                        .contains("/api/search\"")
                        .doesNotContain("secret-key"));
    }

    @Test
    void extract_shouldMapTheOutputTemplate() {
        // --- Arrange ---
        mockWebServer.enqueue(new MockResponse()
                .setBody("{\"id\": 42, \"name\": \"ada\"}")
                .addHeader("Content-Type", "application/json"));
        CallDefinition call = call("getContact");

        // --- Act ---
        RawResponse response = requestExecutor.execute(call, integration, scope);
        List<ResultItem> items = requestExecutor.extract(call, requestExecutor.responseScope(scope, response));

        // --- Assert ---
        assertThat(items).hasSize(1);
        assertThat(items.get(0).output()).isEqualTo(json("{\"id\": 42, \"name\": \"ADA\"}"));
    }

    @Test
    void extract_shouldIterateTheContainerAndFilterItems() {
        // --- Arrange ---
        mockWebServer.enqueue(new MockResponse()
                .setBody("{\"data\": [{\"id\": 1, \"active\": true}, {\"id\": 2, \"active\": false}, {\"id\": 3, \"active\": true}]}")
                .addHeader("Content-Type", "application/json"));
        CallDefinition call = call("listItems");

        // --- Act ---
        RawResponse response = requestExecutor.execute(call, integration, scope);
        List<ResultItem> items = requestExecutor.extract(call, requestExecutor.responseScope(scope, response));

        // --- Assert ---
        assertThat(items).extracting(item -> item.output().get("id").asInt()).containsExactly(1, 3);
    }

    @Test
    void execute_shouldPreferTheCallTemplateForItsStatus() {
        // --- Arrange ---
        mockWebServer.enqueue(new MockResponse()
                .setResponseCode(404)
                .setBody("{\"error\": {\"message\": \"no such contact\"}}")
                .addHeader("Content-Type", "application/json"));

        // --- Act & Assert ---
        assertThatThrownBy(() -> requestExecutor.execute(call("getContact"), integration, scope))
                .isInstanceOf(ValidationException.class)
                .hasMessage("not found")
                .extracting(e -> ((RequestException) e).getStatusCode())
                .isEqualTo(404);
    }

    @Test
    void execute_shouldFallBackToTheBaseTemplateForOtherStatuses() {
        // --- Arrange ---
        mockWebServer.enqueue(new MockResponse()
                .setResponseCode(500)
                .setBody("{\"error\": {\"message\": \"boom\"}}")
                .addHeader("Content-Type", "application/json"));

        // --- Act & Assert ---
        assertThatThrownBy(() -> requestExecutor.execute(call("getContact"), integration, scope))
                .isInstanceOf(ProviderException.class)
                .hasMessage("[500] boom");
    }

    @Test
    void execute_shouldUseTheBuiltinEnvelopeWithoutTemplates() {
        // --- Arrange ---
        integration.getBase().setResponse(null);
        mockWebServer.enqueue(new MockResponse()
                .setResponseCode(401)
                .setBody("{\"message\": \"invalid api key\"}")
                .addHeader("Content-Type", "application/json"));

        // --- Act & Assert ---
        assertThatThrownBy(() -> requestExecutor.execute(call("listItems"), integration, scope))
                .isInstanceOf(RequestException.class)
                .hasMessage("[401] invalid api key")
                .extracting(e -> ((RequestException) e).getKind().getLabel())
                .isEqualTo("AuthError");
    }

    @Test
    void execute_shouldReportRateLimitsWithRetryAfter() {
        // --- Arrange ---
        mockWebServer.enqueue(new MockResponse()
                .setResponseCode(429)
                .addHeader("Retry-After", "7"));

        // --- Act & Assert ---
        assertThatThrownBy(() -> requestExecutor.execute(call("listItems"), integration, scope))
                .isInstanceOfSatisfying(RateLimitException.class, e -> {
                    assertThat(e.isRetryable()).isTrue();
                    assertThat(e.getRetryAfter()).isEqualTo(Duration.ofSeconds(7));
                });
    }

    @Test
    void execute_shouldRaiseSoftErrorsFromTheValidityCheck() {
        // --- Arrange ---
        mockWebServer.enqueue(new MockResponse()
                .setBody("{\"ok\": false, \"reason\": \"quota exhausted\"}")
                .addHeader("Content-Type", "application/json"));

        // --- Act & Assert ---
        assertThatThrownBy(() -> requestExecutor.execute(call("softError"), integration, scope))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Provider said: quota exhausted");
    }

    @Test
    void execute_shouldEncodeFormBodies() throws Exception {
        // --- Arrange ---
        mockWebServer.enqueue(new MockResponse()
                .setBody("{\"access_token\": \"abc\"}")
                .addHeader("Content-Type", "application/json"));

        // --- Act ---
        requestExecutor.execute(call("createToken"), integration, scope);

        // --- Assert ---
        RecordedRequest recordedRequest = mockWebServer.takeRequest();
        assertThat(recordedRequest.getMethod()).isEqualTo("POST");
        assertThat(recordedRequest.getHeader("Content-Type")).startsWith("application/x-www-form-urlencoded");
        assertThat(recordedRequest.getBody().readUtf8())
                .isEqualTo("grant_type=client_credentials&scope=read&scope=write");
    }

    @Test
    void execute_shouldKeepNonJsonBodiesAsText() {
        // --- Arrange ---
        mockWebServer.enqueue(new MockResponse()
                .setBody("plain ok")
                .addHeader("Content-Type", "text/plain"));

        // --- Act ---
        RawResponse response = requestExecutor.execute(call("listItems"), integration, scope);

        // --- Assert ---
        assertThat(response.body().isTextual()).isTrue();
        assertThat(response.body().asText()).isEqualTo("plain ok");
    }

    @Test
    void resolveUrl_shouldKeepAbsoluteUrls() {
        // --- Act ---
        String url = requestExecutor.resolveUrl("https://other.example.com/v2/{{parameters.id}}", integration, scope);

        // --- Assert ---
        assertThat(url).isEqualTo("https://other.example.com/v2/42");
    }
}
