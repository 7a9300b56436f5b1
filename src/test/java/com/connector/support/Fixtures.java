package com.connector.support;

import com.connector.config.RuntimeProperties;
import com.connector.model.IntegrationDefinition;
import com.connector.service.api.FunctionRegistry;
import com.connector.service.impl.ExpressionEvaluatorImpl;
import com.connector.service.impl.LogSanitizer;
import com.connector.service.impl.RequestExecutorImpl;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Shared builders for the unit tests: definitions are written as JSON, the way integrations are authored.
 */
public final class Fixtures {

    public static final ObjectMapper MAPPER = new ObjectMapper();
    public static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private Fixtures() {
    }

    public static Clock fixedClock() {
        return Clock.fixed(NOW, ZoneOffset.UTC);
    }

    public static RuntimeProperties properties() {
        RuntimeProperties properties = new RuntimeProperties();
        properties.getHttp().setResponseTimeout(Duration.ofSeconds(5));
        properties.getRetry().setInitialBackoff(Duration.ofMillis(10));
        return properties;
    }

    public static ExpressionEvaluatorImpl evaluator(Clock clock, FunctionRegistry functionRegistry) {
        return new ExpressionEvaluatorImpl(clock, functionRegistry);
    }

    public static ExpressionEvaluatorImpl evaluator() {
        return evaluator(fixedClock(), null);
    }

    public static RequestExecutorImpl requestExecutor(ExpressionEvaluatorImpl evaluator, Clock clock) {
        return new RequestExecutorImpl(WebClient.builder().build(), evaluator, new LogSanitizer(), clock, properties());
    }

    public static JsonNode json(String json) {
        try {
            return MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid test JSON: " + e.getOriginalMessage(), e);
        }
    }

    public static <T> T read(String json, Class<T> type) {
        try {
            return MAPPER.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid test JSON: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Loads an integration definition from {@code src/test/resources/integrations/}.
     */
    public static IntegrationDefinition integration(String resource) {
        try (InputStream in = Fixtures.class.getClassLoader().getResourceAsStream("integrations/" + resource)) {
            if (in == null) {
                throw new IllegalArgumentException("Missing test resource integrations/" + resource);
            }
            return MAPPER.readValue(in, IntegrationDefinition.class);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Loads an integration definition and points its base URL at a mock server.
     */
    public static IntegrationDefinition integration(String resource, String baseUrl) {
        IntegrationDefinition definition = integration(resource);
        definition.getBase().setBaseUrl(baseUrl);
        return definition;
    }
}
