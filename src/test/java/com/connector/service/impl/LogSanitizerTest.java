package com.connector.service.impl;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import org.junit.jupiter.api.Test;

import static com.connector.support.Fixtures.json;
import static org.assertj.core.api.Assertions.assertThat;

class LogSanitizerTest {

    private final LogSanitizer logSanitizer = new LogSanitizer();

    @Test
    void sanitize_shouldDropTheListedPathsFromACopy() {
        // --- Arrange ---
        JsonNode exchange = json("{\"request\": {\"headers\": {\"authorization\": \"Bearer tok\", \"accept\": \"*/*\"}},"
                + " \"response\": {\"body\": {\"access_token\": \"secret\", \"expires_in\": 3600}}}");

        // --- Act ---
        JsonNode sanitized = logSanitizer.sanitize(exchange,
                List.of("request.headers.authorization", "response.body.access_token", "response.body.missing"));

        // --- Assert ---
        assertThat(sanitized).isEqualTo(json("{\"request\": {\"headers\": {\"accept\": \"*/*\"}},"
                + " \"response\": {\"body\": {\"expires_in\": 3600}}}"));
        assertThat(exchange.at("/request/headers/authorization").asText()).isEqualTo("Bearer tok");
    }

    @Test
    void sanitize_shouldExpandWildcardsOverArrays() {
        // --- Arrange ---
        JsonNode exchange = json("{\"response\": {\"body\": {\"users\": [{\"name\": \"a\", \"ssn\": 1}, {\"name\": \"b\", \"ssn\": 2}]}}}");

        // --- Act ---
        JsonNode sanitized = logSanitizer.sanitize(exchange, List.of("response.body.users.*.ssn"));

        // --- Assert ---
        assertThat(sanitized.at("/response/body/users")).isEqualTo(json("[{\"name\": \"a\"}, {\"name\": \"b\"}]"));
    }

    @Test
    void toJsonPath_shouldQuoteEverySegment() {
        assertThat(LogSanitizer.toJsonPath("request.headers.x-api-key")).isEqualTo("$['request']['headers']['x-api-key']");
        assertThat(LogSanitizer.toJsonPath("$.already.json.path")).isEqualTo("$.already.json.path");
    }
}
