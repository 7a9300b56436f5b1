package com.connector.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;

/**
 * Defaults inherited by every Call of an integration. Call-level keys override base-level keys of the
 * same name.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class BaseDefinition {

    /**
     * Template for the base URL; relative Call URLs are appended to it.
     */
    private String baseUrl;

    private JsonNode headers;

    private JsonNode qs;

    private JsonNode body;

    /**
     * Default response rules, most notably the {@code valid} condition and the {@code error} templates.
     */
    private ResponseDefinition response;

    private LogDefinition log = new LogDefinition();

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class LogDefinition {

        /**
         * Dotted paths (e.g. {@code request.headers.authorization}) removed from every logged exchange.
         */
        private List<String> sanitize = new ArrayList<>();
    }
}
