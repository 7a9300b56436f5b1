package com.connector.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Data;

/**
 * One HTTP request template plus its response-handling rules.
 * <p>
 * Every field except {@code type} may contain {@code {{ }}} expressions, which are evaluated against the
 * current {@link com.connector.expression.Scope} right before the request is sent.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class CallDefinition {

    /**
     * Relative to {@code base.baseUrl}, unless absolute, in which case it fully overrides the base URL.
     */
    private String url;

    /**
     * HTTP method; defaults to {@code GET} when omitted.
     */
    private String method;

    private JsonNode headers;

    private JsonNode qs;

    private JsonNode body;

    /**
     * Body encoding: {@code json} (default), {@code urlencoded} or {@code text}.
     */
    private BodyType type;

    /**
     * When present and falsy, the step is skipped.
     */
    private JsonNode condition;

    private ResponseDefinition response;

    private PaginationDefinition pagination;
}
