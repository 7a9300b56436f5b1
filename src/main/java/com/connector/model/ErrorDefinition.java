package com.connector.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Data;

/**
 * Error templates of a response block.
 * <p>
 * {@code message} and {@code type} are the defaults; any other key is an HTTP status code whose nested
 * template takes precedence for that status, e.g. {@code {"message": "...", "404": {"message": "not found"}}}.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ErrorDefinition {

    private JsonNode message;

    /**
     * Optional explicit kind, e.g. {@code "RateLimitError"}; otherwise derived from the status code.
     */
    private String type;

    @JsonIgnore
    private Map<String, ErrorDefinition> statuses = new LinkedHashMap<>();

    @JsonAnySetter
    public void putStatus(String status, ErrorDefinition template) {
        statuses.put(status, template);
    }

    @JsonAnyGetter
    public Map<String, ErrorDefinition> statusTemplates() {
        return statuses;
    }

    public ErrorDefinition forStatus(int statusCode) {
        return statuses.get(String.valueOf(statusCode));
    }
}
