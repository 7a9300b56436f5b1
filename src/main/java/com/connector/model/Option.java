package com.connector.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

/**
 * One entry of a dynamic option list. Entries with nested {@code options} are groups.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record Option(String label, JsonNode value, List<Option> options) {

    public Option(String label, JsonNode value) {
        this(label, value, List.of());
    }
}
