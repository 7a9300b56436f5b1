package com.connector.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Data;

/**
 * How to request the next page. All templates are evaluated against the previous page's response.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class PaginationDefinition {

    /**
     * Replaces the Call's URL for the next page (e.g. {@code "{{body.next}}"}).
     */
    private String url;

    private JsonNode qs;

    private JsonNode headers;

    private JsonNode body;

    /**
     * Keep fetching while truthy. Defaults to "the previous page returned at least one item".
     */
    private JsonNode condition;

    /**
     * When {@code true} (default) the pagination qs/headers/body are merged over the Call's own values,
     * otherwise they replace them.
     */
    private boolean mergeWithParent = true;
}
