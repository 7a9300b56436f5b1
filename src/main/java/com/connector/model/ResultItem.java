package com.connector.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * An iterated item together with its mapped output.
 *
 * @param item   The raw element of the iterated container (or the whole body when nothing is iterated).
 * @param output The element after the {@code response.output} mapping.
 */
public record ResultItem(JsonNode item, JsonNode output) {
}
