package com.connector.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * App-level values every {@link com.connector.expression.Scope} is built from: the integration's name and its
 * shared {@code common} configuration. Passed explicitly instead of living in process globals.
 *
 * @param integration The integration name.
 * @param common      The integration's shared configuration, may be {@code null}.
 */
public record AppContext(String integration, JsonNode common) {
}
