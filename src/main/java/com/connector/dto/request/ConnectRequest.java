package com.connector.dto.request;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * The data needed to create a connection from the shell.
 *
 * @param alias      The integration name.
 * @param connection The connection definition name.
 * @param parameters The user's connection parameters.
 */
public record ConnectRequest(String alias, String connection, JsonNode parameters) {
}
