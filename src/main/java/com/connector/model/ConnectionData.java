package com.connector.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;

/**
 * Live credential data of a {@link ConnectionInstance}.
 *
 * @param accessToken  The current access token, {@code null} for non-OAuth connections.
 * @param refreshToken The refresh token, kept across refreshes when the provider does not rotate it.
 * @param expires      When the access token expires; {@code null} means it never does.
 * @param extra        Any other values mapped by the connection's {@code response.data} templates.
 */
public record ConnectionData(String accessToken, String refreshToken, Instant expires, JsonNode extra) {

    public static ConnectionData empty() {
        return new ConnectionData(null, null, null, null);
    }
}
