package com.connector.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * An HTTP response as seen by templates.
 *
 * @param statusCode The HTTP status.
 * @param headers    Response headers as an object keyed by lower-case header name.
 * @param body       The parsed JSON body, or a text node when the body is not JSON.
 */
public record RawResponse(int statusCode, JsonNode headers, JsonNode body) {

    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300;
    }
}
