package com.connector.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * A fully evaluated HTTP request, ready to be sent.
 *
 * @param method  Upper-case HTTP method.
 * @param url     Absolute URL, possibly already carrying a query string.
 * @param headers Header names to text values.
 * @param qs      Query parameters; array values repeat the parameter, null values are dropped.
 * @param body    The request body, {@code null} for none.
 * @param type    How {@code body} is encoded.
 */
public record PreparedRequest(String method, String url, ObjectNode headers, ObjectNode qs, JsonNode body, BodyType type) {

    public PreparedRequest withUrl(String newUrl) {
        return new PreparedRequest(method, newUrl, headers, qs, body, type);
    }

    public PreparedRequest withQs(ObjectNode newQs) {
        return new PreparedRequest(method, url, headers, newQs, body, type);
    }

    public PreparedRequest withHeaders(ObjectNode newHeaders) {
        return new PreparedRequest(method, url, newHeaders, qs, body, type);
    }

    public PreparedRequest withBody(JsonNode newBody) {
        return new PreparedRequest(method, url, headers, qs, newBody, type);
    }
}
