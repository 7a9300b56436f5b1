package com.connector.dto.response;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * The answer given to a provider for one inbound webhook call.
 *
 * @param status   HTTP status to answer with.
 * @param headers  Extra response headers (verification handshakes only), may be {@code null}.
 * @param body     Response body, may be {@code null}.
 * @param accepted Number of bundles queued by this call.
 */
public record WebhookReceipt(int status, JsonNode headers, JsonNode body, int accepted) {

    public static WebhookReceipt acknowledged(int accepted) {
        return new WebhookReceipt(200, null, null, accepted);
    }
}
