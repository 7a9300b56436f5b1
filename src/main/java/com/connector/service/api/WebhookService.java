package com.connector.service.api;

import com.connector.dto.response.WebhookReceipt;
import com.connector.model.WebhookRegistration;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Map;

/**
 * Registers webhooks with providers and turns inbound payloads into queued bundles.
 */
public interface WebhookService {

    /**
     * Runs the webhook's {@code attach} Call with the callback URL bound as {@code webhook.url} and stores the
     * registration. The attach output becomes the hook's {@code webhook} data.
     */
    WebhookRegistration attach(String integration, String hookId, String connectionRef, JsonNode parameters);

    /**
     * Runs the {@code detach} Call, if any, and forgets the registration and its queued bundles.
     */
    void detach(String hookRef);

    /**
     * Replaces the parameters of an attached hook and runs its {@code update} Call, if any. The update output is
     * merged into the hook's {@code webhook} data.
     */
    WebhookRegistration update(String hookRef, JsonNode parameters);

    /**
     * Handles one inbound call. Verification handshakes are answered inline; payloads failing the validator are
     * acknowledged and dropped; replays (same event id, or same payload when no event id is mapped) are
     * acknowledged without queueing anything.
     *
     * @param headers Request headers; names are matched case-insensitively.
     * @param query   Query-string parameters.
     * @throws com.connector.exception.ConfigurationException if the hook is unknown.
     */
    WebhookReceipt receive(String hookRef, JsonNode payload, Map<String, String> headers, Map<String, String> query);

    /**
     * Removes and returns every bundle queued for a hook, oldest first.
     */
    List<JsonNode> drain(String hookRef);
}
