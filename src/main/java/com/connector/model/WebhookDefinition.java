package com.connector.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;

/**
 * Provider-side registration Calls plus the rules for turning inbound payloads into bundles.
 * <p>
 * Lombok's {@code @Data} annotation generates standard boilerplate code.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class WebhookDefinition {

    private String label;

    private String connection;

    private List<ParameterSpec> parameters = new ArrayList<>();

    /**
     * Registers the callback URL with the provider. Its output is stored as the hook's {@code webhook.data}.
     */
    private CallDefinition attach;

    private CallDefinition detach;

    private CallDefinition update;

    /**
     * Evaluated per inbound payload; falsy payloads are acknowledged and dropped.
     */
    private JsonNode validator;

    /**
     * Provider handshake answered inline instead of producing bundles (e.g. URL verification challenges).
     */
    private VerificationDefinition verification;

    /**
     * Provider event id used for replay deduplication; a payload hash is used when absent or empty.
     */
    private JsonNode eventId;

    private JsonNode iterate;

    private JsonNode output;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class VerificationDefinition {

        private JsonNode condition;

        private RespondDefinition respond = new RespondDefinition();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RespondDefinition {

        private int status = 200;

        private JsonNode headers;

        private JsonNode body;
    }
}
