package com.connector.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A user's authenticated connection. Created on first successful validation, replaced only by a refresh and
 * deleted on disconnect.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ConnectionInstance {

    private String id;

    private String integration;

    /**
     * Name of the {@link ConnectionDefinition} within the integration.
     */
    private String connection;

    private ConnectionType type;

    /**
     * The user-supplied parameters (API keys, sub-domains, client credentials, ...).
     */
    private JsonNode parameters;

    private ConnectionData data;

    private Instant createdAt;

    private Instant refreshedAt;
}
