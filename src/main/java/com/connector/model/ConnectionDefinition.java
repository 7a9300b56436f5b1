package com.connector.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;

/**
 * Describes how a user authenticates against the provider.
 * <p>
 * OAuth connections use {@code authorize} (only its url and qs are read, to build the redirect URL),
 * {@code token} (code exchange) and {@code refresh}; every type may declare an {@code info} Call used to
 * validate credentials and an {@code invalidate} Call run on disconnect.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ConnectionDefinition {

    private ConnectionType type = ConnectionType.APIKEY;

    private String label;

    private List<ParameterSpec> parameters = new ArrayList<>();

    /**
     * OAuth scopes, exposed to templates as {@code oauth.scope} (space separated).
     */
    private List<String> scope = new ArrayList<>();

    private CallDefinition authorize;

    private CallDefinition token;

    /**
     * Refresh Call; its {@code condition} decides whether a refresh is actually attempted.
     */
    private CallDefinition refresh;

    private CallDefinition info;

    private CallDefinition invalidate;
}
