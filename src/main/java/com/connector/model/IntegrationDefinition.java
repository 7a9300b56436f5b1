package com.connector.model;

import com.connector.exception.ConfigurationException;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Data;

/**
 * The root of a declarative integration: base settings plus named connections, modules, RPCs, webhooks and
 * user functions. Loaded once by the {@link com.connector.service.api.DefinitionLoader} and treated as
 * immutable afterwards.
 * <p>
 * Lombok's {@code @Data} annotation generates standard boilerplate code.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class IntegrationDefinition {

    /**
     * The unique name under which the integration is registered (the alias used by every command).
     */
    private String name;

    private String label;

    /**
     * Settings shared by every Call: base URL, default headers, default response rules, log redaction.
     */
    private BaseDefinition base = new BaseDefinition();

    /**
     * App-level configuration shared by all connections, exposed to expressions as {@code common}.
     */
    private JsonNode common;

    private Map<String, ConnectionDefinition> connections = new LinkedHashMap<>();

    private Map<String, ModuleDefinition> modules = new LinkedHashMap<>();

    private Map<String, RpcDefinition> rpcs = new LinkedHashMap<>();

    private Map<String, WebhookDefinition> webhooks = new LinkedHashMap<>();

    private Map<String, FunctionDefinition> functions = new LinkedHashMap<>();

    public ModuleDefinition requireModule(String moduleId) {
        ModuleDefinition module = modules.get(moduleId);
        if (module == null) {
            throw new ConfigurationException("Module '" + moduleId + "' is not defined in integration '" + name + "'.");
        }
        return module;
    }

    public RpcDefinition requireRpc(String rpcId) {
        RpcDefinition rpc = rpcs.get(rpcId);
        if (rpc == null) {
            throw new ConfigurationException("RPC '" + rpcId + "' is not defined in integration '" + name + "'.");
        }
        return rpc;
    }

    public WebhookDefinition requireWebhook(String hookId) {
        WebhookDefinition webhook = webhooks.get(hookId);
        if (webhook == null) {
            throw new ConfigurationException("Webhook '" + hookId + "' is not defined in integration '" + name + "'.");
        }
        return webhook;
    }

    public ConnectionDefinition requireConnection(String connectionName) {
        ConnectionDefinition connection = connections.get(connectionName);
        if (connection == null) {
            throw new ConfigurationException("Connection '" + connectionName + "' is not defined in integration '" + name + "'.");
        }
        return connection;
    }

    public AppContext appContext() {
        return new AppContext(name, common);
    }
}
