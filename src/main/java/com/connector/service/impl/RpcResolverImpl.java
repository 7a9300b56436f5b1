package com.connector.service.impl;

import com.connector.exception.ConfigurationException;
import com.connector.exception.EvaluationException;
import com.connector.exception.RequestException;
import com.connector.exception.RpcException;
import com.connector.expression.Scope;
import com.connector.expression.ValueCoercion;
import com.connector.model.IntegrationDefinition;
import com.connector.model.Option;
import com.connector.model.ResultItem;
import com.connector.model.RpcDefinition;
import com.connector.service.api.CallChainExecutor;
import com.connector.service.api.ConnectionManager;
import com.connector.service.api.RpcResolver;
import com.connector.service.api.StateService;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class RpcResolverImpl implements RpcResolver {

    private final StateService stateService;
    private final ConnectionManager connectionManager;
    private final CallChainExecutor callChainExecutor;

    public RpcResolverImpl(StateService stateService, ConnectionManager connectionManager, CallChainExecutor callChainExecutor) {
        this.stateService = stateService;
        this.connectionManager = connectionManager;
        this.callChainExecutor = callChainExecutor;
    }

    @Override
    public List<Option> resolve(String integrationName, String rpcId, JsonNode parameters, String connectionRef) {
        IntegrationDefinition integration = stateService.getDefinition(integrationName);
        if (integration == null) {
            throw new ConfigurationException("No integration named '" + integrationName + "' is loaded.");
        }
        RpcDefinition rpc = integration.requireRpc(rpcId);
        JsonNode params = ValueCoercion.nullToNode(parameters);

        RpcDefinition.NestedDependency nested = rpc.getNested();
        if (nested != null && nested.getParameter() != null && ValueCoercion.isEmpty(params.get(nested.getParameter()))) {
            throw new RpcException("RPC '" + rpcId + "' depends on parameter '" + nested.getParameter() + "'"
                    + (nested.getParent() != null ? " chosen from RPC '" + nested.getParent() + "'" : "")
                    + ", which has no value yet.");
        }

        try {
            Scope scope = Scope.of(integration.appContext()).with(Scope.PARAMETERS, params);
            if (connectionRef != null) {
                scope = connectionManager.bind(scope, connectionManager.ensureFresh(connectionRef));
            }
            List<Option> options = new ArrayList<>();
            Iterator<ResultItem> items = callChainExecutor.run(rpc.getCalls(), integration, scope, null);
            while (items.hasNext()) {
                options.add(toOption(items.next().output()));
            }
            log.debug("RPC '{}' of '{}' resolved {} option(s)", rpcId, integrationName, options.size());
            return options;
        } catch (RequestException | EvaluationException e) {
            log.warn("RPC '{}' of '{}' failed, returning no options: {}", rpcId, integrationName, e.getMessage());
            return List.of();
        }
    }

    static Option toOption(JsonNode output) {
        if (!output.isObject()) {
            return new Option(ValueCoercion.toText(output), output);
        }
        JsonNode value = ValueCoercion.nullToNode(output.get("value"));
        JsonNode label = output.get("label");
        List<Option> children = new ArrayList<>();
        JsonNode nested = output.get("options");
        if (nested != null && nested.isArray()) {
            nested.forEach(child -> children.add(toOption(child)));
        }
        String text = ValueCoercion.isNull(label) ? ValueCoercion.toText(value) : ValueCoercion.toText(label);
        return new Option(text, value, children);
    }
}
