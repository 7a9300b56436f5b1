package com.connector.service.api;

import com.connector.model.Option;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

/**
 * Resolves the dynamic option lists shown while a user configures a module.
 */
public interface RpcResolver {

    /**
     * Runs an RPC like a module with the user's current parameters in scope and maps its output to options.
     * Request and evaluation failures degrade to an empty list.
     *
     * @param integration   The integration name.
     * @param rpcId         The RPC name.
     * @param parameters    The parameters chosen so far.
     * @param connectionRef The connection to authenticate with, may be {@code null}.
     * @return The options in provider order; entries with nested options are groups.
     * @throws com.connector.exception.RpcException if the RPC is nested and its parent's value is not chosen yet.
     */
    List<Option> resolve(String integration, String rpcId, JsonNode parameters, String connectionRef);
}
