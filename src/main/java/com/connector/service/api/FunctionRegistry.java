package com.connector.service.api;

import com.connector.model.FunctionDefinition;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.Collection;
import java.util.List;

/**
 * Holds the user-defined functions of every loaded integration and runs them in a restricted environment.
 */
public interface FunctionRegistry {

    /**
     * Compiles and registers the functions of an integration, replacing any previously registered set.
     *
     * @param integration The integration name the functions belong to.
     * @param functions   The function definitions.
     * @throws com.connector.exception.ConfigurationException if a function body does not compile.
     */
    void register(String integration, Collection<FunctionDefinition> functions);

    void unregister(String integration);

    boolean contains(String integration, String name);

    /**
     * Runs a user function within its time budget.
     *
     * @param integration The owning integration.
     * @param name        The function name.
     * @param arguments   The already evaluated arguments, bound positionally to the declared parameters.
     * @param expression  The calling expression, reported when the function fails.
     * @return The function's result.
     * @throws com.connector.exception.EvaluationException if the function fails, times out or is unknown.
     */
    JsonNode invoke(String integration, String name, List<JsonNode> arguments, String expression);
}
