package com.connector.service.api;

import com.connector.model.ModuleResult;
import com.connector.model.Option;
import com.connector.model.TriggerState;
import com.connector.model.WebhookRegistration;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Entry point for the Scenario Engine: runs one module, RPC or webhook operation at a time.
 */
public interface ConnectorRuntime {

    /**
     * Invokes a module. Actions and searches return their output bundles; triggers return the new bundles
     * together with the state to persist for the next poll; instant triggers drain the bundles queued for the
     * webhook named by the {@code hookRef} parameter.
     * <p>
     * Rate-limit and provider failures are retried with bounded attempts; every other failure is surfaced
     * immediately.
     *
     * @param integration       The integration name.
     * @param moduleId          The module name.
     * @param parameters        The user's module parameters.
     * @param connectionRef     The connection instance id, may be {@code null} for public APIs.
     * @param priorTriggerState The state returned by the previous poll of a trigger, {@code null} otherwise.
     * @return The bundles and, for triggers, the new state.
     */
    ModuleResult invoke(String integration, String moduleId, JsonNode parameters, String connectionRef, TriggerState priorTriggerState);

    List<Option> fetchOptions(String integration, String rpcId, JsonNode parameters, String connectionRef);

    WebhookRegistration registerWebhook(String integration, String hookId, String connectionRef, JsonNode parameters);

    void unregisterWebhook(String hookRef);

    WebhookRegistration updateWebhook(String hookRef, JsonNode parameters);

    /**
     * Runs one poll cycle of a trigger on the poll pool, reading and committing its persisted state. Cycles of the
     * same (scenario, module) pair run one after the other; a cycle that times out or is cancelled commits
     * nothing.
     */
    CompletableFuture<ModuleResult> pollAsync(String scenarioId, String integration, String moduleId, JsonNode parameters,
                                              String connectionRef);

    /**
     * Cancels the running poll cycle of a (scenario, module) pair.
     *
     * @return {@code true} if a running or queued cycle was cancelled.
     */
    boolean cancelPoll(String scenarioId, String integration, String moduleId);
}
