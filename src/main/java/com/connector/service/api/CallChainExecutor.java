package com.connector.service.api;

import com.connector.expression.Scope;
import com.connector.model.CallDefinition;
import com.connector.model.IntegrationDefinition;
import com.connector.model.ResultItem;
import java.util.Iterator;
import java.util.List;

/**
 * Runs the ordered Call steps of a module, RPC or webhook operation.
 */
public interface CallChainExecutor {

    /**
     * Executes every step but the last eagerly, threading the {@code temp} accumulator from step to step; the
     * last executed step is paginated lazily. A step whose {@code condition} is falsy is skipped, and a failing
     * step aborts the chain.
     *
     * @param calls The steps, in order.
     * @param scope The initial scope; {@code temp} starts empty unless already bound.
     * @param limit Overrides the last step's {@code response.limit} when not {@code null}.
     * @return The items of the last executed step.
     */
    Iterator<ResultItem> run(List<CallDefinition> calls, IntegrationDefinition integration, Scope scope, Long limit);

    /**
     * Like {@link #run} but ignores the last step's {@code response.limit}, so every page is available to the
     * caller. Only the page cap and the pagination timeout bound the result. Triggers use this to filter for new
     * items before applying their own limit.
     */
    Iterator<ResultItem> runAll(List<CallDefinition> calls, IntegrationDefinition integration, Scope scope);
}
