package com.connector.service.impl;

import com.connector.exception.ConfigurationException;
import com.connector.expression.Scope;
import com.connector.expression.ValueCoercion;
import com.connector.model.CallDefinition;
import com.connector.model.IntegrationDefinition;
import com.connector.model.RawResponse;
import com.connector.model.ResultItem;
import com.connector.service.api.CallChainExecutor;
import com.connector.service.api.ExpressionEvaluator;
import com.connector.service.api.PaginationEngine;
import com.connector.service.api.RequestExecutor;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.math.BigDecimal;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class CallChainExecutorImpl implements CallChainExecutor {

    private final RequestExecutor requestExecutor;
    private final PaginationEngine paginationEngine;
    private final ExpressionEvaluator evaluator;

    public CallChainExecutorImpl(RequestExecutor requestExecutor, PaginationEngine paginationEngine, ExpressionEvaluator evaluator) {
        this.requestExecutor = requestExecutor;
        this.paginationEngine = paginationEngine;
        this.evaluator = evaluator;
    }

    @Override
    public Iterator<ResultItem> run(List<CallDefinition> calls, IntegrationDefinition integration, Scope scope, Long limit) {
        return execute(calls, integration, scope, limit, true);
    }

    @Override
    public Iterator<ResultItem> runAll(List<CallDefinition> calls, IntegrationDefinition integration, Scope scope) {
        return execute(calls, integration, scope, null, false);
    }

    private Iterator<ResultItem> execute(List<CallDefinition> calls, IntegrationDefinition integration, Scope scope, Long limit,
                                         boolean applyDeclaredLimit) {
        if (calls == null || calls.isEmpty()) {
            throw new ConfigurationException("Nothing to execute: no Calls are defined.");
        }
        Scope current = scope.contains(Scope.TEMP) ? scope : scope.with(Scope.TEMP, JsonNodeFactory.instance.objectNode());
        List<ResultItem> lastOutputs = Collections.emptyList();

        for (int step = 0; step < calls.size(); step++) {
            CallDefinition call = calls.get(step);
            if (!evaluator.evaluateCondition(call.getCondition(), current, true)) {
                log.debug("Skipping step {} of '{}': condition is falsy", step + 1, integration.getName());
                continue;
            }
            if (step == calls.size() - 1) {
                Long effective = limit != null || !applyDeclaredLimit ? limit : declaredLimit(call, current);
                return paginationEngine.iterate(call, integration, current, effective);
            }
            RawResponse response = requestExecutor.execute(call, integration, current);
            Scope responseScope = requestExecutor.responseScope(current, response);
            lastOutputs = requestExecutor.extract(call, responseScope);
            current = current.with(Scope.TEMP, accumulate(call, current.get(Scope.TEMP), responseScope));
        }
        return lastOutputs.iterator();
    }

    private JsonNode accumulate(CallDefinition call, JsonNode temp, Scope responseScope) {
        if (call.getResponse() == null || call.getResponse().getTemp() == null) {
            return temp;
        }
        JsonNode additions = evaluator.evaluate(call.getResponse().getTemp(), responseScope);
        ObjectNode next = temp != null && temp.isObject() ? ((ObjectNode) temp).deepCopy() : JsonNodeFactory.instance.objectNode();
        if (additions.isObject()) {
            next.setAll((ObjectNode) additions);
        }
        return next;
    }

    private Long declaredLimit(CallDefinition call, Scope scope) {
        if (call.getResponse() == null || call.getResponse().getLimit() == null) {
            return null;
        }
        BigDecimal limit = ValueCoercion.toNumber(evaluator.evaluate(call.getResponse().getLimit(), scope));
        return limit == null ? null : limit.longValue();
    }
}
