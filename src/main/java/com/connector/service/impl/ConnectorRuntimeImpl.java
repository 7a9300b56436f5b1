package com.connector.service.impl;

import com.connector.config.RuntimeProperties;
import com.connector.exception.ConfigurationException;
import com.connector.exception.ValidationException;
import com.connector.expression.Scope;
import com.connector.expression.ValueCoercion;
import com.connector.model.CallDefinition;
import com.connector.model.IntegrationDefinition;
import com.connector.model.ModuleDefinition;
import com.connector.model.ModuleResult;
import com.connector.model.ModuleType;
import com.connector.model.Option;
import com.connector.model.ParameterSpec;
import com.connector.model.ResultItem;
import com.connector.model.TriggerState;
import com.connector.model.WebhookRegistration;
import com.connector.service.api.CallChainExecutor;
import com.connector.service.api.ConnectionManager;
import com.connector.service.api.ConnectorRuntime;
import com.connector.service.api.ExpressionEvaluator;
import com.connector.service.api.RpcResolver;
import com.connector.service.api.StateService;
import com.connector.service.api.TriggerStateMachine;
import com.connector.service.api.WebhookService;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.resilience4j.retry.Retry;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * The Scenario Engine facade. Resolves definitions, binds fresh connections, dispatches by module type and
 * wraps every provider-facing operation in the shared retry policy.
 */
@Service
@Slf4j
public class ConnectorRuntimeImpl implements ConnectorRuntime {

    private final StateService stateService;
    private final ConnectionManager connectionManager;
    private final CallChainExecutor callChainExecutor;
    private final TriggerStateMachine triggerStateMachine;
    private final RpcResolver rpcResolver;
    private final WebhookService webhookService;
    private final ExpressionEvaluator evaluator;
    private final Retry retry;
    private final ExecutorService pollExecutor;
    private final Duration pollTimeout;

    private final Map<String, ReentrantLock> pollLocks = new ConcurrentHashMap<>();
    private final Map<String, Set<PollCycle>> runningPolls = new ConcurrentHashMap<>();

    public ConnectorRuntimeImpl(StateService stateService, ConnectionManager connectionManager, CallChainExecutor callChainExecutor,
                                TriggerStateMachine triggerStateMachine, RpcResolver rpcResolver, WebhookService webhookService,
                                ExpressionEvaluator evaluator, Retry connectorRetry,
                                @Qualifier("pollExecutor") ExecutorService pollExecutor, RuntimeProperties properties) {
        this.stateService = stateService;
        this.connectionManager = connectionManager;
        this.callChainExecutor = callChainExecutor;
        this.triggerStateMachine = triggerStateMachine;
        this.rpcResolver = rpcResolver;
        this.webhookService = webhookService;
        this.evaluator = evaluator;
        this.retry = connectorRetry;
        this.pollExecutor = pollExecutor;
        this.pollTimeout = properties.getPoll().getTimeout();
    }

    /**
     * One poll cycle as seen by its caller. Committing the trigger state together with delivering the bundles,
     * and aborting on cancellation or timeout, both happen under {@code guard}: a cycle either does both or
     * neither.
     */
    private static final class PollCycle extends CompletableFuture<ModuleResult> {
        private final String key;
        private final ReentrantLock guard = new ReentrantLock();
        private volatile Future<?> task;

        private PollCycle(String key) {
            this.key = key;
        }

        @Override
        public boolean cancel(boolean mayInterruptIfRunning) {
            return abort(new CancellationException("Poll cycle " + key + " was cancelled"));
        }

        private boolean abort(Throwable reason) {
            guard.lock();
            try {
                if (isDone()) {
                    return false;
                }
                boolean aborted = reason instanceof CancellationException ? super.cancel(true) : completeExceptionally(reason);
                Future<?> running = task;
                if (running != null) {
                    running.cancel(true);
                }
                log.warn("Poll cycle {} was {}", key, reason instanceof TimeoutException ? "timed out" : "cancelled");
                return aborted;
            } finally {
                guard.unlock();
            }
        }

        /**
         * Runs {@code save} and completes with {@code result} unless the cycle was aborted first.
         *
         * @return {@code false} when the cycle had already been aborted and nothing was committed.
         */
        private boolean commit(ModuleResult result, Runnable save) {
            guard.lock();
            try {
                if (isDone()) {
                    return false;
                }
                try {
                    save.run();
                } catch (RuntimeException e) {
                    completeExceptionally(e);
                    return true;
                }
                complete(result);
                return true;
            } finally {
                guard.unlock();
            }
        }
    }

    @Override
    public ModuleResult invoke(String integrationName, String moduleId, JsonNode parameters, String connectionRef,
                               TriggerState priorTriggerState) {
        IntegrationDefinition integration = requireIntegration(integrationName);
        ModuleDefinition module = integration.requireModule(moduleId);
        JsonNode resolved = withDefaults(module.getParameters(), parameters, moduleId);

        if (module.getType() == ModuleType.INSTANT_TRIGGER) {
            String hookRef = ValueCoercion.toTextOrNull(resolved.get("hookRef"));
            if (hookRef == null) {
                throw new ConfigurationException("Instant trigger '" + moduleId + "' is fed by its webhook; pass the 'hookRef' parameter.");
            }
            return new ModuleResult(webhookService.drain(hookRef), null);
        }
        if (module.getConnection() != null && connectionRef == null) {
            throw new ValidationException(0, "Module '" + moduleId + "' requires a '" + module.getConnection() + "' connection.");
        }

        log.info("Invoking {} '{}' of integration '{}'", module.getType().getValue(), moduleId, integrationName);
        return retry.executeSupplier(() -> {
            Scope scope = scope(integration, resolved, connectionRef);
            if (module.getType() == ModuleType.TRIGGER) {
                return triggerStateMachine.poll(module, integration, scope, priorTriggerState, declaredLimit(module, scope));
            }
            List<JsonNode> bundles = new ArrayList<>();
            Iterator<ResultItem> items = callChainExecutor.run(module.getCalls(), integration, scope, null);
            items.forEachRemaining(item -> bundles.add(item.output()));
            return new ModuleResult(bundles, null);
        });
    }

    @Override
    public List<Option> fetchOptions(String integration, String rpcId, JsonNode parameters, String connectionRef) {
        return rpcResolver.resolve(integration, rpcId, parameters, connectionRef);
    }

    @Override
    public WebhookRegistration registerWebhook(String integration, String hookId, String connectionRef, JsonNode parameters) {
        return retry.executeSupplier(() -> webhookService.attach(integration, hookId, connectionRef, parameters));
    }

    @Override
    public void unregisterWebhook(String hookRef) {
        retry.executeRunnable(() -> webhookService.detach(hookRef));
    }

    @Override
    public WebhookRegistration updateWebhook(String hookRef, JsonNode parameters) {
        return retry.executeSupplier(() -> webhookService.update(hookRef, parameters));
    }

    @Override
    public CompletableFuture<ModuleResult> pollAsync(String scenarioId, String integration, String moduleId, JsonNode parameters,
                                                     String connectionRef) {
        String key = pollKey(scenarioId, integration, moduleId);
        PollCycle cycle = new PollCycle(key);
        runningPolls.compute(key, (k, cycles) -> {
            Set<PollCycle> registered = cycles != null ? cycles : ConcurrentHashMap.newKeySet();
            registered.add(cycle);
            return registered;
        });
        cycle.whenComplete((result, failure) -> runningPolls.computeIfPresent(key, (k, cycles) -> {
            cycles.remove(cycle);
            return cycles.isEmpty() ? null : cycles;
        }));
        cycle.task = pollExecutor.submit(() -> {
            try {
                runCycle(key, cycle, integration, moduleId, parameters, connectionRef);
            } catch (RuntimeException e) {
                cycle.completeExceptionally(e);
            }
        });
        if (cycle.isDone()) {
            cycle.task.cancel(true);
        }
        CompletableFuture.delayedExecutor(pollTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .execute(() -> cycle.abort(new TimeoutException("Poll cycle " + key + " exceeded " + pollTimeout)));
        return cycle;
    }

    /**
     * Cancels every running or queued cycle of the trigger. Their state is not committed.
     */
    @Override
    public boolean cancelPoll(String scenarioId, String integration, String moduleId) {
        Set<PollCycle> cycles = runningPolls.get(pollKey(scenarioId, integration, moduleId));
        if (cycles == null) {
            return false;
        }
        boolean cancelled = false;
        for (PollCycle cycle : cycles) {
            cancelled |= cycle.cancel(true);
        }
        return cancelled;
    }

    private void runCycle(String key, PollCycle cycle, String integration, String moduleId, JsonNode parameters,
                          String connectionRef) {
        ReentrantLock lock = pollLocks.computeIfAbsent(key, k -> new ReentrantLock());
        try {
            lock.lockInterruptibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Poll cycle " + key + " was cancelled while waiting for the previous one");
        }
        try {
            if (cycle.isDone()) {
                return;
            }
            ModuleResult result = invoke(integration, moduleId, parameters, connectionRef, stateService.getTriggerState(key));
            boolean committed = cycle.commit(result, () -> {
                if (result.state() != null) {
                    stateService.saveTriggerState(key, result.state());
                }
            });
            if (!committed) {
                log.info("Poll cycle {} finished after cancellation; state not committed", key);
            }
        } finally {
            lock.unlock();
        }
    }

    private Scope scope(IntegrationDefinition integration, JsonNode parameters, String connectionRef) {
        Scope scope = Scope.of(integration.appContext()).with(Scope.PARAMETERS, parameters);
        return connectionRef == null ? scope : connectionManager.bind(scope, connectionManager.ensureFresh(connectionRef));
    }

    private Long declaredLimit(ModuleDefinition module, Scope scope) {
        CallDefinition last = module.getCalls().isEmpty() ? null : module.getCalls().get(module.getCalls().size() - 1);
        if (last == null || last.getResponse() == null || last.getResponse().getLimit() == null) {
            return null;
        }
        BigDecimal limit = ValueCoercion.toNumber(evaluator.evaluate(last.getResponse().getLimit(), scope));
        return limit == null ? null : limit.longValue();
    }

    private static JsonNode withDefaults(List<ParameterSpec> specs, JsonNode parameters, String owner) {
        ObjectNode resolved = parameters != null && parameters.isObject()
                ? ((ObjectNode) parameters).deepCopy()
                : JsonNodeFactory.instance.objectNode();
        for (ParameterSpec spec : specs) {
            if (ValueCoercion.isEmpty(resolved.get(spec.getName())) && spec.getDefaultValue() != null) {
                resolved.set(spec.getName(), spec.getDefaultValue());
            }
            if (spec.isRequired() && ValueCoercion.isEmpty(resolved.get(spec.getName()))) {
                throw new ValidationException(0, "Missing required parameter '" + spec.getName() + "' of '" + owner + "'.");
            }
        }
        return resolved;
    }

    private IntegrationDefinition requireIntegration(String name) {
        IntegrationDefinition integration = stateService.getDefinition(name);
        if (integration == null) {
            throw new ConfigurationException("No integration named '" + name + "' is loaded.");
        }
        return integration;
    }

    static String pollKey(String scenarioId, String integration, String moduleId) {
        return scenarioId + "/" + integration + "/" + moduleId;
    }
}
