package com.connector.service.impl;

import com.connector.exception.ConfigurationException;
import com.connector.expression.Scope;
import com.connector.expression.ValueCoercion;
import com.connector.model.CallDefinition;
import com.connector.model.IntegrationDefinition;
import com.connector.model.ModuleDefinition;
import com.connector.model.ModuleResult;
import com.connector.model.ResultItem;
import com.connector.model.TriggerDefinition;
import com.connector.model.TriggerOrder;
import com.connector.model.TriggerState;
import com.connector.model.TriggerStatus;
import com.connector.service.api.CallChainExecutor;
import com.connector.service.api.ExpressionEvaluator;
import com.connector.service.api.TriggerStateMachine;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Polling trigger bookkeeping on top of the {@link CallChainExecutor}.
 * <p>
 * Each fetched item gets a key {@code (id, date)} from the last Call's {@code response.trigger} mapping; without a
 * date the id doubles as the ordering value. An item is new when its date is after the stored date, or equal to it
 * with an id that was not emitted at that date yet.
 */
@Service
@Slf4j
public class TriggerStateMachineImpl implements TriggerStateMachine {

    private final CallChainExecutor callChainExecutor;
    private final ExpressionEvaluator evaluator;

    public TriggerStateMachineImpl(CallChainExecutor callChainExecutor, ExpressionEvaluator evaluator) {
        this.callChainExecutor = callChainExecutor;
        this.evaluator = evaluator;
    }

    private record Keyed(String id, JsonNode date, JsonNode output) {
    }

    @Override
    public ModuleResult poll(ModuleDefinition module, IntegrationDefinition integration, Scope scope, TriggerState lastState, Long limit) {
        if (module.getCalls() == null || module.getCalls().isEmpty()) {
            throw new ConfigurationException("Trigger module of integration '" + integration.getName() + "' defines no Calls.");
        }
        if (lastState == null || !lastState.isInitialized()) {
            return bootstrap(module, integration, scope);
        }
        TriggerDefinition trigger = triggerOf(module.getCalls().get(module.getCalls().size() - 1), integration);
        Iterator<ResultItem> items = callChainExecutor.runAll(module.getCalls(), integration, scope);
        List<Keyed> fresh = collectNew(items, trigger, scope, lastState);

        List<Keyed> emitted = limit == null ? fresh : fresh.subList(0, (int) Math.min(Math.max(limit, 0), fresh.size()));
        if (emitted.isEmpty()) {
            log.debug("Poll of '{}' found no new items", integration.getName());
            return new ModuleResult(List.of(), lastState);
        }
        TriggerState next = advance(lastState, emitted);
        log.info("Poll of '{}' emitted {} of {} new item(s)", integration.getName(), emitted.size(), fresh.size());
        return new ModuleResult(emitted.stream().map(Keyed::output).toList(), next);
    }

    private ModuleResult bootstrap(ModuleDefinition module, IntegrationDefinition integration, Scope scope) {
        List<CallDefinition> calls = module.getEpoch() != null ? List.of(module.getEpoch()) : module.getCalls();
        CallDefinition keyed = calls.get(calls.size() - 1);
        TriggerDefinition trigger = keyed.getResponse() != null && keyed.getResponse().getTrigger() != null
                ? keyed.getResponse().getTrigger()
                : triggerOf(module.getCalls().get(module.getCalls().size() - 1), integration);

        List<Keyed> all = sortAscending(consume(callChainExecutor.runAll(calls, integration, scope), trigger, scope, null), trigger.getOrder());
        TriggerState baseline = all.isEmpty()
                ? new TriggerState(TriggerStatus.POLLING, null, null, null)
                : advance(TriggerState.uninitialized(), all);
        log.info("Bootstrapped trigger of '{}' from {} item(s), baseline id '{}'", integration.getName(), all.size(), baseline.lastId());
        return new ModuleResult(List.of(), baseline);
    }

    private List<Keyed> collectNew(Iterator<ResultItem> items, TriggerDefinition trigger, Scope scope, TriggerState lastState) {
        List<Keyed> fresh = new ArrayList<>();
        for (Keyed item : consume(items, trigger, scope, lastState)) {
            if (isNew(item, lastState)) {
                fresh.add(item);
            }
        }
        return sortAscending(fresh, trigger.getOrder());
    }

    /**
     * Reads items while checking that ids are unique and dates follow the declared order. With a descending order
     * reading stops at the first item older than the stored date, so no further pages are requested.
     */
    private List<Keyed> consume(Iterator<ResultItem> items, TriggerDefinition trigger, Scope scope, TriggerState lastState) {
        List<Keyed> result = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        Keyed previous = null;
        while (items.hasNext()) {
            Keyed current = key(items.next(), trigger, scope);
            if (!seen.add(current.id())) {
                throw new ConfigurationException("Trigger id '" + current.id() + "' is not unique; check the trigger id mapping.");
            }
            if (previous != null) {
                checkOrder(previous, current, trigger.getOrder());
            }
            if (trigger.getOrder() == TriggerOrder.DESC && lastState != null && lastState.lastDate() != null
                    && compareDates(current.date(), lastState.lastDate()) < 0) {
                break;
            }
            result.add(current);
            previous = current;
        }
        return result;
    }

    private Keyed key(ResultItem item, TriggerDefinition trigger, Scope scope) {
        Scope itemScope = scope.with(Scope.ITEM, item.item());
        JsonNode idValue = evaluator.evaluate(trigger.getId(), itemScope);
        String id = ValueCoercion.toTextOrNull(idValue);
        if (id == null || id.isEmpty()) {
            throw new ConfigurationException("Trigger id mapping resolved to an empty value for item " + ValueCoercion.toJson(item.item()));
        }
        JsonNode date = trigger.getDate() == null ? idValue : evaluator.evaluate(trigger.getDate(), itemScope);
        if (ValueCoercion.isNull(date)) {
            throw new ConfigurationException("Trigger date mapping resolved to null for item '" + id + "'.");
        }
        return new Keyed(id, date, item.output());
    }

    private static void checkOrder(Keyed previous, Keyed current, TriggerOrder order) {
        int comparison = compareDates(previous.date(), current.date());
        if (order == TriggerOrder.ASC && comparison > 0 || order == TriggerOrder.DESC && comparison < 0) {
            throw new ConfigurationException("Trigger dates are not " + order.getValue() + "ending: '"
                    + ValueCoercion.toText(previous.date()) + "' precedes '" + ValueCoercion.toText(current.date()) + "'.");
        }
    }

    private static boolean isNew(Keyed item, TriggerState lastState) {
        if (lastState.lastDate() == null) {
            return true;
        }
        int comparison = compareDates(item.date(), lastState.lastDate());
        return comparison > 0 || comparison == 0 && !lastState.idsAtLastDate().contains(item.id());
    }

    private static List<Keyed> sortAscending(List<Keyed> items, TriggerOrder order) {
        List<Keyed> sorted = new ArrayList<>(items);
        if (order == TriggerOrder.DESC) {
            Collections.reverse(sorted);
        } else if (order == TriggerOrder.UNORDERED) {
            sorted.sort(Comparator.comparing(Keyed::date, TriggerStateMachineImpl::compareDates));
        }
        return sorted;
    }

    /**
     * The state after emitting {@code emitted} (ascending): the last item plus every id emitted at its date.
     */
    private static TriggerState advance(TriggerState lastState, List<Keyed> emitted) {
        Keyed last = emitted.get(emitted.size() - 1);
        Set<String> ids = new LinkedHashSet<>();
        if (lastState.lastDate() != null && compareDates(last.date(), lastState.lastDate()) == 0) {
            ids.addAll(lastState.idsAtLastDate());
        }
        for (Keyed item : emitted) {
            if (compareDates(item.date(), last.date()) == 0) {
                ids.add(item.id());
            }
        }
        return new TriggerState(TriggerStatus.POLLING, last.id(), last.date(), ids);
    }

    private static int compareDates(JsonNode left, JsonNode right) {
        Integer comparison = ValueCoercion.compare(left, right);
        if (comparison == null) {
            throw new ConfigurationException("Trigger dates must not be null.");
        }
        return comparison;
    }

    private static TriggerDefinition triggerOf(CallDefinition call, IntegrationDefinition integration) {
        if (call.getResponse() == null || call.getResponse().getTrigger() == null || call.getResponse().getTrigger().getId() == null) {
            throw new ConfigurationException("Trigger module of integration '" + integration.getName()
                    + "' needs a response.trigger.id mapping.");
        }
        return call.getResponse().getTrigger();
    }
}
