package com.connector.service.api;

import com.connector.expression.Scope;
import com.connector.model.IntegrationDefinition;
import com.connector.model.ModuleDefinition;
import com.connector.model.ModuleResult;
import com.connector.model.TriggerState;

/**
 * Decides which items of a polling trigger are new.
 * <p>
 * An uninitialized trigger is bootstrapped first: its epoch Call (or, when absent, its regular Calls) records the
 * newest item as the baseline and emits nothing. Afterwards every poll emits the items that are newer than the
 * stored state, oldest first.
 */
public interface TriggerStateMachine {

    /**
     * Runs one poll cycle. The returned state is only meant to be persisted once the whole cycle completed.
     *
     * @param module    A module of type {@code trigger}.
     * @param scope     The invocation scope with parameters and connection bound.
     * @param lastState The state of the previous cycle; {@code null} or uninitialized to bootstrap.
     * @param limit     Maximum number of bundles to emit; {@code null} for no limit.
     * @return The new items' outputs and the state to persist.
     * @throws com.connector.exception.ConfigurationException if ids repeat or dates contradict the declared order.
     */
    ModuleResult poll(ModuleDefinition module, IntegrationDefinition integration, Scope scope, TriggerState lastState, Long limit);
}
