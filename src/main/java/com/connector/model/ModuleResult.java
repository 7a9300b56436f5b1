package com.connector.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

/**
 * The outcome of one module invocation.
 *
 * @param bundles The output bundles, in emission order.
 * @param state   The trigger state to persist; {@code null} for non-trigger modules.
 */
public record ModuleResult(List<JsonNode> bundles, TriggerState state) {
}
