package com.connector.expression;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

/**
 * A function callable from a template. Arguments are already evaluated; absent trailing arguments are simply
 * not in the list.
 */
@FunctionalInterface
public interface ExpressionFunction {

    JsonNode apply(List<JsonNode> arguments);
}
