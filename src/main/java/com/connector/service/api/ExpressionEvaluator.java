package com.connector.service.api;

import com.connector.expression.Scope;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Resolves JSON templates containing {@code {{ }}} expressions against a {@link Scope}.
 */
public interface ExpressionEvaluator {

    /**
     * Evaluates a template recursively. Values without {@code {{ }}} markers are returned unchanged; a string
     * that is exactly one expression yields the expression's typed value; mixed strings are concatenated as
     * text. Inside objects the key {@code {{...}}} splices the object it evaluates to into its parent.
     *
     * @param template The template, may be {@code null}.
     * @param scope    The variables visible to expressions.
     * @return The evaluated value; a {@code null} template evaluates to JSON null.
     * @throws com.connector.exception.EvaluationException if an expression is malformed or fails.
     */
    JsonNode evaluate(JsonNode template, Scope scope);

    /**
     * Evaluates a string template.
     *
     * @return The text form of the result, or {@code null} when the result is null.
     */
    String evaluateText(String template, Scope scope);

    /**
     * Evaluates a condition template using the truthiness rules of expression values.
     *
     * @param defaultValue Returned when the template is absent.
     */
    boolean evaluateCondition(JsonNode template, Scope scope, boolean defaultValue);
}
