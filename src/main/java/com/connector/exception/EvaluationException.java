package com.connector.exception;

/**
 * A template expression or a custom function failed to evaluate.
 * <p>
 * Evaluation failures are configuration failures: they are never swallowed, because masking them could turn
 * a genuine API failure into a false success.
 */
public class EvaluationException extends ConfigurationException {

    private final String functionName;
    private final String expression;

    public EvaluationException(String message, String expression) {
        this(message, null, expression, null);
    }

    public EvaluationException(String message, String functionName, String expression, Throwable cause) {
        super(describe(message, functionName, expression), cause);
        this.functionName = functionName;
        this.expression = expression;
    }

    public String getFunctionName() {
        return functionName;
    }

    public String getExpression() {
        return expression;
    }

    private static String describe(String message, String functionName, String expression) {
        StringBuilder sb = new StringBuilder(message);
        if (functionName != null) {
            sb.append(" [function: ").append(functionName).append("]");
        }
        if (expression != null) {
            sb.append(" [expression: ").append(expression).append("]");
        }
        return sb.toString();
    }
}
