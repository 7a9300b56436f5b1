package com.connector.expression;

import com.connector.exception.EvaluationException;
import com.connector.service.api.FunctionRegistry;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Evaluates an expression tree against a {@link Scope}.
 * <p>
 * {@code &&} and {@code ||} short-circuit and return the deciding operand, so {@code a || 'fallback'}
 * works as a default. Unbound variables evaluate to null. Builtins shadow user functions of the same name.
 */
public class Interpreter {

    private final BuiltinFunctions builtins;
    private final FunctionRegistry functionRegistry;

    public Interpreter(BuiltinFunctions builtins, FunctionRegistry functionRegistry) {
        this.builtins = builtins;
        this.functionRegistry = functionRegistry;
    }

    public JsonNode evaluate(Expr expr, Scope scope, String source) {
        if (expr instanceof Expr.Literal literal) {
            return literal.value();
        }
        if (expr instanceof Expr.ArrayLiteral array) {
            ArrayNode result = JsonNodeFactory.instance.arrayNode();
            for (Expr element : array.elements()) {
                result.add(evaluate(element, scope, source));
            }
            return result;
        }
        if (expr instanceof Expr.Variable variable) {
            return variable(variable.name(), scope, source);
        }
        if (expr instanceof Expr.Member member) {
            return member(evaluate(member.target(), scope, source), member.name());
        }
        if (expr instanceof Expr.Index index) {
            return index(evaluate(index.target(), scope, source), evaluate(index.index(), scope, source));
        }
        if (expr instanceof Expr.Unary unary) {
            return unary(unary, scope, source);
        }
        if (expr instanceof Expr.Binary binary) {
            return binary(binary, scope, source);
        }
        if (expr instanceof Expr.Call call) {
            return call(call, scope, source);
        }
        throw new EvaluationException("Unsupported expression node " + expr.getClass().getSimpleName(), source);
    }

    private JsonNode variable(String name, Scope scope, String source) {
        JsonNode value = scope.get(name);
        if (value != null) {
            return value;
        }
        if (BuiltinFunctions.ZERO_ARGUMENT.contains(name)) {
            return invokeBuiltin(name, List.of(), source);
        }
        return NullNode.getInstance();
    }

    private JsonNode member(JsonNode target, String name) {
        if (ValueCoercion.isNull(target)) {
            return NullNode.getInstance();
        }
        if (target.isObject()) {
            return ValueCoercion.nullToNode(target.get(name));
        }
        if (target.isArray()) {
            if (isIndex(name)) {
                return ValueCoercion.nullToNode(target.get(Integer.parseInt(name)));
            }
            ArrayNode projected = JsonNodeFactory.instance.arrayNode();
            for (JsonNode element : target) {
                projected.add(member(element, name));
            }
            return projected;
        }
        return NullNode.getInstance();
    }

    private JsonNode index(JsonNode target, JsonNode index) {
        if (ValueCoercion.isNull(target) || ValueCoercion.isNull(index)) {
            return NullNode.getInstance();
        }
        if (target.isArray()) {
            BigDecimal position = ValueCoercion.toNumber(index);
            if (position == null) {
                return member(target, ValueCoercion.toText(index));
            }
            int resolved = position.intValue() < 0 ? target.size() + position.intValue() : position.intValue();
            return ValueCoercion.nullToNode(target.get(resolved));
        }
        return member(target, ValueCoercion.toText(index));
    }

    private JsonNode unary(Expr.Unary unary, Scope scope, String source) {
        JsonNode operand = evaluate(unary.operand(), scope, source);
        if ("!".equals(unary.operator())) {
            return ValueCoercion.bool(!ValueCoercion.truthy(operand));
        }
        try {
            return ValueCoercion.negate(operand);
        } catch (IllegalArgumentException e) {
            throw new EvaluationException(e.getMessage(), null, source, e);
        }
    }

    private JsonNode binary(Expr.Binary binary, Scope scope, String source) {
        String operator = binary.operator();
        JsonNode left = evaluate(binary.left(), scope, source);
        switch (operator) {
            case "&&":
                return ValueCoercion.truthy(left) ? evaluate(binary.right(), scope, source) : left;
            case "||":
                return ValueCoercion.truthy(left) ? left : evaluate(binary.right(), scope, source);
            default:
                break;
        }
        JsonNode right = evaluate(binary.right(), scope, source);
        try {
            return switch (operator) {
                case "=" -> ValueCoercion.bool(ValueCoercion.looseEquals(left, right));
                case "!=" -> ValueCoercion.bool(!ValueCoercion.looseEquals(left, right));
                case "<", "<=", ">", ">=" -> ValueCoercion.bool(compare(operator, left, right));
                case "+" -> ValueCoercion.add(left, right);
                default -> ValueCoercion.arithmetic(operator, left, right);
            };
        } catch (IllegalArgumentException e) {
            throw new EvaluationException(e.getMessage(), null, source, e);
        }
    }

    private static boolean compare(String operator, JsonNode left, JsonNode right) {
        Integer result = ValueCoercion.compare(left, right);
        if (result == null) {
            return false;
        }
        return switch (operator) {
            case "<" -> result < 0;
            case "<=" -> result <= 0;
            case ">" -> result > 0;
            default -> result >= 0;
        };
    }

    private JsonNode call(Expr.Call call, Scope scope, String source) {
        String name = call.name();
        List<Expr> arguments = call.arguments();
        switch (name) {
            case "if":
                return ValueCoercion.truthy(argument(arguments, 0, scope, source))
                        ? argument(arguments, 1, scope, source)
                        : argument(arguments, 2, scope, source);
            case "ifempty": {
                JsonNode value = argument(arguments, 0, scope, source);
                return ValueCoercion.isEmpty(value) ? argument(arguments, 1, scope, source) : value;
            }
            case "switch":
                return lazySwitch(arguments, scope, source);
            default:
                break;
        }
        List<JsonNode> values = new ArrayList<>(arguments.size());
        for (Expr argument : arguments) {
            values.add(evaluate(argument, scope, source));
        }
        if (builtins.contains(name)) {
            return invokeBuiltin(name, values, source);
        }
        if (functionRegistry != null && functionRegistry.contains(scope.getIntegration(), name)) {
            return ValueCoercion.nullToNode(functionRegistry.invoke(scope.getIntegration(), name, values, source));
        }
        throw new EvaluationException("Unknown function '" + name + "'", name, source, null);
    }

    private JsonNode lazySwitch(List<Expr> arguments, Scope scope, String source) {
        JsonNode subject = argument(arguments, 0, scope, source);
        int i = 1;
        for (; i + 1 < arguments.size(); i += 2) {
            if (ValueCoercion.looseEquals(subject, evaluate(arguments.get(i), scope, source))) {
                return evaluate(arguments.get(i + 1), scope, source);
            }
        }
        return i < arguments.size() ? evaluate(arguments.get(i), scope, source) : NullNode.getInstance();
    }

    private JsonNode argument(List<Expr> arguments, int index, Scope scope, String source) {
        return index < arguments.size() ? evaluate(arguments.get(index), scope, source) : NullNode.getInstance();
    }

    private JsonNode invokeBuiltin(String name, List<JsonNode> values, String source) {
        try {
            return builtins.invoke(name, values);
        } catch (EvaluationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new EvaluationException(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage(),
                    name, source, e);
        }
    }

    private static boolean isIndex(String name) {
        return !name.isEmpty() && name.chars().allMatch(Character::isDigit);
    }
}
