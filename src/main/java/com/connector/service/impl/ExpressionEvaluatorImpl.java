package com.connector.service.impl;

import com.connector.exception.EvaluationException;
import com.connector.expression.BuiltinFunctions;
import com.connector.expression.Interpreter;
import com.connector.expression.Scope;
import com.connector.expression.Template;
import com.connector.expression.ValueCoercion;
import com.connector.service.api.ExpressionEvaluator;
import com.connector.service.api.FunctionRegistry;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import java.time.Clock;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Template evaluation over Jackson trees. Parsed templates are cached by source text, since the same
 * definition templates are evaluated on every request.
 */
@Service
@Slf4j
public class ExpressionEvaluatorImpl implements ExpressionEvaluator {

    private final Interpreter interpreter;
    private final Map<String, Template> templateCache = new ConcurrentHashMap<>();

    public ExpressionEvaluatorImpl(Clock clock, FunctionRegistry functionRegistry) {
        this.interpreter = new Interpreter(new BuiltinFunctions(clock), functionRegistry);
    }

    @Override
    public JsonNode evaluate(JsonNode template, Scope scope) {
        if (template == null || template.isMissingNode()) {
            return NullNode.getInstance();
        }
        return evaluateNode(template, scope);
    }

    @Override
    public String evaluateText(String template, Scope scope) {
        if (template == null) {
            return null;
        }
        return ValueCoercion.toTextOrNull(evaluateString(template, scope));
    }

    @Override
    public boolean evaluateCondition(JsonNode template, Scope scope, boolean defaultValue) {
        if (template == null || template.isMissingNode() || template.isNull()) {
            return defaultValue;
        }
        return ValueCoercion.truthy(evaluate(template, scope));
    }

    private JsonNode evaluateNode(JsonNode node, Scope scope) {
        if (node.isTextual()) {
            return Template.containsMarkers(node.textValue()) ? evaluateString(node.textValue(), scope) : node;
        }
        if (node.isArray()) {
            ArrayNode result = JsonNodeFactory.instance.arrayNode(node.size());
            node.forEach(element -> result.add(evaluateNode(element, scope)));
            return result;
        }
        if (node.isObject()) {
            return evaluateObject(node, scope);
        }
        return node;
    }

    private JsonNode evaluateObject(JsonNode node, Scope scope) {
        ObjectNode result = JsonNodeFactory.instance.objectNode();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (Template.isSpliceKey(field.getKey())) {
                JsonNode spliced = evaluateNode(field.getValue(), scope);
                if (ValueCoercion.isNull(spliced)) {
                    continue;
                }
                if (!spliced.isObject()) {
                    throw new EvaluationException("The '{{...}}' directive must evaluate to an object but got "
                            + spliced.getNodeType(), ValueCoercion.toText(field.getValue()));
                }
                result.setAll((ObjectNode) spliced);
                continue;
            }
            String key = Template.containsMarkers(field.getKey())
                    ? ValueCoercion.toText(evaluateString(field.getKey(), scope))
                    : field.getKey();
            result.set(key, evaluateNode(field.getValue(), scope));
        }
        return result;
    }

    private JsonNode evaluateString(String source, Scope scope) {
        if (!Template.containsMarkers(source)) {
            return TextNode.valueOf(source);
        }
        Template template = templateCache.computeIfAbsent(source, Template::parse);
        if (template.isSingleExpression()) {
            Template.Segment segment = template.getSegments().get(0);
            return ValueCoercion.nullToNode(interpreter.evaluate(segment.expression(), scope, segment.expressionSource()));
        }
        StringBuilder text = new StringBuilder();
        for (Template.Segment segment : template.getSegments()) {
            if (segment.isLiteral()) {
                text.append(segment.text());
            } else {
                text.append(ValueCoercion.toText(interpreter.evaluate(segment.expression(), scope, segment.expressionSource())));
            }
        }
        return TextNode.valueOf(text.toString());
    }
}
