package com.connector.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import java.util.Iterator;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Parses JSON arguments given on the command line and renders results as colorized, indented JSON.
 */
@Component
public class JsonPrinter {

    public static final String ANSI_RESET = "\u001B[0m";
    public static final String ANSI_RED = "\u001B[31m";
    public static final String ANSI_GREEN = "\u001B[32m";
    public static final String ANSI_YELLOW = "\u001B[33m";
    public static final String ANSI_PURPLE = "\u001B[35m";
    public static final String ANSI_CYAN = "\u001B[36m";
    public static final String ANSI_WHITE = "\u001B[37m";

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

    /**
     * @param json A JSON document, or {@code null}.
     * @return the parsed value; an empty object when {@code json} is null or blank.
     * @throws IllegalArgumentException if the text is not valid JSON.
     */
    public JsonNode parse(String json) {
        if (json == null || json.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON argument: " + e.getOriginalMessage(), e);
        }
    }

    public JsonNode toTree(Object value) {
        return value == null ? NullNode.getInstance() : objectMapper.valueToTree(value);
    }

    public <T> T convert(JsonNode node, Class<T> type) {
        return objectMapper.convertValue(node, type);
    }

    public String format(Object value) {
        StringBuilder sb = new StringBuilder();
        append(toTree(value), sb, 0);
        return sb.toString();
    }

    private void append(JsonNode node, StringBuilder sb, int indentLevel) {
        String indent = "  ".repeat(indentLevel);
        if (node.isObject()) {
            sb.append(ANSI_WHITE).append("{").append(ANSI_RESET).append("\n");
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                sb.append(indent).append("  ").append(ANSI_CYAN).append("\"").append(field.getKey()).append("\"").append(ANSI_RESET).append(": ");
                append(field.getValue(), sb, indentLevel + 1);
                if (fields.hasNext()) {
                    sb.append(",");
                }
                sb.append("\n");
            }
            sb.append(indent).append(ANSI_WHITE).append("}").append(ANSI_RESET);
        } else if (node.isArray()) {
            sb.append(ANSI_WHITE).append("[").append(ANSI_RESET).append("\n");
            Iterator<JsonNode> elements = node.elements();
            while (elements.hasNext()) {
                sb.append(indent).append("  ");
                append(elements.next(), sb, indentLevel + 1);
                if (elements.hasNext()) {
                    sb.append(",");
                }
                sb.append("\n");
            }
            sb.append(indent).append(ANSI_WHITE).append("]").append(ANSI_RESET);
        } else if (node.isTextual()) {
            sb.append(ANSI_GREEN).append("\"").append(node.asText()).append("\"").append(ANSI_RESET);
        } else if (node.isNumber()) {
            sb.append(ANSI_YELLOW).append(node.asText()).append(ANSI_RESET);
        } else if (node.isBoolean()) {
            sb.append(ANSI_PURPLE).append(node.asBoolean()).append(ANSI_RESET);
        } else if (node.isNull()) {
            sb.append(ANSI_RED).append("null").append(ANSI_RESET);
        } else {
            sb.append(node.asText());
        }
    }
}
