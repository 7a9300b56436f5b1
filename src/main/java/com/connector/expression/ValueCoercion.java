package com.connector.expression;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.DoubleNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.LongNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Iterator;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Supplier;

/**
 * Coercion rules for expression values. Values are Jackson {@link JsonNode}s, i.e. one of
 * Null / Boolean / Number / String / Array / Object; a missing node is treated as Null.
 * <ul>
 *   <li><b>truthiness</b>: null is false; booleans are themselves; numbers are true unless zero; strings are
 *   true unless empty or {@code "false"} (any case); arrays and objects are true unless empty.</li>
 *   <li><b>text</b>: null is {@code ""}; numbers are rendered without exponent or trailing {@code .0};
 *   arrays and objects are rendered as JSON.</li>
 *   <li><b>numbers</b>: numeric nodes as-is; strings are parsed after trimming; booleans and containers are
 *   not numbers.</li>
 *   <li><b>{@code +}</b>: arrays concatenate; if either side is a string (or a container/boolean) both sides
 *   are concatenated as text; numbers add, with null counting as zero; null + null is null.</li>
 *   <li><b>{@code - * / %}</b>: both sides must coerce to numbers, otherwise the expression fails.</li>
 *   <li><b>equality</b>: null only equals null; a number equals a string holding the same number; containers
 *   compare structurally; everything else compares by text.</li>
 *   <li><b>ordering</b>: numerically when both sides are numbers, else chronologically when both parse as
 *   dates, else by text; null is not comparable.</li>
 * </ul>
 */
public final class ValueCoercion {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ValueCoercion() {
    }

    public static JsonNode nullToNode(JsonNode value) {
        return value == null || value.isMissingNode() ? NullNode.getInstance() : value;
    }

    public static boolean isNull(JsonNode value) {
        return value == null || value.isNull() || value.isMissingNode();
    }

    public static boolean truthy(JsonNode value) {
        if (isNull(value)) {
            return false;
        }
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        if (value.isNumber()) {
            return value.decimalValue().signum() != 0;
        }
        if (value.isTextual()) {
            String text = value.textValue();
            return !text.isEmpty() && !"false".equalsIgnoreCase(text);
        }
        if (value.isContainerNode()) {
            return value.size() > 0;
        }
        return true;
    }

    public static boolean isEmpty(JsonNode value) {
        if (isNull(value)) {
            return true;
        }
        if (value.isTextual()) {
            return value.textValue().isEmpty();
        }
        return value.isContainerNode() && value.size() == 0;
    }

    public static String toText(JsonNode value) {
        if (isNull(value)) {
            return "";
        }
        if (value.isTextual()) {
            return value.textValue();
        }
        if (value.isNumber()) {
            return formatNumber(value.decimalValue());
        }
        if (value.isBoolean()) {
            return String.valueOf(value.booleanValue());
        }
        if (value.isBinary()) {
            return value.asText();
        }
        return toJson(value);
    }

    /**
     * @return the text form, or {@code null} when the value is null.
     */
    public static String toTextOrNull(JsonNode value) {
        return isNull(value) ? null : toText(value);
    }

    public static BigDecimal toNumber(JsonNode value) {
        if (isNull(value)) {
            return null;
        }
        if (value.isNumber()) {
            return value.decimalValue();
        }
        if (value.isTextual()) {
            String text = value.textValue().trim();
            if (text.isEmpty()) {
                return null;
            }
            try {
                return new BigDecimal(text);
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    public static JsonNode number(BigDecimal value) {
        if (value == null) {
            return NullNode.getInstance();
        }
        BigDecimal stripped = value.stripTrailingZeros();
        if (stripped.scale() <= 0 && stripped.compareTo(BigDecimal.valueOf(Long.MAX_VALUE)) <= 0
                && stripped.compareTo(BigDecimal.valueOf(Long.MIN_VALUE)) >= 0) {
            return LongNode.valueOf(stripped.longValueExact());
        }
        return DoubleNode.valueOf(value.doubleValue());
    }

    public static JsonNode add(JsonNode left, JsonNode right) {
        if (left != null && left.isArray() || right != null && right.isArray()) {
            ArrayNode result = NODES.arrayNode();
            appendFlat(result, left);
            appendFlat(result, right);
            return result;
        }
        if (isNull(left) && isNull(right)) {
            return NullNode.getInstance();
        }
        boolean leftNumeric = isNull(left) || left.isNumber();
        boolean rightNumeric = isNull(right) || right.isNumber();
        if (leftNumeric && rightNumeric) {
            BigDecimal a = isNull(left) ? BigDecimal.ZERO : left.decimalValue();
            BigDecimal b = isNull(right) ? BigDecimal.ZERO : right.decimalValue();
            return number(a.add(b));
        }
        return TextNode.valueOf(toText(left) + toText(right));
    }

    public static JsonNode arithmetic(String operator, JsonNode left, JsonNode right) {
        BigDecimal a = toNumber(left);
        BigDecimal b = toNumber(right);
        if (a == null || b == null) {
            throw new IllegalArgumentException("Operator '" + operator + "' requires numeric operands but got '"
                    + toText(left) + "' and '" + toText(right) + "'");
        }
        return switch (operator) {
            case "-" -> number(a.subtract(b));
            case "*" -> number(a.multiply(b));
            case "/" -> {
                if (b.signum() == 0) {
                    throw new IllegalArgumentException("Division by zero");
                }
                yield number(a.divide(b, MathContext.DECIMAL64));
            }
            case "%" -> {
                if (b.signum() == 0) {
                    throw new IllegalArgumentException("Division by zero");
                }
                yield number(a.remainder(b));
            }
            default -> throw new IllegalArgumentException("Unknown arithmetic operator: " + operator);
        };
    }

    public static JsonNode negate(JsonNode value) {
        BigDecimal number = toNumber(value);
        if (number == null) {
            throw new IllegalArgumentException("Cannot negate non-numeric value '" + toText(value) + "'");
        }
        return number(number.negate());
    }

    public static boolean looseEquals(JsonNode left, JsonNode right) {
        if (isNull(left) || isNull(right)) {
            return isNull(left) && isNull(right);
        }
        if (left.isNumber() || right.isNumber()) {
            BigDecimal a = toNumber(left);
            BigDecimal b = toNumber(right);
            if (a != null && b != null) {
                return a.compareTo(b) == 0;
            }
        }
        if (left.isContainerNode() || right.isContainerNode()) {
            return left.equals(right);
        }
        return toText(left).equals(toText(right));
    }

    /**
     * Orders two values.
     *
     * @return a negative, zero or positive number, or {@code null} when either value is null.
     */
    public static Integer compare(JsonNode left, JsonNode right) {
        if (isNull(left) || isNull(right)) {
            return null;
        }
        BigDecimal a = toNumber(left);
        BigDecimal b = toNumber(right);
        if (a != null && b != null && (left.isNumber() || right.isNumber() || (isNumericText(left) && isNumericText(right)))) {
            return a.compareTo(b);
        }
        if (left.isTextual() && right.isTextual()) {
            Instant first = toInstant(left);
            Instant second = toInstant(right);
            if (first != null && second != null) {
                return first.compareTo(second);
            }
        }
        return toText(left).compareTo(toText(right));
    }

    /**
     * Interprets a value as a point in time: numbers are epoch milliseconds; strings may be ISO-8601 instants,
     * offset date-times, local date-times (UTC) or dates (start of day, UTC).
     *
     * @return the instant, or {@code null} when the value is not a date.
     */
    public static Instant toInstant(JsonNode value) {
        if (isNull(value)) {
            return null;
        }
        if (value.isNumber()) {
            return Instant.ofEpochMilli(value.longValue());
        }
        if (!value.isTextual()) {
            return null;
        }
        String text = value.textValue().trim();
        if (text.isEmpty()) {
            return null;
        }
        Instant parsed = tryParse(() -> Instant.parse(text));
        if (parsed == null) {
            parsed = tryParse(() -> OffsetDateTime.parse(text).toInstant());
        }
        if (parsed == null) {
            parsed = tryParse(() -> LocalDateTime.parse(text).toInstant(ZoneOffset.UTC));
        }
        if (parsed == null) {
            parsed = tryParse(() -> LocalDate.parse(text).atStartOfDay().toInstant(ZoneOffset.UTC));
        }
        return parsed;
    }

    private static Instant tryParse(Supplier<Instant> parser) {
        try {
            return parser.get();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    public static String toJson(JsonNode value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value cannot be serialized to JSON", e);
        }
    }

    /**
     * Renders a value as JSON with object keys sorted, so structurally equal values produce equal text.
     */
    public static String canonicalJson(JsonNode value) {
        return toJson(sortKeys(nullToNode(value)));
    }

    private static JsonNode sortKeys(JsonNode value) {
        if (value.isObject()) {
            Map<String, JsonNode> sorted = new TreeMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = value.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                sorted.put(field.getKey(), sortKeys(field.getValue()));
            }
            ObjectNode result = NODES.objectNode();
            sorted.forEach(result::set);
            return result;
        }
        if (value.isArray()) {
            ArrayNode result = NODES.arrayNode();
            value.forEach(element -> result.add(sortKeys(element)));
            return result;
        }
        return value;
    }

    public static JsonNode bool(boolean value) {
        return BooleanNode.valueOf(value);
    }

    private static boolean isNumericText(JsonNode value) {
        return value.isTextual() && toNumber(value) != null;
    }

    private static void appendFlat(ArrayNode target, JsonNode value) {
        if (isNull(value)) {
            return;
        }
        if (value.isArray()) {
            target.addAll((ArrayNode) value);
        } else {
            target.add(value);
        }
    }

    private static String formatNumber(BigDecimal value) {
        BigDecimal stripped = value.stripTrailingZeros();
        if (stripped.scale() < 0) {
            stripped = stripped.setScale(0);
        }
        return stripped.toPlainString();
    }
}
