package com.connector.expression;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.LongNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collections;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

/**
 * The builtin function library available to every template: string, date, collection, crypto, number and
 * logic helpers.
 * <p>
 * Dates are exchanged as ISO-8601 strings in UTC. Hash and HMAC digests are hex encoded unless
 * {@code "base64"} is requested. {@code replace} treats a pattern written as {@code /regex/flags} as a regular
 * expression ({@code g} replaces every match, {@code i} ignores case) and anything else as literal text.
 * <p>
 * {@code if}, {@code ifempty} and {@code switch} are registered here for completeness; the interpreter
 * evaluates them lazily so that only the selected branch runs.
 */
public class BuiltinFunctions {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Pattern REGEX_LITERAL = Pattern.compile("^/(.*)/([gimsu]*)$", Pattern.DOTALL);

    /**
     * Names that are also resolvable as bare identifiers, e.g. {@code {{now}}}.
     */
    public static final Set<String> ZERO_ARGUMENT = Set.of("now", "timestamp", "emptyarray", "emptyobject", "uuid");

    private final Clock clock;
    private final Map<String, ExpressionFunction> functions = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

    public BuiltinFunctions(Clock clock) {
        this.clock = clock;
        registerStrings();
        registerCrypto();
        registerDates();
        registerCollections();
        registerLogic();
        registerNumbers();
    }

    public boolean contains(String name) {
        return functions.containsKey(name);
    }

    public JsonNode invoke(String name, List<JsonNode> arguments) {
        ExpressionFunction function = functions.get(name);
        if (function == null) {
            throw new IllegalArgumentException("Unknown function '" + name + "'");
        }
        return ValueCoercion.nullToNode(function.apply(arguments));
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(functions.keySet());
    }

    private void register(String name, ExpressionFunction function) {
        functions.put(name, function);
    }

    // ---------------------------------------------------------------- strings

    private void registerStrings() {
        register("lower", args -> mapText(arg(args, 0), text -> text.toLowerCase(Locale.ROOT)));
        register("upper", args -> mapText(arg(args, 0), text -> text.toUpperCase(Locale.ROOT)));
        register("capitalize", args -> mapText(arg(args, 0),
                text -> text.isEmpty() ? text : text.substring(0, 1).toUpperCase(Locale.ROOT) + text.substring(1)));
        register("trim", args -> mapText(arg(args, 0), String::trim));
        register("length", args -> {
            JsonNode value = arg(args, 0);
            if (ValueCoercion.isNull(value)) {
                return LongNode.valueOf(0);
            }
            return LongNode.valueOf(value.isContainerNode() ? value.size() : ValueCoercion.toText(value).length());
        });
        register("substring", args -> {
            JsonNode value = arg(args, 0);
            if (ValueCoercion.isNull(value)) {
                return NullNode.getInstance();
            }
            String text = ValueCoercion.toText(value);
            int start = clamp(intArg(args, 1, 0), text.length());
            int end = clamp(intArg(args, 2, text.length()), text.length());
            return TextNode.valueOf(start >= end ? "" : text.substring(start, end));
        });
        register("indexOf", args -> {
            JsonNode haystack = arg(args, 0);
            JsonNode needle = arg(args, 1);
            if (haystack.isArray()) {
                for (int i = 0; i < haystack.size(); i++) {
                    if (ValueCoercion.looseEquals(haystack.get(i), needle)) {
                        return LongNode.valueOf(i);
                    }
                }
                return LongNode.valueOf(-1);
            }
            return LongNode.valueOf(ValueCoercion.toText(haystack).indexOf(ValueCoercion.toText(needle), intArg(args, 2, 0)));
        });
        register("replace", args -> {
            JsonNode value = arg(args, 0);
            if (ValueCoercion.isNull(value)) {
                return NullNode.getInstance();
            }
            return TextNode.valueOf(replace(ValueCoercion.toText(value), ValueCoercion.toText(arg(args, 1)),
                    ValueCoercion.toText(arg(args, 2))));
        });
        register("split", args -> {
            JsonNode value = arg(args, 0);
            ArrayNode parts = NODES.arrayNode();
            if (ValueCoercion.isNull(value)) {
                return parts;
            }
            String separator = args.size() > 1 ? ValueCoercion.toText(arg(args, 1)) : ",";
            String text = ValueCoercion.toText(value);
            if (separator.isEmpty()) {
                text.codePoints().forEach(cp -> parts.add(new String(Character.toChars(cp))));
                return parts;
            }
            for (String part : text.split(Pattern.quote(separator), -1)) {
                parts.add(part);
            }
            return parts;
        });
        register("join", args -> {
            JsonNode value = arg(args, 0);
            String separator = args.size() > 1 ? ValueCoercion.toText(arg(args, 1)) : ",";
            if (!value.isArray()) {
                return TextNode.valueOf(ValueCoercion.toText(value));
            }
            List<String> parts = new ArrayList<>();
            value.forEach(element -> parts.add(ValueCoercion.toText(element)));
            return TextNode.valueOf(String.join(separator, parts));
        });
        register("contains", args -> {
            JsonNode haystack = arg(args, 0);
            JsonNode needle = arg(args, 1);
            if (haystack.isArray()) {
                for (JsonNode element : haystack) {
                    if (ValueCoercion.looseEquals(element, needle)) {
                        return ValueCoercion.bool(true);
                    }
                }
                return ValueCoercion.bool(false);
            }
            if (haystack.isObject()) {
                return ValueCoercion.bool(haystack.has(ValueCoercion.toText(needle)));
            }
            return ValueCoercion.bool(!ValueCoercion.isNull(haystack)
                    && ValueCoercion.toText(haystack).contains(ValueCoercion.toText(needle)));
        });
        register("startsWith", args -> ValueCoercion.bool(
                ValueCoercion.toText(arg(args, 0)).startsWith(ValueCoercion.toText(arg(args, 1)))));
        register("endsWith", args -> ValueCoercion.bool(
                ValueCoercion.toText(arg(args, 0)).endsWith(ValueCoercion.toText(arg(args, 1)))));
        register("toString", args -> TextNode.valueOf(ValueCoercion.toText(arg(args, 0))));
        ExpressionFunction parseNumber = args -> ValueCoercion.number(ValueCoercion.toNumber(arg(args, 0)));
        register("parseNumber", parseNumber);
        register("toNumber", parseNumber);
        register("encodeURL", args -> mapText(arg(args, 0),
                text -> URLEncoder.encode(text, StandardCharsets.UTF_8).replace("+", "%20")));
        register("decodeURL", args -> mapText(arg(args, 0), text -> URLDecoder.decode(text, StandardCharsets.UTF_8)));
        register("base64", args -> mapText(arg(args, 0),
                text -> Base64.getEncoder().encodeToString(text.getBytes(StandardCharsets.UTF_8))));
        register("decodeBase64", args -> mapText(arg(args, 0),
                text -> new String(Base64.getDecoder().decode(text.trim()), StandardCharsets.UTF_8)));
        register("toJSON", args -> TextNode.valueOf(ValueCoercion.toJson(arg(args, 0))));
        register("parseJSON", args -> {
            JsonNode value = arg(args, 0);
            if (ValueCoercion.isNull(value) || !value.isTextual()) {
                return value;
            }
            try {
                return MAPPER.readTree(value.textValue());
            } catch (JsonProcessingException e) {
                throw new IllegalArgumentException("Invalid JSON: " + e.getOriginalMessage(), e);
            }
        });
    }

    static String replace(String text, String pattern, String replacement) {
        Matcher literal = REGEX_LITERAL.matcher(pattern);
        if (!literal.matches()) {
            return text.replace(pattern, replacement);
        }
        String flags = literal.group(2);
        int options = 0;
        if (flags.contains("i")) {
            options |= Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
        }
        if (flags.contains("m")) {
            options |= Pattern.MULTILINE;
        }
        if (flags.contains("s")) {
            options |= Pattern.DOTALL;
        }
        Matcher matcher = Pattern.compile(literal.group(1), options).matcher(text);
        return flags.contains("g") ? matcher.replaceAll(replacement) : matcher.replaceFirst(replacement);
    }

    // ---------------------------------------------------------------- crypto

    private void registerCrypto() {
        register("md5", args -> digest("MD5", args));
        register("sha1", args -> digest("SHA-1", args));
        register("sha256", args -> digest("SHA-256", args));
        register("sha512", args -> digest("SHA-512", args));
        register("hmac", args -> {
            String algorithm = "Hmac" + ValueCoercion.toText(args.size() > 2 ? arg(args, 2) : TextNode.valueOf("sha256"))
                    .toUpperCase(Locale.ROOT).replace("-", "");
            try {
                Mac mac = Mac.getInstance(algorithm);
                mac.init(new SecretKeySpec(ValueCoercion.toText(arg(args, 1)).getBytes(StandardCharsets.UTF_8), algorithm));
                byte[] signature = mac.doFinal(ValueCoercion.toText(arg(args, 0)).getBytes(StandardCharsets.UTF_8));
                return TextNode.valueOf(encode(signature, args.size() > 3 ? ValueCoercion.toText(arg(args, 3)) : "hex"));
            } catch (GeneralSecurityException e) {
                throw new IllegalArgumentException("Unsupported HMAC algorithm '" + algorithm + "'", e);
            }
        });
        register("uuid", args -> TextNode.valueOf(UUID.randomUUID().toString()));
    }

    private static JsonNode digest(String algorithm, List<JsonNode> args) {
        try {
            MessageDigest digest = MessageDigest.getInstance(algorithm);
            byte[] hash = digest.digest(ValueCoercion.toText(arg(args, 0)).getBytes(StandardCharsets.UTF_8));
            return TextNode.valueOf(encode(hash, args.size() > 1 ? ValueCoercion.toText(arg(args, 1)) : "hex"));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Digest " + algorithm + " is not available", e);
        }
    }

    private static String encode(byte[] bytes, String encoding) {
        return "base64".equalsIgnoreCase(encoding)
                ? Base64.getEncoder().encodeToString(bytes)
                : HexFormat.of().formatHex(bytes);
    }

    // ---------------------------------------------------------------- dates

    private void registerDates() {
        register("now", args -> TextNode.valueOf(clock.instant().toString()));
        register("timestamp", args -> LongNode.valueOf(clock.instant().getEpochSecond()));
        register("formatDate", args -> {
            Instant instant = ValueCoercion.toInstant(arg(args, 0));
            if (instant == null) {
                return NullNode.getInstance();
            }
            String format = args.size() > 1 ? ValueCoercion.toText(arg(args, 1)) : "iso";
            ZoneId zone = args.size() > 2 ? ZoneId.of(ValueCoercion.toText(arg(args, 2))) : ZoneOffset.UTC;
            return switch (format) {
                case "iso", "" -> TextNode.valueOf(instant.toString());
                case "epoch", "X" -> LongNode.valueOf(instant.getEpochSecond());
                case "x" -> LongNode.valueOf(instant.toEpochMilli());
                default -> TextNode.valueOf(DateTimeFormatter.ofPattern(format, Locale.ROOT).format(instant.atZone(zone)));
            };
        });
        register("parseDate", args -> {
            JsonNode value = arg(args, 0);
            if (ValueCoercion.isNull(value)) {
                return NullNode.getInstance();
            }
            if (args.size() < 2) {
                Instant instant = ValueCoercion.toInstant(value);
                if (instant == null) {
                    throw new IllegalArgumentException("'" + ValueCoercion.toText(value) + "' is not a date");
                }
                return TextNode.valueOf(instant.toString());
            }
            ZoneId zone = args.size() > 2 ? ZoneId.of(ValueCoercion.toText(arg(args, 2))) : ZoneOffset.UTC;
            return TextNode.valueOf(parseDate(ValueCoercion.toText(value), ValueCoercion.toText(arg(args, 1)), zone).toString());
        });
        register("addSeconds", args -> shift(args, Duration::ofSeconds));
        register("addMinutes", args -> shift(args, Duration::ofMinutes));
        register("addHours", args -> shift(args, Duration::ofHours));
        register("addDays", args -> shift(args, Duration::ofDays));
    }

    static Instant parseDate(String text, String format, ZoneId zone) {
        switch (format) {
            case "X":
            case "epoch":
                return Instant.ofEpochSecond(Long.parseLong(text.trim()));
            case "x":
                return Instant.ofEpochMilli(Long.parseLong(text.trim()));
            default:
                break;
        }
        DateTimeFormatter formatter = DateTimeFormatter.ofPattern(format, Locale.ROOT).withZone(zone);
        try {
            return ZonedDateTime.parse(text, formatter).toInstant();
        } catch (DateTimeParseException e) {
            try {
                return LocalDateTime.parse(text, formatter).atZone(zone).toInstant();
            } catch (DateTimeParseException second) {
                return LocalDate.parse(text, formatter).atStartOfDay(zone).toInstant();
            }
        }
    }

    private static JsonNode shift(List<JsonNode> args, java.util.function.LongFunction<Duration> unit) {
        Instant instant = ValueCoercion.toInstant(arg(args, 0));
        if (instant == null) {
            return NullNode.getInstance();
        }
        BigDecimal amount = ValueCoercion.toNumber(arg(args, 1));
        long delta = amount == null ? 0 : amount.longValue();
        return TextNode.valueOf(instant.plus(unit.apply(delta)).toString());
    }

    // ---------------------------------------------------------------- collections

    private void registerCollections() {
        register("get", args -> path(arg(args, 0), ValueCoercion.toText(arg(args, 1))));
        register("first", args -> {
            JsonNode value = arg(args, 0);
            return value.isArray() && value.size() > 0 ? value.get(0) : NullNode.getInstance();
        });
        register("last", args -> {
            JsonNode value = arg(args, 0);
            return value.isArray() && value.size() > 0 ? value.get(value.size() - 1) : NullNode.getInstance();
        });
        register("keys", args -> {
            ArrayNode keys = NODES.arrayNode();
            arg(args, 0).fieldNames().forEachRemaining(keys::add);
            return keys;
        });
        register("values", args -> {
            ArrayNode values = NODES.arrayNode();
            JsonNode value = arg(args, 0);
            if (value.isObject()) {
                value.elements().forEachRemaining(values::add);
            }
            return values;
        });
        register("map", args -> {
            JsonNode array = arg(args, 0);
            ArrayNode result = NODES.arrayNode();
            if (!array.isArray()) {
                return result;
            }
            String key = ValueCoercion.toText(arg(args, 1));
            String filterKey = args.size() > 2 ? ValueCoercion.toText(arg(args, 2)) : null;
            JsonNode filterValue = arg(args, 3);
            for (JsonNode element : array) {
                if (filterKey != null && !ValueCoercion.looseEquals(path(element, filterKey), filterValue)) {
                    continue;
                }
                result.add(path(element, key));
            }
            return result;
        });
        register("sort", args -> {
            JsonNode array = arg(args, 0);
            if (!array.isArray()) {
                return array;
            }
            boolean descending = "desc".equalsIgnoreCase(ValueCoercion.toText(arg(args, 1)));
            String key = args.size() > 2 ? ValueCoercion.toText(arg(args, 2)) : null;
            List<JsonNode> elements = new ArrayList<>();
            array.forEach(elements::add);
            Comparator<JsonNode> comparator = (a, b) -> compareForSort(key == null ? a : path(a, key), key == null ? b : path(b, key));
            elements.sort(descending ? comparator.reversed() : comparator);
            ArrayNode sorted = NODES.arrayNode();
            elements.forEach(sorted::add);
            return sorted;
        });
        register("reverse", args -> {
            JsonNode value = arg(args, 0);
            if (value.isTextual()) {
                return TextNode.valueOf(new StringBuilder(value.textValue()).reverse().toString());
            }
            ArrayNode reversed = NODES.arrayNode();
            if (value.isArray()) {
                for (int i = value.size() - 1; i >= 0; i--) {
                    reversed.add(value.get(i));
                }
            }
            return reversed;
        });
        register("distinct", args -> {
            JsonNode array = arg(args, 0);
            String key = args.size() > 1 ? ValueCoercion.toText(arg(args, 1)) : null;
            ArrayNode result = NODES.arrayNode();
            Set<String> seen = new HashSet<>();
            if (array.isArray()) {
                for (JsonNode element : array) {
                    if (seen.add(ValueCoercion.canonicalJson(key == null ? element : path(element, key)))) {
                        result.add(element);
                    }
                }
            }
            return result;
        });
        register("flatten", args -> {
            ArrayNode result = NODES.arrayNode();
            JsonNode array = arg(args, 0);
            if (array.isArray()) {
                for (JsonNode element : array) {
                    if (element.isArray()) {
                        result.addAll((ArrayNode) element);
                    } else {
                        result.add(element);
                    }
                }
            }
            return result;
        });
        register("slice", args -> {
            JsonNode value = arg(args, 0);
            if (value.isTextual()) {
                String text = value.textValue();
                int start = clamp(intArg(args, 1, 0), text.length());
                int end = clamp(intArg(args, 2, text.length()), text.length());
                return TextNode.valueOf(start >= end ? "" : text.substring(start, end));
            }
            ArrayNode result = NODES.arrayNode();
            if (value.isArray()) {
                int start = clamp(intArg(args, 1, 0), value.size());
                int end = clamp(intArg(args, 2, value.size()), value.size());
                for (int i = start; i < end; i++) {
                    result.add(value.get(i));
                }
            }
            return result;
        });
        register("merge", args -> {
            ObjectNode merged = NODES.objectNode();
            for (JsonNode value : args) {
                if (value != null && value.isObject()) {
                    merged.setAll((ObjectNode) value);
                }
            }
            return merged;
        });
        register("omit", args -> {
            JsonNode value = arg(args, 0);
            if (!value.isObject()) {
                return value;
            }
            ObjectNode copy = ((ObjectNode) value).deepCopy();
            copy.remove(keyArguments(args));
            return copy;
        });
        register("pick", args -> {
            JsonNode value = arg(args, 0);
            ObjectNode picked = NODES.objectNode();
            if (value.isObject()) {
                for (String key : keyArguments(args)) {
                    if (value.has(key)) {
                        picked.set(key, value.get(key));
                    }
                }
            }
            return picked;
        });
        register("object", args -> {
            ObjectNode object = NODES.objectNode();
            for (int i = 0; i + 1 < args.size(); i += 2) {
                object.set(ValueCoercion.toText(args.get(i)), ValueCoercion.nullToNode(args.get(i + 1)));
            }
            return object;
        });
        register("toArray", args -> {
            JsonNode value = arg(args, 0);
            if (value.isArray()) {
                return value;
            }
            ArrayNode result = NODES.arrayNode();
            if (value.isObject()) {
                Iterator<Map.Entry<String, JsonNode>> fields = value.fields();
                while (fields.hasNext()) {
                    Map.Entry<String, JsonNode> field = fields.next();
                    result.addObject().put("key", field.getKey()).set("value", field.getValue());
                }
            } else if (!ValueCoercion.isNull(value)) {
                result.add(value);
            }
            return result;
        });
        register("add", args -> {
            ArrayNode result = NODES.arrayNode();
            JsonNode array = arg(args, 0);
            if (array.isArray()) {
                result.addAll((ArrayNode) array);
            }
            for (int i = 1; i < args.size(); i++) {
                result.add(ValueCoercion.nullToNode(args.get(i)));
            }
            return result;
        });
        register("emptyarray", args -> NODES.arrayNode());
        register("emptyobject", args -> NODES.objectNode());
    }

    /**
     * Resolves a dotted path such as {@code user.emails.0.address} against a value.
     */
    public static JsonNode path(JsonNode value, String path) {
        JsonNode current = ValueCoercion.nullToNode(value);
        if (path == null || path.isEmpty()) {
            return current;
        }
        for (String part : path.split("\\.")) {
            if (current.isArray() && part.chars().allMatch(Character::isDigit)) {
                current = ValueCoercion.nullToNode(current.get(Integer.parseInt(part)));
            } else if (current.isObject()) {
                current = ValueCoercion.nullToNode(current.get(part));
            } else {
                return NullNode.getInstance();
            }
        }
        return current;
    }

    private static int compareForSort(JsonNode a, JsonNode b) {
        boolean aNull = ValueCoercion.isNull(a);
        boolean bNull = ValueCoercion.isNull(b);
        if (aNull || bNull) {
            return Boolean.compare(aNull, bNull);
        }
        return ValueCoercion.compare(a, b);
    }

    private static List<String> keyArguments(List<JsonNode> args) {
        List<String> keys = new ArrayList<>();
        for (int i = 1; i < args.size(); i++) {
            JsonNode key = args.get(i);
            if (key.isArray()) {
                key.forEach(element -> keys.add(ValueCoercion.toText(element)));
            } else {
                keys.add(ValueCoercion.toText(key));
            }
        }
        return keys;
    }

    // ---------------------------------------------------------------- logic

    private void registerLogic() {
        register("isEmpty", args -> ValueCoercion.bool(ValueCoercion.isEmpty(arg(args, 0))));
        register("not", args -> ValueCoercion.bool(!ValueCoercion.truthy(arg(args, 0))));
        register("if", args -> ValueCoercion.truthy(arg(args, 0)) ? arg(args, 1) : arg(args, 2));
        register("ifempty", args -> ValueCoercion.isEmpty(arg(args, 0)) ? arg(args, 1) : arg(args, 0));
        register("switch", args -> {
            JsonNode subject = arg(args, 0);
            int i = 1;
            for (; i + 1 < args.size(); i += 2) {
                if (ValueCoercion.looseEquals(subject, args.get(i))) {
                    return args.get(i + 1);
                }
            }
            return i < args.size() ? args.get(i) : NullNode.getInstance();
        });
    }

    // ---------------------------------------------------------------- numbers

    private void registerNumbers() {
        register("round", args -> {
            BigDecimal value = ValueCoercion.toNumber(arg(args, 0));
            return value == null ? NullNode.getInstance()
                    : ValueCoercion.number(value.setScale(intArg(args, 1, 0), RoundingMode.HALF_UP));
        });
        register("floor", args -> rounded(args, RoundingMode.FLOOR));
        register("ceil", args -> rounded(args, RoundingMode.CEILING));
        register("abs", args -> {
            BigDecimal value = ValueCoercion.toNumber(arg(args, 0));
            return value == null ? NullNode.getInstance() : ValueCoercion.number(value.abs());
        });
        register("max", args -> ValueCoercion.number(numbers(args).stream().max(Comparator.naturalOrder()).orElse(null)));
        register("min", args -> ValueCoercion.number(numbers(args).stream().min(Comparator.naturalOrder()).orElse(null)));
        register("sum", args -> ValueCoercion.number(numbers(args).stream().reduce(BigDecimal.ZERO, BigDecimal::add)));
    }

    private static JsonNode rounded(List<JsonNode> args, RoundingMode mode) {
        BigDecimal value = ValueCoercion.toNumber(arg(args, 0));
        return value == null ? NullNode.getInstance() : ValueCoercion.number(value.setScale(0, mode));
    }

    private static List<BigDecimal> numbers(List<JsonNode> args) {
        List<JsonNode> values = new ArrayList<>();
        if (args.size() == 1 && args.get(0).isArray()) {
            args.get(0).forEach(values::add);
        } else {
            values.addAll(args);
        }
        List<BigDecimal> numbers = new ArrayList<>();
        for (JsonNode value : values) {
            BigDecimal number = ValueCoercion.toNumber(value);
            if (number != null) {
                numbers.add(number);
            }
        }
        return numbers;
    }

    // ---------------------------------------------------------------- helpers

    private static JsonNode arg(List<JsonNode> args, int index) {
        return index < args.size() ? ValueCoercion.nullToNode(args.get(index)) : NullNode.getInstance();
    }

    private static int intArg(List<JsonNode> args, int index, int defaultValue) {
        BigDecimal value = ValueCoercion.toNumber(arg(args, index));
        return value == null ? defaultValue : value.intValue();
    }

    private static int clamp(int index, int length) {
        int resolved = index < 0 ? length + index : index;
        return Math.max(0, Math.min(resolved, length));
    }

    private static JsonNode mapText(JsonNode value, java.util.function.UnaryOperator<String> mapper) {
        if (ValueCoercion.isNull(value)) {
            return NullNode.getInstance();
        }
        return TextNode.valueOf(mapper.apply(ValueCoercion.toText(value)));
    }
}
