package com.connector.service.impl;

import com.connector.config.RuntimeProperties;
import com.connector.exception.ConfigurationException;
import com.connector.exception.EvaluationException;
import com.connector.model.FunctionDefinition;
import com.connector.service.api.FunctionRegistry;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.Base64;
import java.util.Collection;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.expression.EvaluationContext;
import org.springframework.expression.Expression;
import org.springframework.expression.ExpressionParser;
import org.springframework.expression.ParseException;
import org.springframework.expression.PropertyAccessor;
import org.springframework.expression.TypedValue;
import org.springframework.expression.spel.SpelEvaluationException;
import org.springframework.expression.spel.SpelMessage;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.expression.spel.support.StandardEvaluationContext;
import org.springframework.expression.spel.support.StandardTypeLocator;
import org.springframework.stereotype.Service;
import org.springframework.util.ReflectionUtils;

/**
 * Runs user functions as constrained Spring expressions.
 * <p>
 * The evaluation context has no type references, constructors, bean references or method calls; maps are
 * readable but not writable. The only callable helpers are the whitelisted string, crypto and date functions
 * of {@link SandboxFunctions}, e.g. {@code #upper(#name)}. Each call runs on the bounded function pool and is
 * cancelled when it exceeds its time budget.
 */
@Service
@Slf4j
public class SandboxedFunctionRegistry implements FunctionRegistry {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final ExpressionParser PARSER = new SpelExpressionParser();
    private static final Map<String, Method> HELPERS = helperMethods();

    private final Map<String, Map<String, CompiledFunction>> functions = new ConcurrentHashMap<>();
    private final ExecutorService executor;
    private final long defaultTimeoutMillis;

    public SandboxedFunctionRegistry(@Qualifier("functionExecutor") ExecutorService executor, RuntimeProperties properties) {
        this.executor = executor;
        this.defaultTimeoutMillis = properties.getFunctions().getTimeout().toMillis();
    }

    private record CompiledFunction(FunctionDefinition definition, Expression expression) {
    }

    @Override
    public void register(String integration, Collection<FunctionDefinition> definitions) {
        Map<String, CompiledFunction> compiled = new LinkedHashMap<>();
        for (FunctionDefinition definition : definitions) {
            if (definition.getName() == null || definition.getBody() == null || definition.getBody().isBlank()) {
                throw new ConfigurationException("Function definitions need a name and a body in integration '" + integration + "'.");
            }
            try {
                compiled.put(definition.getName(), new CompiledFunction(definition, PARSER.parseExpression(definition.getBody())));
            } catch (ParseException e) {
                throw new ConfigurationException("Function '" + definition.getName() + "' of integration '" + integration
                        + "' does not compile: " + e.getMessage(), e);
            }
        }
        functions.put(integration, compiled);
        log.info("Registered {} user function(s) for integration '{}'", compiled.size(), integration);
    }

    @Override
    public void unregister(String integration) {
        functions.remove(integration);
    }

    @Override
    public boolean contains(String integration, String name) {
        return integration != null && functions.getOrDefault(integration, Map.of()).containsKey(name);
    }

    @Override
    public JsonNode invoke(String integration, String name, List<JsonNode> arguments, String expression) {
        CompiledFunction function = integration == null ? null : functions.getOrDefault(integration, Map.of()).get(name);
        if (function == null) {
            throw new EvaluationException("Unknown function '" + name + "'", name, expression, null);
        }
        EvaluationContext context = sandbox(function.definition(), arguments);
        long timeout = function.definition().getTimeoutMillis() != null ? function.definition().getTimeoutMillis() : defaultTimeoutMillis;

        Future<Object> result = executor.submit(() -> function.expression().getValue(context));
        try {
            return MAPPER.valueToTree(result.get(timeout, TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            result.cancel(true);
            throw new EvaluationException("Function exceeded its time budget of " + timeout + "ms", name, expression, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new EvaluationException("Function failed: " + cause.getMessage(), name, expression, cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            result.cancel(true);
            throw new EvaluationException("Interrupted while running function", name, expression, e);
        } catch (IllegalArgumentException e) {
            throw new EvaluationException("Function returned a value that is not JSON: " + e.getMessage(), name, expression, e);
        }
    }

    private static EvaluationContext sandbox(FunctionDefinition definition, List<JsonNode> arguments) {
        StandardEvaluationContext context = new StandardEvaluationContext();
        context.setTypeLocator(new BlockingTypeLocator());
        context.setPropertyAccessors(List.of(new ReadOnlyMapAccessor()));
        context.setMethodResolvers(List.of());
        context.setConstructorResolvers(List.of());
        context.setBeanResolver(null);
        HELPERS.forEach(context::registerFunction);

        List<String> parameters = definition.getParameters();
        for (int i = 0; i < parameters.size(); i++) {
            JsonNode argument = i < arguments.size() ? arguments.get(i) : null;
            context.setVariable(parameters.get(i), argument == null || argument.isNull() ? null : MAPPER.convertValue(argument, Object.class));
        }
        return context;
    }

    private static Map<String, Method> helperMethods() {
        Map<String, Method> helpers = new LinkedHashMap<>();
        Arrays.stream(SandboxFunctions.class.getDeclaredMethods())
                .filter(method -> Modifier.isStatic(method.getModifiers()))
                .filter(method -> !method.isSynthetic())
                .filter(method -> !Modifier.isPrivate(method.getModifiers()))
                .forEach(method -> {
                    ReflectionUtils.makeAccessible(method);
                    helpers.put(method.getName(), method);
                });
        return helpers;
    }

    private static final class BlockingTypeLocator extends StandardTypeLocator {
        @Override
        public Class<?> findType(String typeName) {
            throw new SpelEvaluationException(SpelMessage.TYPE_NOT_FOUND, typeName);
        }
    }

    private static final class ReadOnlyMapAccessor implements PropertyAccessor {
        @Override
        public Class<?>[] getSpecificTargetClasses() {
            return new Class[]{Map.class};
        }

        @Override
        public boolean canRead(EvaluationContext context, Object target, String name) {
            return target instanceof Map<?, ?>;
        }

        @Override
        public TypedValue read(EvaluationContext context, Object target, String name) {
            return new TypedValue(((Map<?, ?>) target).get(name));
        }

        @Override
        public boolean canWrite(EvaluationContext context, Object target, String name) {
            return false;
        }

        @Override
        public void write(EvaluationContext context, Object target, String name, Object newValue) {
            throw new UnsupportedOperationException("read-only map accessor");
        }
    }

    /**
     * The whitelisted helpers; no filesystem, network or reflection capability.
     */
    static final class SandboxFunctions {
        private SandboxFunctions() {
        }

        static String lower(String value) {
            return value == null ? null : value.toLowerCase(Locale.ROOT);
        }

        static String upper(String value) {
            return value == null ? null : value.toUpperCase(Locale.ROOT);
        }

        static String trim(String value) {
            return value == null ? null : value.trim();
        }

        static int length(Object value) {
            if (value instanceof Collection<?> collection) {
                return collection.size();
            }
            if (value instanceof Map<?, ?> map) {
                return map.size();
            }
            return value == null ? 0 : value.toString().length();
        }

        static String substring(String value, int start, int end) {
            Objects.requireNonNull(value, "value");
            return value.substring(Math.max(0, start), Math.min(end, value.length()));
        }

        static String replace(String value, String target, String replacement) {
            return value == null ? null : value.replace(target, replacement);
        }

        static List<String> split(String value, String separator) {
            return value == null ? List.of() : List.of(value.split(Pattern.quote(separator), -1));
        }

        static String join(List<?> values, String separator) {
            return values == null ? "" : String.join(separator, values.stream().map(String::valueOf).toList());
        }

        static boolean regexMatch(String input, String pattern) {
            return input != null && pattern != null && Pattern.compile(pattern, Pattern.DOTALL).matcher(input).find();
        }

        static String regexExtract(String input, String pattern, int group) {
            if (input == null || pattern == null) {
                return "";
            }
            Matcher matcher = Pattern.compile(pattern, Pattern.DOTALL).matcher(input);
            if (!matcher.find() || group < 0 || group > matcher.groupCount()) {
                return "";
            }
            String result = matcher.group(group);
            return result == null ? "" : result;
        }

        static String md5(String value) {
            return digestHex("MD5", value);
        }

        static String sha256(String value) {
            return digestHex("SHA-256", value);
        }

        static String base64(String value) {
            Objects.requireNonNull(value, "value");
            return Base64.getEncoder().encodeToString(value.getBytes(StandardCharsets.UTF_8));
        }

        static String decodeBase64(String value) {
            Objects.requireNonNull(value, "value");
            return new String(Base64.getDecoder().decode(value), StandardCharsets.UTF_8);
        }

        static String hmacSha256(String value, String key) {
            Objects.requireNonNull(key, "key");
            Objects.requireNonNull(value, "value");
            try {
                Mac mac = Mac.getInstance("HmacSHA256");
                mac.init(new SecretKeySpec(key.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
                return HexFormat.of().formatHex(mac.doFinal(value.getBytes(StandardCharsets.UTF_8)));
            } catch (GeneralSecurityException e) {
                throw new IllegalStateException("Failed to compute HMAC-SHA256", e);
            }
        }

        static String formatDate(String isoInstant, String pattern) {
            Objects.requireNonNull(pattern, "pattern");
            Instant instant = isoInstant == null ? Instant.now() : Instant.parse(isoInstant);
            return DateTimeFormatter.ofPattern(pattern, Locale.ROOT).format(instant.atOffset(ZoneOffset.UTC));
        }

        static String now() {
            return Instant.now().toString();
        }

        static Double parseNumber(String value) {
            return value == null || value.isBlank() ? null : Double.valueOf(value.trim());
        }

        private static String digestHex(String algorithm, String value) {
            Objects.requireNonNull(value, "value");
            try {
                return HexFormat.of().formatHex(MessageDigest.getInstance(algorithm).digest(value.getBytes(StandardCharsets.UTF_8)));
            } catch (GeneralSecurityException e) {
                throw new IllegalStateException(algorithm + " algorithm not available", e);
            }
        }
    }
}
