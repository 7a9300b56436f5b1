package com.connector.service.impl;

import com.connector.config.RuntimeProperties;
import com.connector.exception.ConfigurationException;
import com.connector.exception.ErrorKind;
import com.connector.exception.ProviderException;
import com.connector.exception.RequestException;
import com.connector.expression.Scope;
import com.connector.expression.ValueCoercion;
import com.connector.model.BaseDefinition;
import com.connector.model.BodyType;
import com.connector.model.CallDefinition;
import com.connector.model.ErrorDefinition;
import com.connector.model.IntegrationDefinition;
import com.connector.model.PreparedRequest;
import com.connector.model.RawResponse;
import com.connector.model.ResponseDefinition;
import com.connector.model.ResultItem;
import com.connector.service.api.ExpressionEvaluator;
import com.connector.service.api.RequestExecutor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

/**
 * Executes Calls with the shared {@link WebClient}, blocking per request.
 * <p>
 * Error messages are resolved in this order: the Call's template for the status, the base template for the
 * status, the Call's default template, the base default template, and finally the built-in
 * {@code [<status>] <provider message>} envelope.
 */
@Service
@Slf4j
public class RequestExecutorImpl implements RequestExecutor {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;
    private static final int MAX_PROVIDER_TEXT = 200;

    private final WebClient webClient;
    private final ExpressionEvaluator evaluator;
    private final LogSanitizer logSanitizer;
    private final Clock clock;
    private final Duration responseTimeout;

    public RequestExecutorImpl(WebClient webClient, ExpressionEvaluator evaluator, LogSanitizer logSanitizer,
                               Clock clock, RuntimeProperties properties) {
        this.webClient = webClient;
        this.evaluator = evaluator;
        this.logSanitizer = logSanitizer;
        this.clock = clock;
        this.responseTimeout = properties.getHttp().getResponseTimeout();
    }

    @Override
    public PreparedRequest prepare(CallDefinition call, IntegrationDefinition integration, Scope scope) {
        BaseDefinition base = integration.getBase();
        String method = call.getMethod() == null ? "GET" : evaluator.evaluateText(call.getMethod(), scope);
        if (method == null || method.isBlank()) {
            throw new ConfigurationException("The method of a Call in '" + integration.getName() + "' resolved to nothing.");
        }
        String url = resolveUrl(call.getUrl(), integration, scope);

        ObjectNode headers = NODES.objectNode();
        mergeHeaders(headers, evaluator.evaluate(base.getHeaders(), scope));
        mergeHeaders(headers, evaluator.evaluate(call.getHeaders(), scope));

        ObjectNode qs = NODES.objectNode();
        mergeObject(qs, evaluator.evaluate(base.getQs(), scope));
        mergeObject(qs, evaluator.evaluate(call.getQs(), scope));

        JsonNode body = mergeBody(evaluator.evaluate(base.getBody(), scope), evaluator.evaluate(call.getBody(), scope));
        BodyType type = call.getType() == null ? BodyType.JSON : call.getType();
        return new PreparedRequest(method.trim().toUpperCase(Locale.ROOT), url, headers, qs, body, type);
    }

    @Override
    public String resolveUrl(String urlTemplate, IntegrationDefinition integration, Scope scope) {
        if (urlTemplate == null || urlTemplate.isBlank()) {
            throw new ConfigurationException("A Call in '" + integration.getName() + "' has no url.");
        }
        String url = evaluator.evaluateText(urlTemplate, scope);
        if (url == null || url.isBlank()) {
            throw new ConfigurationException("The url '" + urlTemplate + "' resolved to nothing.");
        }
        if (isAbsolute(url)) {
            return url;
        }
        String baseUrl = evaluator.evaluateText(integration.getBase().getBaseUrl(), scope);
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new ConfigurationException("Relative url '" + url + "' needs base.baseUrl in '" + integration.getName() + "'.");
        }
        if (baseUrl.endsWith("/") && url.startsWith("/")) {
            return baseUrl + url.substring(1);
        }
        if (!baseUrl.endsWith("/") && !url.startsWith("/")) {
            return baseUrl + "/" + url;
        }
        return baseUrl + url;
    }

    @Override
    public RawResponse send(PreparedRequest request, IntegrationDefinition integration) {
        URI uri = buildUri(request);
        WebClient.RequestBodySpec spec = webClient.method(HttpMethod.valueOf(request.method())).uri(uri);
        request.headers().fields().forEachRemaining(header ->
                spec.header(header.getKey(), ValueCoercion.toText(header.getValue())));
        WebClient.RequestHeadersSpec<?> exchange = attachBody(spec, request);

        ResponseEntity<String> entity;
        try {
            entity = exchange.exchangeToMono(response -> response.toEntity(String.class)).block(responseTimeout);
        } catch (WebClientException | IllegalStateException e) {
            log.debug("{} {} failed: {}", request.method(), withoutQuery(uri), e.getMessage());
            throw new ProviderException("Request to " + uri.getHost() + " failed: " + e.getMessage(), e);
        }
        if (entity == null) {
            throw new ProviderException("Request to " + uri.getHost() + " returned no response", null);
        }
        RawResponse response = new RawResponse(entity.getStatusCode().value(), headersToNode(entity.getHeaders()), parseBody(entity.getBody()));
        logExchange(request, uri, response, integration);
        return response;
    }

    @Override
    public void verify(CallDefinition call, IntegrationDefinition integration, Scope responseScope, RawResponse response) {
        ResponseDefinition callResponse = call.getResponse();
        ResponseDefinition baseResponse = integration.getBase().getResponse();
        int status = response.statusCode();

        if (!response.isSuccessful()) {
            throw failure(callResponse, baseResponse, responseScope, response, null);
        }

        JsonNode valid = callResponse != null && callResponse.getValid() != null
                ? callResponse.getValid()
                : baseResponse != null ? baseResponse.getValid() : null;
        if (valid == null || valid.isNull()) {
            return;
        }
        JsonNode condition = valid.isObject() && valid.has("condition") ? valid.get("condition") : valid;
        if (evaluator.evaluateCondition(condition, responseScope, true)) {
            return;
        }
        log.debug("Response with status {} failed its validity check", status);
        if (valid.isObject() && valid.hasNonNull("message")) {
            String message = ValueCoercion.toTextOrNull(evaluator.evaluate(valid.get("message"), responseScope));
            ErrorKind declared = valid.hasNonNull("type") ? ErrorKind.fromName(valid.get("type").asText()) : null;
            ErrorKind kind = declared != null ? declared : ErrorKind.VALIDATION;
            throw RequestException.of(kind, status, message == null || message.isBlank() ? builtinMessage(response) : message, null);
        }
        throw failure(callResponse, baseResponse, responseScope, response, ErrorKind.VALIDATION);
    }

    @Override
    public List<ResultItem> extract(CallDefinition call, Scope responseScope) {
        ResponseDefinition rules = call.getResponse();
        JsonNode body = ValueCoercion.nullToNode(responseScope.get(Scope.BODY));
        if (rules == null || rules.getIterate() == null || rules.getIterate().isNull()) {
            JsonNode output = rules == null || rules.getOutput() == null ? body : evaluator.evaluate(rules.getOutput(), responseScope);
            return List.of(new ResultItem(body, output));
        }

        JsonNode iterate = rules.getIterate();
        JsonNode containerTemplate = iterate.isObject() ? iterate.get("container") : iterate;
        JsonNode itemCondition = iterate.isObject() ? iterate.get("condition") : null;
        JsonNode container = evaluator.evaluate(containerTemplate, responseScope);

        List<JsonNode> elements = new ArrayList<>();
        if (container.isArray()) {
            container.forEach(elements::add);
        } else if (!ValueCoercion.isNull(container)) {
            elements.add(container);
        }

        List<ResultItem> items = new ArrayList<>(elements.size());
        for (JsonNode element : elements) {
            Scope itemScope = responseScope.with(Scope.ITEM, element);
            if (!evaluator.evaluateCondition(itemCondition, itemScope, true)) {
                continue;
            }
            JsonNode output = rules.getOutput() == null ? element : evaluator.evaluate(rules.getOutput(), itemScope);
            items.add(new ResultItem(element, output));
        }
        return items;
    }

    @Override
    public RawResponse execute(CallDefinition call, IntegrationDefinition integration, Scope scope) {
        RawResponse response = send(prepare(call, integration, scope), integration);
        verify(call, integration, responseScope(scope, response), response);
        return response;
    }

    // ---------------------------------------------------------------- errors

    private RequestException failure(ResponseDefinition callResponse, ResponseDefinition baseResponse, Scope scope,
                                     RawResponse response, ErrorKind defaultKind) {
        int status = response.statusCode();
        ErrorDefinition callError = callResponse == null ? null : callResponse.getError();
        ErrorDefinition baseError = baseResponse == null ? null : baseResponse.getError();

        List<ErrorDefinition> candidates = new ArrayList<>(4);
        candidates.add(callError == null ? null : callError.forStatus(status));
        candidates.add(baseError == null ? null : baseError.forStatus(status));
        candidates.add(callError);
        candidates.add(baseError);

        String message = null;
        String type = null;
        for (ErrorDefinition candidate : candidates) {
            if (candidate == null) {
                continue;
            }
            if (type == null && candidate.getType() != null) {
                type = candidate.getType();
            }
            if (message == null && candidate.getMessage() != null && !candidate.getMessage().isNull()) {
                String resolved = ValueCoercion.toTextOrNull(evaluator.evaluate(candidate.getMessage(), scope));
                if (resolved != null && !resolved.isBlank()) {
                    message = resolved;
                }
            }
        }
        if (message == null) {
            message = builtinMessage(response);
        }
        ErrorKind kind = ErrorKind.fromName(type);
        if (kind == null) {
            kind = defaultKind != null ? defaultKind : ErrorKind.fromStatus(status);
        }
        log.debug("Call failed with status {} ({}): {}", status, kind.getLabel(), message);
        return RequestException.of(kind, status, message, kind == ErrorKind.RATE_LIMIT ? retryAfterSeconds(response) : null);
    }

    private static String builtinMessage(RawResponse response) {
        return "[" + response.statusCode() + "] " + providerMessage(response);
    }

    private static String providerMessage(RawResponse response) {
        JsonNode body = ValueCoercion.nullToNode(response.body());
        if (body.isObject()) {
            for (String path : List.of("message", "error.message", "error_description", "error")) {
                JsonNode value = body.at("/" + path.replace('.', '/'));
                if (value.isValueNode() && !ValueCoercion.isEmpty(value)) {
                    return value.asText();
                }
            }
        }
        if (body.isTextual() && !body.textValue().isBlank()) {
            String text = body.textValue().trim();
            return text.length() > MAX_PROVIDER_TEXT ? text.substring(0, MAX_PROVIDER_TEXT) + "..." : text;
        }
        HttpStatus status = HttpStatus.resolve(response.statusCode());
        return status != null ? status.getReasonPhrase() : "Request failed";
    }

    private Long retryAfterSeconds(RawResponse response) {
        JsonNode header = response.headers() == null ? null : response.headers().get("retry-after");
        if (header == null || header.isNull()) {
            return null;
        }
        String value = header.asText().trim();
        try {
            return Math.max(0, Long.parseLong(value));
        } catch (NumberFormatException e) {
            try {
                Instant at = ZonedDateTime.parse(value, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
                return Math.max(0, Duration.between(clock.instant(), at).getSeconds());
            } catch (DateTimeParseException ignored) {
                log.debug("Ignoring unparseable Retry-After header '{}'", value);
                return null;
            }
        }
    }

    // ---------------------------------------------------------------- wire

    private URI buildUri(PreparedRequest request) {
        try {
            UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(request.url());
            Iterator<Map.Entry<String, JsonNode>> params = request.qs().fields();
            while (params.hasNext()) {
                Map.Entry<String, JsonNode> param = params.next();
                String name = UriUtils.encodeQueryParam(param.getKey(), StandardCharsets.UTF_8);
                JsonNode value = param.getValue();
                if (value.isArray()) {
                    for (JsonNode element : value) {
                        if (!ValueCoercion.isNull(element)) {
                            builder.queryParam(name, encodeQueryValue(element));
                        }
                    }
                } else if (!ValueCoercion.isNull(value)) {
                    builder.queryParam(name, encodeQueryValue(value));
                }
            }
            return builder.build(true).toUri();
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid request url '" + request.url() + "': " + e.getMessage(), e);
        }
    }

    private static String encodeQueryValue(JsonNode value) {
        return UriUtils.encodeQueryParam(ValueCoercion.toText(value), StandardCharsets.UTF_8);
    }

    private WebClient.RequestHeadersSpec<?> attachBody(WebClient.RequestBodySpec spec, PreparedRequest request) {
        JsonNode body = request.body();
        if (ValueCoercion.isNull(body)) {
            return spec;
        }
        boolean explicitContentType = request.headers().properties().stream()
                .anyMatch(header -> header.getKey().equalsIgnoreCase(HttpHeaders.CONTENT_TYPE));
        switch (request.type()) {
            case URLENCODED: {
                MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
                body.fields().forEachRemaining(field -> {
                    JsonNode value = field.getValue();
                    if (value.isArray()) {
                        value.forEach(element -> form.add(field.getKey(), ValueCoercion.toText(element)));
                    } else if (!ValueCoercion.isNull(value)) {
                        form.add(field.getKey(), ValueCoercion.toText(value));
                    }
                });
                return spec.body(BodyInserters.fromFormData(form));
            }
            case TEXT:
                if (!explicitContentType) {
                    spec.contentType(MediaType.TEXT_PLAIN);
                }
                return spec.bodyValue(ValueCoercion.toText(body));
            default:
                if (!explicitContentType) {
                    spec.contentType(MediaType.APPLICATION_JSON);
                }
                return spec.bodyValue(ValueCoercion.toJson(body));
        }
    }

    private static JsonNode parseBody(String raw) {
        if (raw == null || raw.isBlank()) {
            return NullNode.getInstance();
        }
        try {
            return MAPPER.readTree(raw);
        } catch (JsonProcessingException e) {
            return TextNode.valueOf(raw);
        }
    }

    private static ObjectNode headersToNode(HttpHeaders headers) {
        ObjectNode node = NODES.objectNode();
        headers.forEach((name, values) -> node.put(name.toLowerCase(Locale.ROOT), String.join(", ", values)));
        return node;
    }

    private void logExchange(PreparedRequest request, URI uri, RawResponse response, IntegrationDefinition integration) {
        if (!log.isDebugEnabled()) {
            return;
        }
        ObjectNode exchange = NODES.objectNode();
        ObjectNode requestNode = exchange.putObject("request");
        requestNode.put("method", request.method());
        requestNode.put("url", withoutQuery(uri));
        ObjectNode requestHeaders = requestNode.putObject("headers");
        request.headers().fields().forEachRemaining(h -> requestHeaders.set(h.getKey().toLowerCase(Locale.ROOT), h.getValue()));
        requestNode.set("qs", queryOf(uri));
        requestNode.set("body", ValueCoercion.nullToNode(request.body()));
        ObjectNode responseNode = exchange.putObject("response");
        responseNode.put("statusCode", response.statusCode());
        responseNode.set("headers", response.headers());
        responseNode.set("body", response.body());
        JsonNode sanitized = logSanitizer.sanitize(exchange, integration.getBase().getLog().getSanitize());
        log.debug("HTTP exchange for '{}': {}", integration.getName(), sanitized);
    }

    /**
     * The logged url never carries the query; its parameters go under {@code request.qs} where the sanitize
     * paths can reach them.
     */
    private static String withoutQuery(URI uri) {
        return UriComponentsBuilder.fromUri(uri).replaceQuery(null).fragment(null).build(true).toUriString();
    }

    private static ObjectNode queryOf(URI uri) {
        ObjectNode qs = NODES.objectNode();
        MultiValueMap<String, String> params = UriComponentsBuilder.fromUri(uri).build(true).getQueryParams();
        params.forEach((name, values) -> {
            String key = UriUtils.decode(name, StandardCharsets.UTF_8);
            if (values.size() == 1) {
                qs.put(key, values.get(0) == null ? null : UriUtils.decode(values.get(0), StandardCharsets.UTF_8));
            } else {
                ArrayNode array = qs.putArray(key);
                values.forEach(value -> array.add(value == null ? null : UriUtils.decode(value, StandardCharsets.UTF_8)));
            }
        });
        return qs;
    }

    // ---------------------------------------------------------------- merging

    private static void mergeHeaders(ObjectNode target, JsonNode source) {
        if (source == null || !source.isObject()) {
            return;
        }
        source.fields().forEachRemaining(field -> {
            List<String> existing = new ArrayList<>();
            target.fieldNames().forEachRemaining(name -> {
                if (name.equalsIgnoreCase(field.getKey())) {
                    existing.add(name);
                }
            });
            target.remove(existing);
            if (!ValueCoercion.isNull(field.getValue())) {
                target.set(field.getKey(), field.getValue());
            }
        });
    }

    private static void mergeObject(ObjectNode target, JsonNode source) {
        if (source != null && source.isObject()) {
            target.setAll((ObjectNode) source);
        }
    }

    private static JsonNode mergeBody(JsonNode base, JsonNode call) {
        if (ValueCoercion.isNull(base)) {
            return ValueCoercion.isNull(call) ? null : call;
        }
        if (ValueCoercion.isNull(call)) {
            return base;
        }
        if (base.isObject() && call.isObject()) {
            ObjectNode merged = ((ObjectNode) base).deepCopy();
            merged.setAll((ObjectNode) call);
            return merged;
        }
        return call;
    }

    private static boolean isAbsolute(String url) {
        String lower = url.toLowerCase(Locale.ROOT);
        return lower.startsWith("http://") || lower.startsWith("https://");
    }
}
