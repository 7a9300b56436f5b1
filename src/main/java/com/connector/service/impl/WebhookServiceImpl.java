package com.connector.service.impl;

import com.connector.config.RuntimeProperties;
import com.connector.dto.response.WebhookReceipt;
import com.connector.exception.ConfigurationException;
import com.connector.exception.WebhookNotFoundException;
import com.connector.expression.Scope;
import com.connector.expression.ValueCoercion;
import com.connector.model.ConnectionInstance;
import com.connector.model.IntegrationDefinition;
import com.connector.model.RawResponse;
import com.connector.model.ResultItem;
import com.connector.model.WebhookDefinition;
import com.connector.model.WebhookRegistration;
import com.connector.service.api.ConnectionManager;
import com.connector.service.api.ExpressionEvaluator;
import com.connector.service.api.RequestExecutor;
import com.connector.service.api.StateService;
import com.connector.service.api.WebhookService;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class WebhookServiceImpl implements WebhookService {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final StateService stateService;
    private final ConnectionManager connectionManager;
    private final RequestExecutor requestExecutor;
    private final ExpressionEvaluator evaluator;
    private final Clock clock;
    private final String publicUrl;
    private final int dedupeWindow;
    private final int maxQueuedBundles;

    private final Map<String, Deque<JsonNode>> queues = new ConcurrentHashMap<>();
    private final Map<String, Map<String, Boolean>> recentEvents = new ConcurrentHashMap<>();

    public WebhookServiceImpl(StateService stateService, ConnectionManager connectionManager, RequestExecutor requestExecutor,
                              ExpressionEvaluator evaluator, Clock clock, RuntimeProperties properties) {
        this.stateService = stateService;
        this.connectionManager = connectionManager;
        this.requestExecutor = requestExecutor;
        this.evaluator = evaluator;
        this.clock = clock;
        this.publicUrl = properties.getPublicUrl().replaceAll("/+$", "");
        this.dedupeWindow = properties.getWebhook().getDedupeWindow();
        this.maxQueuedBundles = properties.getWebhook().getMaxQueuedBundles();
    }

    @Override
    public WebhookRegistration attach(String integrationName, String hookId, String connectionRef, JsonNode parameters) {
        IntegrationDefinition integration = requireIntegration(integrationName);
        WebhookDefinition definition = integration.requireWebhook(hookId);
        String hookRef = UUID.randomUUID().toString();
        String callbackUrl = publicUrl + "/hooks/" + hookRef;

        ObjectNode webhook = NODES.objectNode().put("url", callbackUrl).put("hookRef", hookRef);
        Scope scope = baseScope(integration, connectionRef, parameters, true).with(Scope.WEBHOOK, webhook);
        if (definition.getAttach() != null) {
            RawResponse response = requestExecutor.execute(definition.getAttach(), integration, scope);
            List<ResultItem> outputs = requestExecutor.extract(definition.getAttach(), requestExecutor.responseScope(scope, response));
            if (!outputs.isEmpty() && outputs.get(0).output().isObject()) {
                webhook.setAll((ObjectNode) outputs.get(0).output());
            }
        }

        WebhookRegistration registration = new WebhookRegistration(hookRef, integrationName, hookId, callbackUrl, connectionRef,
                ValueCoercion.nullToNode(parameters), webhook, clock.instant());
        stateService.saveWebhook(registration);
        log.info("Attached webhook '{}' of integration '{}' as {}", hookId, integrationName, hookRef);
        return registration;
    }

    @Override
    public void detach(String hookRef) {
        WebhookRegistration registration = requireRegistration(hookRef);
        IntegrationDefinition integration = requireIntegration(registration.integration());
        WebhookDefinition definition = integration.requireWebhook(registration.hookId());
        if (definition.getDetach() != null) {
            Scope scope = baseScope(integration, registration.connectionRef(), registration.parameters(), true)
                    .with(Scope.WEBHOOK, registration.data());
            requestExecutor.execute(definition.getDetach(), integration, scope);
        }
        stateService.deleteWebhook(hookRef);
        queues.remove(hookRef);
        recentEvents.remove(hookRef);
        log.info("Detached webhook {}", hookRef);
    }

    @Override
    public WebhookRegistration update(String hookRef, JsonNode parameters) {
        WebhookRegistration registration = requireRegistration(hookRef);
        IntegrationDefinition integration = requireIntegration(registration.integration());
        WebhookDefinition definition = integration.requireWebhook(registration.hookId());
        ObjectNode webhook = registration.data() != null && registration.data().isObject()
                ? ((ObjectNode) registration.data()).deepCopy()
                : NODES.objectNode();
        if (definition.getUpdate() != null) {
            Scope scope = baseScope(integration, registration.connectionRef(), parameters, true).with(Scope.WEBHOOK, webhook);
            RawResponse response = requestExecutor.execute(definition.getUpdate(), integration, scope);
            List<ResultItem> outputs = requestExecutor.extract(definition.getUpdate(), requestExecutor.responseScope(scope, response));
            if (!outputs.isEmpty() && outputs.get(0).output().isObject()) {
                webhook.setAll((ObjectNode) outputs.get(0).output());
            }
        }
        WebhookRegistration updated = new WebhookRegistration(hookRef, registration.integration(), registration.hookId(),
                registration.callbackUrl(), registration.connectionRef(), ValueCoercion.nullToNode(parameters), webhook,
                registration.createdAt());
        stateService.saveWebhook(updated);
        log.info("Updated webhook {}", hookRef);
        return updated;
    }

    @Override
    public WebhookReceipt receive(String hookRef, JsonNode payload, Map<String, String> headers, Map<String, String> query) {
        WebhookRegistration registration = requireRegistration(hookRef);
        IntegrationDefinition integration = requireIntegration(registration.integration());
        WebhookDefinition definition = integration.requireWebhook(registration.hookId());

        Scope scope = baseScope(integration, registration.connectionRef(), registration.parameters(), false)
                .with(Scope.WEBHOOK, registration.data())
                .with(Scope.BODY, ValueCoercion.nullToNode(payload))
                .with(Scope.HEADERS, lowerCaseKeys(headers))
                .with(Scope.QUERY, toObject(query));

        WebhookDefinition.VerificationDefinition verification = definition.getVerification();
        if (verification != null && evaluator.evaluateCondition(verification.getCondition(), scope, false)) {
            log.info("Answering verification handshake for webhook {}", hookRef);
            JsonNode responseHeaders = evaluator.evaluate(verification.getRespond().getHeaders(), scope);
            JsonNode body = evaluator.evaluate(verification.getRespond().getBody(), scope);
            return new WebhookReceipt(verification.getRespond().getStatus(), responseHeaders, body, 0);
        }

        if (!evaluator.evaluateCondition(definition.getValidator(), scope, true)) {
            log.debug("Webhook {} dropped a payload rejected by its validator", hookRef);
            return WebhookReceipt.acknowledged(0);
        }

        if (!firstDelivery(hookRef, eventId(definition, scope, payload))) {
            log.debug("Webhook {} ignored a replayed event", hookRef);
            return WebhookReceipt.acknowledged(0);
        }

        List<JsonNode> bundles = new ArrayList<>();
        for (JsonNode item : items(definition, scope, payload)) {
            Scope itemScope = scope.with(Scope.ITEM, item);
            bundles.add(definition.getOutput() == null ? item : evaluator.evaluate(definition.getOutput(), itemScope));
        }
        Deque<JsonNode> queue = queues.computeIfAbsent(hookRef, ref -> new ArrayDeque<>());
        int dropped = 0;
        synchronized (queue) {
            queue.addAll(bundles);
            while (queue.size() > maxQueuedBundles) {
                queue.removeFirst();
                dropped++;
            }
        }
        if (dropped > 0) {
            log.warn("Webhook {} dropped its {} oldest undrained bundle(s); at most {} are kept", hookRef, dropped, maxQueuedBundles);
        }
        log.info("Webhook {} queued {} bundle(s)", hookRef, bundles.size());
        return WebhookReceipt.acknowledged(bundles.size());
    }

    @Override
    public List<JsonNode> drain(String hookRef) {
        requireRegistration(hookRef);
        Deque<JsonNode> queue = queues.get(hookRef);
        if (queue == null) {
            return List.of();
        }
        synchronized (queue) {
            List<JsonNode> drained = new ArrayList<>(queue);
            queue.clear();
            return drained;
        }
    }

    private List<JsonNode> items(WebhookDefinition definition, Scope scope, JsonNode payload) {
        if (definition.getIterate() == null) {
            return List.of(ValueCoercion.nullToNode(payload));
        }
        JsonNode container = evaluator.evaluate(definition.getIterate(), scope);
        List<JsonNode> items = new ArrayList<>();
        if (container.isArray()) {
            container.forEach(items::add);
        } else if (!ValueCoercion.isNull(container)) {
            items.add(container);
        }
        return items;
    }

    private String eventId(WebhookDefinition definition, Scope scope, JsonNode payload) {
        String mapped = definition.getEventId() == null ? null : ValueCoercion.toTextOrNull(evaluator.evaluate(definition.getEventId(), scope));
        if (mapped != null && !mapped.isEmpty()) {
            return mapped;
        }
        try {
            byte[] hash = MessageDigest.getInstance("SHA-256").digest(ValueCoercion.canonicalJson(payload).getBytes(StandardCharsets.UTF_8));
            return "sha256:" + HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    private boolean firstDelivery(String hookRef, String eventId) {
        Map<String, Boolean> recent = recentEvents.computeIfAbsent(hookRef, ref -> new LinkedHashMap<>() {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
                return size() > dedupeWindow;
            }
        });
        synchronized (recent) {
            return recent.put(eventId, Boolean.TRUE) == null;
        }
    }

    private Scope baseScope(IntegrationDefinition integration, String connectionRef, JsonNode parameters, boolean refresh) {
        Scope scope = Scope.of(integration.appContext()).with(Scope.PARAMETERS, ValueCoercion.nullToNode(parameters));
        if (connectionRef == null) {
            return scope;
        }
        ConnectionInstance connection = refresh ? connectionManager.ensureFresh(connectionRef) : stateService.getConnection(connectionRef);
        return connection == null ? scope : connectionManager.bind(scope, connection);
    }

    private IntegrationDefinition requireIntegration(String name) {
        IntegrationDefinition integration = stateService.getDefinition(name);
        if (integration == null) {
            throw new ConfigurationException("No integration named '" + name + "' is loaded.");
        }
        return integration;
    }

    private WebhookRegistration requireRegistration(String hookRef) {
        WebhookRegistration registration = stateService.getWebhook(hookRef);
        if (registration == null) {
            throw new WebhookNotFoundException(hookRef);
        }
        return registration;
    }

    private static ObjectNode lowerCaseKeys(Map<String, String> values) {
        ObjectNode node = NODES.objectNode();
        if (values != null) {
            values.forEach((key, value) -> node.put(key.toLowerCase(Locale.ROOT), value));
        }
        return node;
    }

    private static ObjectNode toObject(Map<String, String> values) {
        ObjectNode node = NODES.objectNode();
        if (values != null) {
            values.forEach(node::put);
        }
        return node;
    }
}
