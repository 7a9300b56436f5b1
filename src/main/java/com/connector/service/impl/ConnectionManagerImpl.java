package com.connector.service.impl;

import com.connector.config.RuntimeProperties;
import com.connector.dto.response.AuthorizationRequest;
import com.connector.exception.AuthException;
import com.connector.exception.ConfigurationException;
import com.connector.exception.ErrorKind;
import com.connector.exception.RequestException;
import com.connector.exception.ValidationException;
import com.connector.expression.Scope;
import com.connector.expression.ValueCoercion;
import com.connector.model.CallDefinition;
import com.connector.model.ConnectionData;
import com.connector.model.ConnectionDefinition;
import com.connector.model.ConnectionInstance;
import com.connector.model.ConnectionType;
import com.connector.model.CredentialState;
import com.connector.model.IntegrationDefinition;
import com.connector.model.ParameterSpec;
import com.connector.model.RawResponse;
import com.connector.service.api.ConnectionManager;
import com.connector.service.api.ExpressionEvaluator;
import com.connector.service.api.RequestExecutor;
import com.connector.service.api.StateService;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Connection lifecycle on top of the {@link RequestExecutor}.
 * <p>
 * Freshness is a guarded transition: a credential is VALID until {@code now + skew} reaches its expiry, then
 * NEAR_EXPIRY; the first caller to notice takes the connection's lock (REFRESHING), re-reads the instance and
 * refreshes only if nobody else did. When the provider's refresh response carries no refresh token, the
 * previous one is kept.
 */
@Service
@Slf4j
public class ConnectionManagerImpl implements ConnectionManager {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;
    private static final SecureRandom RANDOM = new SecureRandom();

    private final StateService stateService;
    private final RequestExecutor requestExecutor;
    private final ExpressionEvaluator evaluator;
    private final Clock clock;
    private final Duration refreshSkew;
    private final Duration authorizationTtl;
    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final Map<String, PendingAuthorization> pending = new ConcurrentHashMap<>();

    public ConnectionManagerImpl(StateService stateService, RequestExecutor requestExecutor, ExpressionEvaluator evaluator,
                                 Clock clock, RuntimeProperties properties) {
        this.stateService = stateService;
        this.requestExecutor = requestExecutor;
        this.evaluator = evaluator;
        this.clock = clock;
        this.refreshSkew = properties.getConnection().getRefreshSkew();
        this.authorizationTtl = properties.getConnection().getAuthorizationTtl();
    }

    private record PendingAuthorization(String integration, String connection, JsonNode parameters, String redirectUri,
                                        String codeVerifier, Instant createdAt) {
    }

    @Override
    public ConnectionInstance validate(String integrationName, String connectionName, JsonNode parameters) {
        IntegrationDefinition integration = requireIntegration(integrationName);
        ConnectionDefinition definition = integration.requireConnection(connectionName);
        if (definition.getType().isOAuth()) {
            throw new ConfigurationException("Connection '" + connectionName + "' uses " + definition.getType().getValue()
                    + "; start it with authorize instead.");
        }
        JsonNode resolved = withDefaults(definition, parameters);

        ConnectionInstance instance = ConnectionInstance.builder()
                .id(UUID.randomUUID().toString())
                .integration(integrationName)
                .connection(connectionName)
                .type(definition.getType())
                .parameters(resolved)
                .data(ConnectionData.empty())
                .createdAt(clock.instant())
                .build();

        if (definition.getInfo() != null) {
            Scope scope = authScope(integration, instance, null);
            try {
                RawResponse response = requestExecutor.execute(definition.getInfo(), integration, scope);
                instance = instance.toBuilder().data(mapData(definition.getInfo(), scope, response, ConnectionData.empty())).build();
            } catch (RequestException e) {
                throw asAuthFailure("Connection validation failed", e);
            }
        }
        stateService.saveConnection(instance);
        log.info("Created {} connection '{}' for integration '{}'", definition.getType().getValue(), instance.getId(), integrationName);
        return instance;
    }

    @Override
    public AuthorizationRequest authorize(String integrationName, String connectionName, JsonNode parameters, String redirectUri) {
        IntegrationDefinition integration = requireIntegration(integrationName);
        ConnectionDefinition definition = integration.requireConnection(connectionName);
        if (!definition.getType().isOAuth()) {
            throw new ConfigurationException("Connection '" + connectionName + "' is not an OAuth connection.");
        }
        CallDefinition authorize = definition.getAuthorize();
        if (authorize == null || authorize.getUrl() == null) {
            throw new ConfigurationException("OAuth connection '" + connectionName + "' has no authorize url.");
        }
        JsonNode resolved = withDefaults(definition, parameters);
        String state = randomToken();
        String verifier = definition.getType() == ConnectionType.OAUTH_PKCE ? randomToken() : null;

        ObjectNode oauth = oauthVariables(definition, redirectUri, state, verifier, null);
        Scope scope = Scope.of(integration.appContext())
                .with(Scope.PARAMETERS, resolved)
                .with(Scope.CONNECTION, resolved)
                .with(Scope.OAUTH, oauth);

        UriComponentsBuilder url = UriComponentsBuilder.fromUriString(requestExecutor.resolveUrl(authorize.getUrl(), integration, scope));
        JsonNode qs = evaluator.evaluate(authorize.getQs(), scope);
        if (qs.isObject()) {
            qs.fields().forEachRemaining(param -> {
                if (!ValueCoercion.isNull(param.getValue())) {
                    url.queryParam(param.getKey(), ValueCoercion.toText(param.getValue()));
                }
            });
        }
        if (!qs.has("state")) {
            url.queryParam("state", state);
        }
        if (verifier != null && !qs.has("code_challenge")) {
            url.queryParam("code_challenge", oauth.get("codeChallenge").asText());
            url.queryParam("code_challenge_method", "S256");
        }

        evictExpiredAuthorizations();
        pending.put(state, new PendingAuthorization(integrationName, connectionName, resolved, redirectUri, verifier, clock.instant()));
        log.info("Started OAuth authorization for connection '{}' of integration '{}'", connectionName, integrationName);
        return new AuthorizationRequest(state, url.encode().build().toUriString());
    }

    @Override
    public ConnectionInstance exchange(String state, String code) {
        PendingAuthorization authorization = state == null ? null : pending.remove(state);
        if (authorization == null) {
            throw new AuthException(0, "Unknown or already used authorization state; restart the connection flow.");
        }
        if (isExpired(authorization)) {
            throw new AuthException(0, "Authorization state expired after " + authorizationTtl + "; restart the connection flow.");
        }
        IntegrationDefinition integration = requireIntegration(authorization.integration());
        ConnectionDefinition definition = integration.requireConnection(authorization.connection());
        if (definition.getToken() == null) {
            throw new ConfigurationException("OAuth connection '" + authorization.connection() + "' has no token Call.");
        }

        ConnectionInstance instance = ConnectionInstance.builder()
                .id(UUID.randomUUID().toString())
                .integration(authorization.integration())
                .connection(authorization.connection())
                .type(definition.getType())
                .parameters(authorization.parameters())
                .data(ConnectionData.empty())
                .createdAt(clock.instant())
                .build();

        Scope scope = authScope(integration, instance,
                oauthVariables(definition, authorization.redirectUri(), state, authorization.codeVerifier(), code));
        try {
            RawResponse response = requestExecutor.execute(definition.getToken(), integration, scope);
            instance = instance.toBuilder().data(mapData(definition.getToken(), scope, response, ConnectionData.empty())).build();
        } catch (RequestException e) {
            throw asAuthFailure("Authorization code exchange failed", e);
        }
        if (definition.getInfo() != null) {
            try {
                requestExecutor.execute(definition.getInfo(), integration, authScope(integration, instance, null));
            } catch (RequestException e) {
                throw asAuthFailure("Connection validation failed", e);
            }
        }
        stateService.saveConnection(instance);
        log.info("Created {} connection '{}' for integration '{}'", definition.getType().getValue(), instance.getId(), authorization.integration());
        return instance;
    }

    private void evictExpiredAuthorizations() {
        if (pending.values().removeIf(this::isExpired)) {
            log.debug("Evicted abandoned OAuth authorizations older than {}", authorizationTtl);
        }
    }

    private boolean isExpired(PendingAuthorization authorization) {
        return !clock.instant().isBefore(authorization.createdAt().plus(authorizationTtl));
    }

    @Override
    public ConnectionInstance ensureFresh(String connectionId) {
        ConnectionInstance instance = requireInstance(connectionId);
        if (credentialState(instance) == CredentialState.VALID) {
            return instance;
        }
        ReentrantLock lock = locks.computeIfAbsent(connectionId, id -> new ReentrantLock());
        lock.lock();
        try {
            ConnectionInstance current = requireInstance(connectionId);
            if (!needsRefresh(current)) {
                return current;
            }
            return refresh(current);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public CredentialState credentialState(ConnectionInstance instance) {
        ReentrantLock lock = locks.get(instance.getId());
        if (lock != null && lock.isLocked()) {
            return CredentialState.REFRESHING;
        }
        Instant expires = instance.getData() == null ? null : instance.getData().expires();
        if (expires == null) {
            return CredentialState.VALID;
        }
        Instant now = clock.instant();
        if (now.plus(refreshSkew).isBefore(expires)) {
            return CredentialState.VALID;
        }
        return now.isBefore(expires) ? CredentialState.NEAR_EXPIRY : CredentialState.EXPIRED;
    }

    @Override
    public void disconnect(String connectionId) {
        ConnectionInstance instance = requireInstance(connectionId);
        IntegrationDefinition integration = stateService.getDefinition(instance.getIntegration());
        ConnectionDefinition definition = integration == null ? null : integration.getConnections().get(instance.getConnection());
        if (definition != null && definition.getInvalidate() != null) {
            try {
                requestExecutor.execute(definition.getInvalidate(), integration, authScope(integration, instance, null));
            } catch (RequestException e) {
                log.warn("Invalidating connection '{}' failed, deleting it anyway: {}", connectionId, e.getMessage());
            }
        }
        stateService.deleteConnection(connectionId);
        locks.remove(connectionId);
        log.info("Disconnected connection '{}'", connectionId);
    }

    @Override
    public Scope bind(Scope scope, ConnectionInstance instance) {
        return scope.with(Scope.CONNECTION, connectionVariables(instance));
    }

    // ---------------------------------------------------------------- refresh

    private boolean needsRefresh(ConnectionInstance instance) {
        Instant expires = instance.getData() == null ? null : instance.getData().expires();
        return expires != null && !clock.instant().plus(refreshSkew).isBefore(expires);
    }

    private ConnectionInstance refresh(ConnectionInstance instance) {
        IntegrationDefinition integration = requireIntegration(instance.getIntegration());
        ConnectionDefinition definition = integration.requireConnection(instance.getConnection());
        CallDefinition refresh = definition.getRefresh();
        Scope scope = authScope(integration, instance, oauthVariables(definition, null, null, null, null));
        boolean expired = !clock.instant().isBefore(instance.getData().expires());

        if (refresh == null || !evaluator.evaluateCondition(refresh.getCondition(), scope, true)) {
            if (expired) {
                throw new AuthException(0, "The access token of connection '" + instance.getId()
                        + "' expired and cannot be refreshed; reconnect required.");
            }
            return instance;
        }

        log.info("Refreshing credentials of connection '{}'", instance.getId());
        ConnectionData refreshed;
        try {
            RawResponse response = requestExecutor.execute(refresh, integration, scope);
            refreshed = mapData(refresh, scope, response, instance.getData());
        } catch (RequestException e) {
            if (e.isRetryable()) {
                throw e;
            }
            throw new AuthException("Refreshing connection '" + instance.getId() + "' failed; reconnect required. " + e.getMessage(), e);
        }
        ConnectionInstance updated = instance.toBuilder().data(refreshed).refreshedAt(clock.instant()).build();
        stateService.saveConnection(updated);
        return updated;
    }

    /**
     * Maps tokens from an auth Call's response. A declared {@code response.data} mapping wins; otherwise the
     * standard OAuth fields {@code access_token}, {@code refresh_token} and {@code expires_in} are read.
     * Values missing from the response fall back to {@code previous}.
     */
    private ConnectionData mapData(CallDefinition call, Scope scope, RawResponse response, ConnectionData previous) {
        Scope responseScope = requestExecutor.responseScope(scope, response);
        JsonNode body = ValueCoercion.nullToNode(response.body());
        String accessToken;
        String refreshToken;
        Instant expires;
        JsonNode extra = previous.extra();

        if (call.getResponse() != null && call.getResponse().getData() != null) {
            JsonNode data = evaluator.evaluate(call.getResponse().getData(), responseScope);
            accessToken = ValueCoercion.toTextOrNull(data.get("accessToken"));
            refreshToken = ValueCoercion.toTextOrNull(data.get("refreshToken"));
            expires = toExpiry(data.get("expires"));
            if (data.isObject()) {
                ObjectNode rest = ((ObjectNode) data).deepCopy();
                rest.remove(List.of("accessToken", "refreshToken", "expires"));
                ObjectNode merged = extra != null && extra.isObject() ? ((ObjectNode) extra).deepCopy() : NODES.objectNode();
                merged.setAll(rest);
                extra = merged;
            }
        } else {
            accessToken = ValueCoercion.toTextOrNull(body.get("access_token"));
            refreshToken = ValueCoercion.toTextOrNull(body.get("refresh_token"));
            BigDecimal expiresIn = ValueCoercion.toNumber(body.get("expires_in"));
            expires = expiresIn == null ? null : clock.instant().plusSeconds(expiresIn.longValue());
        }

        return new ConnectionData(
                accessToken != null ? accessToken : previous.accessToken(),
                refreshToken != null ? refreshToken : previous.refreshToken(),
                expires != null ? expires : accessToken != null ? null : previous.expires(),
                extra);
    }

    private Instant toExpiry(JsonNode value) {
        if (ValueCoercion.isNull(value)) {
            return null;
        }
        Instant instant = ValueCoercion.toInstant(value);
        if (instant == null) {
            throw new ConfigurationException("Connection data 'expires' must be a date but was '" + ValueCoercion.toText(value) + "'.");
        }
        return instant;
    }

    // ---------------------------------------------------------------- scopes

    private Scope authScope(IntegrationDefinition integration, ConnectionInstance instance, ObjectNode oauth) {
        Scope scope = Scope.of(integration.appContext())
                .with(Scope.PARAMETERS, ValueCoercion.nullToNode(instance.getParameters()))
                .with(Scope.DATA, dataVariables(instance.getData()));
        scope = bind(scope, instance);
        return oauth == null ? scope : scope.with(Scope.OAUTH, oauth);
    }

    private static ObjectNode connectionVariables(ConnectionInstance instance) {
        ObjectNode variables = NODES.objectNode();
        if (instance.getParameters() != null && instance.getParameters().isObject()) {
            variables.setAll((ObjectNode) instance.getParameters());
        }
        variables.setAll(dataVariables(instance.getData()));
        return variables;
    }

    private static ObjectNode dataVariables(ConnectionData data) {
        ObjectNode variables = NODES.objectNode();
        if (data == null) {
            return variables;
        }
        if (data.extra() != null && data.extra().isObject()) {
            variables.setAll((ObjectNode) data.extra());
        }
        if (data.accessToken() != null) {
            variables.put("accessToken", data.accessToken());
        }
        if (data.refreshToken() != null) {
            variables.put("refreshToken", data.refreshToken());
        }
        if (data.expires() != null) {
            variables.put("expires", data.expires().toString());
        }
        return variables;
    }

    private ObjectNode oauthVariables(ConnectionDefinition definition, String redirectUri, String state, String verifier, String code) {
        ObjectNode oauth = NODES.objectNode();
        oauth.put("scope", String.join(" ", definition.getScope()));
        oauth.set("scopes", NODES.arrayNode().addAll(definition.getScope().stream().map(NODES::textNode).toList()));
        putIfPresent(oauth, "redirectUri", redirectUri);
        putIfPresent(oauth, "state", state);
        putIfPresent(oauth, "code", code);
        if (verifier != null) {
            oauth.put("codeVerifier", verifier);
            oauth.put("codeChallenge", challenge(verifier));
            oauth.put("codeChallengeMethod", "S256");
        }
        return oauth;
    }

    private static void putIfPresent(ObjectNode node, String name, String value) {
        if (value != null) {
            node.put(name, value);
        }
    }

    // ---------------------------------------------------------------- helpers

    private JsonNode withDefaults(ConnectionDefinition definition, JsonNode parameters) {
        ObjectNode resolved = parameters != null && parameters.isObject() ? ((ObjectNode) parameters).deepCopy() : NODES.objectNode();
        for (ParameterSpec spec : definition.getParameters()) {
            if (ValueCoercion.isEmpty(resolved.get(spec.getName())) && spec.getDefaultValue() != null) {
                resolved.set(spec.getName(), spec.getDefaultValue());
            }
            if (spec.isRequired() && ValueCoercion.isEmpty(resolved.get(spec.getName()))) {
                throw new ValidationException(0, "Missing required connection parameter '" + spec.getName() + "'.");
            }
        }
        return resolved;
    }

    private static AuthException asAuthFailure(String prefix, RequestException e) {
        if (e.getKind() == ErrorKind.AUTH && e instanceof AuthException auth) {
            return auth;
        }
        return new AuthException(e.getStatusCode(), prefix + ": " + e.toEnvelope());
    }

    private IntegrationDefinition requireIntegration(String name) {
        IntegrationDefinition integration = stateService.getDefinition(name);
        if (integration == null) {
            throw new ConfigurationException("No integration named '" + name + "' is loaded.");
        }
        return integration;
    }

    private ConnectionInstance requireInstance(String connectionId) {
        ConnectionInstance instance = stateService.getConnection(connectionId);
        if (instance == null) {
            throw new AuthException(0, "Connection '" + connectionId + "' does not exist; reconnect required.");
        }
        return instance;
    }

    static String randomToken() {
        byte[] bytes = new byte[32];
        RANDOM.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    static String challenge(String verifier) {
        try {
            byte[] hash = MessageDigest.getInstance("SHA-256").digest(verifier.getBytes(StandardCharsets.US_ASCII));
            return Base64.getUrlEncoder().withoutPadding().encodeToString(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }
}
