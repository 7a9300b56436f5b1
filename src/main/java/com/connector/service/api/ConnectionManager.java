package com.connector.service.api;

import com.connector.dto.response.AuthorizationRequest;
import com.connector.expression.Scope;
import com.connector.model.ConnectionInstance;
import com.connector.model.CredentialState;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Creates, validates, refreshes and removes authenticated connections.
 */
public interface ConnectionManager {

    /**
     * Validates user-supplied credentials of a non-OAuth connection and stores the resulting instance.
     * Required parameters are checked before any network call; the connection's {@code info} Call, when
     * declared, must succeed.
     *
     * @param integration    The integration name.
     * @param connectionName The connection definition name.
     * @param parameters     The user's connection parameters.
     * @return The stored connection instance.
     * @throws com.connector.exception.ValidationException if a required parameter is missing.
     * @throws com.connector.exception.AuthException       if the provider rejects the credentials.
     */
    ConnectionInstance validate(String integration, String connectionName, JsonNode parameters);

    /**
     * Starts an OAuth flow. For {@code oauth-pkce} connections a code verifier is generated and kept with the
     * pending authorization; its S256 challenge is added to the URL.
     *
     * @param redirectUri The redirect URI registered with the provider, exposed as {@code oauth.redirectUri}.
     */
    AuthorizationRequest authorize(String integration, String connectionName, JsonNode parameters, String redirectUri);

    /**
     * Completes an OAuth flow by exchanging the authorization code for tokens.
     *
     * @param state The state value returned by {@link #authorize}.
     * @param code  The authorization code the provider redirected back with.
     * @return The stored connection instance.
     * @throws com.connector.exception.AuthException if the state is unknown or the exchange fails.
     */
    ConnectionInstance exchange(String state, String code);

    /**
     * Returns the connection with credentials that are valid for at least the configured skew, refreshing
     * them first when needed. Concurrent callers for the same connection are serialized, so at most one
     * refresh happens.
     *
     * @throws com.connector.exception.AuthException if the credentials expired and cannot be refreshed.
     */
    ConnectionInstance ensureFresh(String connectionId);

    CredentialState credentialState(ConnectionInstance instance);

    /**
     * Runs the connection's {@code invalidate} Call, if any, and deletes the instance.
     */
    void disconnect(String connectionId);

    /**
     * Binds a connection into a scope as {@code connection}: the user's connection parameters merged with the
     * credential data ({@code accessToken}, {@code refreshToken}, {@code expires} and any extra mapped values).
     */
    Scope bind(Scope scope, ConnectionInstance instance);
}
