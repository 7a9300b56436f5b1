package com.connector.service.api;

import com.connector.expression.Scope;
import com.connector.model.CallDefinition;
import com.connector.model.IntegrationDefinition;
import com.connector.model.PreparedRequest;
import com.connector.model.RawResponse;
import com.connector.model.ResultItem;
import com.fasterxml.jackson.databind.node.IntNode;
import java.util.List;

/**
 * Turns a single templated Call into an HTTP exchange and interprets the provider's answer.
 */
public interface RequestExecutor {

    /**
     * Evaluates the Call's url, method, headers, qs and body and merges them over the integration's base
     * settings.
     *
     * @throws com.connector.exception.ConfigurationException if the url or method cannot be resolved.
     */
    PreparedRequest prepare(CallDefinition call, IntegrationDefinition integration, Scope scope);

    /**
     * Sends a prepared request. Transport failures surface as {@link com.connector.exception.ProviderException}
     * with status code {@code 0}; HTTP error statuses are returned, not thrown.
     */
    RawResponse send(PreparedRequest request, IntegrationDefinition integration);

    /**
     * Fails the Call unless the status is 2xx and the {@code valid} rule passes.
     *
     * @param responseScope The scope returned by {@link #responseScope(Scope, RawResponse)}.
     * @throws com.connector.exception.RequestException carrying the resolved message and error kind.
     */
    void verify(CallDefinition call, IntegrationDefinition integration, Scope responseScope, RawResponse response);

    /**
     * Applies {@code response.iterate} and {@code response.output}.
     */
    List<ResultItem> extract(CallDefinition call, Scope responseScope);

    /**
     * Resolves a URL against the integration's base URL; absolute URLs are returned unchanged.
     */
    String resolveUrl(String url, IntegrationDefinition integration, Scope scope);

    /**
     * Prepares, sends and verifies a Call.
     *
     * @return The successful response.
     */
    RawResponse execute(CallDefinition call, IntegrationDefinition integration, Scope scope);

    default Scope responseScope(Scope scope, RawResponse response) {
        return scope.withoutResponse()
                .with(Scope.BODY, response.body())
                .with(Scope.HEADERS, response.headers())
                .with(Scope.STATUS_CODE, IntNode.valueOf(response.statusCode()));
    }
}
