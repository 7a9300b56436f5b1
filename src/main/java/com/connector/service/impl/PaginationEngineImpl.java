package com.connector.service.impl;

import com.connector.config.RuntimeProperties;
import com.connector.exception.ConfigurationException;
import com.connector.exception.ProviderException;
import com.connector.expression.Scope;
import com.connector.expression.ValueCoercion;
import com.connector.model.CallDefinition;
import com.connector.model.IntegrationDefinition;
import com.connector.model.PaginationDefinition;
import com.connector.model.PreparedRequest;
import com.connector.model.RawResponse;
import com.connector.model.ResultItem;
import com.connector.service.api.ExpressionEvaluator;
import com.connector.service.api.PaginationEngine;
import com.connector.service.api.RequestExecutor;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Page loop over the {@link RequestExecutor}.
 * <p>
 * Templates see {@code pagination.page} (1-based number of the page being requested) and
 * {@code pagination.count} (items yielded so far). The pagination url, qs, headers and body are evaluated
 * against the previous page's response; their evaluated form is the cursor, and a cursor equal to the
 * previous one aborts the loop. The page cap and wall-clock timeout apply regardless of the declared limit.
 */
@Service
@Slf4j
public class PaginationEngineImpl implements PaginationEngine {

    private final RequestExecutor requestExecutor;
    private final ExpressionEvaluator evaluator;
    private final Clock clock;
    private final int maxPages;
    private final Duration timeout;

    public PaginationEngineImpl(RequestExecutor requestExecutor, ExpressionEvaluator evaluator, Clock clock,
                                RuntimeProperties properties) {
        this.requestExecutor = requestExecutor;
        this.evaluator = evaluator;
        this.clock = clock;
        this.maxPages = properties.getPagination().getMaxPages();
        this.timeout = properties.getPagination().getTimeout();
    }

    @Override
    public Iterator<ResultItem> iterate(CallDefinition call, IntegrationDefinition integration, Scope scope, Long limit) {
        if (limit != null && limit <= 0) {
            return Collections.emptyIterator();
        }
        return new PagedItemIterator(call, integration, scope, limit);
    }

    private final class PagedItemIterator implements Iterator<ResultItem> {

        private final CallDefinition call;
        private final IntegrationDefinition integration;
        private final Scope scope;
        private final Long limit;
        private final Deque<ResultItem> buffer = new ArrayDeque<>();
        private final Instant deadline;

        private PreparedRequest nextRequest;
        private String lastCursor;
        private int pagesFetched;
        private long yielded;
        private boolean exhausted;

        private PagedItemIterator(CallDefinition call, IntegrationDefinition integration, Scope scope, Long limit) {
            this.call = call;
            this.integration = integration;
            this.scope = scope;
            this.limit = limit;
            this.deadline = clock.instant().plus(timeout);
        }

        @Override
        public boolean hasNext() {
            while (true) {
                if (limit != null && yielded >= limit) {
                    return false;
                }
                if (!buffer.isEmpty()) {
                    return true;
                }
                if (exhausted) {
                    return false;
                }
                fetchPage();
            }
        }

        @Override
        public ResultItem next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            yielded++;
            return buffer.removeFirst();
        }

        private Scope pageScope() {
            ObjectNode pagination = JsonNodeFactory.instance.objectNode();
            pagination.put("page", pagesFetched + 1);
            pagination.put("count", yielded + buffer.size());
            return scope.with(Scope.PAGINATION, pagination);
        }

        private void fetchPage() {
            if (pagesFetched >= maxPages) {
                log.warn("Stopping pagination of '{}' after the maximum of {} pages", integration.getName(), maxPages);
                exhausted = true;
                return;
            }
            if (clock.instant().isAfter(deadline)) {
                throw new ProviderException(0, "Pagination of '" + integration.getName() + "' exceeded its timeout of " + timeout);
            }

            Scope requestScope = pageScope();
            PreparedRequest request = nextRequest != null ? nextRequest : requestExecutor.prepare(call, integration, requestScope);
            RawResponse response = requestExecutor.send(request, integration);
            Scope responseScope = requestExecutor.responseScope(requestScope, response);
            requestExecutor.verify(call, integration, responseScope, response);
            List<ResultItem> items = requestExecutor.extract(call, responseScope);
            buffer.addAll(items);
            pagesFetched++;
            log.debug("Fetched page {} of '{}' with {} item(s)", pagesFetched, integration.getName(), items.size());

            PaginationDefinition pagination = call.getPagination();
            if (pagination == null) {
                exhausted = true;
                return;
            }
            Scope nextScope = requestExecutor.responseScope(pageScope(), response);
            if (!evaluator.evaluateCondition(pagination.getCondition(), nextScope, !items.isEmpty())) {
                exhausted = true;
                return;
            }
            advance(pagination, request, nextScope);
        }

        private void advance(PaginationDefinition pagination, PreparedRequest current, Scope nextScope) {
            ObjectNode cursor = JsonNodeFactory.instance.objectNode();
            String url = pagination.getUrl() == null ? null : evaluator.evaluateText(pagination.getUrl(), nextScope);
            JsonNode qs = evaluator.evaluate(pagination.getQs(), nextScope);
            JsonNode headers = evaluator.evaluate(pagination.getHeaders(), nextScope);
            JsonNode body = evaluator.evaluate(pagination.getBody(), nextScope);
            cursor.put("url", url);
            cursor.set("qs", qs);
            cursor.set("headers", headers);
            cursor.set("body", body);

            String serialized = ValueCoercion.canonicalJson(cursor);
            if (serialized.equals(lastCursor)) {
                throw new ConfigurationException("Pagination of '" + integration.getName()
                        + "' did not advance: the next page would repeat cursor " + serialized);
            }
            lastCursor = serialized;

            PreparedRequest next = current;
            if (url != null && !url.isBlank()) {
                next = next.withUrl(requestExecutor.resolveUrl(url, integration, nextScope));
                if (next.url().contains("?")) {
                    // the provider's next-page link already carries the query
                    next = next.withQs(JsonNodeFactory.instance.objectNode());
                }
            }
            if (qs.isObject()) {
                next = next.withQs(combine(next.qs(), (ObjectNode) qs, pagination.isMergeWithParent()));
            }
            if (headers.isObject()) {
                next = next.withHeaders(combine(next.headers(), (ObjectNode) headers, pagination.isMergeWithParent()));
            }
            if (body.isObject()) {
                ObjectNode parent = next.body() != null && next.body().isObject() ? (ObjectNode) next.body() : JsonNodeFactory.instance.objectNode();
                next = next.withBody(combine(parent, (ObjectNode) body, pagination.isMergeWithParent()));
            } else if (!ValueCoercion.isNull(body)) {
                next = next.withBody(body);
            }
            nextRequest = next;
        }

        private ObjectNode combine(ObjectNode parent, ObjectNode overrides, boolean merge) {
            ObjectNode result = merge ? parent.deepCopy() : JsonNodeFactory.instance.objectNode();
            result.setAll(overrides);
            return result;
        }
    }
}
