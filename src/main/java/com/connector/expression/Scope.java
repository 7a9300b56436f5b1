package com.connector.expression;

import com.connector.model.AppContext;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The immutable set of named variables an expression is evaluated against.
 * <p>
 * Well-known names are {@code parameters}, {@code connection}, {@code common}, {@code body}, {@code headers},
 * {@code statusCode}, {@code item}, {@code temp}, {@code data}, {@code pagination}, {@code oauth},
 * {@code webhook} and {@code query}. Every {@code with*} method returns a new scope; the receiver is never
 * changed, so a scope can be shared between threads and between the steps of a multi-step module.
 */
public final class Scope {

    public static final String PARAMETERS = "parameters";
    public static final String CONNECTION = "connection";
    public static final String COMMON = "common";
    public static final String BODY = "body";
    public static final String HEADERS = "headers";
    public static final String STATUS_CODE = "statusCode";
    public static final String ITEM = "item";
    public static final String TEMP = "temp";
    public static final String DATA = "data";
    public static final String PAGINATION = "pagination";
    public static final String OAUTH = "oauth";
    public static final String WEBHOOK = "webhook";
    public static final String QUERY = "query";

    private final AppContext appContext;
    private final Map<String, JsonNode> bindings;

    private Scope(AppContext appContext, Map<String, JsonNode> bindings) {
        this.appContext = appContext;
        this.bindings = Collections.unmodifiableMap(bindings);
    }

    public static Scope of(AppContext appContext) {
        Map<String, JsonNode> bindings = new LinkedHashMap<>();
        if (appContext.common() != null) {
            bindings.put(COMMON, appContext.common());
        }
        return new Scope(appContext, bindings);
    }

    public Scope with(String name, JsonNode value) {
        Map<String, JsonNode> copy = new LinkedHashMap<>(bindings);
        if (value == null) {
            copy.remove(name);
        } else {
            copy.put(name, value);
        }
        return new Scope(appContext, copy);
    }

    public Scope withAll(Map<String, JsonNode> values) {
        Map<String, JsonNode> copy = new LinkedHashMap<>(bindings);
        values.forEach((name, value) -> {
            if (value == null) {
                copy.remove(name);
            } else {
                copy.put(name, value);
            }
        });
        return new Scope(appContext, copy);
    }

    /**
     * Drops the per-response variables so a scope can be reused for the next request.
     */
    public Scope withoutResponse() {
        Map<String, JsonNode> copy = new LinkedHashMap<>(bindings);
        copy.remove(BODY);
        copy.remove(HEADERS);
        copy.remove(STATUS_CODE);
        copy.remove(ITEM);
        return new Scope(appContext, copy);
    }

    public boolean contains(String name) {
        return bindings.containsKey(name);
    }

    /**
     * @return the bound value, or {@code null} when the name is not bound.
     */
    public JsonNode get(String name) {
        return bindings.get(name);
    }

    public AppContext getAppContext() {
        return appContext;
    }

    public String getIntegration() {
        return appContext.integration();
    }
}
