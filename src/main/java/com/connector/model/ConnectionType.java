package com.connector.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ConnectionType {
    APIKEY("apikey"),
    BASIC("basic"),
    OAUTH("oauth"),
    OAUTH_PKCE("oauth-pkce"),
    CUSTOM("custom");

    private final String value;

    ConnectionType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isOAuth() {
        return this == OAUTH || this == OAUTH_PKCE;
    }

    @JsonCreator
    public static ConnectionType fromValue(String value) {
        for (ConnectionType type : values()) {
            if (type.value.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown connection type: " + value);
    }
}
