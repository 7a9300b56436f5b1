package com.connector.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum BodyType {
    JSON("json"),
    URLENCODED("urlencoded"),
    TEXT("text");

    private final String value;

    BodyType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static BodyType fromValue(String value) {
        if (value == null) {
            return JSON;
        }
        for (BodyType type : values()) {
            if (type.value.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        if ("string".equalsIgnoreCase(value)) {
            return TEXT;
        }
        throw new IllegalArgumentException("Unknown body type: " + value);
    }
}
