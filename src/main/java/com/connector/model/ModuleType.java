package com.connector.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ModuleType {
    ACTION,
    SEARCH,
    TRIGGER,
    INSTANT_TRIGGER;

    @JsonValue
    public String getValue() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static ModuleType fromValue(String value) {
        if (value == null || value.isBlank()) {
            return ACTION;
        }
        return ModuleType.valueOf(value.trim().toUpperCase().replace('-', '_'));
    }
}
