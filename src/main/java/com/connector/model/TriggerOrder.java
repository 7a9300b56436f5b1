package com.connector.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The order in which a polling trigger's provider returns items.
 */
public enum TriggerOrder {
    ASC,
    DESC,
    UNORDERED;

    @JsonValue
    public String getValue() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static TriggerOrder fromValue(String value) {
        if (value == null || value.isBlank()) {
            return ASC;
        }
        return TriggerOrder.valueOf(value.trim().toUpperCase());
    }
}
