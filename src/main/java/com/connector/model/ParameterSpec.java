package com.connector.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Data;

/**
 * A single user-facing parameter of a connection, module, RPC or webhook.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ParameterSpec {

    private String name;

    /**
     * Free-form type hint for the consuming UI (text, number, select, ...).
     */
    private String type;

    private String label;

    private boolean required;

    /**
     * Value applied when the user omits the parameter.
     */
    @JsonProperty("default")
    private JsonNode defaultValue;

    /**
     * Name of the RPC that supplies this parameter's options, if any.
     */
    private String options;
}
