package com.connector.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;

/**
 * A user-facing action, search or trigger, composed of one or more {@link CallDefinition} steps.
 * <p>
 * Lombok's {@code @Data} annotation generates standard boilerplate code.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ModuleDefinition {

    private String label;

    private ModuleType type = ModuleType.ACTION;

    /**
     * Name of the {@link ConnectionDefinition} this module authenticates with; {@code null} for public APIs.
     */
    private String connection;

    private List<ParameterSpec> parameters = new ArrayList<>();

    /**
     * The ordered Call steps. A single JSON object is accepted as a one-step module.
     */
    @JsonAlias("communication")
    @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
    private List<CallDefinition> calls = new ArrayList<>();

    /**
     * Optional bootstrap Call for polling triggers; when absent the regular calls are used.
     */
    private CallDefinition epoch;

    /**
     * For instant triggers, the webhook whose bundles this module consumes.
     */
    private String webhook;
}
