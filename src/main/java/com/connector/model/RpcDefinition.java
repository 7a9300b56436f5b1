package com.connector.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;

/**
 * An out-of-band Call populating configuration-time option lists. Its output mapping should produce
 * {@code {label, value}} objects, optionally with nested {@code options} for grouping.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class RpcDefinition {

    private String label;

    private String connection;

    @JsonAlias("communication")
    @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
    private List<CallDefinition> calls = new ArrayList<>();

    /**
     * Declares that this RPC can only be resolved once the parent's chosen value is known.
     */
    private NestedDependency nested;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class NestedDependency {

        /**
         * The user parameter holding the parent's chosen value.
         */
        private String parameter;

        /**
         * The RPC supplying the parent's options (informational for the consuming UI).
         */
        private String parent;
    }
}
