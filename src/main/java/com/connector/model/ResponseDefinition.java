package com.connector.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Data;

/**
 * Rules applied to a Call's response.
 * <p>
 * Lombok's {@code @Data} annotation generates standard boilerplate code.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ResponseDefinition {

    /**
     * Output mapping, evaluated once per item when {@link #iterate} is set, otherwise once per response.
     * Defaults to the item (or the body).
     */
    private JsonNode output;

    /**
     * Either a template resolving to the item container (e.g. {@code "{{body.data}}"}) or an object
     * {@code {"container": ..., "condition": ...}} that additionally filters items.
     */
    private JsonNode iterate;

    /**
     * Maximum number of items to return; usually {@code "{{parameters.limit}}"}.
     */
    private JsonNode limit;

    /**
     * Values merged into the {@code temp} accumulator after the Call succeeds.
     */
    private JsonNode temp;

    /**
     * Connection data mapping for auth Calls (accessToken, refreshToken, expires, ...).
     */
    private JsonNode data;

    /**
     * Soft-error check: a template, or {@code {"condition": ..., "message": ..., "type": ...}}.
     */
    private JsonNode valid;

    private ErrorDefinition error;

    private TriggerDefinition trigger;
}
