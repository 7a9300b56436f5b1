package com.connector.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class TriggerDefinition {

    /**
     * Unique item id, e.g. {@code "{{item.id}}"}.
     */
    private JsonNode id;

    /**
     * Ordering value, e.g. {@code "{{item.created_at}}"}. When absent the id is used for ordering.
     */
    private JsonNode date;

    private TriggerOrder order = TriggerOrder.ASC;
}
