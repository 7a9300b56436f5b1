package com.connector.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;

/**
 * A user-supplied function callable from templates by name.
 * <p>
 * The {@code body} is a constrained Spring expression; each declared parameter is bound as a variable, so a
 * function {@code fullName(first, last)} may have the body {@code #first + ' ' + #last}.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class FunctionDefinition {

    private String name;

    private List<String> parameters = new ArrayList<>();

    private String body;

    /**
     * Per-call time budget; the runtime default applies when {@code null}.
     */
    private Long timeoutMillis;
}
