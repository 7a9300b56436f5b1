package com.connector.dto.request;

/**
 * @param alias  The name to register the integration under, or {@code null} to use the definition's own name.
 * @param source The path of the JSON definition file.
 */
public record LoadDefinitionRequest(String alias, String source) {
}
