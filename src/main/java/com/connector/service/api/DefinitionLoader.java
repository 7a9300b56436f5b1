package com.connector.service.api;

import com.connector.model.IntegrationDefinition;
import java.nio.file.Path;

public interface DefinitionLoader {

    /**
     * Loads, validates and registers an integration definition from a JSON file, replacing any integration
     * loaded under the same name. Its user functions are compiled and registered as well.
     *
     * @param file  The JSON definition file.
     * @param alias The name to register the integration under; the definition's own {@code name} (or the file
     *              name) is used when {@code null}.
     * @return The registered definition.
     * @throws com.connector.exception.ConfigurationException if the file cannot be read or the definition is invalid.
     */
    IntegrationDefinition load(Path file, String alias);

    /**
     * Validates and registers an already parsed definition.
     */
    IntegrationDefinition register(IntegrationDefinition definition);
}
