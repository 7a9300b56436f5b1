package com.connector.cli;

import com.connector.dto.request.LoadDefinitionRequest;
import com.connector.dto.response.CommandResponse;
import com.connector.exception.ConnectorException;
import com.connector.model.IntegrationDefinition;
import com.connector.service.api.DefinitionLoader;
import java.nio.file.Path;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

/**
 * Loads integration definitions into the running runtime.
 */
@ShellComponent
public class LoadCommand {

    private final DefinitionLoader definitionLoader;

    public LoadCommand(DefinitionLoader definitionLoader) {
        this.definitionLoader = definitionLoader;
    }

    /**
     * Reads, validates and registers an integration definition file, replacing a previously loaded integration
     * of the same name.
     *
     * @param source The path of the JSON definition.
     * @param alias  Optional name to register the integration under.
     * @return A colored confirmation or error message.
     */
    @ShellMethod(key = "load", value = "Loads an integration definition from a JSON file.")
    public String load(
            @ShellOption(help = "The path of the integration definition (JSON).") String source,
            @ShellOption(value = {"--alias", "-a"}, help = "Register the integration under this name.", defaultValue = ShellOption.NULL) String alias
    ) {
        var request = new LoadDefinitionRequest(alias, source);
        CommandResponse response;
        try {
            IntegrationDefinition definition = definitionLoader.load(Path.of(request.source()), request.alias());
            response = new CommandResponse(true, "Loaded integration '" + definition.getName() + "' with "
                    + definition.getModules().size() + " module(s).");
        } catch (ConnectorException | IllegalArgumentException e) {
            response = CommandResponse.failure("Failed to load integration:", e);
        }
        return response.toAnsiString();
    }
}
