package com.connector.cli;

import static com.connector.cli.JsonPrinter.ANSI_CYAN;
import static com.connector.cli.JsonPrinter.ANSI_GREEN;
import static com.connector.cli.JsonPrinter.ANSI_PURPLE;
import static com.connector.cli.JsonPrinter.ANSI_RESET;
import static com.connector.cli.JsonPrinter.ANSI_YELLOW;

import com.connector.dto.response.CommandResponse;
import com.connector.model.IntegrationDefinition;
import com.connector.model.ModuleDefinition;
import com.connector.model.ParameterSpec;
import com.connector.service.api.StateService;
import java.util.List;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

/**
 * Shows what a loaded integration offers.
 */
@ShellComponent
public class DetailsCommand {

    private final StateService stateService;

    public DetailsCommand(StateService stateService) {
        this.stateService = stateService;
    }

    /**
     * Lists the connections, modules, RPCs and webhooks of an integration, or the parameters of one module.
     *
     * @param alias    The integration name.
     * @param moduleId Optional module to describe.
     */
    @ShellMethod(key = "details", value = "Show the modules, RPCs, webhooks and connections of a loaded integration.")
    public String details(
            @ShellOption(help = "The integration name.") String alias,
            @ShellOption(value = {"--module", "-m"}, help = "A module to describe.", defaultValue = ShellOption.NULL) String moduleId
    ) {
        IntegrationDefinition definition = stateService.getDefinition(alias);
        if (definition == null) {
            return new CommandResponse(false, "No integration named '" + alias + "'. Use the 'load' command first.").toAnsiString();
        }
        StringBuilder out = new StringBuilder();
        if (moduleId != null) {
            ModuleDefinition module = definition.getModules().get(moduleId);
            if (module == null) {
                return new CommandResponse(false, "Module '" + moduleId + "' not found in integration '" + alias + "'.").toAnsiString();
            }
            out.append(ANSI_CYAN).append("Module: ").append(ANSI_YELLOW).append(moduleId).append(ANSI_RESET).append("\n");
            describeModule(moduleId, module, out);
            return out.toString();
        }

        out.append(ANSI_CYAN).append("Integration: ").append(ANSI_YELLOW).append(alias).append(ANSI_RESET).append("\n");
        out.append(ANSI_CYAN).append("Connections:").append(ANSI_RESET).append("\n");
        definition.getConnections().forEach((name, connection) ->
                out.append("  - ").append(name).append(" (").append(connection.getType().getValue()).append(")\n"));
        out.append(ANSI_CYAN).append("Modules:").append(ANSI_RESET).append("\n");
        definition.getModules().forEach((name, module) -> describeModule(name, module, out));
        out.append(ANSI_CYAN).append("RPCs:").append(ANSI_RESET).append("\n");
        definition.getRpcs().forEach((name, rpc) -> {
            out.append("  - ").append(name);
            if (rpc.getNested() != null && rpc.getNested().getParameter() != null) {
                out.append(" (needs '").append(rpc.getNested().getParameter()).append("')");
            }
            out.append("\n");
        });
        out.append(ANSI_CYAN).append("Webhooks:").append(ANSI_RESET).append("\n");
        definition.getWebhooks().keySet().forEach(name -> out.append("  - ").append(name).append("\n"));
        return out.toString();
    }

    private static void describeModule(String name, ModuleDefinition module, StringBuilder out) {
        out.append("-".repeat(50)).append("\n");
        out.append(ANSI_GREEN).append(name).append(ANSI_RESET)
                .append(" ").append(ANSI_PURPLE).append(module.getType().getValue()).append(ANSI_RESET);
        if (module.getLabel() != null) {
            out.append("  ").append(module.getLabel());
        }
        out.append("\n");
        describeParameters(module.getParameters(), out);
    }

    private static void describeParameters(List<ParameterSpec> parameters, StringBuilder out) {
        for (ParameterSpec parameter : parameters) {
            out.append("    - ").append(parameter.getName())
                    .append(" (type: ").append(parameter.getType())
                    .append(", required: ").append(parameter.isRequired());
            if (parameter.getOptions() != null) {
                out.append(", options: ").append(parameter.getOptions());
            }
            out.append(")\n");
        }
    }
}
