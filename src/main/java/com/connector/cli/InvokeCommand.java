package com.connector.cli;

import static com.connector.cli.JsonPrinter.ANSI_PURPLE;
import static com.connector.cli.JsonPrinter.ANSI_RESET;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import com.connector.cli.ui.Spinner;
import com.connector.dto.response.CommandResponse;
import com.connector.exception.ConnectorException;
import com.connector.model.ModuleResult;
import com.connector.model.Option;
import com.connector.model.TriggerState;
import com.connector.service.api.ConnectorRuntime;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.function.Supplier;
import org.slf4j.LoggerFactory;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

/**
 * Runs modules and RPCs of a loaded integration from the shell, the way the Scenario Engine would.
 */
@ShellComponent
public class InvokeCommand {

    private final ConnectorRuntime runtime;
    private final JsonPrinter jsonPrinter;
    private final Spinner spinner;

    public InvokeCommand(ConnectorRuntime runtime, JsonPrinter jsonPrinter, Spinner spinner) {
        this.runtime = runtime;
        this.jsonPrinter = jsonPrinter;
        this.spinner = spinner;
    }

    /**
     * Invokes a module and prints its bundles. Triggers run without prior state, so they only bootstrap unless a
     * state is passed with {@code --state}.
     *
     * @param alias      The integration name.
     * @param moduleId   The module name.
     * @param parameters Module parameters as JSON.
     * @param connection The connection id, if the module needs one.
     * @param state      A trigger state as JSON, as printed by a previous invocation.
     * @param verbose    Logs every HTTP exchange (sanitized) while the command runs.
     */
    @ShellMethod(key = "invoke", value = "Invoke a module of a loaded integration.")
    public String invoke(
            @ShellOption(help = "The integration name.") String alias,
            @ShellOption(help = "The module name.") String moduleId,
            @ShellOption(value = {"--params", "-p"}, help = "Module parameters as JSON.", defaultValue = "{}") String parameters,
            @ShellOption(value = {"--connection", "-c"}, help = "The connection id.", defaultValue = ShellOption.NULL) String connection,
            @ShellOption(value = {"--state", "-s"}, help = "Prior trigger state as JSON.", defaultValue = ShellOption.NULL) String state,
            @ShellOption(value = {"--verbose", "-v"}, help = "Enable verbose debug logging.", defaultValue = "false", arity = 0) boolean verbose
    ) {
        return withLogging(verbose, () -> {
            JsonNode params = jsonPrinter.parse(parameters);
            TriggerState priorState = state == null ? null : jsonPrinter.convert(jsonPrinter.parse(state), TriggerState.class);
            ModuleResult result = spinner.spin("Invoking " + moduleId + "...",
                    () -> runtime.invoke(alias, moduleId, params, connection, priorState));
            return jsonPrinter.format(result);
        });
    }

    @ShellMethod(key = "options", value = "Resolve the option list of an RPC.")
    public String options(
            @ShellOption(help = "The integration name.") String alias,
            @ShellOption(help = "The RPC name.") String rpcId,
            @ShellOption(value = {"--params", "-p"}, help = "Parameters chosen so far, as JSON.", defaultValue = "{}") String parameters,
            @ShellOption(value = {"--connection", "-c"}, help = "The connection id.", defaultValue = ShellOption.NULL) String connection
    ) {
        return withLogging(false, () -> {
            List<Option> options = spinner.spin("Resolving " + rpcId + "...",
                    () -> runtime.fetchOptions(alias, rpcId, jsonPrinter.parse(parameters), connection));
            if (options.isEmpty()) {
                return new CommandResponse(true, "No options.").toAnsiString();
            }
            return jsonPrinter.format(options);
        });
    }

    private String withLogging(boolean verbose, Supplier<String> command) {
        Logger rootLogger = (Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        Level originalLevel = rootLogger.getLevel();
        StringBuilder out = new StringBuilder();
        if (verbose) {
            rootLogger.setLevel(Level.DEBUG);
            out.append(ANSI_PURPLE).append("-- Verbose mode enabled --").append(ANSI_RESET).append("\n");
        }
        try {
            out.append(command.get());
        } catch (ConnectorException | IllegalArgumentException e) {
            out.append(CommandResponse.failure("An error occurred:", e).toAnsiString());
        } finally {
            if (verbose) {
                rootLogger.setLevel(originalLevel);
                out.append("\n").append(ANSI_PURPLE).append("-- Verbose mode disabled --").append(ANSI_RESET);
            }
        }
        return out.toString();
    }
}
