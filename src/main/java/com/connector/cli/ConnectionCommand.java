package com.connector.cli;

import com.connector.dto.request.ConnectRequest;
import com.connector.dto.response.AuthorizationRequest;
import com.connector.dto.response.CommandResponse;
import com.connector.exception.ConnectorException;
import com.connector.model.ConnectionInstance;
import com.connector.service.api.ConnectionManager;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

/**
 * Creates and removes connections.
 */
@ShellComponent
public class ConnectionCommand {

    private final ConnectionManager connectionManager;
    private final JsonPrinter jsonPrinter;

    public ConnectionCommand(ConnectionManager connectionManager, JsonPrinter jsonPrinter) {
        this.connectionManager = connectionManager;
        this.jsonPrinter = jsonPrinter;
    }

    /**
     * Validates and stores a non-OAuth connection (API key, basic or custom).
     *
     * @param alias      The integration name.
     * @param connection The connection definition name.
     * @param parameters The connection parameters as a JSON object, e.g. {@code {"apiKey":"..."}}.
     * @return The new connection id, or the failure.
     */
    @ShellMethod(key = "connect", value = "Create a connection with an API key, basic or custom credentials.")
    public String connect(
            @ShellOption(help = "The integration name.") String alias,
            @ShellOption(help = "The connection name.") String connection,
            @ShellOption(value = {"--params", "-p"}, help = "Connection parameters as JSON.", defaultValue = "{}") String parameters
    ) {
        CommandResponse response;
        try {
            var request = new ConnectRequest(alias, connection, jsonPrinter.parse(parameters));
            ConnectionInstance instance = connectionManager.validate(request.alias(), request.connection(), request.parameters());
            response = new CommandResponse(true, "Connection created: " + instance.getId());
        } catch (ConnectorException | IllegalArgumentException e) {
            response = CommandResponse.failure("Connection failed:", e);
        }
        return response.toAnsiString();
    }

    @ShellMethod(key = "authorize", value = "Start an OAuth connection and print the URL to open.")
    public String authorize(
            @ShellOption(help = "The integration name.") String alias,
            @ShellOption(help = "The connection name.") String connection,
            @ShellOption(value = {"--redirect-uri", "-r"}, help = "The redirect URI registered with the provider.") String redirectUri,
            @ShellOption(value = {"--params", "-p"}, help = "Connection parameters as JSON.", defaultValue = "{}") String parameters
    ) {
        CommandResponse response;
        try {
            AuthorizationRequest authorization = connectionManager.authorize(alias, connection, jsonPrinter.parse(parameters), redirectUri);
            response = new CommandResponse(true, "Open this URL to authorize:\n" + authorization.url()
                    + "\nThen run: exchange --state " + authorization.state() + " --code <code>");
        } catch (ConnectorException | IllegalArgumentException e) {
            response = CommandResponse.failure("Authorization failed:", e);
        }
        return response.toAnsiString();
    }

    @ShellMethod(key = "exchange", value = "Complete an OAuth connection with the code the provider redirected back with.")
    public String exchange(
            @ShellOption(help = "The state printed by 'authorize'.") String state,
            @ShellOption(help = "The authorization code.") String code
    ) {
        CommandResponse response;
        try {
            ConnectionInstance instance = connectionManager.exchange(state, code);
            response = new CommandResponse(true, "Connection created: " + instance.getId());
        } catch (ConnectorException e) {
            response = CommandResponse.failure("Token exchange failed:", e);
        }
        return response.toAnsiString();
    }

    @ShellMethod(key = "disconnect", value = "Invalidate and delete a connection.")
    public String disconnect(@ShellOption(help = "The connection id.") String connectionId) {
        CommandResponse response;
        try {
            connectionManager.disconnect(connectionId);
            response = new CommandResponse(true, "Connection '" + connectionId + "' removed.");
        } catch (ConnectorException e) {
            response = CommandResponse.failure("Disconnect failed:", e);
        }
        return response.toAnsiString();
    }
}
