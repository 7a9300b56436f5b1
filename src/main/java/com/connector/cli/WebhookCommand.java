package com.connector.cli;

import com.connector.dto.response.CommandResponse;
import com.connector.exception.ConnectorException;
import com.connector.model.WebhookRegistration;
import com.connector.service.api.ConnectorRuntime;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

@ShellComponent
public class WebhookCommand {

    private final ConnectorRuntime runtime;
    private final JsonPrinter jsonPrinter;

    public WebhookCommand(ConnectorRuntime runtime, JsonPrinter jsonPrinter) {
        this.runtime = runtime;
        this.jsonPrinter = jsonPrinter;
    }

    /**
     * Registers a webhook with the provider and prints the callback URL it was registered with.
     */
    @ShellMethod(key = "hook-attach", value = "Register a webhook of a loaded integration with the provider.")
    public String attach(
            @ShellOption(help = "The integration name.") String alias,
            @ShellOption(help = "The webhook name.") String hookId,
            @ShellOption(value = {"--connection", "-c"}, help = "The connection id.", defaultValue = ShellOption.NULL) String connection,
            @ShellOption(value = {"--params", "-p"}, help = "Webhook parameters as JSON.", defaultValue = "{}") String parameters
    ) {
        CommandResponse response;
        try {
            WebhookRegistration registration = runtime.registerWebhook(alias, hookId, connection, jsonPrinter.parse(parameters));
            response = new CommandResponse(true, "Webhook attached: " + registration.hookRef() + "\nCallback URL: " + registration.callbackUrl());
        } catch (ConnectorException | IllegalArgumentException e) {
            response = CommandResponse.failure("Attaching the webhook failed:", e);
        }
        return response.toAnsiString();
    }

    @ShellMethod(key = "hook-detach", value = "Unregister a webhook from the provider.")
    public String detach(@ShellOption(help = "The hook reference printed by 'hook-attach'.") String hookRef) {
        CommandResponse response;
        try {
            runtime.unregisterWebhook(hookRef);
            response = new CommandResponse(true, "Webhook '" + hookRef + "' detached.");
        } catch (ConnectorException e) {
            response = CommandResponse.failure("Detaching the webhook failed:", e);
        }
        return response.toAnsiString();
    }

    @ShellMethod(key = "hook-update", value = "Change the parameters of an attached webhook.")
    public String update(
            @ShellOption(help = "The hook reference printed by 'hook-attach'.") String hookRef,
            @ShellOption(value = {"--params", "-p"}, help = "The new webhook parameters as JSON.") String parameters
    ) {
        CommandResponse response;
        try {
            runtime.updateWebhook(hookRef, jsonPrinter.parse(parameters));
            response = new CommandResponse(true, "Webhook '" + hookRef + "' updated.");
        } catch (ConnectorException | IllegalArgumentException e) {
            response = CommandResponse.failure("Updating the webhook failed:", e);
        }
        return response.toAnsiString();
    }
}
