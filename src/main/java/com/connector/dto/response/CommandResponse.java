package com.connector.dto.response;

import com.connector.exception.ConnectorException;
import com.connector.exception.RequestException;

/**
 * The outcome of a shell command.
 *
 * @param success Whether the command succeeded.
 * @param message The confirmation or error text shown to the operator.
 */
public record CommandResponse(boolean success, String message) {

    public static CommandResponse failure(String prefix, Exception e) {
        if (e instanceof RequestException requestException) {
            return new CommandResponse(false, prefix + " " + requestException.getKind().getLabel() + " " + requestException.toEnvelope());
        }
        if (e instanceof ConnectorException connectorException) {
            return new CommandResponse(false, prefix + " " + connectorException.getKind().getLabel() + ": " + e.getMessage());
        }
        return new CommandResponse(false, prefix + " " + e.getMessage());
    }

    /**
     * @return the message in green on success, red otherwise.
     */
    public String toAnsiString() {
        String color = success ? "\u001B[32m" : "\u001B[31m";
        return color + message + "\u001B[0m";
    }
}
