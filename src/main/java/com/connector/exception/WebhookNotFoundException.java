package com.connector.exception;

public class WebhookNotFoundException extends ConfigurationException {

    public WebhookNotFoundException(String hookRef) {
        super("Unknown webhook '" + hookRef + "'.");
    }
}
