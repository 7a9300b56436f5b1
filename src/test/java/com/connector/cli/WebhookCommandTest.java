package com.connector.cli;

import com.connector.exception.ProviderException;
import com.connector.model.WebhookRegistration;
import com.connector.service.api.ConnectorRuntime;
import com.connector.support.Fixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static com.connector.support.Fixtures.json;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WebhookCommandTest {

    @Mock
    private ConnectorRuntime runtime;

    private WebhookCommand webhookCommand;

    @BeforeEach
    void setUp() {
        webhookCommand = new WebhookCommand(runtime, new JsonPrinter());
    }

    @Test
    void attach_printsTheHookReferenceAndCallbackUrl() {
        // --- Arrange ---
        when(runtime.registerWebhook("forms", "submissions", "conn-1", json("{\"formId\": \"f-9\"}")))
                .thenReturn(new WebhookRegistration("hook-1", "forms", "submissions", "https://hooks.example.com/hooks/hook-1",
                        "conn-1", json("{\"formId\": \"f-9\"}"), json("{}"), Fixtures.NOW));

        // --- Act ---
        String output = webhookCommand.attach("forms", "submissions", "conn-1", "{\"formId\": \"f-9\"}");

        // --- Assert ---
        assertThat(output).contains("Webhook attached: hook-1")
                .contains("Callback URL: https://hooks.example.com/hooks/hook-1");
    }

    @Test
    void detach_whenTheProviderFails_printsTheFailure() {
        // --- Arrange ---
        doThrow(new ProviderException(503, "[503] unavailable")).when(runtime).unregisterWebhook("hook-1");

        // --- Act ---
        String output = webhookCommand.detach("hook-1");

        // --- Assert ---
        assertThat(output).contains("Detaching the webhook failed: ProviderError [503] unavailable");
    }

    @Test
    void update_passesTheNewParameters() {
        // --- Act ---
        String output = webhookCommand.update("hook-1", "{\"formId\": \"f-2\"}");

        // --- Assert ---
        verify(runtime).updateWebhook("hook-1", json("{\"formId\": \"f-2\"}"));
        assertThat(output).contains("Webhook 'hook-1' updated.");
    }
}
