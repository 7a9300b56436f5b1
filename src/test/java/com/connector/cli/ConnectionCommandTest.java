package com.connector.cli;

import com.connector.dto.response.AuthorizationRequest;
import com.connector.exception.AuthException;
import com.connector.exception.ValidationException;
import com.connector.model.ConnectionInstance;
import com.connector.service.api.ConnectionManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static com.connector.support.Fixtures.json;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ConnectionCommandTest {

    @Mock
    private ConnectionManager connectionManager;

    private ConnectionCommand connectionCommand;

    @BeforeEach
    void setUp() {
        connectionCommand = new ConnectionCommand(connectionManager, new JsonPrinter());
    }

    @Test
    void connect_happyPath_printsTheConnectionId() {
        // --- Arrange ---
        when(connectionManager.validate("crm", "apikey", json("{\"apiKey\": \"k-1\"}")))
                .thenReturn(ConnectionInstance.builder().id("conn-7").build());

        // --- Act ---
        String output = connectionCommand.connect("crm", "apikey", "{\"apiKey\": \"k-1\"}");

        // --- Assert ---
        assertThat(output).contains("Connection created: conn-7");
    }

    @Test
    void connect_whenTheProviderRejectsTheKey_printsTheFailure() {
        // --- Arrange ---
        when(connectionManager.validate(any(), any(), any())).thenThrow(new ValidationException(400, "[400] bad key"));

        // --- Act ---
        String output = connectionCommand.connect("crm", "apikey", "{}");

        // --- Assert ---
        assertThat(output).contains("Connection failed: ValidationError [400] bad key");
    }

    @Test
    void authorize_printsTheUrlAndTheFollowUpCommand() {
        // --- Arrange ---
        when(connectionManager.authorize("crm", "oauth", json("{}"), "http://localhost/cb"))
                .thenReturn(new AuthorizationRequest("st-1", "https://auth.example.com/authorize?state=st-1"));

        // --- Act ---
        String output = connectionCommand.authorize("crm", "oauth", "http://localhost/cb", "{}");

        // --- Assert ---
        assertThat(output).contains("https://auth.example.com/authorize?state=st-1")
                .contains("exchange --state st-1 --code <code>");
    }

    @Test
    void exchange_whenTheStateIsUnknown_printsTheFailure() {
        // --- Arrange ---
        when(connectionManager.exchange("forged", "code")).thenThrow(new AuthException(0, "Unknown or expired authorization state."));

        // --- Act ---
        String output = connectionCommand.exchange("forged", "code");

        // --- Assert ---
        assertThat(output).contains("Token exchange failed:").contains("Unknown or expired authorization state.");
    }

    @Test
    void disconnect_reportsSuccessAndFailure() {
        // --- Arrange ---
        lenient().doThrow(new AuthException(0, "Unknown connection 'missing'.")).when(connectionManager).disconnect("missing");

        // --- Act ---
        String removed = connectionCommand.disconnect("conn-7");
        String failed = connectionCommand.disconnect("missing");

        // --- Assert ---
        verify(connectionManager).disconnect("conn-7");
        assertThat(removed).contains("Connection 'conn-7' removed.");
        assertThat(failed).contains("Disconnect failed:");
    }
}
