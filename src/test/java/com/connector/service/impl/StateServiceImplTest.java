package com.connector.service.impl;

import com.connector.config.RuntimeProperties;
import com.connector.model.ConnectionData;
import com.connector.model.ConnectionInstance;
import com.connector.model.ConnectionType;
import com.connector.model.IntegrationDefinition;
import com.connector.model.TriggerState;
import com.connector.model.TriggerStatus;
import com.connector.model.WebhookRegistration;
import com.connector.support.Fixtures;
import com.fasterxml.jackson.databind.node.IntNode;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;
import java.util.Set;
import java.util.stream.Stream;
import org.jasypt.encryption.StringEncryptor;
import org.jasypt.exceptions.EncryptionOperationNotPossibleException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static com.connector.support.Fixtures.json;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StateServiceImplTest {

    @Mock
    private StringEncryptor stringEncryptor;

    @TempDir
    Path stateDirectory;

    private RuntimeProperties properties;
    private StateServiceImpl stateService;

    @BeforeEach
    void setUp() {
        lenient().when(stringEncryptor.encrypt(anyString())).thenAnswer(invocation ->
                Base64.getEncoder().encodeToString(invocation.<String>getArgument(0).getBytes(StandardCharsets.UTF_8)));
        lenient().when(stringEncryptor.decrypt(anyString())).thenAnswer(invocation ->
                new String(Base64.getDecoder().decode(invocation.<String>getArgument(0)), StandardCharsets.UTF_8));

        properties = new RuntimeProperties();
        properties.setStateDirectory(stateDirectory.toString());
        stateService = reopen();
    }

    private StateServiceImpl reopen() {
        StateServiceImpl service = new StateServiceImpl(stringEncryptor, properties);
        service.init();
        return service;
    }

    private static ConnectionInstance connection() {
        return ConnectionInstance.builder()
                .id("conn-1")
                .integration("crm")
                .connection("oauth")
                .type(ConnectionType.OAUTH)
                .parameters(json("{\"subdomain\": \"acme\"}"))
                .data(new ConnectionData("secret-access-token", "secret-refresh-token", Fixtures.NOW, null))
                .createdAt(Fixtures.NOW)
                .build();
    }

    private Path stateFile() {
        return stateDirectory.resolve(StateServiceImpl.STATE_FILE_NAME);
    }

    @Test
    void saveConnection_shouldEncryptTheInstanceBeforeStoringIt() throws IOException {
        // --- Arrange ---
        ConnectionInstance instance = connection();

        // --- Act ---
        stateService.saveConnection(instance);
        ConnectionInstance retrieved = stateService.getConnection("conn-1");

        // --- Assert ---
        verify(stringEncryptor, times(1)).encrypt(anyString());
        verify(stringEncryptor, times(1)).decrypt(anyString());
        assertThat(retrieved).isEqualTo(instance);
        assertThat(Files.readString(stateFile())).doesNotContain("secret-access-token", "secret-refresh-token");
    }

    @Test
    void getConnection_shouldReturnNullIfIdNotFound() {
        // --- Act ---
        ConnectionInstance retrieved = stateService.getConnection("non-existent");

        // --- Assert ---
        assertThat(retrieved).isNull();
        verify(stringEncryptor, never()).decrypt(anyString());
    }

    @Test
    void getConnection_shouldReturnNullWhenTheSecretKeyChanged() {
        // --- Arrange ---
        stateService.saveConnection(connection());
        when(stringEncryptor.decrypt(anyString())).thenThrow(new EncryptionOperationNotPossibleException());

        // --- Act & Assert ---
        assertThat(stateService.getConnection("conn-1")).isNull();
    }

    @Test
    void state_shouldSurviveARestart() {
        // --- Arrange ---
        IntegrationDefinition definition = Fixtures.integration("runtime.json");
        TriggerState triggerState = new TriggerState(TriggerStatus.POLLING, "b", IntNode.valueOf(2), Set.of("a", "b"));
        WebhookRegistration webhook = new WebhookRegistration("hook-1", "crm", "contacts", "http://localhost:8080/hooks/hook-1",
                "conn-1", json("{}"), json("{\"providerId\": \"wh_1\"}"), Fixtures.NOW);

        stateService.saveDefinition(definition);
        stateService.saveConnection(connection());
        stateService.saveTriggerState("scenario-1/crm/newContacts", triggerState);
        stateService.saveWebhook(webhook);

        // --- Act ---
        StateServiceImpl restarted = reopen();

        // --- Assert ---
        assertThat(restarted.getDefinition("crm").getModules()).containsOnlyKeys(definition.getModules().keySet());
        assertThat(restarted.getConnection("conn-1")).isEqualTo(connection());
        assertThat(restarted.getTriggerState("scenario-1/crm/newContacts")).isEqualTo(triggerState);
        assertThat(restarted.getWebhook("hook-1")).isEqualTo(webhook);
        assertThat(restarted.listConnectionIds()).containsExactly("conn-1");
    }

    @Test
    void delete_shouldRemoveConnectionsAndWebhooksFromDisk() {
        // --- Arrange ---
        stateService.saveConnection(connection());
        stateService.saveWebhook(new WebhookRegistration("hook-1", "crm", "contacts", "http://localhost:8080/hooks/hook-1",
                null, json("{}"), json("{}"), Fixtures.NOW));

        // --- Act ---
        stateService.deleteConnection("conn-1");
        stateService.deleteWebhook("hook-1");

        // --- Assert ---
        StateServiceImpl restarted = reopen();
        assertThat(restarted.getConnection("conn-1")).isNull();
        assertThat(restarted.listWebhooks()).isEmpty();
    }

    @Test
    void saveTriggerState_shouldKeepThePreviousStateWhenTheWriteFails() throws IOException {
        // --- Arrange ---
        Path nested = stateDirectory.resolve("nested");
        properties.setStateDirectory(nested.toString());
        StateServiceImpl service = reopen();
        TriggerState committed = new TriggerState(TriggerStatus.POLLING, "a", IntNode.valueOf(1), Set.of("a"));
        service.saveTriggerState("scenario-1/crm/newContacts", committed);

        Files.delete(nested.resolve(StateServiceImpl.STATE_FILE_NAME));
        Files.delete(nested);
        Files.writeString(nested, "not a directory");

        // --- Act & Assert ---
        TriggerState advanced = new TriggerState(TriggerStatus.POLLING, "b", IntNode.valueOf(2), Set.of("b"));
        assertThatThrownBy(() -> service.saveTriggerState("scenario-1/crm/newContacts", advanced))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> service.saveTriggerState("scenario-1/crm/other", advanced))
                .isInstanceOf(IllegalStateException.class);
        assertThat(service.getTriggerState("scenario-1/crm/newContacts")).isEqualTo(committed);
        assertThat(service.getTriggerState("scenario-1/crm/other")).isNull();
    }

    @Test
    void init_shouldBackUpACorruptedStateFileAndStartClean() throws IOException {
        // --- Arrange ---
        Files.writeString(stateFile(), "{ not json");

        // --- Act ---
        StateServiceImpl restarted = reopen();

        // --- Assert ---
        assertThat(restarted.listDefinitions()).isEmpty();
        assertThat(stateFile()).doesNotExist();
        try (Stream<Path> files = Files.list(stateDirectory)) {
            assertThat(files).anySatisfy(file -> assertThat(file.getFileName().toString()).startsWith("state.json.corrupted."));
        }
    }
}
