package com.connector.config;

import com.connector.exception.ConfigurationException;
import com.connector.model.IntegrationDefinition;
import com.connector.service.api.DefinitionLoader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DefinitionLoaderRunnerTest {

    @Mock
    private DefinitionLoader definitionLoader;

    @TempDir
    Path definitions;

    private DefinitionLoaderRunner runner(Path directory) {
        RuntimeProperties properties = new RuntimeProperties();
        properties.setDefinitionsDirectory(directory.toString());
        return new DefinitionLoaderRunner(definitionLoader, properties);
    }

    @Test
    void run_shouldLoadEveryJsonFileAndSkipInvalidOnes() throws IOException {
        // --- Arrange ---
        Path broken = Files.writeString(definitions.resolve("a-broken.json"), "{}");
        Path valid = Files.writeString(definitions.resolve("b-crm.json"), "{}");
        Files.writeString(definitions.resolve("notes.txt"), "not a definition");
        when(definitionLoader.load(broken, null)).thenThrow(new ConfigurationException("the integration has no name"));
        when(definitionLoader.load(valid, null)).thenReturn(new IntegrationDefinition());

        // --- Act & Assert ---
        assertThatCode(() -> runner(definitions).run()).doesNotThrowAnyException();
        verify(definitionLoader).load(valid, null);
    }

    @Test
    void run_shouldSkipAMissingDirectory() {
        // --- Act ---
        runner(definitions.resolve("absent")).run();

        // --- Assert ---
        verify(definitionLoader, never()).load(any(), isNull());
    }
}
