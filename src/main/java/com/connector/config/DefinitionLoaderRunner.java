package com.connector.config;

import com.connector.exception.ConfigurationException;
import com.connector.service.api.DefinitionLoader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * Loads every {@code *.json} integration definition found in the definitions directory on startup. Files that
 * fail to load are skipped with a warning so one broken definition does not block the others.
 */
@Component
@Profile("!test")
@Slf4j
public class DefinitionLoaderRunner implements CommandLineRunner {

    private final DefinitionLoader definitionLoader;
    private final RuntimeProperties properties;

    public DefinitionLoaderRunner(DefinitionLoader definitionLoader, RuntimeProperties properties) {
        this.definitionLoader = definitionLoader;
        this.properties = properties;
    }

    @Override
    public void run(String... args) {
        Path directory = Path.of(properties.getDefinitionsDirectory());
        if (!Files.isDirectory(directory)) {
            log.info("Definitions directory '{}' not found. Skipping auto-load.", directory);
            return;
        }

        List<Path> files;
        try (Stream<Path> listing = Files.list(directory)) {
            files = listing.filter(path -> path.getFileName().toString().toLowerCase().endsWith(".json")).sorted().toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list definitions directory " + directory, e);
        }

        int loaded = 0;
        for (Path file : files) {
            try {
                definitionLoader.load(file, null);
                loaded++;
            } catch (ConfigurationException e) {
                log.warn("Skipping definition '{}': {}", file.getFileName(), e.getMessage());
            }
        }
        log.info("Auto-load complete: {} of {} definition(s) loaded from '{}'.", loaded, files.size(), directory);
    }
}
