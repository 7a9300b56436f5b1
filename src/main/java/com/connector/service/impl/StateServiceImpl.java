package com.connector.service.impl;

import com.connector.config.RuntimeProperties;
import com.connector.model.ConnectionInstance;
import com.connector.model.IntegrationDefinition;
import com.connector.model.TriggerState;
import com.connector.model.WebhookRegistration;
import com.connector.service.api.StateService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import jakarta.annotation.PostConstruct;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.jasypt.encryption.StringEncryptor;
import org.springframework.stereotype.Service;

/**
 * A file-based implementation of the {@link StateService} that mirrors the runtime's state to
 * {@code state.json} in the configured state directory.
 * <p>
 * Connection instances carry access tokens, refresh tokens and user secrets, so each one is serialized and
 * encrypted with the Jasypt {@link StringEncryptor} before being stored in memory or written to the file. All
 * file I/O is synchronized.
 */
@Service
@Slf4j
public class StateServiceImpl implements StateService {

    static final String STATE_FILE_NAME = "state.json";

    private final File stateFile;
    private final ObjectMapper objectMapper = new ObjectMapper()
            .findAndRegisterModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    private final StringEncryptor encryptor;

    private Map<String, IntegrationDefinition> definitions = new ConcurrentHashMap<>();
    private Map<String, String> connections = new ConcurrentHashMap<>();
    private Map<String, TriggerState> triggerStates = new ConcurrentHashMap<>();
    private Map<String, WebhookRegistration> webhooks = new ConcurrentHashMap<>();

    /**
     * Constructs the StateService with a Jasypt {@link StringEncryptor}, provided by the Jasypt Spring Boot
     * starter.
     *
     * @param encryptor  The encryptor securing connection instances.
     * @param properties The runtime properties naming the state directory.
     */
    public StateServiceImpl(StringEncryptor encryptor, RuntimeProperties properties) {
        this.encryptor = encryptor;
        this.stateFile = new File(properties.getStateDirectory(), STATE_FILE_NAME);
    }

    /**
     * Loads the persisted state once the bean has been constructed.
     */
    @PostConstruct
    public void init() {
        loadState();
    }

    @Override
    public void saveDefinition(IntegrationDefinition definition) {
        putAndSave(definitions, definition.getName(), definition);
    }

    @Override
    public IntegrationDefinition getDefinition(String name) {
        return name == null ? null : definitions.get(name);
    }

    @Override
    public Collection<IntegrationDefinition> listDefinitions() {
        return List.copyOf(definitions.values());
    }

    /**
     * {@inheritDoc}
     * <p>
     * This implementation serializes the instance to JSON and encrypts the result before storing it.
     */
    @Override
    public void saveConnection(ConnectionInstance instance) {
        String encrypted;
        try {
            encrypted = encryptor.encrypt(objectMapper.writeValueAsString(instance));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Connection '" + instance.getId() + "' cannot be serialized", e);
        }
        putAndSave(connections, instance.getId(), encrypted);
    }

    /**
     * {@inheritDoc}
     * <p>
     * If decryption fails, which happens when the secret key changed, an error is logged and {@code null} is
     * returned.
     */
    @Override
    public ConnectionInstance getConnection(String id) {
        String encrypted = id == null ? null : connections.get(id);
        if (encrypted == null) {
            return null;
        }
        try {
            return objectMapper.readValue(encryptor.decrypt(encrypted), ConnectionInstance.class);
        } catch (Exception e) {
            log.error("Could not decrypt connection '{}'. The secret key may have changed or is incorrect.", id);
            return null;
        }
    }

    @Override
    public void deleteConnection(String id) {
        removeAndSave(connections, id);
    }

    @Override
    public Collection<String> listConnectionIds() {
        return List.copyOf(connections.keySet());
    }

    @Override
    public TriggerState getTriggerState(String key) {
        return triggerStates.get(key);
    }

    @Override
    public void saveTriggerState(String key, TriggerState state) {
        putAndSave(triggerStates, key, state);
    }

    @Override
    public void saveWebhook(WebhookRegistration registration) {
        putAndSave(webhooks, registration.hookRef(), registration);
    }

    @Override
    public WebhookRegistration getWebhook(String hookRef) {
        return hookRef == null ? null : webhooks.get(hookRef);
    }

    @Override
    public void deleteWebhook(String hookRef) {
        removeAndSave(webhooks, hookRef);
    }

    @Override
    public Collection<WebhookRegistration> listWebhooks() {
        return new ArrayList<>(webhooks.values());
    }

    /**
     * Stores {@code value} and writes the state file. When the write fails the previous value is restored, so
     * memory never holds state the file does not.
     */
    private synchronized <V> void putAndSave(Map<String, V> map, String key, V value) {
        V previous = map.put(key, value);
        try {
            saveState();
        } catch (IllegalStateException e) {
            if (previous == null) {
                map.remove(key);
            } else {
                map.put(key, previous);
            }
            throw e;
        }
    }

    private synchronized <V> void removeAndSave(Map<String, V> map, String key) {
        V previous = map.remove(key);
        if (previous == null) {
            return;
        }
        try {
            saveState();
        } catch (IllegalStateException e) {
            map.put(key, previous);
            throw e;
        }
    }

    /**
     * Writes the in-memory state to disk, creating the state directory if needed.
     *
     * @throws IllegalStateException if the file cannot be written.
     */
    private synchronized void saveState() {
        try {
            File parentDir = stateFile.getParentFile();
            if (parentDir != null && !parentDir.exists() && !parentDir.mkdirs()) {
                throw new IOException("Failed to create parent directories at: " + parentDir.getAbsolutePath());
            }

            Map<String, Object> state = new LinkedHashMap<>();
            state.put("definitions", definitions);
            state.put("connections", connections);
            state.put("triggerStates", triggerStates);
            state.put("webhooks", webhooks);
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(stateFile, state);
        } catch (IOException e) {
            log.error("CRITICAL: Failed to save runtime state to {}", stateFile, e);
            throw new IllegalStateException("Failed to save runtime state", e);
        }
    }

    /**
     * Loads the state file into memory. A missing file means a clean start; an unreadable one is backed up
     * and the runtime starts clean instead of failing on every startup.
     */
    private synchronized void loadState() {
        if (!stateFile.exists() || stateFile.length() == 0) {
            log.info("No state file found at {}, starting with a clean state.", stateFile);
            return;
        }
        try {
            Map<String, Object> state = objectMapper.readValue(stateFile, new TypeReference<LinkedHashMap<String, Object>>() {});
            if (state.get("definitions") != null) {
                definitions = objectMapper.convertValue(state.get("definitions"),
                        new TypeReference<ConcurrentHashMap<String, IntegrationDefinition>>() {});
            }
            if (state.get("connections") != null) {
                connections = objectMapper.convertValue(state.get("connections"),
                        new TypeReference<ConcurrentHashMap<String, String>>() {});
            }
            if (state.get("triggerStates") != null) {
                triggerStates = objectMapper.convertValue(state.get("triggerStates"),
                        new TypeReference<ConcurrentHashMap<String, TriggerState>>() {});
            }
            if (state.get("webhooks") != null) {
                webhooks = objectMapper.convertValue(state.get("webhooks"),
                        new TypeReference<ConcurrentHashMap<String, WebhookRegistration>>() {});
            }
            log.info("Loaded state from {}: {} definition(s), {} connection(s), {} trigger state(s), {} webhook(s)",
                    stateFile, definitions.size(), connections.size(), triggerStates.size(), webhooks.size());
        } catch (Exception e) {
            log.warn("Could not load or parse state file at {}. A backup will be created, and the runtime will start with a fresh state. Error: {}",
                    stateFile, e.getMessage());
            backupCorruptedStateFile();
            definitions = new ConcurrentHashMap<>();
            connections = new ConcurrentHashMap<>();
            triggerStates = new ConcurrentHashMap<>();
            webhooks = new ConcurrentHashMap<>();
        }
    }

    private void backupCorruptedStateFile() {
        File backupFile = new File(stateFile.getPath() + ".corrupted." + System.currentTimeMillis());
        try {
            Files.move(stateFile.toPath(), backupFile.toPath(), StandardCopyOption.REPLACE_EXISTING);
            log.info("Backed up corrupted state file to {}", backupFile.getAbsolutePath());
        } catch (IOException e) {
            log.error("CRITICAL: Failed to back up corrupted state file from {} to {}", stateFile.getAbsolutePath(), backupFile.getAbsolutePath(), e);
        }
    }
}
