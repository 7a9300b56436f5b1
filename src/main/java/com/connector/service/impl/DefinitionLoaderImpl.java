package com.connector.service.impl;

import com.connector.exception.ConfigurationException;
import com.connector.expression.Template;
import com.connector.model.CallDefinition;
import com.connector.model.IntegrationDefinition;
import com.connector.model.ModuleDefinition;
import com.connector.model.ModuleType;
import com.connector.model.RpcDefinition;
import com.connector.model.WebhookDefinition;
import com.connector.service.api.DefinitionLoader;
import com.connector.service.api.FunctionRegistry;
import com.connector.service.api.StateService;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class DefinitionLoaderImpl implements DefinitionLoader {

    private final ObjectMapper objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final StateService stateService;
    private final FunctionRegistry functionRegistry;

    public DefinitionLoaderImpl(StateService stateService, FunctionRegistry functionRegistry) {
        this.stateService = stateService;
        this.functionRegistry = functionRegistry;
    }

    /**
     * {@inheritDoc}
     * The file is parsed with Jackson; names of connections, modules, RPCs, webhooks and functions come from
     * the keys of their maps.
     */
    @Override
    public IntegrationDefinition load(Path file, String alias) {
        log.info("Loading integration definition from: {}", file);
        IntegrationDefinition definition;
        try {
            definition = objectMapper.readValue(Files.readString(file), IntegrationDefinition.class);
        } catch (IOException | IllegalArgumentException e) {
            throw new ConfigurationException("Failed to read integration definition '" + file + "': " + e.getMessage(), e);
        }
        if (alias != null && !alias.isBlank()) {
            definition.setName(alias);
        } else if (definition.getName() == null || definition.getName().isBlank()) {
            definition.setName(aliasOf(file));
        }
        return register(definition);
    }

    @Override
    public IntegrationDefinition register(IntegrationDefinition definition) {
        List<String> problems = validate(definition);
        if (!problems.isEmpty()) {
            throw new ConfigurationException("Integration '" + definition.getName() + "' is invalid:\n - " + String.join("\n - ", problems));
        }
        definition.getFunctions().forEach((name, function) -> function.setName(name));
        functionRegistry.register(definition.getName(), definition.getFunctions().values());
        stateService.saveDefinition(definition);
        log.info("Registered integration '{}' with {} module(s), {} RPC(s), {} webhook(s) and {} connection(s).",
                definition.getName(), definition.getModules().size(), definition.getRpcs().size(),
                definition.getWebhooks().size(), definition.getConnections().size());
        return definition;
    }

    private List<String> validate(IntegrationDefinition definition) {
        List<String> problems = new ArrayList<>();
        if (definition.getName() == null || definition.getName().isBlank()) {
            problems.add("the integration has no name");
        }
        for (Map.Entry<String, ModuleDefinition> entry : definition.getModules().entrySet()) {
            ModuleDefinition module = entry.getValue();
            String where = "module '" + entry.getKey() + "'";
            checkConnection(definition, module.getConnection(), where, problems);
            if (module.getType() == ModuleType.INSTANT_TRIGGER) {
                if (module.getWebhook() != null && !definition.getWebhooks().containsKey(module.getWebhook())) {
                    problems.add(where + " refers to unknown webhook '" + module.getWebhook() + "'");
                }
                continue;
            }
            checkCalls(module.getCalls(), where, problems);
            if (module.getType() == ModuleType.TRIGGER && !module.getCalls().isEmpty()) {
                CallDefinition last = module.getCalls().get(module.getCalls().size() - 1);
                if (last.getResponse() == null || last.getResponse().getTrigger() == null || last.getResponse().getTrigger().getId() == null) {
                    problems.add(where + " is a trigger without response.trigger.id");
                }
            }
        }
        for (Map.Entry<String, RpcDefinition> entry : definition.getRpcs().entrySet()) {
            String where = "rpc '" + entry.getKey() + "'";
            checkConnection(definition, entry.getValue().getConnection(), where, problems);
            checkCalls(entry.getValue().getCalls(), where, problems);
        }
        for (Map.Entry<String, WebhookDefinition> entry : definition.getWebhooks().entrySet()) {
            checkConnection(definition, entry.getValue().getConnection(), "webhook '" + entry.getKey() + "'", problems);
        }
        definition.getFunctions().forEach((name, function) -> {
            if (function.getBody() == null || function.getBody().isBlank()) {
                problems.add("function '" + name + "' has no body");
            }
        });
        checkTemplates(objectMapper.valueToTree(definition), "", problems);
        return problems;
    }

    private static void checkConnection(IntegrationDefinition definition, String connection, String where, List<String> problems) {
        if (connection != null && !definition.getConnections().containsKey(connection)) {
            problems.add(where + " refers to unknown connection '" + connection + "'");
        }
    }

    private static void checkCalls(List<CallDefinition> calls, String where, List<String> problems) {
        if (calls == null || calls.isEmpty()) {
            problems.add(where + " has no calls");
            return;
        }
        for (int i = 0; i < calls.size(); i++) {
            if (calls.get(i).getUrl() == null || calls.get(i).getUrl().isBlank()) {
                problems.add(where + " step " + (i + 1) + " has no url");
            }
        }
    }

    /**
     * Parses every templated string (and object key) up front so syntax errors surface at load time.
     */
    private static void checkTemplates(JsonNode node, String path, List<String> problems) {
        if (node.isTextual()) {
            checkTemplate(node.textValue(), path, problems);
        } else if (node.isArray()) {
            for (int i = 0; i < node.size(); i++) {
                checkTemplates(node.get(i), path + "[" + i + "]", problems);
            }
        } else if (node.isObject()) {
            node.fields().forEachRemaining(field -> {
                String child = path.isEmpty() ? field.getKey() : path + "." + field.getKey();
                if (!Template.isSpliceKey(field.getKey())) {
                    checkTemplate(field.getKey(), child, problems);
                }
                if (!child.startsWith("functions.")) {
                    checkTemplates(field.getValue(), child, problems);
                }
            });
        }
    }

    private static void checkTemplate(String text, String path, List<String> problems) {
        if (!Template.containsMarkers(text)) {
            return;
        }
        try {
            Template.parse(text);
        } catch (ConfigurationException e) {
            problems.add(path + ": " + e.getMessage());
        }
    }

    static String aliasOf(Path file) {
        return file.getFileName().toString()
                .toLowerCase(Locale.ROOT)
                .replaceFirst("\\.json$", "")
                .replaceAll("[^a-z0-9-]", "-");
    }
}
