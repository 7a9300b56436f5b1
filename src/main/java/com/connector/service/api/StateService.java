package com.connector.service.api;

import com.connector.model.ConnectionInstance;
import com.connector.model.IntegrationDefinition;
import com.connector.model.TriggerState;
import com.connector.model.WebhookRegistration;
import java.util.Collection;

/**
 * An interface defining the contract for managing the persistent state of the runtime: loaded integration
 * definitions, connection instances, trigger states and webhook registrations.
 */
public interface StateService {

    /**
     * Saves or replaces an integration definition under its name.
     *
     * @param definition The definition to persist.
     */
    void saveDefinition(IntegrationDefinition definition);

    /**
     * Retrieves a previously saved definition.
     *
     * @param name The integration name.
     * @return The definition, or {@code null} if none is stored under that name.
     */
    IntegrationDefinition getDefinition(String name);

    Collection<IntegrationDefinition> listDefinitions();

    /**
     * Saves or replaces a connection instance. Connection instances hold secrets and are encrypted before they
     * are kept in memory or written to disk.
     *
     * @param instance The connection instance to persist.
     */
    void saveConnection(ConnectionInstance instance);

    /**
     * @param id The connection instance id.
     * @return The decrypted instance, or {@code null} if it does not exist or cannot be decrypted.
     */
    ConnectionInstance getConnection(String id);

    void deleteConnection(String id);

    Collection<String> listConnectionIds();

    /**
     * @param key The (scenario, module) key of the trigger.
     * @return The stored state, or {@code null} if the trigger never completed a poll.
     */
    TriggerState getTriggerState(String key);

    void saveTriggerState(String key, TriggerState state);

    void saveWebhook(WebhookRegistration registration);

    WebhookRegistration getWebhook(String hookRef);

    void deleteWebhook(String hookRef);

    Collection<WebhookRegistration> listWebhooks();
}
