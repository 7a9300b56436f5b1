package com.connector.service.impl;

import com.connector.config.HttpClientFactory;
import com.connector.config.RuntimeProperties;
import com.connector.exception.ConfigurationException;
import com.connector.exception.ProviderException;
import com.connector.exception.RateLimitException;
import com.connector.exception.ValidationException;
import com.connector.expression.Scope;
import com.connector.model.ConnectionInstance;
import com.connector.model.IntegrationDefinition;
import com.connector.model.ModuleDefinition;
import com.connector.model.ModuleResult;
import com.connector.model.ResultItem;
import com.connector.model.TriggerState;
import com.connector.model.TriggerStatus;
import com.connector.service.api.CallChainExecutor;
import com.connector.service.api.ConnectionManager;
import com.connector.service.api.RpcResolver;
import com.connector.service.api.StateService;
import com.connector.service.api.TriggerStateMachine;
import com.connector.service.api.WebhookService;
import com.connector.support.Fixtures;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.IntNode;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static com.connector.support.Fixtures.json;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ConnectorRuntimeImplTest {

    private static final String KEY = "scenario-1/crm/newContacts";

    @Mock
    private StateService stateService;

    @Mock
    private ConnectionManager connectionManager;

    @Mock
    private CallChainExecutor callChainExecutor;

    @Mock
    private TriggerStateMachine triggerStateMachine;

    @Mock
    private RpcResolver rpcResolver;

    @Mock
    private WebhookService webhookService;

    private final Map<String, TriggerState> triggerStates = new ConcurrentHashMap<>();
    private ExecutorService pollExecutor;
    private ConnectorRuntimeImpl runtime;

    @BeforeEach
    void setUp() {
        pollExecutor = Executors.newFixedThreadPool(2);
        runtime = runtime(Fixtures.properties());

        IntegrationDefinition integration = Fixtures.integration("runtime.json", "https://api.example.com/");
        lenient().when(stateService.getDefinition("crm")).thenReturn(integration);
        lenient().when(stateService.getTriggerState(anyString()))
                .thenAnswer(invocation -> triggerStates.get(invocation.<String>getArgument(0)));
        lenient().doAnswer(invocation -> {
            triggerStates.put(invocation.getArgument(0), invocation.getArgument(1));
            return null;
        }).when(stateService).saveTriggerState(anyString(), any(TriggerState.class));
    }

    @AfterEach
    void tearDown() {
        pollExecutor.shutdownNow();
    }

    private ConnectorRuntimeImpl runtime(RuntimeProperties properties) {
        return new ConnectorRuntimeImpl(stateService, connectionManager, callChainExecutor, triggerStateMachine, rpcResolver,
                webhookService, Fixtures.evaluator(), new HttpClientFactory().connectorRetry(properties), pollExecutor, properties);
    }

    private static ResultItem item(String json) {
        JsonNode node = json(json);
        return new ResultItem(node, node);
    }

    private static TriggerState polledUpTo(int date, String id) {
        return new TriggerState(TriggerStatus.POLLING, id, IntNode.valueOf(date), Set.of(id));
    }

    private void stubConnection() {
        ConnectionInstance connection = ConnectionInstance.builder().id("conn-1").build();
        when(connectionManager.ensureFresh("conn-1")).thenReturn(connection);
        when(connectionManager.bind(any(Scope.class), eq(connection)))
                .thenAnswer(invocation -> invocation.<Scope>getArgument(0).with(Scope.CONNECTION, json("{\"apiKey\": \"k\"}")));
    }

    @Test
    void invoke_shouldApplyParameterDefaultsAndBindTheConnection() {
        // --- Arrange ---
        stubConnection();
        when(callChainExecutor.run(anyList(), any(IntegrationDefinition.class), any(Scope.class), isNull()))
                .thenAnswer(invocation -> {
                    Scope scope = invocation.getArgument(2);
                    assertThat(scope.get(Scope.PARAMETERS).get("source").asText()).isEqualTo("api");
                    assertThat(scope.get(Scope.CONNECTION).get("apiKey").asText()).isEqualTo("k");
                    return List.of(item("{\"id\": 1}")).iterator();
                });

        // --- Act ---
        ModuleResult result = runtime.invoke("crm", "createContact", json("{\"email\": \"ada@example.com\"}"), "conn-1", null);

        // --- Assert ---
        assertThat(result.bundles()).containsExactly(json("{\"id\": 1}"));
        assertThat(result.state()).isNull();
        verify(connectionManager).ensureFresh("conn-1");
    }

    @Test
    void invoke_shouldRejectMissingRequiredParametersBeforeAnyCall() {
        // --- Act & Assert ---
        assertThatThrownBy(() -> runtime.invoke("crm", "createContact", json("{\"email\": \"\"}"), "conn-1", null))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("email");
        verifyNoInteractions(callChainExecutor, connectionManager);
    }

    @Test
    void invoke_shouldRequireAConnectionForAuthenticatedModules() {
        // --- Act & Assert ---
        assertThatThrownBy(() -> runtime.invoke("crm", "createContact", json("{\"email\": \"ada@example.com\"}"), null, null))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("'key' connection");
        verifyNoInteractions(callChainExecutor);
    }

    @Test
    void invoke_shouldRejectUnknownIntegrationsAndModules() {
        // --- Act & Assert ---
        assertThatThrownBy(() -> runtime.invoke("erp", "createContact", json("{}"), null, null))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("erp");
        assertThatThrownBy(() -> runtime.invoke("crm", "deleteEverything", json("{}"), null, null))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("deleteEverything");
    }

    @Test
    void invoke_shouldRetryRetryableProviderFailures() {
        // --- Arrange ---
        when(callChainExecutor.run(anyList(), any(IntegrationDefinition.class), any(Scope.class), isNull()))
                .thenThrow(new ProviderException(503, "[503] busy"))
                .thenThrow(new RateLimitException(429, "[429] slow down", 0L))
                .thenAnswer(invocation -> List.of(item("{\"hit\": true}")).iterator());

        // --- Act ---
        ModuleResult result = runtime.invoke("crm", "publicSearch", json("{}"), null, null);

        // --- Assert ---
        assertThat(result.bundles()).containsExactly(json("{\"hit\": true}"));
        verify(callChainExecutor, times(3)).run(anyList(), any(), any(), any());
    }

    @Test
    void invoke_shouldSurfaceTheLastFailureOnceAttemptsAreExhausted() {
        // --- Arrange ---
        when(callChainExecutor.run(anyList(), any(IntegrationDefinition.class), any(Scope.class), isNull()))
                .thenThrow(new ProviderException(500, "[500] down"));

        // --- Act & Assert ---
        assertThatThrownBy(() -> runtime.invoke("crm", "publicSearch", json("{}"), null, null))
                .isInstanceOf(ProviderException.class)
                .hasMessage("[500] down");
        verify(callChainExecutor, times(3)).run(anyList(), any(), any(), any());
    }

    @Test
    void invoke_shouldNotRetryValidationFailures() {
        // --- Arrange ---
        when(callChainExecutor.run(anyList(), any(IntegrationDefinition.class), any(Scope.class), isNull()))
                .thenThrow(new ValidationException(422, "[422] bad query"));

        // --- Act & Assert ---
        assertThatThrownBy(() -> runtime.invoke("crm", "publicSearch", json("{}"), null, null))
                .isInstanceOf(ValidationException.class);
        verify(callChainExecutor, times(1)).run(anyList(), any(), any(), any());
    }

    @Test
    void invoke_shouldHandTriggersTheirPriorStateAndDeclaredLimit() {
        // --- Arrange ---
        TriggerState prior = polledUpTo(3, "c");
        ModuleResult polled = new ModuleResult(List.of(json("{\"id\": \"d\"}")), polledUpTo(4, "d"));
        when(triggerStateMachine.poll(any(ModuleDefinition.class), any(IntegrationDefinition.class), any(Scope.class),
                eq(prior), eq(5L))).thenReturn(polled);

        // --- Act ---
        ModuleResult result = runtime.invoke("crm", "newContacts", json("{\"limit\": 5}"), null, prior);

        // --- Assert ---
        assertThat(result).isSameAs(polled);
        verifyNoInteractions(callChainExecutor);
    }

    @Test
    void invoke_shouldDrainInstantTriggersFromTheirWebhook() {
        // --- Arrange ---
        when(webhookService.drain("hook-1")).thenReturn(List.of(json("{\"event\": 1}")));

        // --- Act ---
        ModuleResult result = runtime.invoke("crm", "contactHook", json("{\"hookRef\": \"hook-1\"}"), null, null);

        // --- Assert ---
        assertThat(result.bundles()).containsExactly(json("{\"event\": 1}"));
        assertThatThrownBy(() -> runtime.invoke("crm", "contactHook", json("{}"), null, null))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("hookRef");
    }

    @Test
    void pollAsync_shouldCommitTheNewTriggerState() throws Exception {
        // --- Arrange ---
        triggerStates.put(KEY, polledUpTo(1, "a"));
        TriggerState next = polledUpTo(2, "b");
        when(triggerStateMachine.poll(any(), any(), any(), eq(polledUpTo(1, "a")), any()))
                .thenReturn(new ModuleResult(List.of(json("{\"id\": \"b\"}")), next));

        // --- Act ---
        ModuleResult result = runtime.pollAsync("scenario-1", "crm", "newContacts", json("{}"), null).get(5, TimeUnit.SECONDS);

        // --- Assert ---
        assertThat(result.bundles()).hasSize(1);
        assertThat(triggerStates.get(KEY)).isEqualTo(next);
    }

    @Test
    void pollAsync_shouldRunCyclesOfOneTriggerOneAfterAnother() throws Exception {
        // --- Arrange ---
        CountDownLatch firstStarted = new CountDownLatch(1);
        CountDownLatch releaseFirst = new CountDownLatch(1);
        TriggerState afterFirst = polledUpTo(1, "a");
        TriggerState afterSecond = polledUpTo(2, "b");
        when(triggerStateMachine.poll(any(), any(), any(), isNull(), any())).thenAnswer(invocation -> {
            firstStarted.countDown();
            releaseFirst.await(5, TimeUnit.SECONDS);
            return new ModuleResult(List.of(), afterFirst);
        });
        lenient().when(triggerStateMachine.poll(any(), any(), any(), eq(afterFirst), any()))
                .thenReturn(new ModuleResult(List.of(json("{\"id\": \"b\"}")), afterSecond));

        // --- Act ---
        CompletableFuture<ModuleResult> first = runtime.pollAsync("scenario-1", "crm", "newContacts", json("{}"), null);
        assertThat(firstStarted.await(5, TimeUnit.SECONDS)).isTrue();
        CompletableFuture<ModuleResult> second = runtime.pollAsync("scenario-1", "crm", "newContacts", json("{}"), null);
        releaseFirst.countDown();

        // --- Assert ---
        assertThat(first.get(5, TimeUnit.SECONDS).bundles()).isEmpty();
        assertThat(second.get(5, TimeUnit.SECONDS).bundles()).containsExactly(json("{\"id\": \"b\"}"));
        assertThat(triggerStates.get(KEY)).isEqualTo(afterSecond);
    }

    @Test
    void cancelPoll_shouldDiscardTheStateOfTheCancelledCycle() throws Exception {
        // --- Arrange ---
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch never = new CountDownLatch(1);
        CountDownLatch returned = new CountDownLatch(1);
        when(triggerStateMachine.poll(any(), any(), any(), any(), any())).thenAnswer(invocation -> {
            started.countDown();
            try {
                never.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            returned.countDown();
            return new ModuleResult(List.of(json("{\"id\": \"z\"}")), polledUpTo(9, "z"));
        });

        // --- Act ---
        CompletableFuture<ModuleResult> cycle = runtime.pollAsync("scenario-1", "crm", "newContacts", json("{}"), null);
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        boolean cancelled = runtime.cancelPoll("scenario-1", "crm", "newContacts");

        // --- Assert ---
        assertThat(cancelled).isTrue();
        assertThat(cycle).isCompletedExceptionally();
        assertThat(returned.await(5, TimeUnit.SECONDS)).isTrue();
        await().atMost(5, TimeUnit.SECONDS).until(() -> !runtime.cancelPoll("scenario-1", "crm", "newContacts"));
        verify(stateService, never()).saveTriggerState(anyString(), any(TriggerState.class));
        assertThat(triggerStates).doesNotContainKey(KEY);
    }

    @Test
    void pollAsync_shouldDiscardTheStateOfATimedOutCycle() {
        // --- Arrange ---
        RuntimeProperties properties = Fixtures.properties();
        properties.getPoll().setTimeout(Duration.ofMillis(100));
        ConnectorRuntimeImpl impatient = runtime(properties);
        CountDownLatch finished = new CountDownLatch(1);
        when(triggerStateMachine.poll(any(), any(), any(), any(), any())).thenAnswer(invocation -> {
            try {
                new CountDownLatch(1).await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            finished.countDown();
            return new ModuleResult(List.of(), polledUpTo(9, "z"));
        });

        // --- Act ---
        CompletableFuture<ModuleResult> cycle = impatient.pollAsync("scenario-1", "crm", "newContacts", json("{}"), null);

        // --- Assert ---
        await().atMost(5, TimeUnit.SECONDS).until(cycle::isDone);
        assertThat(cycle).isCompletedExceptionally();
        await().atMost(5, TimeUnit.SECONDS).until(() -> finished.getCount() == 0
                && !impatient.cancelPoll("scenario-1", "crm", "newContacts"));
        verify(stateService, never()).saveTriggerState(anyString(), any(TriggerState.class));
    }

    @Test
    void cancelPoll_shouldNotInterruptACycleThatIsCommitting() throws Exception {
        // --- Arrange ---
        TriggerState next = polledUpTo(2, "b");
        when(triggerStateMachine.poll(any(), any(), any(), any(), any()))
                .thenReturn(new ModuleResult(List.of(json("{\"id\": \"b\"}")), next));
        CountDownLatch saving = new CountDownLatch(1);
        CountDownLatch releaseSave = new CountDownLatch(1);
        doAnswer(invocation -> {
            saving.countDown();
            releaseSave.await(5, TimeUnit.SECONDS);
            triggerStates.put(invocation.getArgument(0), invocation.getArgument(1));
            return null;
        }).when(stateService).saveTriggerState(anyString(), any(TriggerState.class));

        // --- Act ---
        CompletableFuture<ModuleResult> cycle = runtime.pollAsync("scenario-1", "crm", "newContacts", json("{}"), null);
        assertThat(saving.await(5, TimeUnit.SECONDS)).isTrue();
        CompletableFuture<Boolean> cancelled = CompletableFuture.supplyAsync(
                () -> runtime.cancelPoll("scenario-1", "crm", "newContacts"));
        CompletableFuture<Boolean> cancelledDirectly = CompletableFuture.supplyAsync(() -> cycle.cancel(true));
        releaseSave.countDown();

        // --- Assert ---
        assertThat(cancelled.get(5, TimeUnit.SECONDS)).isFalse();
        assertThat(cancelledDirectly.get(5, TimeUnit.SECONDS)).isFalse();
        assertThat(cycle.get(5, TimeUnit.SECONDS).bundles()).containsExactly(json("{\"id\": \"b\"}"));
        assertThat(triggerStates.get(KEY)).isEqualTo(next);
    }

    @Test
    void cancelPoll_shouldReachEveryCycleOfTheTrigger() throws Exception {
        // --- Arrange ---
        CountDownLatch started = new CountDownLatch(1);
        when(triggerStateMachine.poll(any(), any(), any(), any(), any())).thenAnswer(invocation -> {
            started.countDown();
            try {
                new CountDownLatch(1).await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return new ModuleResult(List.of(), polledUpTo(9, "z"));
        });

        // --- Act ---
        CompletableFuture<ModuleResult> first = runtime.pollAsync("scenario-1", "crm", "newContacts", json("{}"), null);
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        CompletableFuture<ModuleResult> second = runtime.pollAsync("scenario-1", "crm", "newContacts", json("{}"), null);
        boolean cancelled = runtime.cancelPoll("scenario-1", "crm", "newContacts");

        // --- Assert ---
        assertThat(cancelled).isTrue();
        assertThat(first).isCompletedExceptionally();
        assertThat(second).isCompletedExceptionally();
        await().atMost(5, TimeUnit.SECONDS).until(() -> !runtime.cancelPoll("scenario-1", "crm", "newContacts"));
        verify(stateService, never()).saveTriggerState(anyString(), any(TriggerState.class));
    }

    @Test
    void pollKey_shouldScopeStateToScenarioIntegrationAndModule() {
        assertThat(ConnectorRuntimeImpl.pollKey("scenario-1", "crm", "newContacts")).isEqualTo(KEY);
    }
}
