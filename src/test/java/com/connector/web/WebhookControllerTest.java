package com.connector.web;

import com.connector.dto.response.WebhookReceipt;
import com.connector.exception.WebhookNotFoundException;
import com.connector.service.api.WebhookService;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import static com.connector.support.Fixtures.json;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WebhookControllerTest {

    @Mock
    private WebhookService webhookService;

    private WebTestClient webTestClient;

    @BeforeEach
    void setUp() {
        webTestClient = WebTestClient.bindToController(new WebhookController(webhookService)).build();
    }

    @Test
    @SuppressWarnings("unchecked")
    void receive_shouldHandJsonPayloadsHeadersAndQueryToTheService() {
        // --- Arrange ---
        when(webhookService.receive(eq("hook-1"), any(JsonNode.class), anyMap(), anyMap()))
                .thenReturn(WebhookReceipt.acknowledged(1));

        // --- Act & Assert ---
        webTestClient.post().uri("/hooks/hook-1?source=test")
                .contentType(MediaType.APPLICATION_JSON)
                .header("X-Signature", "sig")
                .bodyValue("{\"event\": \"created\"}")
                .exchange()
                .expectStatus().isOk()
                .expectBody().isEmpty();

        ArgumentCaptor<JsonNode> payload = ArgumentCaptor.forClass(JsonNode.class);
        ArgumentCaptor<Map<String, String>> headers = ArgumentCaptor.forClass(Map.class);
        ArgumentCaptor<Map<String, String>> query = ArgumentCaptor.forClass(Map.class);
        verify(webhookService).receive(eq("hook-1"), payload.capture(), headers.capture(), query.capture());
        assertThat(payload.getValue()).isEqualTo(json("{\"event\": \"created\"}"));
        assertThat(headers.getValue()).containsEntry("X-Signature", "sig");
        assertThat(query.getValue()).containsEntry("source", "test");
    }

    @Test
    void receive_shouldPassNonJsonPayloadsAsText() {
        // --- Arrange ---
        when(webhookService.receive(eq("hook-1"), eq(TextNode.valueOf("plain words")), anyMap(), anyMap()))
                .thenReturn(WebhookReceipt.acknowledged(0));

        // --- Act & Assert ---
        webTestClient.post().uri("/hooks/hook-1")
                .contentType(MediaType.TEXT_PLAIN)
                .bodyValue("plain words")
                .exchange()
                .expectStatus().isOk();
    }

    @Test
    void receive_shouldAnswerWithTheReceiptBodyAndHeaders() {
        // --- Arrange ---
        when(webhookService.receive(eq("hook-1"), any(JsonNode.class), anyMap(), anyMap()))
                .thenReturn(new WebhookReceipt(200, json("{\"X-Hook-Secret\": \"s3cr3t\"}"), TextNode.valueOf("abc123"), 0));

        // --- Act & Assert ---
        webTestClient.post().uri("/hooks/hook-1?hub.challenge=abc123")
                .exchange()
                .expectStatus().isOk()
                .expectHeader().valueEquals("X-Hook-Secret", "s3cr3t")
                .expectHeader().contentTypeCompatibleWith(MediaType.TEXT_PLAIN)
                .expectBody(String.class).isEqualTo("abc123");
    }

    @Test
    void receive_shouldMapUnknownHooksToNotFound() {
        // --- Arrange ---
        when(webhookService.receive(eq("missing"), any(JsonNode.class), anyMap(), anyMap()))
                .thenThrow(new WebhookNotFoundException("missing"));

        // --- Act & Assert ---
        webTestClient.post().uri("/hooks/missing")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{}")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody().jsonPath("$.error").isEqualTo("Unknown webhook 'missing'.");
    }

    @Test
    void drain_shouldReturnTheQueuedBundles() {
        // --- Arrange ---
        when(webhookService.drain("hook-1")).thenReturn(List.of(json("{\"id\": 1}"), json("{\"id\": 2}")));

        // --- Act & Assert ---
        webTestClient.get().uri("/hooks/hook-1/bundles")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(2)
                .jsonPath("$[1].id").isEqualTo(2);
    }
}
