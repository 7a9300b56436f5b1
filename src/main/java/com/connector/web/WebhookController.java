package com.connector.web;

import com.connector.dto.response.WebhookReceipt;
import com.connector.exception.WebhookNotFoundException;
import com.connector.service.api.WebhookService;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Receipt endpoint for provider webhooks. Payloads are accepted as JSON when they parse, otherwise as text;
 * form-encoded payloads arrive as query-style parameters.
 */
@RestController
@RequestMapping("/hooks")
@Slf4j
public class WebhookController {

    private final WebhookService webhookService;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public WebhookController(WebhookService webhookService) {
        this.webhookService = webhookService;
    }

    @PostMapping("/{hookRef}")
    public ResponseEntity<Object> receive(@PathVariable String hookRef,
                                            @RequestBody(required = false) String body,
                                            @RequestHeader HttpHeaders headers,
                                            @RequestParam Map<String, String> query) {
        WebhookReceipt receipt = webhookService.receive(hookRef, parse(body), headers.toSingleValueMap(), query);
        ResponseEntity.BodyBuilder response = ResponseEntity.status(receipt.status());
        if (receipt.headers() != null && receipt.headers().isObject()) {
            receipt.headers().fields().forEachRemaining(header -> response.header(header.getKey(), header.getValue().asText()));
        }
        if (receipt.body() == null || receipt.body().isNull()) {
            return response.build();
        }
        if (receipt.body().isTextual()) {
            return response.contentType(MediaType.TEXT_PLAIN).body(receipt.body().textValue());
        }
        return response.contentType(MediaType.APPLICATION_JSON).body(receipt.body());
    }

    @GetMapping("/{hookRef}/bundles")
    public List<JsonNode> drain(@PathVariable String hookRef) {
        return webhookService.drain(hookRef);
    }

    @ExceptionHandler(WebhookNotFoundException.class)
    public ResponseEntity<Map<String, String>> unknownHook(WebhookNotFoundException e) {
        log.warn("Rejected webhook call: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
    }

    private JsonNode parse(String body) {
        if (body == null || body.isBlank()) {
            return NullNode.getInstance();
        }
        try {
            return objectMapper.readTree(body);
        } catch (IOException e) {
            return TextNode.valueOf(body);
        }
    }
}
