package com.connector.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;

/**
 * A webhook attached with the provider.
 *
 * @param hookRef       Runtime-generated reference; also the path segment of the receipt endpoint.
 * @param integration   The integration name.
 * @param hookId        The {@link WebhookDefinition} name.
 * @param callbackUrl   The URL the provider calls.
 * @param connectionRef The connection used for attach/detach, may be {@code null}.
 * @param parameters    The user parameters the hook was registered with.
 * @param data          Provider data returned by the attach Call (e.g. the provider's hook id).
 * @param createdAt     Registration time.
 */
public record WebhookRegistration(String hookRef,
                                  String integration,
                                  String hookId,
                                  String callbackUrl,
                                  String connectionRef,
                                  JsonNode parameters,
                                  JsonNode data,
                                  Instant createdAt) {
}
