package com.connector.dto.response;

/**
 * The first leg of an OAuth flow: where to send the user, and the state value that identifies the pending
 * authorization when the provider redirects back.
 *
 * @param state The opaque state parameter; pass it to the exchange step together with the returned code.
 * @param url   The provider's authorization URL.
 */
public record AuthorizationRequest(String state, String url) {
}
