package com.connector.model;

/**
 * Freshness of a connection's access credential. Transitions are VALID → NEAR_EXPIRY → REFRESHING → VALID;
 * a failed refresh of an already expired credential ends in EXPIRED.
 */
public enum CredentialState {
    VALID,
    NEAR_EXPIRY,
    REFRESHING,
    EXPIRED
}
