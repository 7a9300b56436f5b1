package com.connector.model;

public enum TriggerStatus {
    UNINITIALIZED,
    POLLING
}
