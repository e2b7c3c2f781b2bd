package com.scriptflow.models;

public enum PendingNodeStatus {
    CREATED,
    CONNECTED,
    SYNCED,
    ORPHAN
}
