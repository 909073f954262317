package com.pennywise_sync.model;

public enum ImportStatus {
    STARTED,
    COMPLETED,
    FAILED
}
