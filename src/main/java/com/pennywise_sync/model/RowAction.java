package com.pennywise_sync.model;

public enum RowAction {
    ADDED,
    UPDATED,
    SKIPPED,
    DELETED
}
