package com.pennywise_sync.model;

public enum TransferKind {
    TRANSFER,
    RESET
}
