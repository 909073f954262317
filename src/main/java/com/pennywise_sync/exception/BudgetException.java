package com.pennywise_sync.exception;

import org.springframework.http.HttpStatus;

/**
 * Base of every failure the ledger and import engines report to callers.
 */
public abstract class BudgetException extends RuntimeException {

    protected BudgetException(String message) {
        super(message);
    }

    protected BudgetException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract HttpStatus status();
}
