package com.pennywise_sync.exception;

import org.springframework.http.HttpStatus;

/**
 * The referenced entity exists but its current state does not allow the operation.
 */
public class InvalidStateException extends BudgetException {

    public InvalidStateException(String message) {
        super(message);
    }

    @Override
    public HttpStatus status() {
        return HttpStatus.BAD_REQUEST;
    }
}
