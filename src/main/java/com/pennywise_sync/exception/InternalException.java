package com.pennywise_sync.exception;

import org.springframework.http.HttpStatus;

/**
 * Unexpected failure: store errors, or an invariant the engine relies on is broken.
 */
public class InternalException extends BudgetException {

    public InternalException(String message) {
        super(message);
    }

    public InternalException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Leaves typed failures untouched and wraps everything else.
     */
    public static Throwable wrap(Throwable error) {
        if (error instanceof BudgetException) {
            return error;
        }
        return new InternalException(String.valueOf(error.getMessage()), error);
    }

    @Override
    public HttpStatus status() {
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }
}
