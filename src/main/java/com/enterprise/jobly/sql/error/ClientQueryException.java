package com.enterprise.jobly.sql.error;

/**
 * Base type for query-construction failures caused by the client's input.
 * Callers map every subtype to a 400-class response; none are retried.
 */
public abstract class ClientQueryException extends IllegalArgumentException {

    protected ClientQueryException(String message) {
        super(message);
    }
}
