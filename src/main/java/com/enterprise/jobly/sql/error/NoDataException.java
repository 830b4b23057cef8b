package com.enterprise.jobly.sql.error;

/**
 * Thrown when a partial update carries no fields.
 */
public class NoDataException extends ClientQueryException {

    public NoDataException() {
        super("No data");
    }
}
