package com.enterprise.jobly.sql.error;

/**
 * Thrown when a filter names a key outside the resource's vocabulary.
 */
public class UnrecognizedFilterKeyException extends ClientQueryException {

    private final String key;

    public UnrecognizedFilterKeyException(String key) {
        super("Invalid query string parameter: " + key);
        this.key = key;
    }

    public String key() {
        return key;
    }
}
