package com.enterprise.jobly.shared.error;

/**
 * A lookup key matched no row. Mapped to 404.
 */
public class NotFoundException extends RuntimeException {

    public NotFoundException(String message) {
        super(message);
    }
}
