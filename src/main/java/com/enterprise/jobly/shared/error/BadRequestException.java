package com.enterprise.jobly.shared.error;

/**
 * The request is well-formed HTTP but not acceptable data (duplicate key, bad field). Mapped to 400.
 */
public class BadRequestException extends RuntimeException {

    public BadRequestException(String message) {
        super(message);
    }

    public BadRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
