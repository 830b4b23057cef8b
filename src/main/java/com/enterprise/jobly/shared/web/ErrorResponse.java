package com.enterprise.jobly.shared.web;

/**
 * Error body: {@code {"error": {"message": "...", "status": 400}}}.
 */
public record ErrorResponse(Error error) {

    public static ErrorResponse of(String message, int status) {
        return new ErrorResponse(new Error(message, status));
    }

    public record Error(String message, int status) {}
}
