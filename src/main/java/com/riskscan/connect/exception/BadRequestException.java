package com.riskscan.connect.exception;

/**
 * Generic exception for HTTP 400 Bad Request scenarios.
 */
public class BadRequestException extends RuntimeException {
    public BadRequestException(String message) {
        super(message);
    }

    public BadRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
