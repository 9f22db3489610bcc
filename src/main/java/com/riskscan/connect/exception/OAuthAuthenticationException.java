package com.riskscan.connect.exception;

/**
 * Exception thrown when the provider reports that the user did not grant access.
 */
public class OAuthAuthenticationException extends RuntimeException {

    public OAuthAuthenticationException(String message) {
        super(message);
    }

    public OAuthAuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }
}
