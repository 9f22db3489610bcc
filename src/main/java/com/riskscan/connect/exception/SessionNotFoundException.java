package com.riskscan.connect.exception;

/**
 * The authorization state is unknown, already used, or older than the session TTL.
 */
public class SessionNotFoundException extends RuntimeException {

    public SessionNotFoundException(String message) {
        super(message);
    }
}
